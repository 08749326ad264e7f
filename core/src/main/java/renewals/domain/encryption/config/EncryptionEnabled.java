package renewals.domain.encryption.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class EncryptionEnabled {
    @Inject
    @ConfigProperty(name = "renewals.encryption.enabled", defaultValue = "true")
    private String encryptionEnabled;

    public boolean isEncryptionEnabled() {
        return Boolean.parseBoolean(encryptionEnabled);
    }
}
