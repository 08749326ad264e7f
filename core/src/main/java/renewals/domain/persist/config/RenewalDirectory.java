package renewals.domain.persist.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.nio.file.Path;
import java.util.Optional;

@ApplicationScoped
public class RenewalDirectory {
    private static final String RENEWAL_DIR = "renewals";

    @Inject
    @ConfigProperty(name = "renewals.config.path")
    private Optional<String> renewalDirectory;

    public Path getRenewalDirectory() {
        return Path.of(renewalDirectory.orElse(RENEWAL_DIR));
    }
}
