package renewals.domain.encryption;

import com.fasterxml.jackson.databind.module.SimpleModule;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import renewals.domain.encryption.json.ProtectedStringDeserializer;
import renewals.domain.encryption.json.ProtectedStringSerializer;

/**
 * A Jackson module that passes every ProtectedString through the secret envelope.
 */
@ApplicationScoped
public class ProtectedStringJacksonModule extends SimpleModule {
    @Inject
    private SecretEnvelope secretEnvelope;

    @PostConstruct
    public void construct() {
        addSerializer(ProtectedString.class, new ProtectedStringSerializer(secretEnvelope));
        addDeserializer(ProtectedString.class, new ProtectedStringDeserializer(secretEnvelope));
    }
}
