package renewals.domain.encryption;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import renewals.domain.encryption.config.EncryptionEnabled;
import renewals.domain.exceptions.DeserializationFailed;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.logging.Logger;

/**
 * Stores secrets either encrypted ("enc-" prefix) or Base64 encoded ("clear-" prefix), depending on
 * whether encryption is enabled. Values without a prefix are read as plain text.
 */
@ApplicationScoped
public class PrefixedSecretEnvelope implements SecretEnvelope {
    public static final String ENCRYPTED_PREFIX = "enc-";
    public static final String CLEAR_PREFIX = "clear-";

    @Inject
    private Encryptor encryptor;

    @Inject
    private EncryptionEnabled encryptionEnabled;

    @Inject
    private Logger logger;

    @Override
    public String wrap(final ProtectedString secret) {
        if (encryptionEnabled.isEncryptionEnabled()) {
            return ENCRYPTED_PREFIX + encryptor.encrypt(secret.getValue());
        }

        return CLEAR_PREFIX + Base64.getEncoder().encodeToString(secret.getValue().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public ProtectedString unwrap(final String stored) {
        if (stored.startsWith(ENCRYPTED_PREFIX)) {
            return Try.of(() -> encryptor.decrypt(StringUtils.removeStart(stored, ENCRYPTED_PREFIX)))
                    .map(ProtectedString::new)
                    .getOrElseThrow(ex -> new DeserializationFailed("Unable to decrypt protected value", ex));
        }

        if (stored.startsWith(CLEAR_PREFIX)) {
            return Try.of(() -> Base64.getDecoder().decode(StringUtils.removeStart(stored, CLEAR_PREFIX)))
                    .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                    .map(ProtectedString::new)
                    .getOrElseThrow(ex -> new DeserializationFailed("Unable to decode protected value", ex));
        }

        logger.fine("Reading unprotected secret, it will be protected on the next write");
        return new ProtectedString(stored);
    }
}
