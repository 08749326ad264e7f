package renewals.domain.encryption;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jasypt.util.text.StrongTextEncryptor;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkState;

/**
 * Password based encryption of secrets. Every call to encrypt uses a fresh salt, so encrypting the same
 * text twice gives two different ciphertexts.
 */
@ApplicationScoped
public class JasyptEncryptor implements Encryptor {
    private final StrongTextEncryptor textEncryptor = new StrongTextEncryptor();

    @Inject
    @ConfigProperty(name = "renewals.encryption.password")
    private Optional<String> encryptionPassword;

    @PostConstruct
    public void construct() {
        encryptionPassword.ifPresent(textEncryptor::setPassword);
    }

    @Override
    public String encrypt(final String text) {
        checkState(encryptionPassword.isPresent(), "Encryption password is not set");
        return textEncryptor.encrypt(text);
    }

    @Override
    public String decrypt(final String text) {
        checkState(encryptionPassword.isPresent(), "Encryption password is not set");
        return textEncryptor.decrypt(text);
    }
}
