package renewals.domain.encryption;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;
import renewals.domain.encryption.config.EncryptionEnabled;
import renewals.domain.exceptions.DeserializationFailed;
import renewals.domain.logger.Loggers;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(PrefixedSecretEnvelope.class)
@AddBeanClasses(JasyptEncryptor.class)
@AddBeanClasses(EncryptionEnabled.class)
@AddBeanClasses(Loggers.class)
public class PrefixedSecretEnvelopeTest {
    private static final ProtectedString SECRET = new ProtectedString("correct horse battery staple");

    @Inject
    private SecretEnvelope secretEnvelope;

    @Test
    public void testEncryptedRoundTrip() {
        updateConfig(Map.of("renewals.encryption.password", "test-password"));

        final String stored = secretEnvelope.wrap(SECRET);

        assertTrue(stored.startsWith(PrefixedSecretEnvelope.ENCRYPTED_PREFIX));
        assertFalse(stored.contains(SECRET.getValue()));
        assertEquals(SECRET, secretEnvelope.unwrap(stored));
    }

    @Test
    public void testEncryptionIsSalted() {
        updateConfig(Map.of("renewals.encryption.password", "test-password"));

        assertNotEquals(secretEnvelope.wrap(SECRET), secretEnvelope.wrap(SECRET));
    }

    @Test
    public void testClearWhenEncryptionDisabled() {
        updateConfig(Map.of("renewals.encryption.enabled", "false"));

        final String stored = secretEnvelope.wrap(new ProtectedString("secret"));

        assertEquals("clear-c2VjcmV0", stored);
        assertEquals("secret", secretEnvelope.unwrap(stored).getValue());
    }

    @Test
    public void testClearValuesReadWhenEncryptionEnabled() {
        updateConfig(Map.of("renewals.encryption.password", "test-password"));

        assertEquals("secret", secretEnvelope.unwrap("clear-c2VjcmV0").getValue());
    }

    @Test
    public void testUnprefixedValueIsPlainText() {
        updateConfig(Map.of("renewals.encryption.enabled", "false"));

        assertEquals("hunter2", secretEnvelope.unwrap("hunter2").getValue());
    }

    @Test
    public void testCorruptCiphertextFails() {
        updateConfig(Map.of("renewals.encryption.password", "test-password"));

        assertThrows(DeserializationFailed.class, () -> secretEnvelope.unwrap("enc-notvalidciphertext"));
    }

    @Test
    public void testEncryptionRequiresPassword() {
        updateConfig(Map.of());

        assertThrows(IllegalStateException.class, () -> secretEnvelope.wrap(SECRET));
    }

    @Test
    public void testInvalidBase64Fails() {
        updateConfig(Map.of("renewals.encryption.enabled", "false"));

        assertThrows(DeserializationFailed.class, () -> secretEnvelope.unwrap("clear-!!!"));
    }

    @Test
    public void testMaskedToString() {
        assertEquals("********", SECRET.toString());
        assertFalse(String.valueOf(SECRET).contains("horse"));
    }

    private void updateConfig(final Map<String, String> properties) {
        final var configSource = new PropertiesConfigSource(
                properties,
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }
}
