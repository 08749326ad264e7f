package renewals.domain.persist;

import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Test;
import renewals.domain.exceptions.InvalidRenewal;
import renewals.domain.files.DefaultFileSanitizer;
import renewals.domain.logger.Loggers;
import renewals.domain.plugins.LiteralPluginOptionsRegistry;
import renewals.domain.plugins.fixtures.CsrTargetOptions;
import renewals.domain.plugins.fixtures.TestPluginOptionsProducer;
import renewals.domain.plugins.fixtures.TestRenewals;
import renewals.domain.renewal.Renewal;
import renewals.domain.validate.ValidateStringBlank;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(RenewalValidator.class)
@AddBeanClasses(RenewalFiles.class)
@AddBeanClasses(DefaultFileSanitizer.class)
@AddBeanClasses(ValidateStringBlank.class)
@AddBeanClasses(LiteralPluginOptionsRegistry.class)
@AddBeanClasses(Loggers.class)
@AddBeanClasses(TestPluginOptionsProducer.class)
public class RenewalValidatorTest {
    private static final Instant DUE = Instant.parse("2026-04-01T00:00:00Z");

    @Inject
    private RenewalValidator renewalValidator;

    @Test
    public void testValidRenewal() {
        final Renewal renewal = TestRenewals.create("abc", "example.com", DUE);
        renewal.setLastFriendlyName(null);

        final Renewal validated = renewalValidator.validate(renewal, "abc");

        assertEquals("example.com", validated.getLastFriendlyName());
        assertNotNull(validated.getHistory());
        assertTrue(validated.getHistory().isEmpty());
    }

    @Test
    public void testLastFriendlyNameIsKept() {
        final Renewal renewal = TestRenewals.create("abc", "example.com", DUE);
        renewal.setLastFriendlyName("old.example.com");

        assertEquals("old.example.com", renewalValidator.validate(renewal, "abc").getLastFriendlyName());
    }

    @Test
    public void testNullRenewal() {
        final InvalidRenewal ex = assertThrows(InvalidRenewal.class, () -> renewalValidator.validate(null, "abc"));
        assertTrue(ex.getMessage().contains("empty"));
    }

    @Test
    public void testIdMismatch() {
        final InvalidRenewal ex = assertThrows(InvalidRenewal.class,
                () -> renewalValidator.validate(TestRenewals.create("abc", "example.com", DUE), "xyz"));
        assertTrue(ex.getMessage().contains("mismatch"));
    }

    @Test
    public void testMissingId() {
        assertThrows(InvalidRenewal.class,
                () -> renewalValidator.validate(TestRenewals.create(null, "example.com", DUE), ""));
    }

    @Test
    public void testIdMayUseCharactersReservedOnWindows() {
        final Renewal renewal = TestRenewals.create("host:443", "example.com", DUE);

        assertEquals("host:443", renewalValidator.validate(renewal, "host:443").getId());
    }

    @Test
    public void testIdWithPathSeparator() {
        assertThrows(InvalidRenewal.class,
                () -> renewalValidator.validate(TestRenewals.create("a/b", "example.com", DUE), "a/b"));
        assertThrows(InvalidRenewal.class,
                () -> renewalValidator.validate(TestRenewals.create("..", "example.com", DUE), ".."));
    }

    @Test
    public void testTargetCheckedFirst() {
        final Renewal renewal = TestRenewals.create("abc", "example.com", DUE);
        renewal.setTargetPluginOptions(null);
        renewal.setInstallationPluginOptions(null);

        final InvalidRenewal ex = assertThrows(InvalidRenewal.class, () -> renewalValidator.validate(renewal, "abc"));
        assertTrue(ex.getMessage().contains("TargetPluginOptions"));
    }

    @Test
    public void testMissingInstallation() {
        final Renewal renewal = TestRenewals.create("abc", "example.com", DUE);
        renewal.setInstallationPluginOptions(null);

        final InvalidRenewal ex = assertThrows(InvalidRenewal.class, () -> renewalValidator.validate(renewal, "abc"));
        assertTrue(ex.getMessage().contains("InstallationPluginOptions"));
    }

    @Test
    public void testMissingCsr() {
        final Renewal renewal = TestRenewals.create("abc", "example.com", DUE);
        renewal.setCsrPluginOptions(null);

        final InvalidRenewal ex = assertThrows(InvalidRenewal.class, () -> renewalValidator.validate(renewal, "abc"));
        assertTrue(ex.getMessage().contains("CsrPluginOptions"));
    }

    @Test
    public void testCsrExemptTarget() {
        final CsrTargetOptions target = new CsrTargetOptions("request.csr");
        target.setPlugin(TestPluginOptionsProducer.CSR);
        final Renewal renewal = TestRenewals.create("abc", "example.com", DUE);
        renewal.setTargetPluginOptions(target);
        renewal.setCsrPluginOptions(null);

        assertNull(renewalValidator.validate(renewal, "abc").getCsrPluginOptions());
    }
}
