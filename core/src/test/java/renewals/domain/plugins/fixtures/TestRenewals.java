package renewals.domain.plugins.fixtures;

import renewals.domain.encryption.ProtectedString;
import renewals.domain.renewal.Renewal;

import java.time.Instant;

/**
 * Builds renewals, and the JSON of renewal files, configured with the test plugins.
 */
public final class TestRenewals {
    public static final String SECRET = "secret";

    private static final String RENEWAL_JSON = """
            {
              "Id": "%s",
              "FriendlyName": "%s",
              "Date": "%s",
              "TargetPluginOptions": { "Plugin": "manual", "Host": "example.com" },
              "ValidationPluginOptions": { "Plugin": "http", "Path": "/var/www" },
              "CsrPluginOptions": { "Plugin": "rsa", "KeySize": 3072 },
              "StorePluginOptions": { "Plugin": "pem", "PemPassword": "clear-c2VjcmV0" },
              "InstallationPluginOptions": { "Plugin": "script", "Script": "install.ps1" }
            }
            """;

    private TestRenewals() {
    }

    public static Renewal create(final String id, final String friendlyName, final Instant date) {
        final Renewal renewal = new Renewal();
        renewal.setId(id);
        renewal.setFriendlyName(friendlyName);
        renewal.setLastFriendlyName(friendlyName);
        renewal.setDate(date);
        renewal.setTargetPluginOptions(new ManualTargetOptions("example.com"));
        renewal.setValidationPluginOptions(new HttpValidationOptions("/var/www"));
        renewal.setCsrPluginOptions(new RsaCsrOptions(3072));
        renewal.setStorePluginOptions(new PemStoreOptions(new ProtectedString(SECRET)));
        renewal.setInstallationPluginOptions(new ScriptInstallationOptions("install.ps1"));
        return renewal;
    }

    /**
     * Every configuration block is on its own line, so tests can remove or alter single blocks.
     */
    public static String json(final String id, final String friendlyName, final Instant date) {
        return RENEWAL_JSON.formatted(id, friendlyName, date);
    }
}
