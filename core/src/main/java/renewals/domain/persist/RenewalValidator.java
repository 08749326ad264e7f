package renewals.domain.persist;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jspecify.annotations.Nullable;
import renewals.domain.exceptions.InvalidRenewal;
import renewals.domain.plugins.PluginOptionsRegistry;
import renewals.domain.renewal.Renewal;
import renewals.domain.validate.ValidateString;

import java.util.ArrayList;

/**
 * Checks the structure of a renewal read from disk, and fills in the defaults for optional fields.
 */
@ApplicationScoped
public class RenewalValidator {
    @Inject
    private PluginOptionsRegistry pluginOptionsRegistry;

    @Inject
    private RenewalFiles renewalFiles;

    @Inject
    private ValidateString validateString;

    /**
     * @param renewal  the decoded renewal
     * @param fileStem the name of the file the renewal was read from, without the renewal suffix
     * @return the renewal, with LastFriendlyName and History defaulted
     * @throws InvalidRenewal when the renewal can not be used
     */
    public Renewal validate(@Nullable final Renewal renewal, final String fileStem) {
        if (renewal == null) {
            throw new InvalidRenewal("result is empty");
        }

        if (!renewalFiles.isValidId(renewal.getId())) {
            throw new InvalidRenewal("invalid id " + renewal.getId());
        }

        if (!fileStem.equals(renewal.getId())) {
            throw new InvalidRenewal("mismatch between filename and id " + renewal.getId());
        }

        if (renewal.getTargetPluginOptions() == null) {
            throw new InvalidRenewal("missing TargetPluginOptions");
        }

        if (renewal.getValidationPluginOptions() == null) {
            throw new InvalidRenewal("missing ValidationPluginOptions");
        }

        if (renewal.getStorePluginOptions() == null) {
            throw new InvalidRenewal("missing StorePluginOptions");
        }

        if (renewal.getCsrPluginOptions() == null && !pluginOptionsRegistry.isCsrExempt(renewal.getTargetPluginOptions())) {
            throw new InvalidRenewal("missing CsrPluginOptions");
        }

        if (renewal.getInstallationPluginOptions() == null) {
            throw new InvalidRenewal("missing InstallationPluginOptions");
        }

        if (validateString.isBlank(renewal.getLastFriendlyName())) {
            renewal.setLastFriendlyName(renewal.getFriendlyName());
        }

        if (renewal.getHistory() == null) {
            renewal.setHistory(new ArrayList<>());
        }

        return renewal;
    }
}
