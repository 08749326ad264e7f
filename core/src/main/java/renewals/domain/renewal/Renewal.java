package renewals.domain.renewal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;
import renewals.domain.encryption.ProtectedString;
import renewals.domain.plugins.CsrPluginOptions;
import renewals.domain.plugins.InstallationPluginOptions;
import renewals.domain.plugins.StorePluginOptions;
import renewals.domain.plugins.TargetPluginOptions;
import renewals.domain.plugins.ValidationPluginOptions;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A scheduled, recurring renewal and the plugin configuration used to execute it.
 * Each renewal is persisted as its own file, named after the Id.
 */
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Renewal {
    /**
     * Orders renewals by their next due date. Renewals without a date come first.
     */
    public static final Comparator<Renewal> DUE_DATE_ORDER =
            Comparator.comparing(Renewal::getDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    @Nullable
    private String id;

    @Nullable
    private String friendlyName;

    @Nullable
    private String lastFriendlyName;

    @Nullable
    private Instant date;

    @Nullable
    private ProtectedString pfxPassword;

    @Nullable
    private List<RenewResult> history;

    @Nullable
    private TargetPluginOptions targetPluginOptions;

    @Nullable
    private ValidationPluginOptions validationPluginOptions;

    @Nullable
    private CsrPluginOptions csrPluginOptions;

    @Nullable
    private StorePluginOptions storePluginOptions;

    @Nullable
    private InstallationPluginOptions installationPluginOptions;

    @Nullable
    public String getId() {
        return id;
    }

    public void setId(@Nullable final String id) {
        this.id = id;
    }

    @Nullable
    public String getFriendlyName() {
        return friendlyName;
    }

    public void setFriendlyName(@Nullable final String friendlyName) {
        this.friendlyName = friendlyName;
    }

    @Nullable
    public String getLastFriendlyName() {
        return lastFriendlyName;
    }

    public void setLastFriendlyName(@Nullable final String lastFriendlyName) {
        this.lastFriendlyName = lastFriendlyName;
    }

    @Nullable
    public Instant getDate() {
        return date;
    }

    public void setDate(@Nullable final Instant date) {
        this.date = date;
    }

    @Nullable
    public ProtectedString getPfxPassword() {
        return pfxPassword;
    }

    public void setPfxPassword(@Nullable final ProtectedString pfxPassword) {
        this.pfxPassword = pfxPassword;
    }

    @Nullable
    public List<RenewResult> getHistory() {
        return history;
    }

    public void setHistory(@Nullable final List<RenewResult> history) {
        // Keep a mutable copy so results can be appended
        this.history = history == null ? null : new ArrayList<>(history);
    }

    @Nullable
    public TargetPluginOptions getTargetPluginOptions() {
        return targetPluginOptions;
    }

    public void setTargetPluginOptions(@Nullable final TargetPluginOptions targetPluginOptions) {
        this.targetPluginOptions = targetPluginOptions;
    }

    @Nullable
    public ValidationPluginOptions getValidationPluginOptions() {
        return validationPluginOptions;
    }

    public void setValidationPluginOptions(@Nullable final ValidationPluginOptions validationPluginOptions) {
        this.validationPluginOptions = validationPluginOptions;
    }

    @Nullable
    public CsrPluginOptions getCsrPluginOptions() {
        return csrPluginOptions;
    }

    public void setCsrPluginOptions(@Nullable final CsrPluginOptions csrPluginOptions) {
        this.csrPluginOptions = csrPluginOptions;
    }

    @Nullable
    public StorePluginOptions getStorePluginOptions() {
        return storePluginOptions;
    }

    public void setStorePluginOptions(@Nullable final StorePluginOptions storePluginOptions) {
        this.storePluginOptions = storePluginOptions;
    }

    @Nullable
    public InstallationPluginOptions getInstallationPluginOptions() {
        return installationPluginOptions;
    }

    public void setInstallationPluginOptions(@Nullable final InstallationPluginOptions installationPluginOptions) {
        this.installationPluginOptions = installationPluginOptions;
    }

    @Override
    public String toString() {
        final int renewed = history == null ? 0 : history.size();
        return lastFriendlyName + " (" + id + ") - " + renewed + " results, due after " + date;
    }
}
