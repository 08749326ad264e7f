package renewals.domain.renewal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * The outcome of one attempt to execute a renewal.
 */
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RenewResult {
    private boolean success;

    @Nullable
    private Instant date;

    @Nullable
    private String errorMessage;

    public RenewResult() {
    }

    public RenewResult(final boolean success, final Instant date, @Nullable final String errorMessage) {
        this.success = success;
        this.date = date;
        this.errorMessage = errorMessage;
    }

    public static RenewResult success(final Instant date) {
        return new RenewResult(true, date, null);
    }

    public static RenewResult failure(final Instant date, final String errorMessage) {
        return new RenewResult(false, date, errorMessage);
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(final boolean success) {
        this.success = success;
    }

    @Nullable
    public Instant getDate() {
        return date;
    }

    public void setDate(@Nullable final Instant date) {
        this.date = date;
    }

    @Nullable
    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(@Nullable final String errorMessage) {
        this.errorMessage = errorMessage;
    }
}
