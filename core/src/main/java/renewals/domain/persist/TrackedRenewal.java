package renewals.domain.persist;

import org.jspecify.annotations.Nullable;
import renewals.domain.renewal.Renewal;

import java.nio.file.Path;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A renewal paired with what the next persist pass has to do with it.
 *
 * @param file the file the renewal was read from or last written to, or null when it has no file yet
 */
public record TrackedRenewal(Renewal renewal, RenewalState state, @Nullable Path file) {
    public TrackedRenewal {
        checkNotNull(renewal);
        checkNotNull(state);
    }

    public static TrackedRenewal clean(final Renewal renewal, final Path file) {
        return new TrackedRenewal(renewal, RenewalState.CLEAN, file);
    }

    public TrackedRenewal withState(final RenewalState newState) {
        return new TrackedRenewal(renewal, newState, file);
    }

    /**
     * Tracks a different instance of the same renewal, keeping this entry's file.
     */
    public TrackedRenewal replace(final Renewal newRenewal, final RenewalState newState) {
        return new TrackedRenewal(newRenewal, newState, file);
    }

    public boolean isDeleted() {
        return state == RenewalState.DELETED;
    }

    public boolean hasId(final String id) {
        return id.equals(renewal.getId());
    }
}
