package renewals.domain.persist;

import org.jspecify.annotations.Nullable;
import renewals.domain.renewal.RenewResult;
import renewals.domain.renewal.Renewal;

import java.util.List;

/**
 * The persistent collection of renewals. Renewals are read lazily on first access, and every mutation is
 * written to disk before the method returns.
 */
public interface RenewalStore {
    /**
     * @return every renewal, ordered by due date
     */
    List<Renewal> list();

    /**
     * Both filters must match, ignoring case. A blank filter matches every renewal.
     *
     * @param id           matched against the renewal Id
     * @param friendlyName matched against the last friendly name
     */
    List<Renewal> list(@Nullable String id, @Nullable String friendlyName);

    /**
     * Records the result of executing a renewal. A renewal the store does not know yet is added with a
     * fresh history.
     */
    void save(Renewal renewal, RenewResult result);

    /**
     * Adds a renewal built elsewhere, history included.
     */
    void importRenewal(Renewal renewal);

    void cancel(Renewal renewal);

    /**
     * Cancels every renewal.
     */
    void clear();

    /**
     * Rewrites every renewal file, so all secrets are stored with the current envelope settings.
     */
    void encrypt();

    /**
     * Forgets the cached renewals, so the next read goes back to disk.
     */
    void reload();
}
