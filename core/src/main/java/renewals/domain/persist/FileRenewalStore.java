package renewals.domain.persist;

import io.vavr.control.Try;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jspecify.annotations.Nullable;
import renewals.domain.persist.config.RenewalDays;
import renewals.domain.persist.config.RenewalDirectory;
import renewals.domain.renewal.RenewResult;
import renewals.domain.renewal.Renewal;
import renewals.domain.validate.ValidateString;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A renewal store backed by one JSON file per renewal.
 * The cache is an immutable snapshot, remembering the file behind each renewal, that is replaced after every
 * persist pass. All methods are synchronized, so read-modify-write cycles from different threads do not interleave.
 */
@ApplicationScoped
public class FileRenewalStore implements RenewalStore {
    @Inject
    private Logger logger;

    @Inject
    private RenewalLoader renewalLoader;

    @Inject
    private RenewalWriter renewalWriter;

    @Inject
    private RenewalDirectory renewalDirectory;

    @Inject
    private RenewalDays renewalDays;

    @Inject
    private ValidateString validateString;

    @Nullable
    private List<TrackedRenewal> cache;

    @PostConstruct
    public void construct() {
        logger.fine("Renewal period: " + renewalDays.getRenewalDays() + " days");
    }

    @Override
    public synchronized List<Renewal> list() {
        return getRenewals();
    }

    @Override
    public synchronized List<Renewal> list(@Nullable final String id, @Nullable final String friendlyName) {
        return getRenewals().stream()
                .filter(renewal -> validateString.matchesFilter(friendlyName, renewal.getLastFriendlyName()))
                .filter(renewal -> validateString.matchesFilter(id, renewal.getId()))
                .toList();
    }

    @Override
    public synchronized void save(final Renewal renewal, final RenewResult result) {
        checkNotNull(renewal);
        checkNotNull(result);

        final List<TrackedRenewal> renewals = getWorkingSet();
        final boolean isNew = find(renewals, renewal).isEmpty();

        if (isNew) {
            renewal.setHistory(new ArrayList<>());
            logger.info("Adding renewal for " + renewal.getLastFriendlyName());
        }

        if (renewal.getHistory() == null) {
            renewal.setHistory(new ArrayList<>());
        }
        renewal.getHistory().add(result);

        if (result.isSuccess() && result.getDate() != null) {
            renewal.setDate(result.getDate().plus(renewalDays.getRenewalPeriod()));
            logger.info("Next renewal scheduled at " + renewal.getDate());
        }

        track(renewals, renewal, isNew ? RenewalState.NEW : RenewalState.UPDATED);
        persist(renewals);
    }

    @Override
    public synchronized void importRenewal(final Renewal renewal) {
        checkNotNull(renewal);

        if (renewal.getHistory() == null) {
            renewal.setHistory(new ArrayList<>());
        }

        final List<TrackedRenewal> renewals = getWorkingSet();
        track(renewals, renewal, RenewalState.NEW);
        logger.info("Importing renewal for " + renewal.getLastFriendlyName());
        persist(renewals);
    }

    @Override
    public synchronized void cancel(final Renewal renewal) {
        checkNotNull(renewal);

        final List<TrackedRenewal> renewals = getWorkingSet();
        // Renewals that are not cached are tracked too, so a file left behind on disk is still removed
        track(renewals, renewal, RenewalState.DELETED);
        persist(renewals);
        logger.warning("Renewal " + renewal + " cancelled");
    }

    @Override
    public synchronized void clear() {
        persist(getCache().stream()
                .map(tracked -> tracked.withState(RenewalState.DELETED))
                .toList());
        logger.warning("All renewals cancelled");
    }

    @Override
    public synchronized void encrypt() {
        persist(getCache().stream()
                .peek(tracked -> logger.info("Re-writing password information for " + tracked.renewal().getLastFriendlyName()))
                .map(tracked -> tracked.withState(RenewalState.UPDATED))
                .toList());
    }

    @Override
    public synchronized void reload() {
        cache = null;
    }

    private List<TrackedRenewal> getCache() {
        if (cache == null) {
            cache = renewalLoader.load(renewalDirectory.getRenewalDirectory());
        }
        return cache;
    }

    private List<Renewal> getRenewals() {
        return getCache().stream()
                .map(TrackedRenewal::renewal)
                .toList();
    }

    private List<TrackedRenewal> getWorkingSet() {
        return new ArrayList<>(getCache());
    }

    private Optional<TrackedRenewal> find(final List<TrackedRenewal> renewals, final Renewal renewal) {
        if (renewal.getId() == null) {
            return Optional.empty();
        }

        return renewals.stream()
                .filter(tracked -> tracked.hasId(renewal.getId()))
                .findFirst();
    }

    /**
     * Replaces the entry with the same Id, keeping the file it was read from, or appends when there is none.
     */
    private void track(final List<TrackedRenewal> renewals, final Renewal renewal, final RenewalState state) {
        final Optional<TrackedRenewal> existing = find(renewals, renewal);
        if (existing.isPresent()) {
            renewals.set(renewals.indexOf(existing.get()), existing.get().replace(renewal, state));
        } else {
            renewals.add(new TrackedRenewal(renewal, state, null));
        }
    }

    /**
     * A failed pass may leave some files written and the cached renewals changed in memory only, so the cache is
     * dropped and the next read goes back to disk.
     */
    private void persist(final List<TrackedRenewal> renewals) {
        cache = Try.of(() -> renewalWriter.write(renewalDirectory.getRenewalDirectory(), renewals))
                .onFailure(ex -> {
                    logger.warning("Persisting renewals failed, they will be read from disk again");
                    cache = null;
                })
                .get();
    }
}
