package renewals.domain.persist;

/**
 * The bookkeeping state of a renewal in the store's working set.
 */
public enum RenewalState {
    /**
     * Matches the file on disk.
     */
    CLEAN,
    NEW,
    UPDATED,
    /**
     * The file is removed on the next persist pass, and the renewal leaves the cache.
     */
    DELETED;

    public boolean requiresWrite() {
        return this == NEW || this == UPDATED;
    }
}
