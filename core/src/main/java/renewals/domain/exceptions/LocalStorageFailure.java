package renewals.domain.exceptions;

/**
 * Represents a failure reading or writing the renewal files on the local filesystem.
 */
public class LocalStorageFailure extends RuntimeException implements ExternalException {
    public LocalStorageFailure() {
        super();
    }

    public LocalStorageFailure(final String message) {
        super(message);
    }

    public LocalStorageFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public LocalStorageFailure(final Throwable cause) {
        super(cause);
    }
}
