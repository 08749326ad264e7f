package renewals.domain.exceptions;

/**
 * Represents a renewal document that decoded, but breaks one of the structural rules a renewal must follow.
 */
public class InvalidRenewal extends RuntimeException implements InternalException {
    public InvalidRenewal() {
        super();
    }

    public InvalidRenewal(final String message) {
        super(message);
    }

    public InvalidRenewal(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InvalidRenewal(final Throwable cause) {
        super(cause);
    }
}
