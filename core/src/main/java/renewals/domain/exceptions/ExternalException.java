package renewals.domain.exceptions;

/**
 * Marker interface for exceptions raised by the environment, like a full disk or a missing permission.
 * Running the same operation again may succeed once the environment is fixed.
 */
public interface ExternalException {
}
