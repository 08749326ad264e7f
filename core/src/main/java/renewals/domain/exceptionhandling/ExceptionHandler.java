package renewals.domain.exceptionhandling;

/**
 * Turns exceptions into messages suitable for the log.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
