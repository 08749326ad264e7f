package renewals.domain.encryption;

/**
 * Converts secrets to and from the representation stored in renewal files.
 */
public interface SecretEnvelope {
    String wrap(ProtectedString secret);

    ProtectedString unwrap(String stored);
}
