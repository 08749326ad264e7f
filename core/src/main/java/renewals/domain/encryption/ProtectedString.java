package renewals.domain.encryption;

import java.util.Objects;

/**
 * A secret held in plain text in memory. It is written to disk through a SecretEnvelope, and never
 * prints its value.
 */
public final class ProtectedString {
    private static final String MASK = "********";

    private final String value;

    public ProtectedString(final String value) {
        this.value = Objects.requireNonNull(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof ProtectedString protectedString && value.equals(protectedString.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return MASK;
    }
}
