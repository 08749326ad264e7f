package renewals.domain.validate;

import org.jspecify.annotations.Nullable;

public interface ValidateString {

    boolean isBlank(@Nullable String value);

    /**
     * Compares ignoring case. A blank filter matches everything.
     */
    boolean matchesFilter(@Nullable String filter, @Nullable String value);
}
