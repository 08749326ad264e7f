package renewals.domain.validate;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;


@ApplicationScoped
public class ValidateStringBlank implements ValidateString {
    @Override
    public boolean isBlank(@Nullable final String value) {
        return StringUtils.isBlank(value);
    }

    @Override
    public boolean matchesFilter(@Nullable final String filter, @Nullable final String value) {
        return isBlank(filter) || StringUtils.equalsIgnoreCase(filter, value);
    }
}
