package renewals.domain.files;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.lang3.StringUtils;

import java.util.Set;

/**
 * Replaces path separators and NUL. Characters that only Windows reserves, like ':' and '?', are kept.
 */
@ApplicationScoped
public class DefaultFileSanitizer implements FileSanitizer {
    private static final Set<String> RESERVED_NAMES = Set.of(".", "..");

    @Override
    public String sanitizeFileName(final String fileName) {
        return fileName.replaceAll("[\\\\/\\x00]", "_");
    }

    @Override
    public boolean isSafeFileName(final String fileName) {
        return StringUtils.isNotBlank(fileName)
                && !RESERVED_NAMES.contains(fileName)
                && sanitizeFileName(fileName).equals(fileName);
    }
}
