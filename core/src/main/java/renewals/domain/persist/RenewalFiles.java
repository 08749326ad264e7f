package renewals.domain.persist;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import renewals.domain.exceptions.InvalidFile;
import renewals.domain.files.FileSanitizer;

import java.nio.file.Path;

/**
 * Maps renewal Ids to file names and back. A renewal lives in "[Id].renewal.json".
 */
@ApplicationScoped
public class RenewalFiles {
    public static final String RENEWAL_FILE_SUFFIX = ".renewal.json";

    @Inject
    private FileSanitizer fileSanitizer;

    public boolean isRenewalFile(final Path file) {
        return file.getFileName().toString().endsWith(RENEWAL_FILE_SUFFIX);
    }

    /**
     * The file name without the renewal suffix.
     */
    public String getFileStem(final Path file) {
        return StringUtils.removeEnd(file.getFileName().toString(), RENEWAL_FILE_SUFFIX);
    }

    public boolean isValidId(@Nullable final String id) {
        return StringUtils.isNotBlank(id) && fileSanitizer.isSafeFileName(id);
    }

    public Path getRenewalFile(final Path directory, @Nullable final String id) {
        if (!isValidId(id)) {
            throw new InvalidFile("The renewal Id \"" + id + "\" can not be used as a file name");
        }

        return directory.resolve(id + RENEWAL_FILE_SUFFIX);
    }
}
