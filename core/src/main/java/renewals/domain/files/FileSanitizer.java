package renewals.domain.files;

public interface FileSanitizer {
    String sanitizeFileName(String fileName);

    /**
     * True when the name can be used as a single file name without any changes.
     */
    boolean isSafeFileName(String fileName);
}
