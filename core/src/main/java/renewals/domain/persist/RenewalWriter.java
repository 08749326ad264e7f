package renewals.domain.persist;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.io.FileUtils;
import renewals.domain.exceptions.LocalStorageFailure;
import renewals.domain.renewal.Renewal;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Reconciles a working set of tracked renewals with the files on disk.
 * Deleted renewals lose their file, new and updated renewals are written, clean renewals are left alone.
 */
@ApplicationScoped
public class RenewalWriter {
    private static final String TEMP_FILE_SUFFIX = ".tmp";

    @Inject
    private Logger logger;

    @Inject
    private RenewalCodec renewalCodec;

    @Inject
    private RenewalFiles renewalFiles;

    /**
     * A renewal that was read from a file is written back to, or deleted from, that same file. Renewals without a
     * file go to "[directory]/[Id].renewal.json". Failures are not retried, and renewals processed before a
     * failure stay written.
     *
     * @return the renewals that were not deleted with the files that now hold them, sorted by due date
     * @throws LocalStorageFailure when a file can not be written or deleted
     */
    public List<TrackedRenewal> write(final Path directory, final List<TrackedRenewal> renewals) {
        final List<TrackedRenewal> written = new ArrayList<>();

        for (final TrackedRenewal tracked : renewals) {
            final Path file = getFile(directory, tracked);
            if (tracked.isDeleted()) {
                delete(file);
                continue;
            }

            if (tracked.state().requiresWrite()) {
                write(file, renewalCodec.encode(tracked.renewal()));
            }
            written.add(TrackedRenewal.clean(tracked.renewal(), file));
        }

        return written.stream()
                .sorted(Comparator.comparing(TrackedRenewal::renewal, Renewal.DUE_DATE_ORDER))
                .toList();
    }

    private Path getFile(final Path directory, final TrackedRenewal tracked) {
        if (tracked.file() != null) {
            return tracked.file();
        }

        return renewalFiles.getRenewalFile(directory, tracked.renewal().getId());
    }

    private void delete(final Path file) {
        Try.of(() -> Files.deleteIfExists(file))
                .onSuccess(deleted -> {
                    if (deleted) {
                        logger.fine("Deleted renewal file " + file);
                    }
                })
                .getOrElseThrow(ex -> new LocalStorageFailure("Unable to delete renewal file " + file, ex));
    }

    /**
     * The content goes to a temporary file next to the target first, so readers never see a partial file.
     */
    private void write(final Path file, final String content) {
        final Path tempFile = file.resolveSibling(file.getFileName() + TEMP_FILE_SUFFIX);

        Try.run(() -> FileUtils.writeStringToFile(tempFile.toFile(), content, StandardCharsets.UTF_8))
                .andThenTry(() -> move(tempFile, file))
                .onSuccess(v -> logger.fine("Wrote renewal file " + file))
                .onFailure(ex -> Try.run(() -> Files.deleteIfExists(tempFile)))
                .getOrElseThrow(ex -> new LocalStorageFailure("Unable to write renewal file " + file, ex));
    }

    private void move(final Path source, final Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException ex) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
