package renewals.domain.persist;

import io.vavr.control.Option;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import renewals.domain.exceptionhandling.ExceptionHandler;
import renewals.domain.exceptions.LocalStorageFailure;
import renewals.domain.renewal.Renewal;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reads every renewal file below a directory. Each file is decoded and validated on its own, and a file that
 * fails either step is logged and left out, so one corrupt file never stops the others from loading.
 */
@ApplicationScoped
public class RenewalLoader {
    @Inject
    private Logger logger;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private RenewalCodec renewalCodec;

    @Inject
    private RenewalValidator renewalValidator;

    @Inject
    private RenewalFiles renewalFiles;

    /**
     * @return the valid renewals with the files they were read from, sorted by due date
     * @throws LocalStorageFailure when the directory exists but can not be scanned
     */
    public List<TrackedRenewal> load(final Path directory) {
        return Try.withResources(() -> new TimedOperation("loading renewals from " + directory))
                .of(t -> loadTimed(directory))
                .get();
    }

    private List<TrackedRenewal> loadTimed(final Path directory) {
        if (!Files.isDirectory(directory)) {
            logger.fine("Renewal directory " + directory + " does not exist yet");
            return List.of();
        }

        final Map<String, TrackedRenewal> renewals = new LinkedHashMap<>();
        for (final Path file : findRenewalFiles(directory)) {
            readRenewal(file).forEach(renewal -> {
                if (renewals.containsKey(renewal.getId())) {
                    logger.warning("Ignoring renewal " + file + ": another file already uses the id " + renewal.getId());
                } else {
                    renewals.put(renewal.getId(), TrackedRenewal.clean(renewal, file));
                }
            });
        }

        logger.fine("Loaded " + renewals.size() + " renewals from " + directory);

        return renewals.values().stream()
                .sorted(Comparator.comparing(TrackedRenewal::renewal, Renewal.DUE_DATE_ORDER))
                .toList();
    }

    private List<Path> findRenewalFiles(final Path directory) {
        return Try.withResources(() -> Files.walk(directory))
                .of(paths -> paths
                        .filter(Files::isRegularFile)
                        .filter(renewalFiles::isRenewalFile)
                        .sorted()
                        .toList())
                .getOrElseThrow(ex -> new LocalStorageFailure("Unable to scan renewal directory " + directory, ex));
    }

    private Option<Renewal> readRenewal(final Path file) {
        return Try.of(() -> Files.readString(file))
                .map(renewalCodec::decode)
                .map(renewal -> renewalValidator.validate(renewal, renewalFiles.getFileStem(file)))
                .onFailure(ex -> logger.severe("Unable to read renewal " + file.getFileName() + ": " + exceptionHandler.getExceptionMessage(ex)))
                .toOption();
    }
}
