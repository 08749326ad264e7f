package renewals.application.cli;

import io.vavr.control.Try;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;
import renewals.Marker;
import renewals.domain.exceptionhandling.ExceptionHandler;
import renewals.domain.persist.RenewalStore;
import renewals.domain.renewal.Renewal;

import java.util.List;
import java.util.Optional;

/**
 * Runs a single renewal store operation. Plugins are picked up from any bean archive on the class path.
 */
public class Main {
    private static final String DEFAULT_COMMAND = "list";
    private static final int EXIT_FAILURE = 1;
    private static final int EXIT_SUCCESS = 0;

    @Inject
    private RenewalStore renewalStore;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    @ConfigProperty(name = "renewals.cli.id")
    private Optional<String> idFilter;

    @Inject
    @ConfigProperty(name = "renewals.cli.friendlyname")
    private Optional<String> friendlyNameFilter;

    public static void main(final String[] args) {
        final Weld weld = new Weld();
        final int status;
        try (WeldContainer weldContainer = weld.addBeanClass(Main.class).addPackages(true, Marker.class).initialize()) {
            status = weldContainer.select(Main.class).get().entry(args);
        }
        System.exit(status);
    }

    /**
     * @return the process exit status, non-zero when the command failed
     */
    public int entry(final String[] args) {
        final String command = args.length > 0 && StringUtils.isNotBlank(args[0])
                ? args[0].trim().toLowerCase()
                : DEFAULT_COMMAND;

        return Try.run(() -> runCommand(command))
                .onFailure(e -> System.err.println("Failed to run " + command + ": " + exceptionHandler.getExceptionMessage(e)))
                .map(v -> EXIT_SUCCESS)
                .getOrElse(EXIT_FAILURE);
    }

    private void runCommand(final String command) {
        if ("list".equals(command)) {
            printRenewals(renewalStore.list(idFilter.orElse(null), friendlyNameFilter.orElse(null)));
        } else if ("encrypt".equals(command)) {
            renewalStore.encrypt();
            System.out.println("Rewrote " + renewalStore.list().size() + " renewals");
        } else if ("clear".equals(command)) {
            renewalStore.clear();
            System.out.println("Cancelled all renewals");
        } else {
            throw new IllegalArgumentException("Unknown command " + command + ", expected list, encrypt or clear");
        }
    }

    private void printRenewals(final List<Renewal> renewals) {
        if (renewals.isEmpty()) {
            System.out.println("No renewals found");
            return;
        }

        renewals.forEach(System.out::println);
    }
}
