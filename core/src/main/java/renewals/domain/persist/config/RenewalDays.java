package renewals.domain.persist.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;

/**
 * The time between a successful run and the next due date.
 */
@ApplicationScoped
public class RenewalDays {
    private static final int DEFAULT_RENEWAL_DAYS = 55;

    @Inject
    @ConfigProperty(name = "renewals.schedule.days", defaultValue = "55")
    private String renewalDays;

    public int getRenewalDays() {
        return NumberUtils.toInt(renewalDays, DEFAULT_RENEWAL_DAYS);
    }

    public Duration getRenewalPeriod() {
        return Duration.ofDays(getRenewalDays());
    }
}
