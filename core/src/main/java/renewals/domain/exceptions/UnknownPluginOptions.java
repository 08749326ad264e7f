package renewals.domain.exceptions;

import org.jspecify.annotations.Nullable;
import renewals.domain.plugins.PluginCategory;

/**
 * Represents a configuration block whose plugin discriminator is not known to the plugin registry.
 * A renewal file containing such a block can not be decoded.
 */
public class UnknownPluginOptions extends RuntimeException implements InternalException {
    private final PluginCategory category;

    @Nullable
    private final String discriminator;

    public UnknownPluginOptions(final PluginCategory category, @Nullable final String discriminator) {
        super(discriminator == null
                ? "Missing " + category.getLabel() + " plugin discriminator"
                : "Unknown " + category.getLabel() + " plugin " + discriminator);
        this.category = category;
        this.discriminator = discriminator;
    }

    public PluginCategory getCategory() {
        return category;
    }

    @Nullable
    public String getDiscriminator() {
        return discriminator;
    }
}
