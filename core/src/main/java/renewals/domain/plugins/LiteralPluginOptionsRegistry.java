package renewals.domain.plugins;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * A registry that matches discriminators literally (ignoring case) against the PluginOptionsType beans
 * available in the container.
 */
@ApplicationScoped
public class LiteralPluginOptionsRegistry implements PluginOptionsRegistry {
    @Inject
    private Instance<PluginOptionsType> pluginOptionsTypes;

    @Inject
    private Logger logger;

    @Override
    public Optional<PluginOptionsType> find(final PluginCategory category, @Nullable final String name) {
        if (StringUtils.isBlank(name)) {
            return Optional.empty();
        }

        return getTypes(category)
                .filter(type -> type.getName().equalsIgnoreCase(name.trim()))
                .findFirst();
    }

    @Override
    public Optional<PluginOptionsType> findByOptionsClass(final PluginCategory category, final Class<?> optionsClass) {
        return getTypes(category)
                .filter(type -> type.getOptionsClass().equals(optionsClass))
                .findFirst();
    }

    @Override
    public boolean isCsrExempt(@Nullable final TargetPluginOptions targetOptions) {
        if (targetOptions == null) {
            return false;
        }

        return find(PluginCategory.TARGET, targetOptions.getPlugin())
                .map(PluginOptionsType::isCsrExempt)
                .orElse(false);
    }

    private Stream<PluginOptionsType> getTypes(final PluginCategory category) {
        if (pluginOptionsTypes == null) {
            return Stream.empty();
        }

        return pluginOptionsTypes.stream()
                .filter(type -> type.getCategory() == category)
                .filter(this::isCompatible);
    }

    private boolean isCompatible(final PluginOptionsType type) {
        if (type.getCategory().getBaseClass().isAssignableFrom(type.getOptionsClass())) {
            return true;
        }

        logger.warning("Ignoring " + type.getName() + " because " + type.getOptionsClass().getName()
                + " does not extend " + type.getCategory().getBaseClass().getSimpleName());
        return false;
    }
}
