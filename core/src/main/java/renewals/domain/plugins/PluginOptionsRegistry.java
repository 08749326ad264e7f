package renewals.domain.plugins;

import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * Resolves configuration block discriminators to the schemas registered by the plugin subsystem.
 */
public interface PluginOptionsRegistry {
    Optional<PluginOptionsType> find(PluginCategory category, @Nullable String name);

    Optional<PluginOptionsType> findByOptionsClass(PluginCategory category, Class<?> optionsClass);

    /**
     * True when the target plugin owning these options does not need a CSR block.
     */
    boolean isCsrExempt(@Nullable TargetPluginOptions targetOptions);
}
