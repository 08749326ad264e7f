package renewals.domain.plugins;

/**
 * Describes one plugin's configuration schema. Plugins make themselves known by exposing beans of this type,
 * which the registry collects.
 */
public interface PluginOptionsType {
    PluginCategory getCategory();

    /**
     * The discriminator written to the "Plugin" field of the configuration block.
     */
    String getName();

    Class<? extends PluginOptions> getOptionsClass();

    /**
     * Target plugins that supply their own certificate request return true, which makes the CSR block of a
     * renewal optional.
     */
    default boolean isCsrExempt() {
        return false;
    }
}
