package renewals.domain.plugins;

/**
 * Options describing which identifiers a renewal covers.
 */
public abstract class TargetPluginOptions extends PluginOptions {
}
