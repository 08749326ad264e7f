package renewals.domain.plugins;

/**
 * Options describing how ownership of the targeted identifiers is proven.
 */
public abstract class ValidationPluginOptions extends PluginOptions {
}
