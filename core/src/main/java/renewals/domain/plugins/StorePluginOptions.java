package renewals.domain.plugins;

/**
 * Options describing where the issued certificate is stored.
 */
public abstract class StorePluginOptions extends PluginOptions {
}
