package renewals.domain.plugins;

/**
 * Options describing how the stored certificate is installed.
 */
public abstract class InstallationPluginOptions extends PluginOptions {
}
