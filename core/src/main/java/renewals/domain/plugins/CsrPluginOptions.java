package renewals.domain.plugins;

/**
 * Options describing how the certificate request and its key are generated.
 */
public abstract class CsrPluginOptions extends PluginOptions {
}
