package renewals.domain.plugins;

/**
 * The five pluggable roles a renewal is configured with. Each role has its own abstract options base class,
 * and plugin discriminators are only unique within a category.
 */
public enum PluginCategory {
    TARGET("target", TargetPluginOptions.class),
    VALIDATION("validation", ValidationPluginOptions.class),
    CSR("csr", CsrPluginOptions.class),
    STORE("store", StorePluginOptions.class),
    INSTALLATION("installation", InstallationPluginOptions.class);

    private final String label;
    private final Class<? extends PluginOptions> baseClass;

    PluginCategory(final String label, final Class<? extends PluginOptions> baseClass) {
        this.label = label;
        this.baseClass = baseClass;
    }

    public String getLabel() {
        return label;
    }

    public Class<? extends PluginOptions> getBaseClass() {
        return baseClass;
    }
}
