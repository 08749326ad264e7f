package renewals.domain.plugins;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A plain PluginOptionsType, usually exposed through a producer method by the plugin that owns it.
 */
public class PluginOptionsDefinition implements PluginOptionsType {
    private final PluginCategory category;
    private final String name;
    private final Class<? extends PluginOptions> optionsClass;
    private final boolean csrExempt;

    public PluginOptionsDefinition(
            final PluginCategory category,
            final String name,
            final Class<? extends PluginOptions> optionsClass) {
        this(category, name, optionsClass, false);
    }

    public PluginOptionsDefinition(
            final PluginCategory category,
            final String name,
            final Class<? extends PluginOptions> optionsClass,
            final boolean csrExempt) {
        checkNotNull(category);
        checkNotNull(name);
        checkNotNull(optionsClass);
        checkArgument(!csrExempt || category == PluginCategory.TARGET, "Only target plugins can be CSR exempt");

        this.category = category;
        this.name = name;
        this.optionsClass = optionsClass;
        this.csrExempt = csrExempt;
    }

    @Override
    public PluginCategory getCategory() {
        return category;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Class<? extends PluginOptions> getOptionsClass() {
        return optionsClass;
    }

    @Override
    public boolean isCsrExempt() {
        return csrExempt;
    }

    @Override
    public String toString() {
        return category.getLabel() + " plugin " + name + " (" + optionsClass.getSimpleName() + ")";
    }
}
