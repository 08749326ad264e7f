package renewals.domain.plugins;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

/**
 * The common base of every plugin configuration block. The only field shared by all plugins is the
 * discriminator naming the plugin that owns the block; everything else is defined by the concrete
 * options class the plugin registers.
 */
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class PluginOptions {
    /**
     * The name of the JSON field holding the discriminator.
     */
    public static final String DISCRIMINATOR = "Plugin";

    @Nullable
    private String plugin;

    @Nullable
    public String getPlugin() {
        return plugin;
    }

    public void setPlugin(@Nullable final String plugin) {
        this.plugin = plugin;
    }
}
