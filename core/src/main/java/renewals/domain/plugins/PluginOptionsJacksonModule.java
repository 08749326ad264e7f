package renewals.domain.plugins;

import com.fasterxml.jackson.databind.module.SimpleModule;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import renewals.domain.plugins.json.PluginOptionsDeserializer;

/**
 * A Jackson module for deserializing the plugin configuration blocks of a renewal.
 */
@ApplicationScoped
public class PluginOptionsJacksonModule extends SimpleModule {
    @Inject
    private PluginOptionsRegistry registry;

    @PostConstruct
    public void construct() {
        addDeserializer(TargetPluginOptions.class,
                new PluginOptionsDeserializer<>(TargetPluginOptions.class, PluginCategory.TARGET, registry));
        addDeserializer(ValidationPluginOptions.class,
                new PluginOptionsDeserializer<>(ValidationPluginOptions.class, PluginCategory.VALIDATION, registry));
        addDeserializer(CsrPluginOptions.class,
                new PluginOptionsDeserializer<>(CsrPluginOptions.class, PluginCategory.CSR, registry));
        addDeserializer(StorePluginOptions.class,
                new PluginOptionsDeserializer<>(StorePluginOptions.class, PluginCategory.STORE, registry));
        addDeserializer(InstallationPluginOptions.class,
                new PluginOptionsDeserializer<>(InstallationPluginOptions.class, PluginCategory.INSTALLATION, registry));
    }
}
