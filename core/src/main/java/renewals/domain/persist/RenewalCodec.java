package renewals.domain.persist;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.jspecify.annotations.Nullable;
import renewals.domain.exceptions.DeserializationFailed;
import renewals.domain.exceptions.UnknownPluginOptions;
import renewals.domain.json.JsonDeserializer;
import renewals.domain.plugins.PluginCategory;
import renewals.domain.plugins.PluginOptions;
import renewals.domain.plugins.PluginOptionsRegistry;
import renewals.domain.plugins.PluginOptionsType;
import renewals.domain.renewal.Renewal;

/**
 * Converts renewals to and from the JSON stored in renewal files.
 */
@ApplicationScoped
public class RenewalCodec {
    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private PluginOptionsRegistry pluginOptionsRegistry;

    /**
     * Decodes a renewal file. The result is null when the file holds a JSON null.
     *
     * @throws UnknownPluginOptions when a configuration block names a plugin that is not registered
     * @throws renewals.domain.exceptions.DeserializationFailed for any other malformed content
     */
    @Nullable
    public Renewal decode(final String json) {
        return Try.of(() -> jsonDeserializer.deserialize(json, Renewal.class))
                .getOrElseThrow(RenewalCodec::unwrapUnknownPlugin);
    }

    /**
     * Jackson wraps exceptions thrown by deserializers, so dig the typed error back out.
     */
    private static RuntimeException unwrapUnknownPlugin(final Throwable ex) {
        final UnknownPluginOptions unknownPluginOptions = ExceptionUtils.throwableOfType(ex, UnknownPluginOptions.class);
        if (unknownPluginOptions != null) {
            return unknownPluginOptions;
        }

        return ex instanceof RuntimeException runtimeException ? runtimeException : new DeserializationFailed(ex);
    }

    public String encode(final Renewal renewal) {
        stampDiscriminator(PluginCategory.TARGET, renewal.getTargetPluginOptions());
        stampDiscriminator(PluginCategory.VALIDATION, renewal.getValidationPluginOptions());
        stampDiscriminator(PluginCategory.CSR, renewal.getCsrPluginOptions());
        stampDiscriminator(PluginCategory.STORE, renewal.getStorePluginOptions());
        stampDiscriminator(PluginCategory.INSTALLATION, renewal.getInstallationPluginOptions());

        return jsonDeserializer.serializePretty(renewal);
    }

    /**
     * Options created in code may not have their discriminator set. Fill it in from the registered type,
     * otherwise the file could never be read back.
     */
    private void stampDiscriminator(final PluginCategory category, @Nullable final PluginOptions options) {
        if (options == null || StringUtils.isNotBlank(options.getPlugin())) {
            return;
        }

        final PluginOptionsType type = pluginOptionsRegistry.findByOptionsClass(category, options.getClass())
                .orElseThrow(() -> new UnknownPluginOptions(category, null));
        options.setPlugin(type.getName());
    }
}
