package renewals.domain.plugins.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import renewals.domain.exceptions.UnknownPluginOptions;
import renewals.domain.plugins.PluginCategory;
import renewals.domain.plugins.PluginOptions;
import renewals.domain.plugins.PluginOptionsRegistry;
import renewals.domain.plugins.PluginOptionsType;

import java.io.IOException;

/**
 * Reads a configuration block as a tree, resolves its "Plugin" discriminator against the registry, and then
 * binds the tree to the concrete options class the plugin registered.
 */
public class PluginOptionsDeserializer<T extends PluginOptions> extends StdDeserializer<T> {
    private final Class<T> baseClass;
    private final PluginCategory category;
    private final PluginOptionsRegistry registry;

    public PluginOptionsDeserializer(
            final Class<T> baseClass,
            final PluginCategory category,
            final PluginOptionsRegistry registry) {
        super(baseClass);
        this.baseClass = baseClass;
        this.category = category;
        this.registry = registry;
    }

    @Override
    public T deserialize(final JsonParser jsonParser, final DeserializationContext context) throws IOException {
        final JsonNode node = jsonParser.readValueAsTree();

        if (!node.isObject()) {
            return context.reportInputMismatch(this,
                    "Expected the " + category.getLabel() + " plugin options to be an object");
        }

        final JsonNode discriminator = node.get(PluginOptions.DISCRIMINATOR);
        final String name = discriminator == null || discriminator.isNull() ? null : discriminator.asText();

        final PluginOptionsType type = registry.find(category, name)
                .orElseThrow(() -> new UnknownPluginOptions(category, name));

        // The deserializer is registered for the abstract base class only, so binding the concrete class
        // falls through to the regular bean deserializer.
        return baseClass.cast(context.readTreeAsValue(node, type.getOptionsClass()));
    }
}
