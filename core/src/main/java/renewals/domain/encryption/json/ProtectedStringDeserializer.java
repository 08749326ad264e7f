package renewals.domain.encryption.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import renewals.domain.encryption.ProtectedString;
import renewals.domain.encryption.SecretEnvelope;

import java.io.IOException;

public class ProtectedStringDeserializer extends StdDeserializer<ProtectedString> {
    private final SecretEnvelope secretEnvelope;

    public ProtectedStringDeserializer(final SecretEnvelope secretEnvelope) {
        super(ProtectedString.class);
        this.secretEnvelope = secretEnvelope;
    }

    @Override
    public ProtectedString deserialize(final JsonParser jsonParser, final DeserializationContext context) throws IOException {
        return secretEnvelope.unwrap(jsonParser.getValueAsString());
    }
}
