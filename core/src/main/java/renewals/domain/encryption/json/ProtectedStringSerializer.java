package renewals.domain.encryption.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import renewals.domain.encryption.ProtectedString;
import renewals.domain.encryption.SecretEnvelope;

import java.io.IOException;

public class ProtectedStringSerializer extends StdSerializer<ProtectedString> {
    private final SecretEnvelope secretEnvelope;

    public ProtectedStringSerializer(final SecretEnvelope secretEnvelope) {
        super(ProtectedString.class);
        this.secretEnvelope = secretEnvelope;
    }

    @Override
    public void serialize(final ProtectedString value, final JsonGenerator generator, final SerializerProvider provider) throws IOException {
        generator.writeString(secretEnvelope.wrap(value));
    }
}
