package renewals.domain.json;

public interface JsonDeserializer {
    /**
     * Serializes with indentation, for files that people are expected to read.
     */
    String serializePretty(Object object);

    <T> T deserialize(String json, Class<T> clazz);
}
