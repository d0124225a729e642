package dev.zhengxiang.multiplexer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Jackson JSON encoding of cached values, shared by the file and Redis stores so both hold the
 * same bytes.
 *
 * @param <T> value type
 */
public class JsonCodec<T> {

    private final ObjectMapper mapper;
    private final JavaType type;

    public JsonCodec(ObjectMapper mapper, JavaType type) {
        this.mapper = mapper;
        this.type = type;
    }

    public static <T> JsonCodec<T> of(Class<T> type) {
        ObjectMapper mapper = createObjectMapper();
        return new JsonCodec<>(mapper, mapper.constructType(type));
    }

    /**
     * Mapper with Java time support that tolerates fields added or removed since a value was
     * stored.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public JavaType getType() {
        return type;
    }

    public byte[] encode(T value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new StorageException("Failed to encode value of type " + type, e);
        }
    }

    /**
     * @throws IOException if the bytes are not a valid encoding of the value type
     */
    public T decode(byte[] bytes) throws IOException {
        return mapper.readValue(bytes, type);
    }
}
