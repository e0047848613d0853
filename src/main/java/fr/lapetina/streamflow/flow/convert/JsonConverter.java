package fr.lapetina.streamflow.flow.convert;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.ByteArrayInputStream;

/**
 * JSON converters backed by Jackson.
 *
 * <pre>{@code
 * JsonConverter json = new JsonConverter();
 * Summary summary = flow.run(ctx, json.input(article), json.output(Summary.class));
 * }</pre>
 */
public class JsonConverter {

    private final ObjectMapper objectMapper;

    public JsonConverter() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public JsonConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Serializes the value when the flow starts.
     */
    public InputConverter input(Object value) {
        return () -> new ByteArrayInputStream(objectMapper.writeValueAsBytes(value));
    }

    public <T> OutputConverter<T> output(Class<T> type) {
        return stream -> objectMapper.readValue(stream, type);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
