package io.corekit.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.corekit.json.JsonValueModule;

/**
 * Shared Jackson configuration and small helpers.
 */
public final class Utils {

    /**
     * General purpose mapper. Knows about {@link io.corekit.json.JsonValue} and {@code java.time}
     * types, writes dates as ISO-8601 strings and ignores unknown properties.
     */
    public static final ObjectMapper OBJECT_MAPPER = createObjectMapper();

    /**
     * Mapper for API payloads whose keys are snake_case: {@code created_at} binds to the
     * {@code createdAt} property.
     */
    public static final ObjectMapper SNAKE_CASE_MAPPER = createObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    private Utils() {
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new JsonValueModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Pretty-prints a JSON document for log output.
     *
     * @param json the document
     * @return the indented document, or the input unchanged if it is not valid JSON
     */
    public static String prettyPrint(String json) {
        if (json.isBlank()) {
            return json;
        }
        try {
            JsonNode node = OBJECT_MAPPER.readTree(json);
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            return json;
        }
    }

    /**
     * Strips the {@link CompletionException} and {@link ExecutionException} wrappers that
     * {@code CompletableFuture} puts around a failure.
     *
     * @param failure the failure as observed on a future
     * @return the innermost wrapped failure
     */
    public static Throwable unwrapCompletionException(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}
