package it.unimib.datai.fnship.cli.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.file.Path;

public final class JsonIO {
    private static final ObjectMapper JSON = new ObjectMapper()
            .findAndRegisterModules()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private JsonIO() {}

    /**
     * Reads an invoke payload: inline JSON, {@code @path} for a file, or {@code @-} for stdin.
     */
    public static JsonNode readPayload(String data) {
        if (data == null) {
            return null;
        }
        String text;
        if ("@-".equals(data)) {
            text = SourceFiles.read(System.in);
        } else if (data.startsWith("@")) {
            text = SourceFiles.read(Path.of(data.substring(1)));
        } else {
            text = data;
        }
        try {
            return JSON.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    public static String write(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render JSON output", e);
        }
    }
}
