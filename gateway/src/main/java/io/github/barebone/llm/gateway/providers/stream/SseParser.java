package io.github.barebone.llm.gateway.providers.stream;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Splits a {@code text/event-stream} body into events.
 * <p>
 * Lines are grouped until a blank line. {@code event:} sets the event name,
 * {@code data:} lines are joined with newlines, comment lines starting with
 * {@code :} and unknown fields are skipped.
 */
public class SseParser {

    private final BufferedReader reader;

    public SseParser(InputStream body) {
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
    }

    /**
     * Reads the next event, or returns null at the end of the body.
     */
    public SseEvent nextEvent() throws IOException {
        String eventType = null;
        StringBuilder data = null;

        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                if (data != null) {
                    return new SseEvent(eventType, data.toString());
                }
                eventType = null;
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }

            String value = extractData(line);
            if (value != null) {
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
                continue;
            }

            String type = extractEventType(line);
            if (type != null) {
                eventType = type;
            }
        }

        // Body ended without a trailing blank line
        return data != null ? new SseEvent(eventType, data.toString()) : null;
    }

    /**
     * Extracts the content of a {@code data:} line, or null for other lines.
     */
    public static String extractData(String line) {
        return fieldValue(line, "data:");
    }

    /**
     * Extracts the content of an {@code event:} line, or null for other lines.
     */
    public static String extractEventType(String line) {
        return fieldValue(line, "event:");
    }

    private static String fieldValue(String line, String field) {
        if (line == null || !line.startsWith(field)) {
            return null;
        }
        String value = line.substring(field.length());
        return value.startsWith(" ") ? value.substring(1) : value;
    }
}
