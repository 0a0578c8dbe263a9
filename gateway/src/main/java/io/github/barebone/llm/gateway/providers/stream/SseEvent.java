package io.github.barebone.llm.gateway.providers.stream;

/**
 * One server-sent event: an optional {@code event:} name and its {@code data:} payload.
 */
public final class SseEvent {

    static final String DONE_MARKER = "[DONE]";

    private final String event;
    private final String data;

    public SseEvent(String event, String data) {
        this.event = event;
        this.data = data != null ? data : "";
    }

    /**
     * Event name, or null when the backend only sends data lines
     */
    public String getEvent() {
        return event;
    }

    public String getData() {
        return data;
    }

    /**
     * Whether this is the literal {@code [DONE]} terminator
     */
    public boolean isDoneMarker() {
        return DONE_MARKER.equals(data.trim());
    }

    @Override
    public String toString() {
        return "SseEvent{event='" + event + "', data='" +
                (data.length() > 80 ? data.substring(0, 80) + "..." : data) + "'}";
    }
}
