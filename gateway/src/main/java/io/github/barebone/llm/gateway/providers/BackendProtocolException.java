package io.github.barebone.llm.gateway.providers;

/**
 * The backend sent something the stream parser cannot make sense of: an event
 * sequence that is structurally impossible, or a stream that ends before its
 * terminal event. The stream is aborted.
 */
public class BackendProtocolException extends ProviderException {

    public BackendProtocolException(String backendId, String message) {
        super(backendId, message, -1, false);
    }

    public BackendProtocolException(String backendId, String message, Throwable cause) {
        super(backendId, message, -1, false, cause);
    }
}
