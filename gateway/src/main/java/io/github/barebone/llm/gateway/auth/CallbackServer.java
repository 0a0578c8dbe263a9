package io.github.barebone.llm.gateway.auth;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.barebone.llm.gateway.GatewayTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Loopback listener receiving the OAuth redirect.
 * <p>
 * Binds 127.0.0.1 only and handles exactly one callback on the configured path:
 * a matching {@code state} with a {@code code} completes the login, anything
 * else on that path fails it. Requests to other paths get 404 and are ignored.
 */
public class CallbackServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CallbackServer.class);

    private static final String SUCCESS_PAGE = "<!doctype html>\n" +
            "<html><head><title>Authentication successful</title></head>\n" +
            "<body><p>Authentication successful. Return to your terminal.</p></body></html>";

    private final String backendId;
    private final String path;
    private final String expectedState;
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private final HttpServer server;

    /**
     * Binds the listener and starts serving.
     *
     * @param port port to bind on the loopback interface, 0 for any free port
     */
    public CallbackServer(String backendId, int port, String path, String expectedState) throws IOException {
        this.backendId = backendId;
        this.path = path;
        this.expectedState = expectedState;
        this.server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), 0);
        this.server.createContext("/", this::handle);
        this.server.start();
        logger.debug("OAuth callback listener started on 127.0.0.1:{}{}", getPort(), path);
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Blocks until the callback arrives and returns the authorization code.
     */
    public String awaitCode(Duration timeout) throws AuthenticationException, GatewayTimeoutException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new GatewayTimeoutException(backendId,
                    "Timed out after " + timeout.getSeconds() + "s waiting for the OAuth callback", timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AuthenticationException) {
                throw (AuthenticationException) e.getCause();
            }
            throw new AuthenticationException(backendId, AuthenticationException.Reason.AUTHORIZATION_DENIED,
                    "OAuth callback failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException(backendId, AuthenticationException.Reason.AUTHORIZATION_DENIED,
                    "Interrupted while waiting for the OAuth callback", e);
        }
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod()) ||
                    !path.equals(exchange.getRequestURI().getPath())) {
                respond(exchange, 404, "text/plain; charset=utf-8", "Not found");
                return;
            }
            if (result.isDone()) {
                respond(exchange, 400, "text/plain; charset=utf-8", "Callback already handled");
                return;
            }

            Map<String, String> params = parseQuery(exchange.getRequestURI().getRawQuery());
            String state = params.get("state");
            String code = params.get("code");
            String error = params.get("error");

            if (!expectedState.equals(state)) {
                logger.warn("Rejected OAuth callback for {}: state mismatch", backendId);
                respond(exchange, 400, "text/plain; charset=utf-8", "State mismatch");
                result.completeExceptionally(new AuthenticationException(backendId,
                        AuthenticationException.Reason.STATE_MISMATCH, "OAuth state mismatch"));
            } else if (error != null) {
                respond(exchange, 400, "text/plain; charset=utf-8", "Error: " + error);
                result.completeExceptionally(new AuthenticationException(backendId,
                        AuthenticationException.Reason.AUTHORIZATION_DENIED, "Authorization failed: " + error));
            } else if (code == null || code.isEmpty()) {
                respond(exchange, 400, "text/plain; charset=utf-8", "Missing authorization code");
                result.completeExceptionally(new AuthenticationException(backendId,
                        AuthenticationException.Reason.MISSING_CODE, "Callback carried no authorization code"));
            } else {
                respond(exchange, 200, "text/html; charset=utf-8", SUCCESS_PAGE);
                result.complete(code);
            }
        } finally {
            exchange.close();
        }
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq >= 0 ? pair.substring(0, eq) : pair;
            String value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.putIfAbsent(URLDecoder.decode(name, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    @Override
    public void close() {
        int port = getPort();
        server.stop(0);
        result.cancel(false);
        logger.debug("OAuth callback listener on port {} stopped", port);
    }
}
