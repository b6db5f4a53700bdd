package com.equitiesai.providers;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ChatDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ChatDispatcher dispatcher = new ChatDispatcher(mapper);
    private final AtomicReference<String> seenAuth = new AtomicReference<>();
    private final AtomicReference<String> seenBody = new AtomicReference<>();
    private Javalin stub;

    @BeforeEach
    void startStub() {
        stub = Javalin.create()
            .post("/ok", ctx -> {
                seenAuth.set(ctx.header("Authorization"));
                seenBody.set(ctx.body());
                ctx.contentType("application/json").result("{\"answer\":42}");
            })
            .post("/overloaded", ctx -> ctx.status(500).contentType("application/json")
                .result("{\"error\":{\"message\":\"Overloaded\",\"type\":\"server_error\"}}"))
            .post("/html", ctx -> ctx.status(502).contentType("text/html").result("<html>Bad gateway</html>"))
            .post("/detail", ctx -> ctx.status(422).contentType("application/json")
                .result("{\"detail\":\"Invalid model\"}"))
            .post("/unauthorized", ctx -> ctx.status(401).contentType("application/json")
                .result("{\"error\":{\"message\":\"Incorrect API key provided: sk-secret-123\"}}"))
            .post("/forbidden", ctx -> ctx.status(403).contentType("application/json")
                .result("{\"error\":\"API key not valid: g-secret-456\"}"))
            .post("/slow", ctx -> {
                Thread.sleep(2000);
                ctx.result("{}");
            })
            .post("/events", ctx -> ctx.contentType("text/event-stream").result("data: [DONE]\n\n"))
            .start(0);
    }

    @AfterEach
    void stopStub() {
        stub.stop();
    }

    private String url(String path) {
        return "http://localhost:" + stub.port() + path;
    }

    private Map<String, String> bearer(String key) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put("Authorization", "Bearer " + key);
        return headers;
    }

    @Test
    void successReturnsBodyAndSendsHeaders() throws Exception {
        String body = dispatcher.send("openai", url("/ok"), bearer("sk-1"), "{\"model\":\"gpt-5\"}", 5000);
        assertEquals("{\"answer\":42}", body);
        assertEquals("Bearer sk-1", seenAuth.get());
        assertEquals("{\"model\":\"gpt-5\"}", seenBody.get());
    }

    @Test
    void providerErrorMessageIsSurfaced() {
        HttpStatusException error = assertThrows(HttpStatusException.class,
            () -> dispatcher.send("openai", url("/overloaded"), bearer("sk-1"), "{}", 5000));
        assertEquals(500, error.getStatusCode());
        assertEquals("Overloaded", error.getMessage());
        assertEquals("openai", error.getProviderId());
    }

    @Test
    void unstructuredErrorFallsBackToStatus() {
        HttpStatusException error = assertThrows(HttpStatusException.class,
            () -> dispatcher.send("mistral", url("/html"), bearer("m-1"), "{}", 5000));
        assertEquals(502, error.getStatusCode());
        assertEquals("request failed with status 502", error.getMessage());
    }

    @Test
    void detailFieldIsUsed() {
        HttpStatusException error = assertThrows(HttpStatusException.class,
            () -> dispatcher.send("mistral", url("/detail"), bearer("m-1"), "{}", 5000));
        assertEquals("Invalid model", error.getMessage());
    }

    @Test
    void unauthorizedIsAuthErrorWithoutSecret() {
        AuthException error = assertThrows(AuthException.class,
            () -> dispatcher.send("openai", url("/unauthorized"), bearer("sk-secret-123"), "{}", 5000));
        assertEquals(401, error.getStatusCode());
        assertFalse(error.getMessage().contains("sk-secret-123"));
        assertTrue(error.getMessage().contains("***"));
    }

    @Test
    void forbiddenWithKeyInUrlIsRedacted() {
        Map<String, String> headers = Map.of("Content-Type", "application/json");
        AuthException error = assertThrows(AuthException.class,
            () -> dispatcher.send("google", url("/forbidden?key=g-secret-456"), headers, "{}", 5000));
        assertEquals(403, error.getStatusCode());
        assertEquals("API key not valid: ***", error.getMessage());
    }

    @Test
    void deadlineCancelsSlowRequest() {
        long started = System.nanoTime();
        RequestTimeoutException error = assertThrows(RequestTimeoutException.class,
            () -> dispatcher.send("xai", url("/slow"), bearer("x-1"), "{}", 200));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;
        assertTrue(elapsedMs < 1500, "took " + elapsedMs + "ms");
        assertEquals("xai", error.getProviderId());
    }

    @Test
    void refusedConnectionIsNetworkError() {
        Javalin closed = Javalin.create().start(0);
        int port = closed.port();
        closed.stop();
        NetworkException error = assertThrows(NetworkException.class,
            () -> dispatcher.send("anthropic", "http://localhost:" + port + "/ok", bearer("a-1"), "{}", 2000));
        assertNotNull(error.getCause());
    }

    @Test
    void openStreamReturnsBody() throws Exception {
        try (InputStream in = dispatcher.openStream("openai", url("/events"), bearer("sk-1"), "{}")) {
            assertEquals("data: [DONE]\n\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void openStreamMapsErrorStatus() {
        HttpStatusException error = assertThrows(HttpStatusException.class,
            () -> dispatcher.openStream("openai", url("/overloaded"), bearer("sk-1"), "{}"));
        assertEquals("Overloaded", error.getMessage());
    }

    @Test
    void errorMessageShapes() {
        assertEquals("a", dispatcher.extractErrorMessage("{\"error\":{\"message\":\"a\"}}"));
        assertEquals("b", dispatcher.extractErrorMessage("{\"error\":\"b\"}"));
        assertEquals("c", dispatcher.extractErrorMessage("{\"message\":\"c\"}"));
        assertNull(dispatcher.extractErrorMessage("{\"error\":{\"code\":5}}"));
        assertNull(dispatcher.extractErrorMessage("[1,2]"));
        assertNull(dispatcher.extractErrorMessage("not json"));
        assertNull(dispatcher.extractErrorMessage(""));
    }

    @Test
    void urlKeysAreMasked() {
        assertEquals("https://x/models/m:generateContent?key=***",
            ChatDispatcher.redactUrl("https://x/models/m:generateContent?key=abc"));
        assertEquals("https://x/m?alt=sse&key=***",
            ChatDispatcher.redactUrl("https://x/m?alt=sse&key=abc"));
        assertEquals("x-api-key was *** and bearer ***",
            ChatDispatcher.redact("x-api-key was ant-1 and bearer sk-2",
                Map.of("x-api-key", "ant-1", "Authorization", "Bearer sk-2"), "https://x"));
    }
}
