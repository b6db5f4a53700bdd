package com.equitiesai.providers;

import com.equitiesai.AppLogger;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sends provider requests over {@link HttpClient} and maps failures to the gateway's
 * exception types. Never retries.
 */
public class ChatDispatcher {

    private static final Pattern KEY_PARAM = Pattern.compile("([?&]key=)[^&]*");

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final AppLogger logger;

    public ChatDispatcher(ObjectMapper mapper) {
        this(mapper, HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build());
    }

    public ChatDispatcher(ObjectMapper mapper, HttpClient httpClient) {
        this.mapper = mapper;
        this.httpClient = httpClient;
        this.logger = AppLogger.get();
    }

    /**
     * POST a JSON body and return the response body. The deadline covers the whole
     * exchange; when it passes the in-flight request is cancelled.
     */
    public String send(String providerId, String url, Map<String, String> headers, String body, int timeoutMs)
        throws InterruptedException {
        HttpRequest request = buildRequest(url, headers, body)
            .timeout(Duration.ofMillis(timeoutMs))
            .build();
        logger.info("Chat request to " + providerId + ": " + redactUrl(url));

        CompletableFuture<HttpResponse<String>> future =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        HttpResponse<String> response;
        try {
            response = future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new RequestTimeoutException(providerId, timeoutMs);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpTimeoutException) {
                throw new RequestTimeoutException(providerId, timeoutMs);
            }
            throw networkFailure(providerId, cause, headers, url);
        }

        checkStatus(providerId, response.statusCode(), response.body(), headers, url);
        return response.body();
    }

    /**
     * POST a JSON body and return the response body as it arrives. There is no overall
     * deadline; the caller owns the stream and must close it.
     */
    public InputStream openStream(String providerId, String url, Map<String, String> headers, String body)
        throws InterruptedException {
        HttpRequest request = buildRequest(url, headers, body)
            .header("Accept", "text/event-stream")
            .build();
        logger.info("Streaming chat request to " + providerId + ": " + redactUrl(url));

        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw networkFailure(providerId, e, headers, url);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            String errorBody;
            try (InputStream in = response.body()) {
                errorBody = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                errorBody = "";
            }
            checkStatus(providerId, status, errorBody, headers, url);
        }
        return response.body();
    }

    private HttpRequest.Builder buildRequest(String url, Map<String, String> headers, String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        for (Map.Entry<String, String> header : headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder;
    }

    private void checkStatus(String providerId, int status, String body, Map<String, String> headers, String url) {
        if (status >= 200 && status < 300) {
            return;
        }
        String providerMessage = extractErrorMessage(body);
        String message = providerMessage != null
            ? providerMessage
            : "request failed with status " + status;
        message = redact(message, headers, url);
        logger.warn("Chat request to " + providerId + " failed (" + status + "): " + message);
        if (status == 401 || status == 403) {
            throw new AuthException(providerId, status, message);
        }
        throw new HttpStatusException(providerId, status, message);
    }

    /**
     * Best-effort extraction of a provider's structured error message.
     */
    String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }
        JsonNode error = root.path("error");
        if (error.isObject() && error.path("message").isTextual()) {
            return error.path("message").asText();
        }
        if (error.isTextual()) {
            return error.asText();
        }
        if (root.path("message").isTextual()) {
            return root.path("message").asText();
        }
        if (root.path("detail").isTextual()) {
            return root.path("detail").asText();
        }
        return null;
    }

    private NetworkException networkFailure(String providerId, Throwable cause, Map<String, String> headers,
                                            String url) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        String message = redact("Network error calling " + providerId + ": " + detail, headers, url);
        logger.warn(message);
        return new NetworkException(providerId, message, cause);
    }

    static String redactUrl(String url) {
        return url == null ? null : KEY_PARAM.matcher(url).replaceAll("$1***");
    }

    /**
     * Mask every credential that went out with the request.
     */
    static String redact(String text, Map<String, String> headers, String url) {
        if (text == null) {
            return null;
        }
        List<String> secrets = new ArrayList<>();
        for (Map.Entry<String, String> header : headers.entrySet()) {
            String name = header.getKey().toLowerCase(Locale.ROOT);
            String value = header.getValue();
            if ("authorization".equals(name) && value.startsWith("Bearer ")) {
                secrets.add(value.substring("Bearer ".length()));
            } else if ("x-api-key".equals(name)) {
                secrets.add(value);
            }
        }
        Matcher m = KEY_PARAM.matcher(url == null ? "" : url);
        while (m.find()) {
            String param = m.group();
            String encoded = param.substring(param.indexOf('=') + 1);
            secrets.add(encoded);
            secrets.add(URLDecoder.decode(encoded, StandardCharsets.UTF_8));
        }
        String result = redactUrl(text);
        for (String secret : secrets) {
            if (secret != null && !secret.isBlank()) {
                result = result.replace(secret, "***");
            }
        }
        return result;
    }
}
