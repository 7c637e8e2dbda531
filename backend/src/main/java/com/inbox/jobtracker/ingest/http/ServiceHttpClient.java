package com.inbox.jobtracker.ingest.http;

import com.inbox.jobtracker.config.TrackerProperties;
import com.inbox.jobtracker.ingest.model.HttpCallResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * JSON-over-HTTP client for the parser and store services. Failures are reported through
 * {@link HttpCallResult} rather than thrown so callers can turn them into per-record outcomes.
 */
@Service
public class ServiceHttpClient {
    private static final String USER_AGENT = "inbox-job-tracker/0.1";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(20);

    private final TrackerProperties properties;
    private final HttpClient client;

    public ServiceHttpClient(
        TrackerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(CONNECT_TIMEOUT)
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpCallResult postJson(String url, String jsonBody, Map<String, String> headers) {
        return send(url, "POST", jsonBody, headers);
    }

    public HttpCallResult patchJson(String url, String jsonBody, Map<String, String> headers) {
        return send(url, "PATCH", jsonBody, headers);
    }

    private HttpCallResult send(String url, String method, String body, Map<String, String> headers) {
        URI uri = uriFor(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult("invalid_url", "URL missing host or malformed");
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .header("User-Agent", USER_AGENT)
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .method(method, HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8));
        int timeoutSeconds = properties.getRequestTimeoutSeconds();
        if (timeoutSeconds > 0) {
            builder.timeout(Duration.ofSeconds(timeoutSeconds));
        }
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (value != null && !value.isBlank()) {
                    builder.header(name, value);
                }
            });
        }

        try {
            HttpResponse<byte[]> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            return new HttpCallResult(response.statusCode(), responseBody, null, null);
        } catch (HttpTimeoutException e) {
            return errorResult("timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult("io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult("interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult("http_error", e.getMessage());
        }
    }

    private URI uriFor(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private HttpCallResult errorResult(String code, String message) {
        return new HttpCallResult(0, null, code, message);
    }
}
