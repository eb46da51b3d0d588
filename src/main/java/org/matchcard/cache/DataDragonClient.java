package org.matchcard.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches static assets from Data Dragon. No API key; Data Dragon is a plain CDN.
 */
public class DataDragonClient implements AssetSource {
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public DataDragonClient() {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public DataDragonClient(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public byte[] download(URI uri, Duration timeout) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(positive(timeout))
                .GET()
                .build();
        HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("Data Dragon " + uri + " returned " + status);
        }
        byte[] body = response.body();
        if (body == null || body.length == 0) {
            throw new IOException("Data Dragon " + uri + " returned an empty body");
        }
        return body;
    }

    /**
     * Reads the newest patch version from the versions manifest (first array entry).
     */
    public String latestVersion(URI versionsUri) throws IOException, InterruptedException {
        byte[] body = download(versionsUri, Duration.ofSeconds(10));
        JsonNode root = mapper.readTree(body);
        if (root == null || !root.isArray() || root.isEmpty()) {
            throw new IOException("Unexpected versions manifest from " + versionsUri);
        }
        String version = root.get(0).asText("");
        if (version.isBlank()) {
            throw new IOException("Versions manifest from " + versionsUri + " has a blank first entry");
        }
        return version;
    }

    private static Duration positive(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return Duration.ofMillis(1);
        }
        return timeout;
    }
}
