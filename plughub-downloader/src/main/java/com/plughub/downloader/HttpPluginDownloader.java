package com.plughub.downloader;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plughub.config.PlugHubConfig;
import com.plughub.manager.PluginDownloader;
import com.plughub.plugin.PluginManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link PluginDownloader} against a plugin server:
 * <ul>
 *   <li>{@code GET /api/server/status}</li>
 *   <li>{@code GET /api/plugins/available[?category=]} (a JSON array, or an object with a {@code plugins} array)</li>
 *   <li>{@code GET /api/plugins/{id}}</li>
 *   <li>{@code GET /api/plugins/{id}/download} (zip package, saved as {@code <downloadDir>/<id>.zip})</li>
 * </ul>
 */
public final class HttpPluginDownloader implements PluginDownloader {

    private static final Logger log = LoggerFactory.getLogger(HttpPluginDownloader.class);

    static final String USER_AGENT = "PlugHub-Client/1.0";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final String serverUrl;
    private final Duration timeout;
    private final Path downloadDir;
    private final HttpClient httpClient;

    public HttpPluginDownloader(PlugHubConfig config) {
        this(config, HttpClient.newBuilder()
                .connectTimeout(config.getServerTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpPluginDownloader(PlugHubConfig config, HttpClient httpClient) {
        this.serverUrl = config.getServerUrl();
        this.timeout = config.getServerTimeout();
        this.downloadDir = config.getDownloadDir();
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        log.info("Plugin downloader using server {}", serverUrl);
    }

    /** Server status document; {@code status} and {@code version} default to "unknown". */
    public Map<String, Object> getServerStatus() throws IOException {
        Map<String, Object> status = new LinkedHashMap<>(getJson("/api/server/status", MAP_TYPE));
        status.putIfAbsent("status", "unknown");
        status.putIfAbsent("version", "unknown");
        return status;
    }

    /** Plugins the server offers, optionally filtered by category. */
    public List<Map<String, Object>> listAvailablePlugins(String category) throws IOException {
        String path = "/api/plugins/available";
        if (category != null && !category.isBlank()) {
            path += "?category=" + URLEncoder.encode(category.trim(), StandardCharsets.UTF_8);
        }
        JsonNode root = getJson(path, new TypeReference<JsonNode>() {});
        JsonNode array = root.isArray() ? root : root.path("plugins");
        List<Map<String, Object>> plugins = new ArrayList<>();
        if (array.isArray()) {
            for (JsonNode node : array) {
                plugins.add(MAPPER.convertValue(node, MAP_TYPE));
            }
        }
        log.info("Plugin server offers {} plugins", plugins.size());
        return plugins;
    }

    public Map<String, Object> getPluginInfo(String pluginId) throws IOException {
        return getJson("/api/plugins/" + checkId(pluginId), MAP_TYPE);
    }

    @Override
    public Path fetchPackage(String pluginId) throws IOException {
        String id = checkId(pluginId);
        Files.createDirectories(downloadDir);
        Path partial = Files.createTempFile(downloadDir, id + "-", ".part");
        try {
            HttpResponse<Path> response = send(request("/api/plugins/" + id + "/download"),
                    HttpResponse.BodyHandlers.ofFile(partial));
            checkStatus(response, "download of plugin " + id);
            Path target = downloadDir.resolve(id + ".zip");
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Downloaded plugin {} ({} bytes) to {}", id, Files.size(target), target);
            return target;
        } finally {
            Files.deleteIfExists(partial);
        }
    }

    private <T> T getJson(String path, TypeReference<T> type) throws IOException {
        HttpRequest request = request(path);
        log.debug("GET {}", request.uri());
        HttpResponse<String> response = send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        checkStatus(response, "GET " + path);
        return MAPPER.readValue(response.body(), type);
    }

    private HttpRequest request(String path) {
        return HttpRequest.newBuilder(URI.create(serverUrl + path))
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json, application/zip")
                .timeout(timeout)
                .GET()
                .build();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) throws IOException {
        try {
            return httpClient.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ex = new InterruptedIOException("Interrupted while calling " + request.uri());
            ex.initCause(e);
            throw ex;
        }
    }

    private static void checkStatus(HttpResponse<?> response, String what) throws PluginServerException {
        int code = response.statusCode();
        if (code < 200 || code >= 300) {
            log.warn("Plugin server answered {} to {}", code, what);
            throw new PluginServerException("Plugin server returned HTTP " + code + " for " + what, code);
        }
    }

    private static String checkId(String pluginId) {
        if (!PluginManifest.isValidId(pluginId)) {
            throw new IllegalArgumentException("Invalid plugin id: " + pluginId);
        }
        return pluginId;
    }
}
