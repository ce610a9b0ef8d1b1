package com.plughub.downloader;

import com.plughub.config.PlugHubConfig;
import com.plughub.events.EventBus;
import com.plughub.manager.OperationResult;
import com.plughub.manager.PluginManager;
import com.plughub.plugin.AbstractPlugin;
import com.plughub.repository.InMemoryPluginRepository;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpPluginDownloaderTest {

    @TempDir
    Path tmp;

    private HttpServer server;
    private final Map<String, String> lastQuery = new ConcurrentHashMap<>();
    private PlugHubConfig config;
    private HttpPluginDownloader downloader;
    private byte[] weatherZip;

    @BeforeEach
    void setUp() throws IOException {
        weatherZip = weatherZip();
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/server/status", ex -> respond(ex, 200, "{\"status\":\"online\"}", "application/json"));
        server.createContext("/api/plugins/available", ex -> {
            String query = ex.getRequestURI().getQuery();
            lastQuery.put("available", query != null ? query : "");
            String body = query != null
                    ? "{\"plugins\":[{\"id\":\"weather\",\"version\":\"1.2.0\"}]}"
                    : "[{\"id\":\"weather\",\"version\":\"1.2.0\"},{\"id\":\"news\",\"version\":\"0.1.0\"}]";
            respond(ex, 200, body, "application/json");
        });
        server.createContext("/api/plugins/", ex -> {
            lastQuery.put("agent", ex.getRequestHeaders().getFirst("User-Agent"));
            String path = ex.getRequestURI().getPath();
            if (path.equals("/api/plugins/weather")) {
                respond(ex, 200, "{\"id\":\"weather\",\"version\":\"1.2.0\",\"name\":\"Weather\"}", "application/json");
            } else if (path.equals("/api/plugins/weather/download")) {
                respond(ex, 200, weatherZip, "application/zip");
            } else {
                respond(ex, 404, "{\"error\":\"not found\"}", "application/json");
            }
        });
        server.start();
        config = PlugHubConfig.builder(tmp.resolve("home"))
                .serverUrl("http://127.0.0.1:" + server.getAddress().getPort() + "/")
                .build();
        downloader = new HttpPluginDownloader(config);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void getServerStatus_fillsMissingVersion() throws Exception {
        Map<String, Object> status = downloader.getServerStatus();

        assertEquals("online", status.get("status"));
        assertEquals("unknown", status.get("version"));
    }

    @Test
    void listAvailablePlugins_acceptsArrayAndWrappedForms() throws Exception {
        List<Map<String, Object>> all = downloader.listAvailablePlugins(null);
        assertEquals(2, all.size());
        assertEquals("news", all.get(1).get("id"));

        List<Map<String, Object>> tools = downloader.listAvailablePlugins("home tools");
        assertEquals(1, tools.size());
        assertEquals("category=home+tools", lastQuery.get("available"));
    }

    @Test
    void getPluginInfo_readsDocument() throws Exception {
        assertEquals("Weather", downloader.getPluginInfo("weather").get("name"));
        assertEquals(HttpPluginDownloader.USER_AGENT, lastQuery.get("agent"));
        assertThrows(IllegalArgumentException.class, () -> downloader.getPluginInfo("../etc"));
    }

    @Test
    void fetchPackage_savesArchiveInDownloadDir() throws Exception {
        Path pkg = downloader.fetchPackage("weather");

        assertEquals(config.getDownloadDir().resolve("weather.zip"), pkg);
        assertArrayEquals(weatherZip, Files.readAllBytes(pkg));
    }

    @Test
    void fetchPackage_httpErrorLeavesNoPartialFile() throws Exception {
        PluginServerException e = assertThrows(PluginServerException.class, () -> downloader.fetchPackage("missing"));

        assertEquals(404, e.getStatusCode());
        try (Stream<Path> files = Files.list(config.getDownloadDir())) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void installFromRemote_downloadsAndLoads() {
        EventBus bus = new EventBus();
        PluginManager manager = PluginManager.builder()
                .config(config)
                .repository(new InMemoryPluginRepository())
                .eventBus(bus)
                .downloader(downloader)
                .build();
        manager.initialize();
        try {
            OperationResult installed = manager.installFromRemote("weather", true);
            assertTrue(installed.isSuccess(), installed.getMessage());
            assertTrue(manager.isLoaded("weather"));
            assertEquals("sunny", manager.process("weather", Map.of()).getData().get("forecast"));

            OperationResult missing = manager.installFromRemote("missing", false);
            assertTrue(missing.getMessage().contains("404"), missing.getMessage());
        } finally {
            manager.onExit();
            bus.shutdown();
        }
    }

    private static void respond(HttpExchange ex, int status, String body, String contentType) throws IOException {
        respond(ex, status, body.getBytes(StandardCharsets.UTF_8), contentType);
    }

    private static void respond(HttpExchange ex, int status, byte[] body, String contentType) throws IOException {
        ex.getResponseHeaders().add("Content-Type", contentType);
        ex.sendResponseHeaders(status, body.length);
        try (OutputStream out = ex.getResponseBody()) {
            out.write(body);
        }
    }

    private static byte[] weatherZip() throws IOException {
        String manifest = "{\"id\":\"weather\",\"name\":\"Weather\",\"version\":\"1.2.0\",\"main\":\""
                + WeatherPlugin.class.getName() + "\"}";
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            zip.putNextEntry(new ZipEntry("manifest.json"));
            zip.write(manifest.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        }
        return bytes.toByteArray();
    }

    public static class WeatherPlugin extends AbstractPlugin {
        @Override
        public Map<String, Object> process(Map<String, Object> input) {
            return Map.of("forecast", "sunny");
        }
    }
}
