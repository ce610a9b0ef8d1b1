package com.plughub.plugin;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginManifestTest {

    @TempDir
    Path tempDir;

    @Test
    void parse_fullManifestKeepsExtrasInMetadata() {
        String json = """
                {"id":"weather","name":"Weather","version":"1.2.0","author":"ops","description":"Forecasts",
                 "dependencies":["http-client","http-client"],"main":"org.example.WeatherPlugin",
                 "category":"data","supported_input_types":["text"]}
                """;

        PluginManifest m = PluginManifest.parse(stream(json));

        assertEquals("weather", m.getId());
        assertEquals("1.2.0", m.getVersion());
        assertEquals(List.of("http-client"), m.getDependencies());
        assertEquals(PluginDialect.CLASS, m.getDialect());
        assertFalse(m.isBuiltin());
        Map<String, Object> meta = m.toMetadata();
        assertEquals("data", meta.get("category"));
        assertEquals(List.of("text"), meta.get("supported_input_types"));
        assertEquals("org.example.WeatherPlugin", meta.get(PluginManifest.KEY_MAIN));
        assertEquals(PluginDialect.CLASS, meta.get(PluginManifest.KEY_DIALECT));
    }

    @Test
    void validate_reportsEveryProblem() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("id", "bad id!");
        raw.put("name", "");
        raw.put("dependencies", "not-a-list");
        raw.put("builtin", "yes");
        raw.put("main", 42);

        ValidationResult result = PluginManifest.validate(raw);

        assertFalse(result.isValid());
        assertEquals(6, result.getErrors().size(), result.toString());
        assertTrue(result.getErrors().contains("missing required field 'version'"));
    }

    @Test
    void fromMap_missingVersionThrowsManifestException() {
        ManifestException e = assertThrows(ManifestException.class,
                () -> PluginManifest.fromMap(Map.of("id", "a", "name", "A")));
        assertEquals(List.of("missing required field 'version'"), e.getErrors());
    }

    @Test
    void fromMap_rejectsSelfDependencyAndBadVersion() {
        ValidationResult result = PluginManifest.validate(Map.of(
                "id", "a", "name", "A", "version", "one", "dependencies", List.of("a")));

        assertEquals(2, result.getErrors().size());
    }

    @Test
    void requires_keptInMetadataAndTypeChecked() {
        PluginManifest m = PluginManifest.fromMap(Map.of("id", "db", "name", "DB", "version", "1.0.0",
                "requires", List.of(" org.h2.Driver ")));

        assertEquals(List.of("org.h2.Driver"), m.getRequires());
        assertEquals(List.of("org.h2.Driver"), m.toMetadata().get(PluginManifest.KEY_REQUIRES));
        assertFalse(PluginManifest.fromMap(Map.of("id", "a", "name", "A", "version", "1.0.0"))
                .toMetadata().containsKey(PluginManifest.KEY_REQUIRES));

        ValidationResult bad = PluginManifest.validate(Map.of("id", "db", "name", "DB", "version", "1.0.0",
                "requires", "org.h2.Driver"));
        assertEquals(List.of("field 'requires' must be a list of class names"), bad.getErrors());
    }

    @Test
    void isValidVersion_acceptsSemverVariants() {
        assertTrue(PluginManifest.isValidVersion("1.0"));
        assertTrue(PluginManifest.isValidVersion("2.10.3"));
        assertTrue(PluginManifest.isValidVersion("1.0.0-beta.1+build.7"));
        assertFalse(PluginManifest.isValidVersion("1"));
        assertFalse(PluginManifest.isValidVersion("v1.0"));
    }

    @Test
    void readFromDirectory_missingFileAndInvalidJson() throws Exception {
        assertThrows(ManifestException.class, () -> PluginManifest.readFromDirectory(tempDir));

        Files.writeString(tempDir.resolve(PluginManifest.FILE_NAME), "{not json");
        ManifestException e = assertThrows(ManifestException.class, () -> PluginManifest.readFromDirectory(tempDir));
        assertTrue(e.getMessage().contains("not valid JSON"));
    }

    @Test
    void readFromDirectory_readsDialectAndBuiltinFlag() throws Exception {
        Files.writeString(tempDir.resolve(PluginManifest.FILE_NAME),
                "{\"id\":\"f\",\"name\":\"F\",\"version\":\"0.1.0\",\"dialect\":\"function\",\"builtin\":true}");

        PluginManifest m = PluginManifest.readFromDirectory(tempDir);

        assertEquals(PluginDialect.FUNCTION, m.getDialect());
        assertTrue(m.isBuiltin());
        assertNull(m.getMain());
    }

    private static ByteArrayInputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
