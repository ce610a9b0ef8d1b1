package com.plughub.manager;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/** Writes plugin package directories and archives for manager tests. */
final class TestPackages {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TestPackages() {
    }

    static Path directory(Path parent, String id, String version, Class<?> main, String... dependencies)
            throws IOException {
        Map<String, Object> manifest = manifest(id, version, main, dependencies);
        return directory(parent.resolve(id + "-" + version), manifest);
    }

    static Path directory(Path dir, Map<String, Object> manifest) throws IOException {
        Files.createDirectories(dir);
        MAPPER.writerWithDefaultPrettyPrinter().writeValue(dir.resolve("manifest.json").toFile(), manifest);
        Files.writeString(dir.resolve("README.txt"), "plugin " + manifest.get("id"));
        return dir;
    }

    static Map<String, Object> manifest(String id, String version, Class<?> main, String... dependencies) {
        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("id", id);
        manifest.put("name", id.toUpperCase() + " plugin");
        manifest.put("version", version);
        manifest.put("author", "tests");
        manifest.put("dependencies", List.of(dependencies));
        manifest.put("main", main.getName());
        return manifest;
    }

    /** Zips {@code dir} with its files under a single top-level folder. */
    static Path zip(Path dir, Path zipFile) throws IOException {
        String top = dir.getFileName().toString() + "/";
        try (OutputStream out = Files.newOutputStream(zipFile);
             ZipOutputStream zip = new ZipOutputStream(out);
             Stream<Path> files = Files.walk(dir)) {
            for (Path file : files.filter(Files::isRegularFile).sorted().toList()) {
                zip.putNextEntry(new ZipEntry(top + dir.relativize(file).toString().replace('\\', '/')));
                zip.write(Files.readAllBytes(file));
                zip.closeEntry();
            }
        }
        return zipFile;
    }

    /** Archive with a manifest at the root and one entry escaping the extraction directory. */
    static Path zipSlip(Path zipFile, Map<String, Object> manifest) throws IOException {
        try (ZipOutputStream zip = new ZipOutputStream(Files.newOutputStream(zipFile))) {
            zip.putNextEntry(new ZipEntry("manifest.json"));
            zip.write(MAPPER.writeValueAsBytes(manifest));
            zip.closeEntry();
            zip.putNextEntry(new ZipEntry("../../evil.txt"));
            zip.write("owned".getBytes());
            zip.closeEntry();
        }
        return zipFile;
    }
}
