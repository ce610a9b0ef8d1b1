package com.plughub.plugin;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed {@code manifest.json} of a plugin package.
 * <p>
 * Required: {@code id}, {@code name}, {@code version}. Optional: {@code author}, {@code description},
 * {@code dependencies} (list of ids), {@code main}, {@code dialect} (default {@link PluginDialect#CLASS}),
 * {@code builtin}, {@code requires} (fully qualified class names the plugin needs from its own class path
 * or the host's; checked at load, never fetched). Any other key is kept verbatim and ends up in the record metadata.
 */
public final class PluginManifest {

    public static final String FILE_NAME = "manifest.json";

    public static final String KEY_ID = "id";
    public static final String KEY_NAME = "name";
    public static final String KEY_VERSION = "version";
    public static final String KEY_AUTHOR = "author";
    public static final String KEY_DESCRIPTION = "description";
    public static final String KEY_DEPENDENCIES = "dependencies";
    public static final String KEY_MAIN = "main";
    public static final String KEY_DIALECT = "dialect";
    public static final String KEY_BUILTIN = "builtin";
    public static final String KEY_REQUIRES = "requires";

    private static final Set<String> KNOWN_KEYS = Set.of(KEY_ID, KEY_NAME, KEY_VERSION, KEY_AUTHOR,
            KEY_DESCRIPTION, KEY_DEPENDENCIES, KEY_MAIN, KEY_DIALECT, KEY_BUILTIN, KEY_REQUIRES);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /** Letters, digits, dot, underscore, dash; starts with a letter or digit. */
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    /** MAJOR.MINOR[.PATCH] with optional pre-release and build suffixes. */
    private static final Pattern VERSION_PATTERN =
            Pattern.compile("\\d+\\.\\d+(\\.\\d+)?(-[0-9A-Za-z.-]+)?(\\+[0-9A-Za-z.-]+)?");

    private final String id;
    private final String name;
    private final String version;
    private final String author;
    private final String description;
    private final List<String> dependencies;
    private final String main;
    private final String dialect;
    private final boolean builtin;
    private final List<String> requires;
    private final Map<String, Object> extras;

    private PluginManifest(Map<String, Object> raw) {
        this.id = ((String) raw.get(KEY_ID)).trim();
        this.name = ((String) raw.get(KEY_NAME)).trim();
        this.version = ((String) raw.get(KEY_VERSION)).trim();
        this.author = stringOrEmpty(raw.get(KEY_AUTHOR));
        this.description = stringOrEmpty(raw.get(KEY_DESCRIPTION));
        List<String> deps = new ArrayList<>();
        if (raw.get(KEY_DEPENDENCIES) instanceof List<?> list) {
            for (Object o : list) {
                String dep = ((String) o).trim();
                if (!deps.contains(dep)) deps.add(dep);
            }
        }
        this.dependencies = List.copyOf(deps);
        this.main = raw.get(KEY_MAIN) instanceof String s && !s.isBlank() ? s.trim() : null;
        this.dialect = raw.get(KEY_DIALECT) instanceof String s && !s.isBlank() ? s.trim() : PluginDialect.CLASS;
        this.builtin = Boolean.TRUE.equals(raw.get(KEY_BUILTIN));
        List<String> classes = new ArrayList<>();
        if (raw.get(KEY_REQUIRES) instanceof List<?> list) {
            for (Object o : list) {
                classes.add(((String) o).trim());
            }
        }
        this.requires = List.copyOf(classes);
        Map<String, Object> extra = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (!KNOWN_KEYS.contains(k)) extra.put(k, v);
        });
        this.extras = Collections.unmodifiableMap(extra);
    }

    /**
     * Reads and validates {@code manifest.json} inside a plugin directory.
     *
     * @throws ManifestException if the file is missing, not JSON, or invalid
     */
    public static PluginManifest readFromDirectory(Path pluginDir) {
        Path file = pluginDir.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            throw new ManifestException("Missing " + FILE_NAME + " in " + pluginDir);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        } catch (IOException e) {
            throw new ManifestException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses and validates manifest JSON.
     *
     * @throws ManifestException if the content is not a JSON object or fails validation
     */
    public static PluginManifest parse(InputStream json) {
        Map<String, Object> raw;
        try {
            raw = MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ManifestException("Manifest is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ManifestException("Cannot read manifest: " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new ManifestException("Manifest is empty");
        }
        return fromMap(raw);
    }

    /**
     * Validates and wraps an already parsed manifest.
     *
     * @throws ManifestException listing every problem found
     */
    public static PluginManifest fromMap(Map<String, Object> raw) {
        ValidationResult result = validate(raw);
        if (!result.isValid()) {
            throw new ManifestException(result.getErrors());
        }
        return new PluginManifest(raw);
    }

    /** Checks required fields, id shape, version format and the types of optional fields. */
    public static ValidationResult validate(Map<String, Object> raw) {
        if (raw == null) {
            return ValidationResult.failure("manifest is null");
        }
        List<String> errors = new ArrayList<>();
        Object id = raw.get(KEY_ID);
        if (!(id instanceof String s) || s.isBlank()) {
            errors.add("missing required field 'id'");
        } else if (!isValidId(s.trim())) {
            errors.add("invalid id '" + s + "': use letters, digits, '.', '_' or '-'");
        }
        Object name = raw.get(KEY_NAME);
        if (!(name instanceof String s) || s.isBlank()) {
            errors.add("missing required field 'name'");
        }
        Object version = raw.get(KEY_VERSION);
        if (!(version instanceof String s) || s.isBlank()) {
            errors.add("missing required field 'version'");
        } else if (!isValidVersion(s.trim())) {
            errors.add("invalid version '" + s + "': expected MAJOR.MINOR[.PATCH]");
        }
        for (String key : List.of(KEY_AUTHOR, KEY_DESCRIPTION, KEY_MAIN, KEY_DIALECT)) {
            Object v = raw.get(key);
            if (v != null && !(v instanceof String)) {
                errors.add("field '" + key + "' must be a string");
            }
        }
        Object builtin = raw.get(KEY_BUILTIN);
        if (builtin != null && !(builtin instanceof Boolean)) {
            errors.add("field 'builtin' must be a boolean");
        }
        Object deps = raw.get(KEY_DEPENDENCIES);
        if (deps != null) {
            if (!(deps instanceof List<?> list)) {
                errors.add("field 'dependencies' must be a list of plugin ids");
            } else {
                for (Object dep : list) {
                    if (!(dep instanceof String d) || !isValidId(d.trim())) {
                        errors.add("invalid dependency '" + dep + "'");
                    } else if (id instanceof String s && d.trim().equals(s.trim())) {
                        errors.add("plugin cannot depend on itself");
                    }
                }
            }
        }
        Object requires = raw.get(KEY_REQUIRES);
        if (requires != null) {
            if (!(requires instanceof List<?> list)) {
                errors.add("field 'requires' must be a list of class names");
            } else {
                for (Object cls : list) {
                    if (!(cls instanceof String c) || c.isBlank()) {
                        errors.add("invalid required class '" + cls + "'");
                    }
                }
            }
        }
        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    public static boolean isValidVersion(String version) {
        return version != null && VERSION_PATTERN.matcher(version).matches();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public String getAuthor() {
        return author;
    }

    public String getDescription() {
        return description;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    /** Entry-point class name, or null. */
    public String getMain() {
        return main;
    }

    public String getDialect() {
        return dialect;
    }

    public boolean isBuiltin() {
        return builtin;
    }

    /** Class names that must resolve before the plugin is instantiated. */
    public List<String> getRequires() {
        return requires;
    }

    /** Keys not part of the known manifest schema. */
    public Map<String, Object> getExtras() {
        return extras;
    }

    /**
     * Metadata stored on the plugin record: the extra keys plus {@code dependencies}, {@code main},
     * {@code dialect} and, when declared, {@code requires}.
     */
    public Map<String, Object> toMetadata() {
        Map<String, Object> meta = new LinkedHashMap<>(extras);
        meta.put(KEY_DEPENDENCIES, dependencies);
        if (main != null) meta.put(KEY_MAIN, main);
        meta.put(KEY_DIALECT, dialect);
        if (!requires.isEmpty()) meta.put(KEY_REQUIRES, requires);
        return meta;
    }

    private static String stringOrEmpty(Object o) {
        return o instanceof String s ? s.trim() : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PluginManifest that)) return false;
        return id.equals(that.id) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "PluginManifest{id=" + id + ", version=" + version + ", dialect=" + dialect + "}";
    }
}
