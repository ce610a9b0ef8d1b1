package com.plughub.repository;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted description of an installed or builtin plugin.
 * <p>
 * {@code metadata} is free-form; the host reads {@value #META_DEPENDENCIES} (ordered list of plugin ids),
 * {@value #META_MAIN} (entry-point class), {@value #META_DIALECT} and {@value #META_REQUIRES} (class names
 * that must resolve before the plugin is instantiated) from it.
 */
public final class PluginRecord {

    public static final String META_DEPENDENCIES = "dependencies";
    public static final String META_MAIN = "main";
    public static final String META_DIALECT = "dialect";
    public static final String META_REQUIRES = "requires";

    private final String id;
    private final String name;
    private final String version;
    private final String author;
    private final String description;
    private final boolean enabled;
    private final boolean builtin;
    private final Instant installDate;
    private final Map<String, Object> metadata;

    @JsonCreator
    public PluginRecord(@JsonProperty("id") String id,
                        @JsonProperty("name") String name,
                        @JsonProperty("version") String version,
                        @JsonProperty("author") String author,
                        @JsonProperty("description") String description,
                        @JsonProperty("enabled") boolean enabled,
                        @JsonProperty("builtin") boolean builtin,
                        @JsonProperty("installDate") Instant installDate,
                        @JsonProperty("metadata") Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name != null ? name : id;
        this.version = version != null ? version : "0.0.0";
        this.author = author != null ? author : "";
        this.description = description != null ? description : "";
        this.enabled = enabled;
        this.builtin = builtin;
        this.installDate = installDate != null ? installDate : Instant.EPOCH;
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    private PluginRecord(Builder b) {
        this(b.id, b.name, b.version, b.author, b.description, b.enabled, b.builtin, b.installDate, b.metadata);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /** Builder pre-filled with this record's values. */
    public Builder toBuilder() {
        return new Builder(id)
                .name(name)
                .version(version)
                .author(author)
                .description(description)
                .enabled(enabled)
                .builtin(builtin)
                .installDate(installDate)
                .metadata(metadata);
    }

    public PluginRecord withEnabled(boolean enabled) {
        return enabled == this.enabled ? this : toBuilder().enabled(enabled).build();
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

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isBuiltin() {
        return builtin;
    }

    public Instant getInstallDate() {
        return installDate;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /** Declared dependencies in declaration order; empty when absent or malformed. */
    @JsonIgnore
    public List<String> getDependencies() {
        Object deps = metadata.get(META_DEPENDENCIES);
        if (!(deps instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    /** Entry-point class name, or null. */
    @JsonIgnore
    public String getMain() {
        Object main = metadata.get(META_MAIN);
        return main instanceof String s && !s.isBlank() ? s : null;
    }

    /** Dialect from metadata, or {@code defaultDialect} when absent. */
    @JsonIgnore
    public String getDialect(String defaultDialect) {
        Object dialect = metadata.get(META_DIALECT);
        return dialect instanceof String s && !s.isBlank() ? s : defaultDialect;
    }

    @JsonIgnore
    public List<String> getRequiredClasses() {
        Object requires = metadata.get(META_REQUIRES);
        if (!(requires instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PluginRecord that)) return false;
        return enabled == that.enabled && builtin == that.builtin && id.equals(that.id)
                && name.equals(that.name) && version.equals(that.version) && author.equals(that.author)
                && description.equals(that.description) && installDate.equals(that.installDate)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, enabled);
    }

    @Override
    public String toString() {
        return "PluginRecord{id=" + id + ", version=" + version + ", enabled=" + enabled + ", builtin=" + builtin + "}";
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String version;
        private String author = "";
        private String description = "";
        private boolean enabled;
        private boolean builtin;
        private Instant installDate = Instant.now();
        private Map<String, Object> metadata = Map.of();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder builtin(boolean builtin) {
            this.builtin = builtin;
            return this;
        }

        public Builder installDate(Instant installDate) {
            this.installDate = installDate;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? metadata : Map.of();
            return this;
        }

        /** Sets {@value #META_DEPENDENCIES} in the metadata. */
        public Builder dependencies(List<String> dependencies) {
            Map<String, Object> m = new LinkedHashMap<>(metadata);
            m.put(META_DEPENDENCIES, List.copyOf(dependencies));
            this.metadata = m;
            return this;
        }

        public PluginRecord build() {
            return new PluginRecord(this);
        }
    }
}
