package com.plughub.manager;

import com.plughub.plugin.ManifestException;
import com.plughub.plugin.PluginManifest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Turns a package (directory or {@code .zip} of one) into an installed plugin directory.
 * <p>
 * {@link #stage(Path)} validates the manifest before touching the filesystem, then copies the package
 * to {@code <pluginsDir>/.staging/<uuid>}. {@link #commit(StagedPackage, Path)} swaps it into place,
 * keeping the previous directory as a backup until {@link Backup#discard()} or {@link Backup#restore()}.
 */
final class PackageInstaller {

    private static final Logger log = LoggerFactory.getLogger(PackageInstaller.class);

    static final String STAGING_DIR = ".staging";
    static final String BACKUP_DIR = ".backup";

    private final Path pluginsDir;

    PackageInstaller(Path pluginsDir) {
        this.pluginsDir = pluginsDir;
    }

    /**
     * @throws ManifestException if the package has no valid manifest or an unsupported format
     * @throws IOException       if the package cannot be read or copied
     */
    StagedPackage stage(Path source) throws IOException {
        if (!Files.exists(source)) {
            throw new NoSuchFileException(source.toString(), null, "plugin package not found");
        }
        if (Files.isDirectory(source)) {
            PluginManifest manifest = PluginManifest.readFromDirectory(source);
            Path root = newStagingRoot();
            Path content = root.resolve("package");
            try {
                PluginFiles.copyRecursively(source, content);
            } catch (IOException e) {
                PluginFiles.deleteRecursively(root);
                throw e;
            }
            log.debug("Staged directory package {} v{} from {}", manifest.getId(), manifest.getVersion(), source);
            return new StagedPackage(manifest, root, content);
        }
        if (isZip(source)) {
            return stageZip(source);
        }
        throw new ManifestException("Unsupported package " + source.getFileName()
                + ": expected a directory or a .zip archive");
    }

    /**
     * Moves the staged content to {@code target}. A previous target is moved aside first; on failure the
     * partial target is removed and the previous one restored.
     */
    Backup commit(StagedPackage staged, Path target) throws IOException {
        Path backup = null;
        if (Files.exists(target)) {
            Path backupRoot = Files.createDirectories(pluginsDir.resolve(BACKUP_DIR));
            backup = backupRoot.resolve(target.getFileName() + "-" + UUID.randomUUID());
            PluginFiles.move(target, backup);
        }
        try {
            Files.createDirectories(target.getParent());
            PluginFiles.move(staged.content(), target);
        } catch (IOException e) {
            log.warn("Installing into {} failed, rolling back: {}", target, e.getMessage());
            rollback(target, backup);
            throw e;
        }
        return new Backup(target, backup);
    }

    private StagedPackage stageZip(Path zip) throws IOException {
        try (ZipFile zf = new ZipFile(zip.toFile())) {
            String prefix = findManifestPrefix(zf);
            PluginManifest manifest;
            try (InputStream in = zf.getInputStream(zf.getEntry(prefix + PluginManifest.FILE_NAME))) {
                manifest = PluginManifest.parse(in);
            }
            Path root = newStagingRoot();
            Path content = root.resolve("package");
            try {
                extract(zf, prefix, content);
            } catch (IOException | RuntimeException e) {
                PluginFiles.deleteRecursively(root);
                throw e;
            }
            log.debug("Staged zip package {} v{} from {}", manifest.getId(), manifest.getVersion(), zip);
            return new StagedPackage(manifest, root, content);
        }
    }

    /** "" when manifest.json sits at the archive root, "dir/" when the archive wraps one top-level directory. */
    private static String findManifestPrefix(ZipFile zf) {
        if (zf.getEntry(PluginManifest.FILE_NAME) != null) {
            return "";
        }
        List<String> candidates = new ArrayList<>();
        Enumeration<? extends ZipEntry> entries = zf.entries();
        while (entries.hasMoreElements()) {
            String name = entries.nextElement().getName();
            int slash = name.indexOf('/');
            if (slash > 0 && name.equals(name.substring(0, slash + 1) + PluginManifest.FILE_NAME)) {
                candidates.add(name.substring(0, slash + 1));
            }
        }
        if (candidates.size() != 1) {
            throw new ManifestException("Missing " + PluginManifest.FILE_NAME + " in archive " + zf.getName());
        }
        return candidates.get(0);
    }

    private static void extract(ZipFile zf, String prefix, Path content) throws IOException {
        Path base = content.toAbsolutePath().normalize();
        Files.createDirectories(base);
        Enumeration<? extends ZipEntry> entries = zf.entries();
        while (entries.hasMoreElements()) {
            ZipEntry entry = entries.nextElement();
            String name = entry.getName();
            if (!name.startsWith(prefix) || name.length() == prefix.length()) {
                continue;
            }
            Path out = base.resolve(name.substring(prefix.length())).normalize();
            if (!out.startsWith(base)) {
                throw new ManifestException("Archive entry escapes the package directory: " + name);
            }
            if (entry.isDirectory()) {
                Files.createDirectories(out);
            } else {
                Files.createDirectories(out.getParent());
                try (InputStream in = zf.getInputStream(entry)) {
                    Files.copy(in, out);
                }
            }
        }
    }

    private Path newStagingRoot() throws IOException {
        return Files.createDirectories(pluginsDir.resolve(STAGING_DIR).resolve(UUID.randomUUID().toString()));
    }

    private static boolean isZip(Path source) {
        return Files.isRegularFile(source)
                && source.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private static void rollback(Path target, Path backup) {
        try {
            PluginFiles.deleteRecursively(target);
            if (backup != null) {
                PluginFiles.move(backup, target);
            }
        } catch (IOException e) {
            log.error("Rollback of {} failed (backup: {}): {}", target, backup, e.getMessage(), e);
        }
    }

    /** Previous directory of a committed install. */
    static final class Backup {
        private final Path target;
        private final Path previous;

        Backup(Path target, Path previous) {
            this.target = target;
            this.previous = previous;
        }

        /** Puts the previous directory back (or removes the target if there was none). */
        void restore() {
            rollback(target, previous);
        }

        void discard() {
            if (previous == null) return;
            try {
                PluginFiles.deleteRecursively(previous);
            } catch (IOException e) {
                log.warn("Failed to remove backup {}: {}", previous, e.getMessage());
            }
        }
    }
}
