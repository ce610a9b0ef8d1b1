package com.plughub.manager;

import com.plughub.plugin.ManifestException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PackageInstallerTest {

    @TempDir
    Path tmp;

    @Test
    void stage_thenCloseRemovesStagingCopy() throws Exception {
        PackageInstaller installer = new PackageInstaller(tmp.resolve("plugins"));
        Path pkg = TestPackages.directory(tmp, "alpha", "1.0.0", TestPlugins.RecordingPlugin.class);

        Path content;
        try (StagedPackage staged = installer.stage(pkg)) {
            assertEquals("alpha", staged.manifest().getId());
            content = staged.content();
            assertTrue(Files.isRegularFile(content.resolve("README.txt")));
        }
        assertFalse(Files.exists(content));
        assertTrue(Files.exists(pkg.resolve("manifest.json")));
    }

    @Test
    void stage_rejectsMissingOrManifestlessSources() throws Exception {
        PackageInstaller installer = new PackageInstaller(tmp.resolve("plugins"));

        assertThrows(NoSuchFileException.class, () -> installer.stage(tmp.resolve("nope")));
        assertThrows(ManifestException.class, () -> installer.stage(Files.createDirectories(tmp.resolve("empty"))));

        Path zip = tmp.resolve("bare.zip");
        try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(zip))) {
            out.putNextEntry(new ZipEntry("a/readme.txt"));
            out.write("no manifest".getBytes());
            out.closeEntry();
        }
        assertThrows(ManifestException.class, () -> installer.stage(zip));
    }

    @Test
    void commit_replacesTargetAndRestoreBringsPreviousBack() throws Exception {
        Path plugins = tmp.resolve("plugins");
        PackageInstaller installer = new PackageInstaller(plugins);
        Path target = plugins.resolve("alpha");
        try (StagedPackage v1 = installer.stage(TestPackages.directory(tmp, "alpha", "1.0.0",
                TestPlugins.RecordingPlugin.class))) {
            installer.commit(v1, target).discard();
        }

        try (StagedPackage v2 = installer.stage(TestPackages.directory(tmp, "alpha", "2.0.0",
                TestPlugins.RecordingPlugin.class))) {
            PackageInstaller.Backup backup = installer.commit(v2, target);
            assertTrue(Files.readString(target.resolve("manifest.json")).contains("2.0.0"));

            backup.restore();
        }
        assertTrue(Files.readString(target.resolve("manifest.json")).contains("1.0.0"));
    }
}
