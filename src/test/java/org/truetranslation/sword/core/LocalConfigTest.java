package org.truetranslation.sword.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.truetranslation.sword.core.model.ModuleInfo;
import org.truetranslation.sword.core.model.Source;
import org.truetranslation.sword.core.model.SourceType;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalConfigTest {

    @TempDir
    Path swordDir;

    private LocalConfig config;

    @BeforeEach
    void setUp() {
        config = new LocalConfig(swordDir);
    }

    @Test
    void listInstalledModules_shouldBeEmptyWithoutModsDirectory() throws IOException {
        assertThat(config.listInstalledModules()).isEmpty();
    }

    @Test
    void listInstalledModules_shouldReadOnlyParseableConfFiles() throws IOException {
        config.ensureDirectories();
        Path mods = config.getModsDir();
        Files.writeString(mods.resolve("web.conf"), "[WEB]\nVersion=1.0\n");
        Files.writeString(mods.resolve("kjv.conf"), "[KJV]\nVersion=2.9\n");
        Files.writeString(mods.resolve("install.conf"), "[General]\n");
        Files.writeString(mods.resolve("broken.conf"), "no header here\n");
        Files.writeString(mods.resolve("notes.txt"), "[Notes]\n");
        Files.createDirectories(mods.resolve("sub.conf"));

        List<ModuleInfo> modules = config.listInstalledModules();

        assertThat(modules).extracting(ModuleInfo::getId).containsExactly("KJV", "WEB");
        assertThat(modules.get(0).getConfPath()).isEqualTo(mods.resolve("kjv.conf").toString());
    }

    @Test
    void getInstalledModule_shouldIgnoreCase() throws IOException {
        config.writeModuleConf("KJV", "[KJV]\n".getBytes(StandardCharsets.UTF_8));

        assertThat(config.getInstalledModule("kjv")).isPresent();
        assertThat(config.isModuleInstalled("Kjv")).isTrue();
        assertThat(config.isModuleInstalled("ESV")).isFalse();
    }

    @Test
    void getModuleDataPath_shouldNormalizeConfValue() {
        Path expected = swordDir.toAbsolutePath().resolve("modules/texts/ztext/kjv");

        assertThat(config.getModuleDataPath("./modules/texts/ztext/kjv/")).isEqualTo(expected);
        assertThat(config.getModuleDataPath("modules/texts/ztext/kjv")).isEqualTo(expected);
    }

    @Test
    void getModuleDataPath_shouldKeepLeadingSlashPathsInsideSwordDir() {
        assertThat(config.getModuleDataPath("/a/b/")).isEqualTo(config.getModuleDataPath("a/b/"));
        assertThat(config.getModuleDataPath("/modules/texts/ztext/kjv/"))
            .startsWith(swordDir.toAbsolutePath())
            .isEqualTo(config.getModuleDataPath("./modules/texts/ztext/kjv/"));
    }

    @Test
    void load_shouldRequireExistingDirectory() throws IOException {
        Path file = Files.writeString(swordDir.resolve("file"), "x");

        assertThatThrownBy(() -> LocalConfig.load(swordDir.resolve("absent")))
            .isInstanceOf(IOException.class).hasMessageContaining("not found");
        assertThatThrownBy(() -> LocalConfig.load(file))
            .isInstanceOf(IOException.class).hasMessageContaining("not a directory");
        assertThat(LocalConfig.load(swordDir).getSwordDir()).isEqualTo(swordDir.toAbsolutePath().normalize());
    }

    @Test
    void installConf_shouldRoundTrip() throws IOException {
        assertThat(config.loadInstallConf()).isEmpty();
        List<Source> sources = List.of(
            new Source("CrossWire", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/raw"),
            new Source("Mirror", SourceType.HTTPS, "mirror.example.org", "/sword"));

        config.saveInstallConf(sources);

        assertThat(config.getModsDir().resolve("install.conf")).exists();
        assertThat(config.loadInstallConf()).isEqualTo(sources);
    }

    @Test
    void getModuleActualSize_shouldSumFilesRecursively() throws IOException {
        Path data = Files.createDirectories(swordDir.resolve("modules/texts/ztext/kjv/sub"));
        Files.write(data.resolve("a.bin"), new byte[10]);
        Files.write(data.getParent().resolve("b.bin"), new byte[5]);

        assertThat(config.getModuleActualSize("./modules/texts/ztext/kjv/")).isEqualTo(15L);
        assertThatThrownBy(() -> config.getModuleActualSize("./modules/none/"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void moduleConf_shouldUseLowerCaseFileName() throws IOException {
        Path written = config.writeModuleConf("KJV", "[KJV]\n".getBytes(StandardCharsets.UTF_8));

        assertThat(written.getFileName().toString()).isEqualTo("kjv.conf");
        config.removeModuleConf("KJV");
        assertThat(written).doesNotExist();
        assertThatThrownBy(() -> config.removeModuleConf("KJV")).isInstanceOf(NoSuchFileException.class);
    }
}
