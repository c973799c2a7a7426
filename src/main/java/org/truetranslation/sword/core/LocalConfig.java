package org.truetranslation.sword.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.truetranslation.sword.core.format.ConfParser;
import org.truetranslation.sword.core.model.ModuleInfo;
import org.truetranslation.sword.core.model.Source;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A local SWORD directory. There is no separate database of installed
 * modules: a module counts as installed while its descriptor sits in
 * {@code mods.d}, and every query reads the directory afresh.
 */
public class LocalConfig {
    private static final Logger LOG = LoggerFactory.getLogger(LocalConfig.class);

    static final String INSTALL_CONF = "install.conf";

    private final Path swordDir;

    public LocalConfig(Path swordDir) {
        this.swordDir = swordDir.toAbsolutePath().normalize();
    }

    public static Path defaultSwordDir() {
        return Paths.get(System.getProperty("user.home"), ".sword");
    }

    /**
     * Opens an existing SWORD directory.
     *
     * @throws IOException if the path does not exist or is not a directory
     */
    public static LocalConfig load(Path swordDir) throws IOException {
        if (!Files.exists(swordDir)) {
            throw new IOException("sword directory not found: " + swordDir);
        }
        if (!Files.isDirectory(swordDir)) {
            throw new IOException("path is not a directory: " + swordDir);
        }
        return new LocalConfig(swordDir);
    }

    public Path getSwordDir() { return swordDir; }
    public Path getModsDir() { return swordDir.resolve("mods.d"); }
    public Path getModulesDir() { return swordDir.resolve("modules"); }

    public void ensureDirectories() throws IOException {
        for (Path dir : List.of(swordDir, getModsDir(), getModulesDir())) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new IOException("creating directory " + dir + ": " + e.getMessage(), e);
            }
        }
    }

    /**
     * Reads every module descriptor in {@code mods.d}, ordered by file name.
     * Descriptors that cannot be read or parsed are left out.
     */
    public List<ModuleInfo> listInstalledModules() throws IOException {
        Path modsDir = getModsDir();
        if (!Files.isDirectory(modsDir)) {
            return Collections.emptyList();
        }

        List<Path> confFiles;
        try (Stream<Path> files = Files.list(modsDir)) {
            confFiles = files
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".conf"))
                .filter(p -> !p.getFileName().toString().equals(INSTALL_CONF))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new IOException("reading mods.d: " + e.getMessage(), e);
        }

        List<ModuleInfo> modules = new ArrayList<>();
        for (Path confPath : confFiles) {
            try {
                ModuleInfo module = ConfParser.parseModuleConf(Files.readAllBytes(confPath),
                    confPath.getFileName().toString());
                modules.add(module.withConfPath(confPath.toString()));
            } catch (IOException e) {
                LOG.debug("Skipping {}: {}", confPath, e.getMessage());
            }
        }
        return modules;
    }

    /** Looks a module up by ID, ignoring case. */
    public Optional<ModuleInfo> getInstalledModule(String moduleId) throws IOException {
        return listInstalledModules().stream()
            .filter(m -> m.getId().equalsIgnoreCase(moduleId))
            .findFirst();
    }

    public boolean isModuleInstalled(String moduleId) throws IOException {
        return getInstalledModule(moduleId).isPresent();
    }

    /** Absolute location of a descriptor's {@code DataPath}, e.g. {@code ./modules/texts/ztext/kjv/}, inside the SWORD directory. */
    public Path getModuleDataPath(String dataPath) {
        String path = dataPath == null ? "" : dataPath;
        if (path.startsWith("./")) {
            path = path.substring(2);
        }
        // DataPath is always relative to the SWORD directory, even when written with a leading slash.
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return swordDir.resolve(path).normalize();
    }

    /** Sum of the sizes of all regular files under the module's data directory. */
    public long getModuleActualSize(String dataPath) throws IOException {
        Path fullPath = getModuleDataPath(dataPath);
        if (!Files.exists(fullPath)) {
            throw new IOException("data directory not found: " + fullPath);
        }
        try (Stream<Path> files = Files.walk(fullPath)) {
            long total = 0;
            for (Path p : (Iterable<Path>) files::iterator) {
                if (Files.isRegularFile(p)) {
                    total += Files.size(p);
                }
            }
            return total;
        }
    }

    public void saveInstallConf(List<Source> sources) throws IOException {
        Files.createDirectories(getModsDir());
        Path confPath = getModsDir().resolve(INSTALL_CONF);
        Files.write(confPath, ConfParser.formatSourcesConf(sources).getBytes(StandardCharsets.UTF_8));
    }

    /** Sources saved in {@code mods.d/install.conf}; empty when the file does not exist. */
    public List<Source> loadInstallConf() throws IOException {
        Path confPath = getModsDir().resolve(INSTALL_CONF);
        if (!Files.exists(confPath)) {
            return Collections.emptyList();
        }
        try {
            return ConfParser.parseSourcesConf(Files.readString(confPath, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IOException("reading install.conf: " + e.getMessage(), e);
        }
    }

    /** The conventional descriptor location, {@code mods.d/<lower-case id>.conf}. */
    public Path getModuleConfPath(String moduleId) {
        return getModsDir().resolve(moduleId.toLowerCase(Locale.ROOT) + ".conf");
    }

    public Path writeModuleConf(String moduleId, byte[] content) throws IOException {
        Files.createDirectories(getModsDir());
        Path confPath = getModuleConfPath(moduleId);
        Files.write(confPath, content);
        return confPath;
    }

    /** @throws java.nio.file.NoSuchFileException if there is no such descriptor */
    public void removeModuleConf(String moduleId) throws IOException {
        Files.delete(getModuleConfPath(moduleId));
    }
}
