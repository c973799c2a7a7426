package org.truetranslation.sword.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.truetranslation.sword.core.format.ArchiveExtractor;
import org.truetranslation.sword.core.format.ConfParser;
import org.truetranslation.sword.core.model.InstallResult;
import org.truetranslation.sword.core.model.InstallStatus;
import org.truetranslation.sword.core.model.ModuleInfo;
import org.truetranslation.sword.core.model.ModuleUpdate;
import org.truetranslation.sword.core.model.ModuleVerification;
import org.truetranslation.sword.core.model.Source;
import org.truetranslation.sword.core.transport.CancellationToken;
import org.truetranslation.sword.core.transport.RepositoryClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Installs, removes and checks SWORD modules in a {@link LocalConfig}
 * directory using packages fetched through a {@link RepositoryClient}.
 */
public class Installer {
    private static final Logger LOG = LoggerFactory.getLogger(Installer.class);

    private final LocalConfig config;
    private final RepositoryClient client;
    private final Supplier<RepositoryClient> workerClientFactory;
    private final Messages messages = Messages.getInstance();
    private ProgressCallback onProgress;

    public Installer(LocalConfig config, RepositoryClient client) {
        this(config, client, () -> new RepositoryClient(client.getOptions()));
    }

    /**
     * @param workerClientFactory supplies the client each batch worker downloads with
     */
    public Installer(LocalConfig config, RepositoryClient client, Supplier<RepositoryClient> workerClientFactory) {
        this.config = config;
        this.client = client;
        this.workerClientFactory = workerClientFactory;
    }

    public LocalConfig getConfig() {
        return config;
    }

    public void setOnProgress(ProgressCallback onProgress) {
        this.onProgress = onProgress;
    }

    /**
     * Downloads the module's package from the first candidate URL that
     * answers and unpacks it into the SWORD directory.
     *
     * @throws PackageNotAvailableException if every candidate URL reported the file missing
     * @throws IOException                  on any other download or extraction failure
     */
    public void install(CancellationToken token, Source source, ModuleInfo module) throws IOException {
        progress(1, 3, messages.format("msg.install.downloading", module.getId()));

        List<String> packageUrls = source.getModulePackageUrls(module.getId());
        byte[] data = null;
        IOException lastError = null;
        boolean allNotFound = true;
        for (String url : packageUrls) {
            try {
                data = client.download(token, url);
                LOG.debug("Fetched {} from {}", module.getId(), url);
                break;
            } catch (IOException e) {
                LOG.debug("No package at {}: {}", url, e.getMessage());
                lastError = e;
                if (!RepositoryClient.isNotFoundError(e)) {
                    allNotFound = false;
                }
            }
        }

        if (data == null) {
            if (allNotFound) {
                throw new PackageNotAvailableException(module.getId(), packageUrls.size(), lastError);
            }
            throw new IOException("downloading module package: " + lastError.getMessage(), lastError);
        }

        progress(2, 3, messages.format("msg.install.installing", module.getId()));
        config.ensureDirectories();
        try {
            ArchiveExtractor.extractZipArchive(data, config.getSwordDir());
        } catch (IOException e) {
            throw new IOException("extracting module package: " + e.getMessage(), e);
        }

        // Packages normally carry their own descriptor.
        if (!config.isModuleInstalled(module.getId())) {
            LOG.debug("Package for {} has no descriptor, writing one from the index", module.getId());
            config.writeModuleConf(module.getId(),
                ConfParser.formatModuleConf(module).getBytes(StandardCharsets.UTF_8));
        }

        progress(3, 3, messages.format("msg.install.done", module.getId()));
    }

    /**
     * Installs many modules in parallel. Blocks until every worker is done
     * and returns one result per module processed; per-module failures are
     * recorded in the results, not thrown. When the token is cancelled,
     * modules not yet started are left out of the results.
     */
    public List<InstallResult> installBatch(CancellationToken token, Source source, List<ModuleInfo> modules,
                                            BatchInstallOptions options) {
        Set<String> installed = new HashSet<>();
        if (options.isSkipInstalled()) {
            try {
                for (ModuleInfo m : config.listInstalledModules()) {
                    installed.add(m.getId().toUpperCase(Locale.ROOT));
                }
            } catch (IOException e) {
                LOG.warn("Cannot list installed modules, nothing will be skipped: {}", e.getMessage());
            }
        }

        List<InstallResult> results = new ArrayList<>(modules.size());
        if (modules.isEmpty()) {
            return results;
        }
        BlockingQueue<ModuleInfo> jobs = new ArrayBlockingQueue<>(modules.size(), false, modules);
        ReentrantLock resultsLock = new ReentrantLock();
        Consumer<InstallResult> onResult = options.getOnResult();

        int workers = Math.min(options.getWorkers(), modules.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < workers; w++) {
                futures.add(pool.submit(() -> {
                    Installer worker = new Installer(config, workerClientFactory.get(), workerClientFactory);
                    ModuleInfo module;
                    while ((module = jobs.poll()) != null) {
                        if (token.isCancelled()) {
                            return;
                        }
                        InstallResult result;
                        if (options.isSkipInstalled() && installed.contains(module.getId().toUpperCase(Locale.ROOT))) {
                            result = new InstallResult(module, source, InstallStatus.SKIPPED, null);
                        } else {
                            result = worker.installOne(token, source, module);
                        }

                        resultsLock.lock();
                        try {
                            results.add(result);
                        } finally {
                            resultsLock.unlock();
                        }
                        if (onResult != null) {
                            onResult.accept(result);
                        }
                    }
                }));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    LOG.error("Install worker stopped unexpectedly", e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel();
                    break;
                }
            }
        } finally {
            pool.shutdown();
        }
        // Workers still running after an interrupt keep appending to the shared list.
        resultsLock.lock();
        try {
            return new ArrayList<>(results);
        } finally {
            resultsLock.unlock();
        }
    }

    private InstallResult installOne(CancellationToken token, Source source, ModuleInfo module) {
        try {
            install(token, source, module);
            return new InstallResult(module, source, InstallStatus.DONE, null);
        } catch (PackageNotAvailableException e) {
            return new InstallResult(module, source, InstallStatus.UNAVAILABLE, e);
        } catch (IOException | RuntimeException e) {
            LOG.debug("Installing {} failed", module.getId(), e);
            return new InstallResult(module, source, InstallStatus.FAILED, e);
        }
    }

    /**
     * Deletes a module's data directory and descriptor.
     *
     * @throws IOException if the module is not installed, or its data path
     *                     does not lie inside the SWORD directory
     */
    public void uninstall(String moduleId) throws IOException {
        ModuleInfo module = config.getInstalledModule(moduleId)
            .orElseThrow(() -> new IOException("module " + moduleId + " is not installed"));

        Path dataPath = config.getModuleDataPath(module.getDataPath());
        if (dataPath.equals(config.getSwordDir()) || !dataPath.startsWith(config.getSwordDir())) {
            throw new IOException("refusing to remove data path outside the sword directory: " + module.getDataPath());
        }
        try {
            deleteRecursively(dataPath);
        } catch (IOException e) {
            throw new IOException("removing data directory: " + e.getMessage(), e);
        }

        Path confPath = module.getConfPath() != null
            ? Paths.get(module.getConfPath())
            : config.getModuleConfPath(moduleId);
        try {
            Files.deleteIfExists(confPath);
        } catch (IOException e) {
            throw new IOException("removing conf file: " + e.getMessage(), e);
        }
        LOG.debug("Uninstalled {} ({})", module.getId(), dataPath);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> paths = new ArrayList<>();
            walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        }
    }

    /** Downloads and parses the source's module index. */
    public List<ModuleInfo> refreshSource(CancellationToken token, Source source) throws IOException {
        byte[] data;
        try {
            data = client.download(token, source.getModsIndexUrl());
        } catch (IOException e) {
            throw new IOException("downloading module index: " + e.getMessage(), e);
        }
        try {
            return ConfParser.parseModsArchive(data);
        } catch (IOException e) {
            throw new IOException("parsing module index: " + e.getMessage(), e);
        }
    }

    public List<ModuleInfo> listAvailable(CancellationToken token, Source source) throws IOException {
        return refreshSource(token, source);
    }

    /** Installed modules whose version differs from the one the source offers. */
    public List<ModuleUpdate> checkUpdates(CancellationToken token, Source source) throws IOException {
        List<ModuleInfo> available = refreshSource(token, source);

        Map<String, ModuleInfo> installed = new HashMap<>();
        for (ModuleInfo m : config.listInstalledModules()) {
            installed.put(m.getId().toUpperCase(Locale.ROOT), m);
        }

        List<ModuleUpdate> updates = new ArrayList<>();
        for (ModuleInfo offered : available) {
            ModuleInfo local = installed.get(offered.getId().toUpperCase(Locale.ROOT));
            if (local == null) {
                continue;
            }
            ModuleUpdate update = new ModuleUpdate(offered, local.getVersion(), offered.getVersion());
            if (update.hasUpdate()) {
                updates.add(update);
            }
        }
        return updates;
    }

    /**
     * Checks that the files a module's driver needs are present: {@code ot.bzs}
     * or {@code nt.bzs} for compressed texts, {@code dict.idx} or
     * {@code dict.zdx} for compressed dictionaries, and a non-empty data
     * directory for everything else.
     *
     * @throws IOException if the module is not installed
     */
    public boolean validateModule(String moduleId) throws IOException {
        ModuleInfo module = config.getInstalledModule(moduleId)
            .orElseThrow(() -> new IOException("module " + moduleId + " is not installed"));

        Path dataPath = config.getModuleDataPath(module.getDataPath());
        if (!Files.isDirectory(dataPath)) {
            return false;
        }
        String driver = module.getDriver().toLowerCase(Locale.ROOT);
        if (driver.startsWith("ztext")) {
            return Files.exists(dataPath.resolve("ot.bzs")) || Files.exists(dataPath.resolve("nt.bzs"));
        }
        if (driver.startsWith("zld")) {
            return Files.exists(dataPath.resolve("dict.idx")) || Files.exists(dataPath.resolve("dict.zdx"));
        }
        return !isEmptyDirectory(dataPath);
    }

    public ModuleVerification verifyModule(String moduleId) {
        Optional<ModuleInfo> found;
        try {
            found = config.getInstalledModule(moduleId);
        } catch (IOException e) {
            return ModuleVerification.notInstalled(moduleId, e.getMessage());
        }
        if (found.isEmpty()) {
            return ModuleVerification.notInstalled(moduleId, "module not installed");
        }
        ModuleInfo module = found.get();
        long expected = module.getInstallSize();

        Path dataPath = config.getModuleDataPath(module.getDataPath());
        boolean dataExists;
        try {
            dataExists = !isEmptyDirectory(dataPath);
        } catch (IOException e) {
            return new ModuleVerification(moduleId, true, false, false, expected, 0,
                "cannot read data directory: " + e.getMessage());
        }

        long actual;
        try {
            actual = config.getModuleActualSize(module.getDataPath());
        } catch (IOException e) {
            return new ModuleVerification(moduleId, true, dataExists, false, expected, 0,
                "cannot calculate size: " + e.getMessage());
        }

        boolean sizeMatch = expected <= 0 || actual == expected;
        return new ModuleVerification(moduleId, true, dataExists, sizeMatch, expected, actual, null);
    }

    public List<ModuleVerification> verifyAllModules() throws IOException {
        List<ModuleVerification> results = new ArrayList<>();
        for (ModuleInfo m : config.listInstalledModules()) {
            results.add(verifyModule(m.getId()));
        }
        return Collections.unmodifiableList(results);
    }

    /** Writes a bare descriptor without any module data. */
    public void installConf(String moduleId, byte[] content) throws IOException {
        config.writeModuleConf(moduleId, content);
    }

    public void removeConf(String moduleId) throws IOException {
        config.removeModuleConf(moduleId);
    }

    private static boolean isEmptyDirectory(Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    private void progress(int step, int total, String message) {
        if (onProgress != null) {
            onProgress.update(step, total, message);
        }
    }

    @FunctionalInterface
    public interface ProgressCallback {
        void update(int current, int total, String message);
    }
}
