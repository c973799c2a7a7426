package org.truetranslation.sword.cli;

import ch.qos.logback.classic.Level;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.LoggerFactory;
import org.truetranslation.sword.core.BatchInstallOptions;
import org.truetranslation.sword.core.ConfigManager;
import org.truetranslation.sword.core.Installer;
import org.truetranslation.sword.core.LocalConfig;
import org.truetranslation.sword.core.Messages;
import org.truetranslation.sword.core.PackageNotAvailableException;
import org.truetranslation.sword.core.format.ModuleFilters;
import org.truetranslation.sword.core.model.InstallResult;
import org.truetranslation.sword.core.model.InstallStatus;
import org.truetranslation.sword.core.model.ModuleInfo;
import org.truetranslation.sword.core.model.ModuleType;
import org.truetranslation.sword.core.model.ModuleUpdate;
import org.truetranslation.sword.core.model.ModuleVerification;
import org.truetranslation.sword.core.model.Source;
import org.truetranslation.sword.core.transport.CancellationToken;
import org.truetranslation.sword.core.transport.RepositoryClient;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

@Command(
    name = "sword-cli",
    mixinStandardHelpOptions = true,
    versionProvider = Main.VersionProvider.class,
    resourceBundle = "picocli.main",
    subcommands = {
        Main.SourcesCommand.class,
        Main.RefreshCommand.class,
        Main.ListCommand.class,
        Main.InstallCommand.class,
        Main.InstallAllCommand.class,
        Main.InstallMegaCommand.class,
        Main.InstalledCommand.class,
        Main.UninstallCommand.class,
        Main.VerifyCommand.class,
        Main.UpdatesCommand.class
    }
)
public class Main implements Callable<Integer> {

    static final Duration BATCH_TIMEOUT = Duration.ofHours(2);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    @Override
    public Integer call() {
        new CommandLine(this).usage(System.out);
        return 0;
    }

    /** Options shared by every subcommand. */
    static class CommonOptions {
        @Option(names = {"--sword-path"}, paramLabel = "<dir>", descriptionKey = "swordpath")
        File swordPath;

        @Option(names = {"--config"}, paramLabel = "<file>", descriptionKey = "config")
        File configFile;

        @Option(names = {"-v", "--verbose"}, descriptionKey = "verbose")
        boolean verbose;

        @Option(names = {"--silent"}, descriptionKey = "silent")
        boolean silent;

        Session open() {
            ConfigManager configManager = configFile != null
                ? new ConfigManager(configFile.toPath())
                : new ConfigManager();
            Messages.init(configManager.getConfigDir());

            int verbosity = configManager.getVerbosity();
            if (verbose) {
                verbosity = 1;
                ch.qos.logback.classic.Logger logger =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("org.truetranslation.sword");
                logger.setLevel(Level.DEBUG);
            }
            if (silent) verbosity = 0;

            LocalConfig localConfig = new LocalConfig(swordPath != null
                ? swordPath.toPath()
                : configManager.getSwordPath());
            RepositoryClient client = new RepositoryClient(configManager.toClientOptions());
            return new Session(configManager, localConfig, new Installer(localConfig, client), verbosity);
        }
    }

    static final class Session {
        final ConfigManager configManager;
        final LocalConfig localConfig;
        final Installer installer;
        final int verbosity;
        final Messages messages = Messages.getInstance();

        Session(ConfigManager configManager, LocalConfig localConfig, Installer installer, int verbosity) {
            this.configManager = configManager;
            this.localConfig = localConfig;
            this.installer = installer;
            this.verbosity = verbosity;
        }

        void info(String key, Object... args) {
            if (verbosity > 0) {
                System.out.println(messages.format(key, args));
            }
        }

        void error(String key, Object... args) {
            System.err.println(messages.format(key, args));
        }

        /** Sources saved in install.conf, or the public defaults when there are none. */
        List<Source> sources() throws IOException {
            List<Source> saved = localConfig.loadInstallConf();
            return saved.isEmpty() ? Source.defaultSources() : saved;
        }

        Optional<Source> findSource(String name) throws IOException {
            for (Source source : sources()) {
                if (source.getName().equalsIgnoreCase(name)) {
                    return Optional.of(source);
                }
            }
            return Optional.empty();
        }
    }

    @Command(name = "sources", resourceBundle = "picocli.sources")
    static class SourcesCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Option(names = {"--save"}, descriptionKey = "save")
        boolean save;

        @Override
        public Integer call() {
            Session session = common.open();
            try {
                List<Source> sources = session.sources();
                System.out.printf("%-28s %-6s %-22s %s%n", "NAME", "TYPE", "HOST", "DIRECTORY");
                for (Source s : sources) {
                    System.out.printf("%-28s %-6s %-22s %s%n", s.getName(), s.getType().getScheme().toUpperCase(Locale.ROOT),
                        s.getHost(), s.getDirectory());
                }
                if (save) {
                    session.localConfig.ensureDirectories();
                    session.localConfig.saveInstallConf(sources);
                    session.info("msg.sources.saved", sources.size(), session.localConfig.getModsDir().resolve("install.conf"));
                }
                return 0;
            } catch (IOException e) {
                session.error("error.generic", e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "refresh", resourceBundle = "picocli.refresh")
    static class RefreshCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Parameters(index = "0", paramLabel = "<source>", descriptionKey = "source")
        String sourceName;

        @Override
        public Integer call() {
            Session session = common.open();
            try {
                Optional<Source> source = session.findSource(sourceName);
                if (source.isEmpty()) {
                    session.error("error.source.notFound", sourceName);
                    return 1;
                }
                session.info("msg.refresh.start", source.get().getName());
                List<ModuleInfo> modules = session.installer.refreshSource(CancellationToken.create(), source.get());
                System.out.println(session.messages.format("msg.refresh.count", modules.size(), source.get().getName()));
                return 0;
            } catch (IOException | CancellationException e) {
                session.error("error.generic", e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "list", resourceBundle = "picocli.list")
    static class ListCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Parameters(index = "0", paramLabel = "<source>", descriptionKey = "source")
        String sourceName;

        @Option(names = {"-t", "--type"}, paramLabel = "<type>", descriptionKey = "type")
        String type;

        @Option(names = {"-L", "--lang"}, paramLabel = "<code>", descriptionKey = "language")
        String language;

        @Option(names = {"-s", "--search"}, paramLabel = "<text>", descriptionKey = "search")
        String keyword;

        @Option(names = {"-j", "--json"}, descriptionKey = "json")
        boolean json;

        @Override
        public Integer call() {
            Session session = common.open();
            try {
                Optional<Source> source = session.findSource(sourceName);
                if (source.isEmpty()) {
                    session.error("error.source.notFound", sourceName);
                    return 1;
                }
                List<ModuleInfo> modules = session.installer.listAvailable(CancellationToken.create(), source.get());
                if (type != null) {
                    modules = ModuleFilters.byType(modules, ModuleType.parse(type));
                }
                if (language != null) {
                    modules = ModuleFilters.byLanguage(modules, language);
                }
                if (keyword != null) {
                    modules = ModuleFilters.search(modules, keyword);
                }

                if (json) {
                    List<Map<String, Object>> out = new ArrayList<>();
                    modules.forEach(m -> out.add(toJson(m)));
                    System.out.println(GSON.toJson(out));
                } else if (modules.isEmpty()) {
                    session.info("msg.list.empty");
                } else {
                    System.out.printf("%-20s %-11s %-6s %-10s %s%n", "ID", "TYPE", "LANG", "VERSION", "DESCRIPTION");
                    for (ModuleInfo m : modules) {
                        System.out.printf("%-20s %-11s %-6s %-10s %s%n", m.getId(), m.getType(), m.getLanguage(),
                            m.getVersion(), m.getDescription());
                    }
                    session.info("msg.list.total", modules.size());
                }
                return 0;
            } catch (IllegalArgumentException e) {
                session.error("error.type.unknown", type);
                return 1;
            } catch (IOException | CancellationException e) {
                session.error("error.generic", e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "install", resourceBundle = "picocli.install")
    static class InstallCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Parameters(index = "0", paramLabel = "<source>", descriptionKey = "source")
        String sourceName;

        @Parameters(index = "1..*", arity = "1..*", paramLabel = "<module>", descriptionKey = "modules")
        List<String> moduleIds;

        @Override
        public Integer call() {
            Session session = common.open();
            CancellationToken token = CancellationToken.create();
            try {
                Optional<Source> source = session.findSource(sourceName);
                if (source.isEmpty()) {
                    session.error("error.source.notFound", sourceName);
                    return 1;
                }
                List<ModuleInfo> available = session.installer.refreshSource(token, source.get());
                if (session.verbosity > 0) {
                    session.installer.setOnProgress((current, total, message) ->
                        System.out.printf("[%d/%d] %s%n", current, total, message));
                }

                int failures = 0;
                for (String id : moduleIds) {
                    Optional<ModuleInfo> module = available.stream()
                        .filter(m -> m.getId().equalsIgnoreCase(id))
                        .findFirst();
                    if (module.isEmpty()) {
                        session.error("error.module.notInIndex", id, source.get().getName());
                        failures++;
                        continue;
                    }
                    try {
                        session.installer.install(token, source.get(), module.get());
                    } catch (PackageNotAvailableException e) {
                        session.error("error.install.unavailable", e.getModuleId(), e.getUrlCount());
                        failures++;
                    } catch (IOException e) {
                        session.error("error.install.failed", id, e.getMessage());
                        failures++;
                    }
                }
                return failures == 0 ? 0 : 1;
            } catch (IOException | CancellationException e) {
                session.error("error.generic", e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "install-all", resourceBundle = "picocli.installall")
    static class InstallAllCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Parameters(index = "0", paramLabel = "<source>", descriptionKey = "source")
        String sourceName;

        @Option(names = {"-w", "--workers"}, paramLabel = "<n>", descriptionKey = "workers")
        Integer workers;

        @Override
        public Integer call() {
            Session session = common.open();
            CancellationToken token = CancellationToken.withTimeout(BATCH_TIMEOUT);
            try {
                Optional<Source> source = session.findSource(sourceName);
                if (source.isEmpty()) {
                    session.error("error.source.notFound", sourceName);
                    return 1;
                }
                List<ModuleInfo> modules = session.installer.refreshSource(token, source.get());
                int workerCount = workers != null ? workers : session.configManager.getWorkers();
                session.info("msg.batch.start", modules.size(), source.get().getName(), workerCount);

                List<InstallResult> results = runBatch(session, token, source.get(), modules, workerCount);
                printSummary(session, results);
                return countStatus(results).get(InstallStatus.FAILED) == 0 ? 0 : 1;
            } catch (IOException | CancellationException e) {
                session.error("error.generic", e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "install-mega", resourceBundle = "picocli.installmega")
    static class InstallMegaCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Option(names = {"-w", "--workers"}, paramLabel = "<n>", descriptionKey = "workers")
        Integer workers;

        @Override
        public Integer call() {
            Session session = common.open();
            CancellationToken token = CancellationToken.withTimeout(BATCH_TIMEOUT);
            int workerCount = workers != null ? workers : session.configManager.getWorkers();
            try {
                Set<String> seen = new HashSet<>();
                List<InstallResult> all = new ArrayList<>();
                for (Source source : session.sources()) {
                    token.throwIfCancelled();
                    List<ModuleInfo> modules;
                    try {
                        modules = session.installer.refreshSource(token, source);
                    } catch (IOException e) {
                        session.error("error.mega.sourceFailed", source.getName(), e.getMessage());
                        continue;
                    }
                    // A module offered by several sources is taken from the first one.
                    List<ModuleInfo> fresh = new ArrayList<>();
                    for (ModuleInfo m : modules) {
                        if (seen.add(m.getId().toUpperCase(Locale.ROOT))) {
                            fresh.add(m);
                        }
                    }
                    session.info("msg.batch.start", fresh.size(), source.getName(), workerCount);
                    all.addAll(runBatch(session, token, source, fresh, workerCount));
                }
                printSummary(session, all);
                return countStatus(all).get(InstallStatus.FAILED) == 0 ? 0 : 1;
            } catch (IOException | CancellationException e) {
                session.error("error.generic", e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "installed", resourceBundle = "picocli.installed")
    static class InstalledCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Option(names = {"-j", "--json"}, descriptionKey = "json")
        boolean json;

        @Override
        public Integer call() {
            Session session = common.open();
            try {
                List<ModuleInfo> modules = session.localConfig.listInstalledModules();
                if (json) {
                    List<Map<String, Object>> out = new ArrayList<>();
                    modules.forEach(m -> out.add(toJson(m)));
                    System.out.println(GSON.toJson(out));
                    return 0;
                }
                if (modules.isEmpty()) {
                    session.info("msg.installed.none", session.localConfig.getSwordDir());
                    return 0;
                }
                System.out.printf("%-20s %-11s %-10s %-28s %s%n", "ID", "TYPE", "VERSION", "LICENSE", "DESCRIPTION");
                for (ModuleInfo m : modules) {
                    System.out.printf("%-20s %-11s %-10s %-28s %s%n", m.getId(), m.getType(), m.getVersion(),
                        m.getLicenseSpdx(), m.getDescription());
                }
                session.info("msg.installed.total", modules.size());
                return 0;
            } catch (IOException e) {
                session.error("error.generic", e.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "uninstall", resourceBundle = "picocli.uninstall")
    static class UninstallCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Parameters(arity = "1..*", paramLabel = "<module>", descriptionKey = "modules")
        List<String> moduleIds;

        @Override
        public Integer call() {
            Session session = common.open();
            int failures = 0;
            for (String id : moduleIds) {
                try {
                    session.installer.uninstall(id);
                    session.info("msg.uninstall.done", id);
                } catch (IOException e) {
                    session.error("error.uninstall.failed", id, e.getMessage());
                    failures++;
                }
            }
            return failures == 0 ? 0 : 1;
        }
    }

    @Command(name = "verify", resourceBundle = "picocli.verify")
    static class VerifyCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Parameters(index = "0", arity = "0..1", paramLabel = "<module>", descriptionKey = "module")
        String moduleId;

        @Override
        public Integer call() {
            Session session = common.open();
            List<ModuleVerification> results;
            if (moduleId != null) {
                results = List.of(session.installer.verifyModule(moduleId));
            } else {
                try {
                    results = session.installer.verifyAllModules();
                } catch (IOException e) {
                    session.error("error.generic", e.getMessage());
                    return 1;
                }
            }
            if (results.isEmpty()) {
                session.info("msg.installed.none", session.localConfig.getSwordDir());
                return 0;
            }

            System.out.printf("%-20s %-6s %-10s %-10s %s%n", "MODULE", "STATUS", "EXPECTED", "ACTUAL", "NOTE");
            int issues = 0;
            for (ModuleVerification v : results) {
                String note = v.getError() != null ? v.getError()
                    : !v.isDataExists() ? session.messages.get("msg.verify.noData")
                    : !v.isSizeMatch() ? session.messages.get("msg.verify.sizeMismatch")
                    : "";
                if (!v.isValid()) issues++;
                System.out.printf("%-20s %-6s %-10s %-10s %s%n", v.getModuleId(), v.isValid() ? "OK" : "ISSUE",
                    v.getExpectedSize() > 0 ? formatBytes(v.getExpectedSize()) : "-",
                    formatBytes(v.getActualSize()), note);
            }
            System.out.println(session.messages.format("msg.verify.summary", results.size() - issues, issues));
            return issues == 0 ? 0 : 1;
        }
    }

    @Command(name = "updates", resourceBundle = "picocli.updates")
    static class UpdatesCommand implements Callable<Integer> {
        @Mixin CommonOptions common;

        @Parameters(index = "0", paramLabel = "<source>", descriptionKey = "source")
        String sourceName;

        @Override
        public Integer call() {
            Session session = common.open();
            try {
                Optional<Source> source = session.findSource(sourceName);
                if (source.isEmpty()) {
                    session.error("error.source.notFound", sourceName);
                    return 1;
                }
                List<ModuleUpdate> updates = session.installer.checkUpdates(CancellationToken.create(), source.get());
                if (updates.isEmpty()) {
                    session.info("msg.updates.none");
                    return 0;
                }
                for (ModuleUpdate u : updates) {
                    System.out.printf("%-20s %s -> %s%n", u.getModule().getId(), u.getInstalledVersion(),
                        u.getAvailableVersion());
                }
                session.info("msg.updates.total", updates.size());
                return 0;
            } catch (IOException | CancellationException e) {
                session.error("error.generic", e.getMessage());
                return 1;
            }
        }
    }

    static List<InstallResult> runBatch(Session session, CancellationToken token, Source source,
                                        List<ModuleInfo> modules, int workers) {
        AtomicInteger counter = new AtomicInteger();
        int total = modules.size();
        BatchInstallOptions options = new BatchInstallOptions(workers, true, result -> {
            int n = counter.incrementAndGet();
            if (session.verbosity > 0) {
                String line = String.format("[%d/%d] %s... %s", n, total, result.getModule().getId(),
                    result.getStatus().label());
                if (result.getStatus() == InstallStatus.FAILED && result.getError() != null) {
                    line += " (" + result.getError().getMessage() + ")";
                }
                System.out.println(line);
            }
        });
        return session.installer.installBatch(token, source, modules, options);
    }

    static Map<InstallStatus, Integer> countStatus(List<InstallResult> results) {
        Map<InstallStatus, Integer> counts = new EnumMap<>(InstallStatus.class);
        for (InstallStatus status : InstallStatus.values()) {
            counts.put(status, 0);
        }
        for (InstallResult r : results) {
            counts.merge(r.getStatus(), 1, Integer::sum);
        }
        return counts;
    }

    private static void printSummary(Session session, List<InstallResult> results) {
        Map<InstallStatus, Integer> counts = countStatus(results);
        System.out.println(session.messages.format("msg.batch.summary",
            counts.get(InstallStatus.DONE), counts.get(InstallStatus.SKIPPED),
            counts.get(InstallStatus.UNAVAILABLE), counts.get(InstallStatus.FAILED)));
    }

    private static Map<String, Object> toJson(ModuleInfo m) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", m.getId());
        out.put("type", m.getType().getDisplayName());
        out.put("language", m.getLanguage());
        out.put("version", m.getVersion());
        out.put("description", m.getDescription());
        out.put("license", m.getLicenseSpdx());
        out.put("dataPath", m.getDataPath());
        if (m.getInstallSize() > 0) {
            out.put("installSize", m.getInstallSize());
        }
        if (!m.getFeatures().isEmpty()) {
            out.put("features", m.getFeatures());
        }
        return out;
    }

    /** Human-readable size using binary units, e.g. {@code 1.5 KB}. */
    static String formatBytes(long bytes) {
        final long unit = 1024;
        if (bytes < unit) {
            return bytes + " B";
        }
        long div = unit;
        int exp = 0;
        for (long n = bytes / unit; n >= unit; n /= unit) {
            div *= unit;
            exp++;
        }
        return String.format(Locale.ROOT, "%.1f %cB", (double) bytes / div, "KMGTPE".charAt(exp));
    }

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] { Messages.getInstance().get("app.version") };
        }
    }

    public static CommandLine createCommandLine() {
        return new CommandLine(new Main());
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
