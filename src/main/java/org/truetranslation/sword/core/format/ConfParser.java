package org.truetranslation.sword.core.format;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.truetranslation.sword.core.model.ModuleInfo;
import org.truetranslation.sword.core.model.Source;
import org.truetranslation.sword.core.model.SourceType;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes the INI-like text formats of a SWORD installation:
 * module descriptors ({@code mods.d/*.conf}), the gzip-compressed tar index
 * a repository publishes, and the {@code install.conf} source list.
 */
public final class ConfParser {
    private static final Logger LOG = LoggerFactory.getLogger(ConfParser.class);

    private ConfParser() {
    }

    /**
     * Parses one module descriptor. The first {@code [Section]} line names the
     * module; unknown keys are ignored and {@code Feature} may repeat.
     *
     * @param filename recorded as the module's conf path
     * @throws ConfFormatException if the data is empty or has no section header
     */
    public static ModuleInfo parseModuleConf(byte[] data, String filename) throws ConfFormatException {
        if (data == null || data.length == 0) {
            throw new ConfFormatException("empty conf file: " + filename);
        }
        String[] lines = new String(data, StandardCharsets.UTF_8).split("\n");

        String moduleId = null;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.startsWith("[") && line.endsWith("]")) {
                moduleId = line.substring(1, line.length() - 1).trim();
                break;
            }
        }
        if (moduleId == null || moduleId.isEmpty()) {
            throw new ConfFormatException("no section header found in " + filename);
        }

        ModuleInfo.Builder module = ModuleInfo.builder(moduleId).confPath(filename);
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("[") || line.startsWith("#")) {
                continue;
            }
            int eq = line.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();

            switch (key) {
                case "Description": module.description(value); break;
                case "Lang": module.language(value); break;
                case "Version": module.version(value); break;
                case "DataPath": module.dataPath(value); break;
                case "ModDrv": module.driver(value); break;
                case "SourceType": module.sourceType(value); break;
                case "Encoding": module.encoding(value); break;
                case "About": module.about(value); break;
                case "Copyright": module.copyright(value); break;
                case "DistributionLicense": module.license(value); break;
                case "Feature": module.addFeature(value); break;
                case "InstallSize":
                    try {
                        module.installSize(Long.parseLong(value));
                    } catch (NumberFormatException e) {
                        LOG.debug("Ignoring InstallSize '{}' in {}", value, filename);
                    }
                    break;
                default:
                    break;
            }
        }
        return module.build();
    }

    /**
     * Reads every {@code .conf} entry of a {@code mods.d.tar.gz} index.
     * Entries that cannot be read or parsed are skipped. A tar stream that
     * breaks part way ends the listing with whatever was read before it.
     *
     * @throws IOException if the data is not gzip at all
     */
    public static List<ModuleInfo> parseModsArchive(byte[] data) throws IOException {
        GzipCompressorInputStream gzip;
        try {
            gzip = new GzipCompressorInputStream(new ByteArrayInputStream(data));
        } catch (IOException e) {
            throw new IOException("creating gzip reader: " + e.getMessage(), e);
        }

        List<ModuleInfo> modules = new ArrayList<>();
        try (TarArchiveInputStream tar = new TarArchiveInputStream(gzip)) {
            while (true) {
                TarArchiveEntry entry;
                try {
                    entry = tar.getNextEntry();
                } catch (IOException e) {
                    LOG.debug("Stopping at unreadable tar entry: {}", e.getMessage());
                    break;
                }
                if (entry == null) {
                    break;
                }
                if (!entry.isFile() || !entry.getName().endsWith(".conf")) {
                    continue;
                }
                try {
                    byte[] content = tar.readAllBytes();
                    modules.add(parseModuleConf(content, entry.getName()));
                } catch (IOException e) {
                    LOG.debug("Skipping {}: {}", entry.getName(), e.getMessage());
                }
            }
        }
        return modules;
    }

    /**
     * Reads source definitions of the form
     * {@code FTPSource=host|directory|name}. {@code HTTPSource} and
     * {@code HTTPSSource} lines are read the same way; anything else is
     * ignored, as are lines without exactly three fields or with an
     * empty host, directory or name.
     */
    public static List<Source> parseSourcesConf(String text) {
        List<Source> sources = new ArrayList<>();
        for (String raw : text.split("\n")) {
            String line = raw.trim();
            int eq = line.indexOf('=');
            if (eq < 0) {
                continue;
            }
            Optional<SourceType> type = SourceType.fromConfKey(line.substring(0, eq));
            if (type.isEmpty()) {
                continue;
            }
            String[] parts = line.substring(eq + 1).split("\\|", -1);
            if (parts.length != 3) {
                continue;
            }
            Source source = new Source(parts[2].trim(), type.get(), parts[0].trim(), parts[1].trim());
            try {
                source.validate();
            } catch (IllegalArgumentException e) {
                LOG.warn("Skipping source entry \"{}\": {}", line, e.getMessage());
                continue;
            }
            sources.add(source);
        }
        return sources;
    }

    public static String formatSourcesConf(List<Source> sources) {
        StringBuilder sb = new StringBuilder("[General]\n\n");
        for (Source source : sources) {
            sb.append('[').append(source.getName()).append("]\n");
            sb.append(source.getType().getConfKey()).append('=')
                .append(source.getHost()).append('|')
                .append(source.getDirectory()).append('|')
                .append(source.getName()).append('\n');
            sb.append('\n');
        }
        return sb.toString();
    }

    /** A minimal descriptor carrying the fields the installer relies on. */
    public static String formatModuleConf(ModuleInfo module) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(module.getId()).append("]\n");
        sb.append("DataPath=").append(module.getDataPath()).append('\n');
        appendIfPresent(sb, "ModDrv", module.getDriver());
        appendIfPresent(sb, "Lang", module.getLanguage());
        appendIfPresent(sb, "Description", module.getDescription());
        appendIfPresent(sb, "Version", module.getVersion());
        appendIfPresent(sb, "SourceType", module.getSourceType());
        appendIfPresent(sb, "Encoding", module.getEncoding());
        for (String feature : module.getFeatures()) {
            sb.append("Feature=").append(feature).append('\n');
        }
        return sb.toString();
    }

    private static void appendIfPresent(StringBuilder sb, String key, String value) {
        if (value != null && !value.isEmpty()) {
            sb.append(key).append('=').append(value).append('\n');
        }
    }
}
