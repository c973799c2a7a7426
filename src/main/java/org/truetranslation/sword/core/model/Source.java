package org.truetranslation.sword.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A remote SWORD module repository: where its {@code mods.d.tar.gz} index lives
 * and where its module packages can be found.
 */
public final class Source {

    private static final List<Source> DEFAULT_SOURCES;
    static {
        List<Source> sources = new ArrayList<>();
        sources.add(new Source("Bible.org", SourceType.FTP, "ftp.crosswire.org", "/pub/bible.org/sword"));
        sources.add(new Source("CrossWire", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/raw"));
        sources.add(new Source("CrossWire Attic", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/atticraw"));
        sources.add(new Source("CrossWire Beta", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/betaraw"));
        sources.add(new Source("CrossWire Wycliffe", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/wyclifferaw"));
        sources.add(new Source("Deutsche Bibelgesellschaft", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/dbgraw"));
        sources.add(new Source("IBT", SourceType.FTP, "ftp.ibt.org.ru", "/pub/modsword/raw"));
        sources.add(new Source("Lockman Foundation", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/lockmanraw"));
        sources.add(new Source("STEP Bible", SourceType.FTP, "ftp.stepbible.org", "/pub/sword"));
        sources.add(new Source("Xiphos", SourceType.FTP, "ftp.xiphos.org", "/pub/xiphos"));
        sources.add(new Source("eBible.org", SourceType.FTP, "ftp.ebible.org", "/sword"));
        DEFAULT_SOURCES = Collections.unmodifiableList(sources);
    }

    private final String name;
    private final SourceType type;
    private final String host;
    private final String directory;

    public Source(String name, SourceType type, String host, String directory) {
        this.name = name;
        this.type = type;
        this.host = host;
        this.directory = directory;
    }

    public String getName() { return name; }
    public SourceType getType() { return type; }
    public String getHost() { return host; }
    public String getDirectory() { return directory; }

    /**
     * Checks that every field is set.
     *
     * @throws IllegalArgumentException describing the first missing field
     */
    public void validate() {
        if (isBlank(name)) {
            throw new IllegalArgumentException("source name cannot be empty");
        }
        if (isBlank(host)) {
            throw new IllegalArgumentException("source host cannot be empty");
        }
        if (isBlank(directory)) {
            throw new IllegalArgumentException("source directory cannot be empty");
        }
        if (type == null) {
            throw new IllegalArgumentException("invalid source type: null");
        }
    }

    /** Scheme and host, without any directory, e.g. {@code ftp://ftp.crosswire.org}. */
    public String getBaseUrl() {
        String scheme = type != null ? type.getScheme() : SourceType.HTTP.getScheme();
        return scheme + "://" + host;
    }

    public String getModsIndexUrl() {
        return getBaseUrl() + trimmedDirectory() + "/mods.d.tar.gz";
    }

    public String getModuleDataUrl(String dataPath) {
        String path = dataPath.startsWith("./") ? dataPath.substring(2) : dataPath;
        return getBaseUrl() + trimmedDirectory() + "/" + path;
    }

    /**
     * Candidate locations of a module's {@code .zip} package, most likely first.
     * Mirrors disagree on where packages sit relative to the raw conf directory,
     * so callers try each URL in turn and stop at the first that downloads.
     */
    public List<String> getModulePackageUrls(String moduleId) {
        String dir = trimmedDirectory();
        String base = getBaseUrl();
        String fileName = moduleId + ".zip";

        List<String> urls = new ArrayList<>();
        if (dir.endsWith("raw")) {
            String parent = dir.substring(0, dir.length() - "raw".length());
            // /pub/sword/raw -> /pub/sword/packages/rawzip
            urls.add(base + parent + "packages/rawzip/" + fileName);
            // lockmanraw -> lockmanpackages
            urls.add(base + parent + "packages/" + fileName);
            // /pub/modsword/raw -> /pub/modsword/rawzip
            urls.add(base + parent + "rawzip/" + fileName);
        } else {
            urls.add(base + dir + "/zip/" + fileName);
            urls.add(base + dir + "/packages/rawzip/" + fileName);
        }
        return urls;
    }

    private String trimmedDirectory() {
        String dir = directory == null ? "" : directory;
        while (dir.endsWith("/")) {
            dir = dir.substring(0, dir.length() - 1);
        }
        return dir;
    }

    /** The public repositories known to the official SWORD installer. */
    public static List<Source> defaultSources() {
        return DEFAULT_SOURCES;
    }

    public static Optional<Source> findDefault(String name) {
        return DEFAULT_SOURCES.stream().filter(s -> s.name.equals(name)).findFirst();
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Source)) return false;
        Source other = (Source) o;
        return Objects.equals(name, other.name) && type == other.type
            && Objects.equals(host, other.host) && Objects.equals(directory, other.directory);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, host, directory);
    }

    @Override
    public String toString() {
        return String.format("%s (%s%s)", name, getBaseUrl(), directory);
    }
}
