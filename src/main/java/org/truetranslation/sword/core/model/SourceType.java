package org.truetranslation.sword.core.model;

import java.util.Optional;

/**
 * Transport protocol of a remote SWORD repository.
 */
public enum SourceType {
    FTP("ftp", "FTPSource"),
    HTTP("http", "HTTPSource"),
    HTTPS("https", "HTTPSSource");

    private final String scheme;
    private final String confKey;

    SourceType(String scheme, String confKey) {
        this.scheme = scheme;
        this.confKey = confKey;
    }

    public String getScheme() { return scheme; }

    /** Key used for this type in {@code install.conf}, e.g. {@code FTPSource}. */
    public String getConfKey() { return confKey; }

    public static Optional<SourceType> fromConfKey(String key) {
        for (SourceType type : values()) {
            if (type.confKey.equals(key)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
