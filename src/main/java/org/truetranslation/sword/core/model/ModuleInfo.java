package org.truetranslation.sword.core.model;

import org.truetranslation.sword.core.format.LicenseNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Metadata of one SWORD module, read either from a remote index or from an
 * installed {@code .conf} file. Instances are immutable; use {@link Builder}.
 */
public final class ModuleInfo {

    private final String id;
    private final String description;
    private final String language;
    private final String version;
    private final String dataPath;
    private final String driver;
    private final String sourceType;
    private final String encoding;
    private final List<String> features;
    private final String about;
    private final String copyright;
    private final String license;
    private final String confPath;
    private final long installSize;

    private ModuleInfo(Builder b) {
        this.id = b.id;
        this.description = b.description;
        this.language = b.language;
        this.version = b.version;
        this.dataPath = b.dataPath;
        this.driver = b.driver;
        this.sourceType = b.sourceType;
        this.encoding = b.encoding;
        this.features = Collections.unmodifiableList(new ArrayList<>(b.features));
        this.about = b.about;
        this.copyright = b.copyright;
        this.license = b.license;
        this.confPath = b.confPath;
        this.installSize = b.installSize;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() { return id; }
    public String getDescription() { return description; }
    public String getLanguage() { return language; }
    public String getVersion() { return version; }
    public String getDataPath() { return dataPath; }
    public String getDriver() { return driver; }
    public String getSourceType() { return sourceType; }
    public String getEncoding() { return encoding; }
    public List<String> getFeatures() { return features; }
    public String getAbout() { return about; }
    public String getCopyright() { return copyright; }
    public String getLicense() { return license; }

    /** Where the descriptor was read from: a file path for installed modules, the archive entry name for index entries. */
    public String getConfPath() { return confPath; }

    /** Declared payload size in bytes, 0 when the descriptor does not say. */
    public long getInstallSize() { return installSize; }

    public ModuleType getType() {
        return ModuleType.fromDriver(driver);
    }

    public boolean isBible() {
        return getType() == ModuleType.BIBLE;
    }

    public boolean hasFeature(String feature) {
        return features.contains(feature);
    }

    public String getLicenseSpdx() {
        return LicenseNormalizer.toSpdx(license);
    }

    public ModuleInfo withConfPath(String newConfPath) {
        return toBuilder().confPath(newConfPath).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder(id)
            .description(description)
            .language(language)
            .version(version)
            .dataPath(dataPath)
            .driver(driver)
            .sourceType(sourceType)
            .encoding(encoding)
            .about(about)
            .copyright(copyright)
            .license(license)
            .confPath(confPath)
            .installSize(installSize);
        features.forEach(b::addFeature);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleInfo)) return false;
        ModuleInfo other = (ModuleInfo) o;
        return installSize == other.installSize
            && Objects.equals(id, other.id)
            && Objects.equals(description, other.description)
            && Objects.equals(language, other.language)
            && Objects.equals(version, other.version)
            && Objects.equals(dataPath, other.dataPath)
            && Objects.equals(driver, other.driver)
            && Objects.equals(sourceType, other.sourceType)
            && Objects.equals(encoding, other.encoding)
            && features.equals(other.features)
            && Objects.equals(about, other.about)
            && Objects.equals(copyright, other.copyright)
            && Objects.equals(license, other.license)
            && Objects.equals(confPath, other.confPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, dataPath, driver, confPath);
    }

    @Override
    public String toString() {
        return String.format("%s: %s (v%s)", id, description, version);
    }

    public static final class Builder {
        private final String id;
        private String description = "";
        private String language = "";
        private String version = "";
        private String dataPath = "";
        private String driver = "";
        private String sourceType = "";
        private String encoding = "";
        private final List<String> features = new ArrayList<>();
        private String about = "";
        private String copyright = "";
        private String license = "";
        private String confPath;
        private long installSize;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id");
        }

        public Builder description(String value) { this.description = value; return this; }
        public Builder language(String value) { this.language = value; return this; }
        public Builder version(String value) { this.version = value; return this; }
        public Builder dataPath(String value) { this.dataPath = value; return this; }
        public Builder driver(String value) { this.driver = value; return this; }
        public Builder sourceType(String value) { this.sourceType = value; return this; }
        public Builder encoding(String value) { this.encoding = value; return this; }
        public Builder addFeature(String value) { this.features.add(value); return this; }
        public Builder about(String value) { this.about = value; return this; }
        public Builder copyright(String value) { this.copyright = value; return this; }
        public Builder license(String value) { this.license = value; return this; }
        public Builder confPath(String value) { this.confPath = value; return this; }
        public Builder installSize(long value) { this.installSize = value; return this; }

        public ModuleInfo build() {
            return new ModuleInfo(this);
        }
    }
}
