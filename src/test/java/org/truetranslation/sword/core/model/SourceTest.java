package org.truetranslation.sword.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceTest {

    @Test
    void getModsIndexUrl_shouldJoinSchemeHostAndDirectory() {
        Source source = new Source("CrossWire", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/raw");

        assertThat(source.getBaseUrl()).isEqualTo("ftp://ftp.crosswire.org");
        assertThat(source.getModsIndexUrl()).isEqualTo("ftp://ftp.crosswire.org/pub/sword/raw/mods.d.tar.gz");
    }

    @Test
    void getModsIndexUrl_shouldTrimTrailingSlash() {
        Source source = new Source("Test", SourceType.HTTPS, "example.org", "/sword/");

        assertThat(source.getModsIndexUrl()).isEqualTo("https://example.org/sword/mods.d.tar.gz");
    }

    @Test
    void getModulePackageUrls_shouldTrySiblingPackageDirectoriesForRawDirectory() {
        Source source = new Source("CrossWire", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/raw");

        assertThat(source.getModulePackageUrls("KJV")).containsExactly(
            "ftp://ftp.crosswire.org/pub/sword/packages/rawzip/KJV.zip",
            "ftp://ftp.crosswire.org/pub/sword/packages/KJV.zip",
            "ftp://ftp.crosswire.org/pub/sword/rawzip/KJV.zip");
    }

    @Test
    void getModulePackageUrls_shouldHandleRawSuffixWithoutSeparator() {
        Source source = new Source("Lockman Foundation", SourceType.FTP, "ftp.crosswire.org", "/pub/sword/lockmanraw");

        assertThat(source.getModulePackageUrls("NASB")).containsExactly(
            "ftp://ftp.crosswire.org/pub/sword/lockmanpackages/rawzip/NASB.zip",
            "ftp://ftp.crosswire.org/pub/sword/lockmanpackages/NASB.zip",
            "ftp://ftp.crosswire.org/pub/sword/lockmanrawzip/NASB.zip");
    }

    @Test
    void getModulePackageUrls_shouldUseSubdirectoriesOtherwise() {
        Source source = new Source("eBible.org", SourceType.FTP, "ftp.ebible.org", "/sword/");

        assertThat(source.getModulePackageUrls("engwebp")).containsExactly(
            "ftp://ftp.ebible.org/sword/zip/engwebp.zip",
            "ftp://ftp.ebible.org/sword/packages/rawzip/engwebp.zip");
    }

    @Test
    void getModuleDataUrl_shouldStripLeadingDotSlash() {
        Source source = new Source("Test", SourceType.HTTP, "example.org", "/sword");

        assertThat(source.getModuleDataUrl("./modules/texts/ztext/kjv/"))
            .isEqualTo("http://example.org/sword/modules/texts/ztext/kjv/");
    }

    @Test
    void validate_shouldRejectMissingFields() {
        assertThatThrownBy(() -> new Source("", SourceType.FTP, "h", "/d").validate())
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("name");
        assertThatThrownBy(() -> new Source("n", SourceType.FTP, " ", "/d").validate())
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("host");
        assertThatThrownBy(() -> new Source("n", SourceType.FTP, "h", null).validate())
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("directory");
        assertThatThrownBy(() -> new Source("n", null, "h", "/d").validate())
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("type");
    }

    @Test
    void defaultSources_shouldAllBeValidFtpSources() {
        assertThat(Source.defaultSources()).hasSize(11);
        for (Source source : Source.defaultSources()) {
            source.validate();
            assertThat(source.getType()).isEqualTo(SourceType.FTP);
        }
    }

    @Test
    void findDefault_shouldResolveKnownNamesOnly() {
        assertThat(Source.findDefault("CrossWire")).get()
            .extracting(Source::getDirectory).isEqualTo("/pub/sword/raw");
        assertThat(Source.findDefault("Nowhere")).isEmpty();
    }

    @Test
    void sourceType_shouldMapConfKeys() {
        assertThat(SourceType.fromConfKey("HTTPSSource")).contains(SourceType.HTTPS);
        assertThat(SourceType.fromConfKey("Other")).isEmpty();
    }
}
