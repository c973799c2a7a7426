package org.truetranslation.sword.core.format;

import org.junit.jupiter.api.Test;
import org.truetranslation.sword.core.model.ModuleInfo;
import org.truetranslation.sword.core.model.ModuleType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ModuleFiltersTest {

    private final List<ModuleInfo> modules = List.of(
        ModuleInfo.builder("KJV").driver("zText").language("en").description("King James Version").build(),
        ModuleInfo.builder("MHC").driver("zCom").language("en").description("Matthew Henry Commentary").build(),
        ModuleInfo.builder("GerLut").driver("zText").language("de").description("Luther 1912").build(),
        ModuleInfo.builder("StrongsGreek").driver("RawLD4").language("en-US").description("Strong's Greek").build());

    @Test
    void byType_shouldKeepMatchingDrivers() {
        assertThat(ModuleFilters.byType(modules, ModuleType.BIBLE))
            .extracting(ModuleInfo::getId).containsExactly("KJV", "GerLut");
    }

    @Test
    void byLanguage_shouldMatchExactly() {
        assertThat(ModuleFilters.byLanguage(modules, "en"))
            .extracting(ModuleInfo::getId).containsExactly("KJV", "MHC");
    }

    @Test
    void search_shouldMatchIdOrDescriptionIgnoringCase() {
        assertThat(ModuleFilters.search(modules, "GREEK"))
            .extracting(ModuleInfo::getId).containsExactly("StrongsGreek");
        assertThat(ModuleFilters.search(modules, "luther"))
            .extracting(ModuleInfo::getId).containsExactly("GerLut");
    }
}
