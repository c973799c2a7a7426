package org.truetranslation.sword.core.format;

import org.truetranslation.sword.core.model.ModuleInfo;
import org.truetranslation.sword.core.model.ModuleType;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Narrowing helpers for module lists read from an index.
 */
public final class ModuleFilters {

    private ModuleFilters() {
    }

    public static List<ModuleInfo> byType(List<ModuleInfo> modules, ModuleType type) {
        return modules.stream()
            .filter(m -> m.getType() == type)
            .collect(Collectors.toList());
    }

    /** Exact language code match, e.g. {@code en} does not match {@code en-US}. */
    public static List<ModuleInfo> byLanguage(List<ModuleInfo> modules, String language) {
        return modules.stream()
            .filter(m -> m.getLanguage().equals(language))
            .collect(Collectors.toList());
    }

    /** Case-insensitive substring search over module ID and description. */
    public static List<ModuleInfo> search(List<ModuleInfo> modules, String keyword) {
        String needle = keyword.toLowerCase(Locale.ROOT);
        return modules.stream()
            .filter(m -> m.getId().toLowerCase(Locale.ROOT).contains(needle)
                || m.getDescription().toLowerCase(Locale.ROOT).contains(needle))
            .collect(Collectors.toList());
    }
}
