package org.truetranslation.sword.core.format;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Maps the free-text {@code DistributionLicense} of a module to an SPDX
 * identifier. Rules are tried in order and the first match wins; text that
 * matches nothing is returned unchanged.
 */
public final class LicenseNormalizer {

    private static final List<Rule> RULES = List.of(
        new Rule(s -> s.isEmpty() || s.equals("-"), ""),
        new Rule(s -> s.contains("public domain"), "CC-PDDC"),
        new Rule(s -> s.equals("gpl"), "GPL-3.0-or-later"),
        new Rule(s -> s.equals("unrestricted"), "Unlicense"),
        new Rule(s -> s.contains("cc0"), "CC0-1.0"),
        new Rule(s -> s.contains("by-nc-nd") && s.contains("4.0"), "CC-BY-NC-ND-4.0"),
        new Rule(s -> s.contains("by-nc-nd"), "CC-BY-NC-ND-3.0"),
        new Rule(s -> s.contains("by-nc-sa") && s.contains("4.0"), "CC-BY-NC-SA-4.0"),
        new Rule(s -> s.contains("by-nc-sa"), "CC-BY-NC-SA-3.0"),
        new Rule(s -> s.contains("by-sa") && s.contains("4.0"), "CC-BY-SA-4.0"),
        new Rule(s -> s.contains("by-sa"), "CC-BY-SA-3.0"),
        new Rule(s -> s.contains("by-nd") && s.contains("4.0"), "CC-BY-ND-4.0"),
        new Rule(s -> s.contains("by-nd"), "CC-BY-ND-3.0"),
        new Rule(s -> s.contains("by 4.0") || (s.contains("attribution") && s.contains("4.0")), "CC-BY-4.0"),
        new Rule(s -> s.contains("creative commons: by"), "CC-BY-3.0"),
        new Rule(s -> s.contains("copyrighted") && s.contains("free"), "LicenseRef-Copyrighted-Free"),
        new Rule(s -> s.contains("copyrighted"), "LicenseRef-Copyrighted")
    );

    private LicenseNormalizer() {
    }

    public static String toSpdx(String license) {
        if (license == null) {
            return "";
        }
        String lower = license.trim().toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (rule.matches.test(lower)) {
                return rule.spdxId;
            }
        }
        return license;
    }

    private static final class Rule {
        final Predicate<String> matches;
        final String spdxId;

        Rule(Predicate<String> matches, String spdxId) {
            this.matches = matches;
            this.spdxId = spdxId;
        }
    }
}
