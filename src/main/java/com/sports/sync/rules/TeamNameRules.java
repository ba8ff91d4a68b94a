package com.sports.sync.rules;

import com.sports.sync.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;

/**
 * Built-in rules for club names. Providers disagree on whether a women's or youth
 * side carries a marker ("Women", "WFC", "U21") and on club-type affixes
 * ("FC", "SC", "1."), so these are stripped before names are compared.
 */
public final class TeamNameRules {

    private TeamNameRules() {
        // Utility class
    }

    /**
     * Creates an engine with the women's, youth, suffix and prefix rules.
     */
    public static NormalizationEngine createTeamEngine() {
        List<NormalizationRule> rules = new ArrayList<>();
        rules.addAll(getWomensTeamRules());
        rules.addAll(getYouthTeamRules());
        rules.addAll(getClubSuffixRules());
        rules.addAll(getClubPrefixRules());
        return new NormalizationEngine(rules);
    }

    /**
     * Removes markers of women's teams: "Women", "Women's", "WFC", "Ladies", "Femenino", ...
     */
    public static List<NormalizationRule> getWomensTeamRules() {
        return List.of(
                rule("womens-apostrophe", ",?\\s+Women'+s$", 10, false),
                rule("womens-plain", ",?\\s+Womens?$", 10, false),
                rule("womens-w", ",?\\s+W$", 10, true),
                rule("womens-wfc", "\\s+WFC$", 10, false),
                rule("womens-lfc", "\\s+LFC$", 10, false),
                rule("womens-ladies", "\\s+Ladies$", 10, false),
                rule("womens-f", "\\s+F$", 10, true),
                rule("womens-comma", ",\\s*Women('s)?", 11, false),
                rule("womens-romance", "\\s+(Femenino|Femminile|Féminas)", 11, false)
        );
    }

    /**
     * Rewrites youth markers ("Under-21", "Sub 21", "U-21") to "U21" and drops a trailing one.
     */
    public static List<NormalizationRule> getYouthTeamRules() {
        return List.of(
                rule("youth-under", "\\s+Under[-\\s]?(?=\\d)", " U", 20, false),
                rule("youth-sub", "\\s+Sub[-\\s]?(?=\\d)", " U", 20, true),
                rule("youth-u-hyphen", "\\s+U-(?=\\d)", " U", 20, true),
                rule("youth-suffix", "\\s+U\\s?\\d+$", "", 21, true)
        );
    }

    /**
     * Removes club-type suffixes such as "FC", "SC", "CF", "AC" and "Football".
     */
    public static List<NormalizationRule> getClubSuffixRules() {
        return List.of(
                rule("club-suffix",
                        ",?\\s+(SC|Sc|sc|FC|fc|Fc|LFC|CF|CD|WFC|FCW|HSC|AC|AF|FCO|Ladies|Women|Women's|W|F|VF|FF|Football)$",
                        30, true)
        );
    }

    /**
     * Removes club-type prefixes such as "FC ", "SC ", "Olympique de " and "1. ",
     * including stacked ones ("1. FC Köln").
     */
    public static List<NormalizationRule> getClubPrefixRules() {
        return List.of(
                rule("club-prefix",
                        "^((SC|FC|CF|CD|RC|OL|Olympique de|Olympique|WNT|SKN|SK|1\\.)\\s+)+",
                        40, true)
        );
    }

    private static NormalizationRule rule(String name, String pattern, int priority, boolean caseSensitive) {
        return rule(name, pattern, "", priority, caseSensitive);
    }

    private static NormalizationRule rule(String name, String pattern, String replacement,
                                          int priority, boolean caseSensitive) {
        return NormalizationRule.builder()
                .name(name)
                .pattern(pattern)
                .replacement(replacement)
                .applicableTypes(EntityType.TEAM)
                .priority(priority)
                .caseSensitive(caseSensitive)
                .build();
    }
}
