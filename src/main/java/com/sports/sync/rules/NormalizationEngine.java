package com.sports.sync.rules;

import com.sports.sync.core.model.EntityType;
import com.sports.sync.similarity.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies {@link NormalizationRule}s to names in priority order (lower number first,
 * insertion order within a priority), then finishes with {@link TextNormalizer}.
 * The rule list is fixed at construction, so an engine can be shared between threads.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes a name with every rule.
     */
    public String normalize(String name) {
        return normalize(name, null);
    }

    /**
     * Normalizes a name with the rules applicable to {@code entityType}
     * (all rules when the type is null). Null or blank input yields an empty string.
     */
    public String normalize(String name, EntityType entityType) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name.replace('\u00A0', ' ').trim();
        for (NormalizationRule rule : rules) {
            if (entityType == null || rule.appliesTo(entityType)) {
                String before = result;
                result = rule.apply(result).trim();
                if (!before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
                }
            }
        }
        return TextNormalizer.normalize(result);
    }

    /**
     * Checks whether two names normalize to the same non-empty value.
     */
    public boolean areEquivalent(String name1, String name2, EntityType entityType) {
        String normalized1 = normalize(name1, entityType);
        return !normalized1.isEmpty() && normalized1.equals(normalize(name2, entityType));
    }
}
