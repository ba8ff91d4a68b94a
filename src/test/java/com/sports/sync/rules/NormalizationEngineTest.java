package com.sports.sync.rules;

import com.sports.sync.core.model.EntityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        NormalizationEngine engine = TeamNameRules.createTeamEngine();

        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
    }

    @Test
    @DisplayName("Should apply rules by priority, lowest first")
    void testPriorityOrder() {
        NormalizationRule second = NormalizationRule.builder()
                .name("bar-to-baz").pattern("bar").replacement("baz").priority(2).build();
        NormalizationRule first = NormalizationRule.builder()
                .name("foo-to-bar").pattern("foo").replacement("bar").priority(1).build();

        NormalizationEngine engine = new NormalizationEngine(List.of(second, first));

        assertEquals("baz", engine.normalize("foo"));
        assertEquals(List.of(first, second), engine.getRules());
    }

    @Test
    @DisplayName("Should only apply rules scoped to the requested entity type")
    void testTypeScoping() {
        NormalizationRule playerOnly = NormalizationRule.builder()
                .name("strip-jr").pattern("\\s+Jr\\.?$").applicableTypes(EntityType.PLAYER).build();
        NormalizationEngine engine = new NormalizationEngine(List.of(playerOnly));

        assertEquals("neymar", engine.normalize("Neymar Jr.", EntityType.PLAYER));
        assertEquals("neymar jr", engine.normalize("Neymar Jr.", EntityType.TEAM));
        assertEquals("neymar", engine.normalize("Neymar Jr."));
    }

    @Test
    @DisplayName("Patterns are case-insensitive unless marked case-sensitive")
    void testCaseSensitivity() {
        NormalizationRule insensitive = NormalizationRule.builder()
                .name("club").pattern("\\s+club$").build();
        NormalizationRule sensitive = NormalizationRule.builder()
                .name("fc").pattern("\\s+FC$").caseSensitive(true).build();

        assertEquals("Santos", insensitive.apply("Santos CLUB"));
        assertEquals("Santos fc", sensitive.apply("Santos fc"));
        assertEquals("Santos", sensitive.apply("Santos FC"));
    }

    @Test
    @DisplayName("Rule builder requires a name and a pattern")
    void testBuilderValidation() {
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().pattern("x").build());
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().name("x").build());
    }

    @Test
    @DisplayName("Unscoped rules apply to every type")
    void testUnscopedRule() {
        NormalizationRule rule = NormalizationRule.builder().name("any").pattern("x").build();

        for (EntityType type : EntityType.values()) {
            assertTrue(rule.appliesTo(type));
        }
    }
}
