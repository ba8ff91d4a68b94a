package com.sports.sync.rules;

import com.sports.sync.core.model.EntityType;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to provider-supplied names before comparison.
 * Rules carry a priority (lower runs first) and can be scoped to entity types.
 * Patterns are case-insensitive unless built with {@code caseSensitive(true)}.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final Set<EntityType> applicableTypes;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = builder.caseSensitive
                ? Pattern.compile(builder.pattern)
                : Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.replacement = builder.replacement;
        this.applicableTypes = builder.applicableTypes != null ?
                Set.copyOf(builder.applicableTypes) : Set.of();
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Unscoped rules apply to every entity type.
     */
    public boolean appliesTo(EntityType type) {
        return applicableTypes.isEmpty() || applicableTypes.contains(type);
    }

    public String apply(String input) {
        if (input == null) {
            return null;
        }
        return pattern.matcher(input).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement = "";
        private Set<EntityType> applicableTypes;
        private int priority = 100;
        private boolean caseSensitive = false;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder applicableTypes(EntityType... types) {
            this.applicableTypes = Set.of(types);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder caseSensitive(boolean caseSensitive) {
            this.caseSensitive = caseSensitive;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            return new NormalizationRule(this);
        }
    }
}
