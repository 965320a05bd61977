package com.patent.linkage.rules;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * A single step of company-name normalization.
 * A rule is either a regex replacement or an arbitrary string transform.
 * Rules carry a priority; lower numbers run first.
 */
public class NormalizationRule {
    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final UnaryOperator<String> transform;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = builder.pattern != null ? Pattern.compile(builder.pattern) : null;
        this.replacement = builder.replacement;
        this.transform = builder.transform;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Applies this rule to the given input string.
     */
    public String apply(String input) {
        if (input == null) {
            return null;
        }
        if (transform != null) {
            return transform.apply(input);
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
                ", pattern=" + (pattern != null ? pattern.pattern() : "<transform>") +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private UnaryOperator<String> transform;
        private int priority = 100;

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

        public Builder transform(UnaryOperator<String> transform) {
            this.transform = transform;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            if (transform == null) {
                Objects.requireNonNull(pattern, "pattern or transform is required");
                Objects.requireNonNull(replacement, "replacement is required");
            } else if (pattern != null) {
                throw new IllegalArgumentException("Rule '" + name + "' cannot have both pattern and transform");
            }
            return new NormalizationRule(this);
        }
    }
}
