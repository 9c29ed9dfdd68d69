package com.location.resolution.matching;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * A named {@code (predicate, score)} pair. Rules are evaluated in priority order
 * (lower number first) by a {@link ScoringRuleSet}; the first rule whose predicate
 * holds decides the score.
 *
 * @param <T> the candidate type the predicate inspects
 */
public final class ScoringRule<T> {
    private final String name;
    private final BiPredicate<T, String> predicate;
    private final double score;
    private final int priority;

    private ScoringRule(Builder<T> builder) {
        this.name = builder.name;
        this.predicate = builder.predicate;
        this.score = builder.score;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public double getScore() {
        return score;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Tests the candidate against a normalized query.
     */
    public boolean matches(T candidate, String query) {
        return candidate != null && query != null && predicate.test(candidate, query);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScoringRule<?> that = (ScoringRule<?>) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ScoringRule{" +
                "name='" + name + '\'' +
                ", score=" + score +
                ", priority=" + priority +
                '}';
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    public static class Builder<T> {
        private String name;
        private BiPredicate<T, String> predicate;
        private double score;
        private int priority = 100;

        public Builder<T> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<T> when(BiPredicate<T, String> predicate) {
            this.predicate = predicate;
            return this;
        }

        public Builder<T> score(double score) {
            this.score = score;
            return this;
        }

        public Builder<T> priority(int priority) {
            this.priority = priority;
            return this;
        }

        public ScoringRule<T> build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(predicate, "predicate is required");
            if (score < 0.0 || score > 1.0) {
                throw new IllegalArgumentException("score must be between 0.0 and 1.0");
            }
            return new ScoringRule<>(this);
        }
    }
}
