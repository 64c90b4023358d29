package io.exprkit.core.config;

import io.exprkit.core.engine.Expression;
import io.exprkit.core.engine.ExpressionOption;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable engine configuration.
 *
 * @param options         binding options applied to every compiled expression
 * @param constants       named constants, folded at bind time
 * @param arrays          named arrays, indexed with {@code name[i]}
 * @param cacheEnabled    whether parsed trees are cached by source text
 * @param maxNestingDepth maximum bracket nesting accepted by the parser
 * @param maxTreeDepth    maximum depth of a parsed tree, counting every operator and call level
 * @param maxSourceLength maximum source length, in UTF-16 units, accepted by the parser
 */
public record EngineConfig(
        Set<ExpressionOption> options,
        Map<String, Double> constants,
        Map<String, List<Double>> arrays,
        boolean cacheEnabled,
        int maxNestingDepth,
        int maxTreeDepth,
        int maxSourceLength) {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 256;
    public static final int DEFAULT_MAX_TREE_DEPTH = 1024;
    public static final int DEFAULT_MAX_SOURCE_LENGTH = 16_384;

    /** No options, no constants or arrays, cache on, default limits. */
    public static final EngineConfig DEFAULT = builder().build();

    public EngineConfig {
        options = options.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(options));
        constants = Map.copyOf(constants);
        Map<String, List<Double>> copied = new LinkedHashMap<>();
        arrays.forEach((name, values) -> copied.put(name, List.copyOf(values)));
        arrays = Map.copyOf(copied);
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        if (maxTreeDepth < 1) {
            throw new IllegalArgumentException("maxTreeDepth must be positive: " + maxTreeDepth);
        }
        if (maxSourceLength < 1) {
            throw new IllegalArgumentException("maxSourceLength must be positive: " + maxSourceLength);
        }
        for (String name : constants.keySet()) {
            requireIdentifier(name, "constant");
        }
        for (String name : arrays.keySet()) {
            requireIdentifier(name, "array");
        }
    }

    private static void requireIdentifier(String name, String kind) {
        if (!Expression.isValidIdentifier(name)) {
            throw new IllegalArgumentException("Invalid " + kind + " name: '" + name + "'");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder initialised from this configuration. */
    public Builder toBuilder() {
        Builder builder = new Builder()
                .cacheEnabled(cacheEnabled)
                .maxNestingDepth(maxNestingDepth)
                .maxTreeDepth(maxTreeDepth)
                .maxSourceLength(maxSourceLength);
        options.forEach(builder::option);
        constants.forEach(builder::constant);
        arrays.forEach(builder::array);
        return builder;
    }

    public static final class Builder {
        private final Set<ExpressionOption> options = EnumSet.noneOf(ExpressionOption.class);
        private final Map<String, Double> constants = new LinkedHashMap<>();
        private final Map<String, List<Double>> arrays = new LinkedHashMap<>();
        private boolean cacheEnabled = true;
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private int maxTreeDepth = DEFAULT_MAX_TREE_DEPTH;
        private int maxSourceLength = DEFAULT_MAX_SOURCE_LENGTH;

        Builder() {}

        public Builder option(ExpressionOption option) {
            options.add(Objects.requireNonNull(option, "option must not be null"));
            return this;
        }

        /** Replaces the option set. */
        public Builder options(Set<ExpressionOption> replacement) {
            options.clear();
            options.addAll(replacement);
            return this;
        }

        public Builder constant(String name, double value) {
            constants.put(Objects.requireNonNull(name, "name must not be null"), value);
            return this;
        }

        public Builder array(String name, List<Double> values) {
            arrays.put(Objects.requireNonNull(name, "name must not be null"), values);
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder maxTreeDepth(int maxTreeDepth) {
            this.maxTreeDepth = maxTreeDepth;
            return this;
        }

        public Builder maxSourceLength(int maxSourceLength) {
            this.maxSourceLength = maxSourceLength;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(options, constants, arrays, cacheEnabled, maxNestingDepth, maxTreeDepth, maxSourceLength);
        }
    }
}
