package io.exprkit.core.engine;

import java.util.Locale;

/** Binding options for {@link Expression}. */
public enum ExpressionOption {

    /** Skip constant folding; every node stays live. */
    NO_OPTIMIZE("no-optimize"),

    /** Enable the built-in boolean constants, comparisons, logic and ternary operators. */
    BOOL_SYMBOLS("bool-symbols"),

    /** Treat caller-supplied operators and functions as pure, so they may be folded. */
    PURE_SYMBOLS("pure-symbols");

    private final String configName;

    ExpressionOption(String configName) {
        this.configName = configName;
    }

    /** The name used in configuration files and environment variables. */
    public String configName() {
        return configName;
    }

    /**
     * Resolves a configuration name (case-insensitive).
     *
     * @throws IllegalArgumentException if no option has that name
     */
    public static ExpressionOption fromConfigName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ExpressionOption option : values()) {
            if (option.configName.equals(normalized)) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unknown expression option: '" + name + "'");
    }
}
