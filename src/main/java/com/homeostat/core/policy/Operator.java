package com.homeostat.core.policy;

import java.util.Locale;

/**
 * Comparison applied between a metric value and a condition threshold.
 */
public enum Operator {
    GT(">"),
    GE(">="),
    LT("<"),
    LE("<="),
    EQ("==");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GT -> value > threshold;
            case GE -> value >= threshold;
            case LT -> value < threshold;
            case LE -> value <= threshold;
            case EQ -> Double.compare(value, threshold) == 0;
        };
    }

    /**
     * Accepts either the symbol ({@code >=}) or the constant name ({@code ge}).
     *
     * @throws PolicyException if the text matches neither
     */
    public static Operator parse(String text) {
        if (text == null || text.isBlank()) {
            throw new PolicyException("Condition operator is required");
        }
        String trimmed = text.trim();
        for (Operator op : values()) {
            if (op.symbol.equals(trimmed) || op.name().equals(trimmed.toUpperCase(Locale.ROOT))) {
                return op;
            }
        }
        throw new PolicyException("Unknown condition operator: " + text);
    }
}
