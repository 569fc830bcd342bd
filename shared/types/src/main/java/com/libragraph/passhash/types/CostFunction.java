package com.libragraph.passhash.types;

/**
 * How a handler's rounds value maps to actual work.
 */
public enum CostFunction {
    LINEAR(0, "linear"),
    LOG2(1, "log2");

    private final int id;
    private final String label;

    CostFunction(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    /**
     * Iterations performed for the given rounds value.
     */
    public long iterations(int rounds) {
        return this == LOG2 ? 1L << rounds : rounds;
    }

    public static CostFunction fromLabel(String label) {
        for (CostFunction c : values()) {
            if (c.label.equals(label)) return c;
        }
        throw new IllegalArgumentException("Unknown cost function: " + label);
    }
}
