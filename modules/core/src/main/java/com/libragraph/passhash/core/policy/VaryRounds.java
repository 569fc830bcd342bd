package com.libragraph.passhash.core.policy;

import com.libragraph.passhash.types.CostFunction;

import java.util.random.RandomGenerator;

/**
 * Random jitter applied to default rounds, either a percentage ({@code "10%"})
 * or an absolute number of rounds.
 */
public record VaryRounds(int amount, boolean percent) {

    public VaryRounds {
        if (amount < 0) {
            throw new IllegalArgumentException("vary_rounds must not be negative");
        }
        if (percent && amount > 100) {
            throw new IllegalArgumentException("vary_rounds percentage must be at most 100%");
        }
    }

    public static VaryRounds parse(Object raw) {
        if (raw instanceof Number n) {
            return new VaryRounds(n.intValue(), false);
        }
        String text = raw.toString().trim();
        boolean percent = text.endsWith("%");
        String digits = percent ? text.substring(0, text.length() - 1).trim() : text;
        try {
            return new VaryRounds(Integer.parseInt(digits), percent);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("vary_rounds must be a number or percentage, got '" + raw + "'", e);
        }
    }

    /**
     * Lower and upper bound of the jitter window around {@code rounds}. For log2
     * costs a percentage is taken of the iteration count, not of the exponent.
     */
    public long[] window(long rounds, CostFunction cost) {
        if (percent && cost == CostFunction.LOG2) {
            double iterations = Math.pow(2, rounds);
            double fraction = amount / 100.0;
            long lower = (long) Math.floor(log2(iterations * (1 - fraction)));
            long upper = (long) Math.floor(log2(iterations * (1 + fraction)));
            return new long[]{Math.max(0, Math.min(lower, rounds)), Math.max(upper, rounds)};
        }
        long delta = percent ? rounds * amount / 100 : amount;
        return new long[]{Math.max(1, rounds - delta), rounds + delta};
    }

    public long apply(long rounds, CostFunction cost, RandomGenerator random) {
        long[] window = window(rounds, cost);
        if (window[0] >= window[1]) {
            return window[0];
        }
        return random.nextLong(window[0], window[1] + 1);
    }

    /**
     * Value as written in a policy: {@code "10%"} or the absolute number.
     */
    public Object toValue() {
        return percent ? amount + "%" : amount;
    }

    private static double log2(double value) {
        return value <= 0 ? Double.NEGATIVE_INFINITY : Math.log(value) / Math.log(2);
    }
}
