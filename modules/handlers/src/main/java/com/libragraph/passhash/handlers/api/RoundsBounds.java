package com.libragraph.passhash.handlers.api;

import com.libragraph.passhash.types.CostFunction;

/**
 * Rounds capability of a handler. When {@code strictBounds} is set, a value below
 * {@code min} is rejected even in relaxed mode.
 */
public record RoundsBounds(
        long min,
        long defaultRounds,
        long max,
        CostFunction costFunction,
        boolean strictBounds
) {
    public RoundsBounds {
        if (costFunction == null) {
            throw new MisconfiguredHandlerException("rounds cost function is required");
        }
        if (min < 0 || min > defaultRounds || defaultRounds > max) {
            throw new MisconfiguredHandlerException(
                    "rounds bounds must satisfy 0 <= min <= default <= max, got "
                            + min + "/" + defaultRounds + "/" + max);
        }
    }

    public static RoundsBounds linear(long min, long defaultRounds, long max) {
        return new RoundsBounds(min, defaultRounds, max, CostFunction.LINEAR, false);
    }
}
