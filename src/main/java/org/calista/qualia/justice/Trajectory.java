package org.calista.qualia.justice;

import java.util.List;

/**
 * Direction of normalized justice intensity across the interview.
 */
public enum Trajectory {
    INSUFFICIENT_DATA,
    RISING,
    FALLING,
    STABLE;

    static final double RATIO = 1.3;
    static final int MIN_SITES = 3;

    /**
     * Compares the mean of the first and last third of the values (in turn order).
     * Fewer than three values is {@link #INSUFFICIENT_DATA}.
     */
    public static Trajectory classify(List<Double> ordered) {
        int n = ordered == null ? 0 : ordered.size();
        if (n < MIN_SITES) return INSUFFICIENT_DATA;

        int third = Math.max(n / 3, 1);
        double first = 0;
        double last = 0;
        for (int i = 0; i < third; i++) {
            first += ordered.get(i);
            last += ordered.get(n - third + i);
        }
        first /= third;
        last /= third;

        if (last > first * RATIO) return RISING;
        if (first > last * RATIO) return FALLING;
        return STABLE;
    }
}
