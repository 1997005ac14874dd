package quest.gekko.pricewatch.domain;

import quest.gekko.pricewatch.config.PriceWatchProperties;

public enum Grade {
    A, B, C, D, F;

    /** Lower bounds are inclusive: an index equal to a threshold earns that grade. */
    public static Grade of(double index, PriceWatchProperties.Grades thresholds) {
        if (index >= thresholds.a()) return A;
        if (index >= thresholds.b()) return B;
        if (index >= thresholds.c()) return C;
        if (index >= thresholds.d()) return D;
        return F;
    }
}
