package quest.gekko.pricewatch.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class Numbers {
    public static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static Double round(Double value, int scale) {
        return value == null ? null : round(value.doubleValue(), scale);
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
