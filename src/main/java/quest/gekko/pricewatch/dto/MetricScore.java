package quest.gekko.pricewatch.dto;

/**
 * Normalised score of one metric in [0, 1] from the own product's point of view.
 * An unknown metric scores the neutral 0.5 and says so through {@code known}.
 */
public record MetricScore(double value, boolean known) {
    public static final double NEUTRAL = 0.5;

    public static MetricScore of(double value) {
        return new MetricScore(Math.max(0.0, Math.min(1.0, value)), true);
    }

    public static MetricScore unknown() {
        return new MetricScore(NEUTRAL, false);
    }
}
