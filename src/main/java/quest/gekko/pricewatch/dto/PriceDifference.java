package quest.gekko.pricewatch.dto;

public record PriceDifference(double ownPrice, double competitorPrice, double absolute, double percentage,
                              String whoCheaper, String recommendation) {}
