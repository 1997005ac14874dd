package quest.gekko.pricewatch.dto;

public record RatingDifference(double ownRating, double competitorRating, double absolute, double percentage,
                               String whoBetter, String recommendation) {}
