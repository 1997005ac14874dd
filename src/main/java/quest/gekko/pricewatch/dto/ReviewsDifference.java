package quest.gekko.pricewatch.dto;

public record ReviewsDifference(int ownReviews, int competitorReviews, int absolute, Double percentage,
                                String whoMore, String recommendation) {}
