package quest.gekko.pricewatch.service.integration.extract;

public record ExtractedAttributes(
        String name,
        Double price,
        Double cardPrice,
        Double oldPrice,
        Double rating,
        Integer reviewCount,
        Boolean available,
        String imageUrl,
        String productUrl) {

    public boolean hasPlausiblePrice() {
        return positive(price) || positive(cardPrice);
    }

    /** Drops values that cannot be real: negative prices, ratings outside 0..5, negative counts. */
    public ExtractedAttributes sanitized() {
        Double p = positive(price) ? price : null;
        Double card = positive(cardPrice) ? cardPrice : null;
        return new ExtractedAttributes(
                name,
                p != null ? p : card,
                card,
                positive(oldPrice) ? oldPrice : null,
                rating != null && rating >= 0 && rating <= 5 ? rating : null,
                reviewCount != null && reviewCount >= 0 ? reviewCount : null,
                available,
                imageUrl,
                productUrl);
    }

    private static boolean positive(Double d) {
        return d != null && d > 0 && !d.isNaN() && !d.isInfinite();
    }
}
