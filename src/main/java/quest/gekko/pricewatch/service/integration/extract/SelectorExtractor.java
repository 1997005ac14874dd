package quest.gekko.pricewatch.service.integration.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Last resort: reads the visible price widgets of the marketplace product card.
 */
@Component
@Order(3)
public class SelectorExtractor implements Extractor {

    @Override
    public String name() { return "selectors"; }

    @Override
    public Optional<ExtractedAttributes> extract(Document page) {
        Double normal = firstPrice(page, "[data-widget=webPrice]", "span[class*=tsHeadline500Medium]");
        Double card = firstPrice(page, "[data-widget=webOzonCardPrice]", "span[class*=ozonCard]");
        if (normal == null && card == null) return Optional.empty();

        Double old = firstPrice(page, "span[class*=line-through]", "s");

        String scoreText = firstText(page, "[data-widget=webSingleProductScore]", "[class*=rating]");
        Double rating = PriceText.firstDecimal(scoreText);
        Integer reviews = PriceText.reviewCount(scoreText);
        if (reviews == null) reviews = PriceText.reviewCount(firstText(page, ":containsOwn(отзыв)", ":containsOwn(review)"));

        Element img = page.selectFirst("img[src*=cdn]");
        Element canonical = page.selectFirst("link[rel=canonical]");

        ExtractedAttributes attributes = new ExtractedAttributes(
                firstText(page, "[data-widget=webProductHeading] h1", "h1", "span[class*=tsBody500Medium]"),
                normal != null ? normal : card,
                card,
                old,
                rating,
                reviews,
                !outOfStock(page),
                img != null ? img.attr("abs:src") : null,
                canonical != null ? canonical.attr("abs:href") : null).sanitized();
        return attributes.hasPlausiblePrice() ? Optional.of(attributes) : Optional.empty();
    }

    private static Double firstPrice(Document page, String... selectors) {
        for (String selector : selectors) {
            for (Element el : page.select(selector)) {
                for (Element candidate : el.getAllElements()) {
                    Double value = PriceText.parse(candidate.ownText());
                    if (value != null) return value;
                }
            }
        }
        return null;
    }

    private static String firstText(Document page, String... selectors) {
        for (String selector : selectors) {
            Element el = page.selectFirst(selector);
            if (el != null && !el.text().isBlank()) return el.text().trim();
        }
        return null;
    }

    private static boolean outOfStock(Document page) {
        if (page.selectFirst("[data-widget=webOutOfStock]") != null) return true;
        String text = page.text().toLowerCase(Locale.ROOT);
        return text.contains("нет в наличии") || text.contains("out of stock");
    }
}
