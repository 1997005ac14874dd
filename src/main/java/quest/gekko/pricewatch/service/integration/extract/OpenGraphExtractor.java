package quest.gekko.pricewatch.service.integration.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Falls back to Open Graph / microdata meta tags.
 */
@Component
@Order(2)
public class OpenGraphExtractor implements Extractor {

    @Override
    public String name() { return "open-graph"; }

    @Override
    public Optional<ExtractedAttributes> extract(Document page) {
        Double price = PriceText.parse(meta(page,
                "meta[property=product:price:amount]", "meta[property=og:price:amount]", "meta[itemprop=price]"));
        if (price == null) return Optional.empty();

        ExtractedAttributes attributes = new ExtractedAttributes(
                meta(page, "meta[property=og:title]", "meta[name=title]"),
                price,
                null,
                null,
                PriceText.firstDecimal(meta(page, "meta[itemprop=ratingValue]")),
                reviewCount(meta(page, "meta[itemprop=reviewCount]")),
                availability(meta(page, "meta[property=product:availability]", "meta[property=og:availability]",
                        "link[itemprop=availability]")),
                meta(page, "meta[property=og:image]"),
                meta(page, "meta[property=og:url]", "link[rel=canonical]")).sanitized();
        return attributes.hasPlausiblePrice() ? Optional.of(attributes) : Optional.empty();
    }

    private static String meta(Document page, String... selectors) {
        for (String selector : selectors) {
            Element el = page.selectFirst(selector);
            if (el == null) continue;
            String value = el.hasAttr("content") ? el.attr("content") : el.attr("abs:href");
            if (value != null && !value.isBlank()) return value.trim();
        }
        return null;
    }

    private static Integer reviewCount(String value) {
        Double count = PriceText.parse(value);
        return count == null ? null : count.intValue();
    }

    private static Boolean availability(String value) {
        if (value == null) return null;
        String v = value.toLowerCase(Locale.ROOT).replace(" ", "");
        if (v.contains("outofstock") || v.equals("oos") || v.contains("soldout")) return false;
        if (v.contains("instock")) return true;
        return null;
    }
}
