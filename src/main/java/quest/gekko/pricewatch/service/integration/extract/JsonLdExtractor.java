package quest.gekko.pricewatch.service.integration.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reads the schema.org {@code Product} block that most product pages embed as JSON-LD.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class JsonLdExtractor implements Extractor {
    private final ObjectMapper mapper;

    @Override
    public String name() { return "json-ld"; }

    @Override
    public Optional<ExtractedAttributes> extract(Document page) {
        for (Element script : page.select("script[type=application/ld+json]")) {
            JsonNode root;
            try {
                root = mapper.readTree(script.data());
            } catch (JsonProcessingException e) {
                log.debug("Skipping malformed JSON-LD block: {}", e.getOriginalMessage());
                continue;
            }
            Optional<ExtractedAttributes> found = findProduct(root)
                    .map(this::toAttributes)
                    .filter(ExtractedAttributes::hasPlausiblePrice);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    private Optional<JsonNode> findProduct(JsonNode node) {
        if (node == null) return Optional.empty();
        if (node.isArray()) {
            for (JsonNode child : node) {
                Optional<JsonNode> found = findProduct(child);
                if (found.isPresent()) return found;
            }
            return Optional.empty();
        }
        if (!node.isObject()) return Optional.empty();
        if (isProduct(node.get("@type"))) return Optional.of(node);
        return findProduct(node.get("@graph"));
    }

    private static boolean isProduct(JsonNode type) {
        if (type == null) return false;
        if (type.isTextual()) return "Product".equals(type.asText());
        if (type.isArray()) {
            for (JsonNode t : type) {
                if ("Product".equals(t.asText())) return true;
            }
        }
        return false;
    }

    private ExtractedAttributes toAttributes(JsonNode product) {
        JsonNode offers = product.path("offers");
        if (offers.isArray()) offers = offers.path(0);

        Double price = number(offers.get("price"));
        if (price == null) price = number(offers.get("lowPrice"));

        JsonNode rating = product.path("aggregateRating");
        Integer reviews = integer(rating.get("reviewCount"));
        if (reviews == null) reviews = integer(rating.get("ratingCount"));

        String url = text(offers.get("url"));
        if (url == null) url = text(product.get("url"));

        return new ExtractedAttributes(
                text(product.get("name")),
                price,
                null,
                null,
                number(rating.get("ratingValue")),
                reviews,
                availability(text(offers.get("availability"))),
                image(product.get("image")),
                url).sanitized();
    }

    private static Boolean availability(String value) {
        if (value == null) return null;
        if (value.endsWith("InStock") || value.endsWith("LimitedAvailability")) return true;
        if (value.endsWith("OutOfStock") || value.endsWith("SoldOut") || value.endsWith("Discontinued")) return false;
        return null;
    }

    private static String image(JsonNode node) {
        if (node == null) return null;
        if (node.isArray()) return image(node.path(0));
        if (node.isObject()) return text(node.get("url"));
        return text(node);
    }

    private static Double number(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) return node.asDouble();
        return PriceText.parse(node.asText());
    }

    private static Integer integer(JsonNode node) {
        Double d = number(node);
        return d == null ? null : d.intValue();
    }

    private static String text(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode() || node.asText().isBlank() ? null : node.asText();
    }
}
