package quest.gekko.pricewatch.service.integration.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class JsonLdExtractorTest {
    private final JsonLdExtractor extractor = new JsonLdExtractor(new ObjectMapper());

    @Test
    void extract_readsProductFromGraphAndOfferArray() {
        String html = """
                <html><head>
                <script type="application/ld+json">{ not json </script>
                <script type="application/ld+json">
                {"@context":"https://schema.org","@graph":[
                  {"@type":"BreadcrumbList"},
                  {"@type":["Product"],"name":"Blender","image":["https://cdn.shop.test/b1.jpg"],
                   "url":"https://shop.test/product/555555555/",
                   "offers":[{"@type":"AggregateOffer","lowPrice":"3 490,00","availability":"https://schema.org/OutOfStock"}],
                   "aggregateRating":{"ratingValue":4.2,"ratingCount":31}}
                ]}
                </script></head></html>
                """;

        Optional<ExtractedAttributes> result = extractor.extract(Jsoup.parse(html));

        assertThat(result).isPresent();
        ExtractedAttributes a = result.get();
        assertThat(a.name()).isEqualTo("Blender");
        assertThat(a.price()).isEqualTo(3490.0);
        assertThat(a.rating()).isEqualTo(4.2);
        assertThat(a.reviewCount()).isEqualTo(31);
        assertThat(a.available()).isFalse();
        assertThat(a.imageUrl()).isEqualTo("https://cdn.shop.test/b1.jpg");
        assertThat(a.productUrl()).isEqualTo("https://shop.test/product/555555555/");
    }

    @Test
    void extract_dropsImplausibleRating() {
        String html = """
                <script type="application/ld+json">
                {"@type":"Product","offers":{"price":100},"aggregateRating":{"ratingValue":9.5,"reviewCount":-3}}
                </script>
                """;

        ExtractedAttributes a = extractor.extract(Jsoup.parse(html)).orElseThrow();

        assertThat(a.rating()).isNull();
        assertThat(a.reviewCount()).isNull();
    }

    @Test
    void extract_withoutPricedProduct_isEmpty() {
        String html = """
                <script type="application/ld+json">{"@type":"Organization","name":"Shop"}</script>
                <script type="application/ld+json">{"@type":"Product","name":"Free sample","offers":{"price":0}}</script>
                """;

        assertThat(extractor.extract(Jsoup.parse(html))).isEmpty();
    }
}
