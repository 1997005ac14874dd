package quest.gekko.pricewatch.service.fetch;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.retry.backoff.Sleeper;
import quest.gekko.pricewatch.MutableClock;
import quest.gekko.pricewatch.TestProperties;
import quest.gekko.pricewatch.config.ConnectorConfig;
import quest.gekko.pricewatch.config.PriceWatchProperties;
import quest.gekko.pricewatch.dto.ProductSnapshot;
import quest.gekko.pricewatch.exception.FetchTimeoutException;
import quest.gekko.pricewatch.exception.ParseFailureException;
import quest.gekko.pricewatch.exception.RemoteRateLimitException;
import quest.gekko.pricewatch.exception.SourceNotFoundException;
import quest.gekko.pricewatch.exception.TransportException;
import quest.gekko.pricewatch.service.integration.connector.ProductSource;
import quest.gekko.pricewatch.service.integration.extract.JsonLdExtractor;
import quest.gekko.pricewatch.service.integration.extract.OpenGraphExtractor;
import quest.gekko.pricewatch.service.integration.extract.SelectorExtractor;
import quest.gekko.pricewatch.util.RateLimiter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FetchClientTest {
    private static final String ID = "123456789";
    private static final String PAGE = """
            <html><head>
            <script type="application/ld+json">
            {"@context":"https://schema.org","@type":"Product","name":"Electric kettle",
             "image":"https://cdn.shop.test/kettle.jpg",
             "offers":{"@type":"Offer","price":"1999","priceCurrency":"RUB","availability":"https://schema.org/InStock"},
             "aggregateRating":{"ratingValue":"4.7","reviewCount":"120"}}
            </script></head><body></body></html>
            """;

    @Mock ProductSource source;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final AtomicLong tickerNanos = new AtomicLong();
    private final List<Long> sleeps = new ArrayList<>();
    private final Sleeper sleeper = sleeps::add;
    private FetchClient client;

    @BeforeEach
    void setUp() {
        PriceWatchProperties.Fetch props = TestProperties.fetch("https://shop.test");
        lenient().when(source.productUrl(anyString()))
                .thenAnswer(inv -> "https://shop.test/product/" + inv.getArgument(0) + "/");
        client = new FetchClient(
                source,
                List.of(new JsonLdExtractor(new ObjectMapper()), new OpenGraphExtractor(), new SelectorExtractor()),
                new ProductSnapshotCache(props.cacheTtl(), props.cacheMaxSize(), tickerNanos::get),
                new RateLimiter(1000, Duration.ofMinutes(1), clock, sleeper),
                new ConnectorConfig().fetchRetryTemplate(props, sleeper),
                sleeper,
                props,
                clock);
    }

    @Test
    void fetch_mapsStructuredDataIntoSnapshot() {
        when(source.fetchPage(ID)).thenReturn(PAGE);

        ProductSnapshot snapshot = client.fetch(ID);

        assertThat(snapshot.productId()).isEqualTo(ID);
        assertThat(snapshot.name()).isEqualTo("Electric kettle");
        assertThat(snapshot.price()).isEqualTo(1999.0);
        assertThat(snapshot.rating()).isEqualTo(4.7);
        assertThat(snapshot.reviewCount()).isEqualTo(120);
        assertThat(snapshot.available()).isTrue();
        assertThat(snapshot.source()).isEqualTo("json-ld");
        assertThat(snapshot.productUrl()).isEqualTo("https://shop.test/product/123456789/");
    }

    @Test
    void fetch_withinTtl_servesFromCache() {
        when(source.fetchPage(ID)).thenReturn(PAGE);

        ProductSnapshot first = client.fetch(ID);
        ProductSnapshot second = client.fetch(ID);

        assertThat(second).isEqualTo(first);
        verify(source, times(1)).fetchPage(ID);
        assertThat(client.stats().cacheHits()).isEqualTo(1);
        assertThat(client.stats().cacheMisses()).isEqualTo(1);
    }

    @Test
    void fetch_afterTtl_goesBackToSource() {
        when(source.fetchPage(ID)).thenReturn(PAGE);

        client.fetch(ID);
        tickerNanos.addAndGet(Duration.ofSeconds(3601).toNanos());
        client.fetch(ID);

        verify(source, times(2)).fetchPage(ID);
    }

    @Test
    void fetch_skipCache_alwaysFetchesLive() {
        when(source.fetchPage(ID)).thenReturn(PAGE);

        client.fetch(ID);
        client.fetch(ID, true);

        verify(source, times(2)).fetchPage(ID);
    }

    @Test
    void fetch_transientFailures_areRetriedWithBackoff() {
        when(source.fetchPage(ID))
                .thenThrow(new TransportException(ID, "HTTP 503", null))
                .thenThrow(new FetchTimeoutException(ID, null))
                .thenReturn(PAGE);

        ProductSnapshot snapshot = client.fetch(ID);

        assertThat(snapshot.price()).isEqualTo(1999.0);
        verify(source, times(3)).fetchPage(ID);
        assertThat(sleeps).hasSize(2).allMatch(ms -> ms >= 1000 && ms <= 10_000);
        assertThat(client.stats().retries()).isEqualTo(2);
    }

    @Test
    void fetch_transientFailures_giveUpAfterThreeRetries() {
        when(source.fetchPage(ID)).thenThrow(new TransportException(ID, "HTTP 502", null));

        assertThatThrownBy(() -> client.fetch(ID)).isInstanceOf(TransportException.class);

        verify(source, times(4)).fetchPage(ID);
        assertThat(client.stats().failures()).isEqualTo(1);
    }

    @Test
    void fetch_notFound_isNotRetried() {
        when(source.fetchPage(ID)).thenThrow(new SourceNotFoundException(ID));

        assertThatThrownBy(() -> client.fetch(ID)).isInstanceOf(SourceNotFoundException.class);

        verify(source, times(1)).fetchPage(ID);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void fetch_pageWithoutPrice_isParseFailureAndNotCached() {
        when(source.fetchPage(ID)).thenReturn("<html><body><h1>Kettle</h1></body></html>");

        assertThatThrownBy(() -> client.fetch(ID)).isInstanceOf(ParseFailureException.class);
        assertThatThrownBy(() -> client.fetch(ID)).isInstanceOf(ParseFailureException.class);

        verify(source, times(2)).fetchPage(ID);
    }

    @Test
    void fetch_remoteRateLimit_waitsPenaltyBeforeRetrying() {
        when(source.fetchPage(ID))
                .thenThrow(new RemoteRateLimitException(ID, 429))
                .thenReturn(PAGE);

        client.fetch(ID);

        assertThat(sleeps).contains(5000L);
    }

    @Test
    void fetch_fallsBackToSelectorsWhenNoStructuredData() {
        when(source.fetchPage(ID)).thenReturn("""
                <html><body>
                <div data-widget="webPrice"><span>2 490 ₽</span></div>
                </body></html>
                """);

        ProductSnapshot snapshot = client.fetch(ID);

        assertThat(snapshot.price()).isEqualTo(2490.0);
        assertThat(snapshot.source()).isEqualTo("selectors");
    }

    @Test
    void fetch_malformedIdentifier_isRejectedWithoutNetwork() {
        assertThatThrownBy(() -> client.fetch("12-34")).isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(source);
    }
}
