package quest.gekko.pricewatch.service.integration.connector;

import io.netty.channel.ConnectTimeoutException;
import io.netty.handler.timeout.ReadTimeoutException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import quest.gekko.pricewatch.config.PriceWatchProperties;
import quest.gekko.pricewatch.exception.FetchException;
import quest.gekko.pricewatch.exception.FetchTimeoutException;
import quest.gekko.pricewatch.exception.ParseFailureException;
import quest.gekko.pricewatch.exception.RemoteRateLimitException;
import quest.gekko.pricewatch.exception.SourceNotFoundException;
import quest.gekko.pricewatch.exception.TransportException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeoutException;

@Service
@RequiredArgsConstructor
@Slf4j
public class MarketplacePageSource implements ProductSource {
    private final WebClient sourceWebClient;
    private final PriceWatchProperties.Fetch fetch;

    @Override
    public String productUrl(String productId) {
        return fetch.baseUrl() + fetch.productPath().replace("{id}", productId);
    }

    @Override
    public String fetchPage(String productId) {
        String body;
        try {
            body = sourceWebClient.get()
                    .uri(fetch.productPath(), productId)
                    .accept(MediaType.TEXT_HTML, MediaType.ALL)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> Mono.error(statusError(productId, response.statusCode())))
                    .bodyToMono(String.class)
                    .timeout(fetch.timeout())
                    .block();
        } catch (FetchException e) {
            throw e;
        } catch (WebClientRequestException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ReadTimeoutException || cause instanceof ConnectTimeoutException) {
                throw new FetchTimeoutException(productId, e);
            }
            throw new TransportException(productId, e.getMessage(), e);
        } catch (RuntimeException e) {
            if (Exceptions.unwrap(e) instanceof TimeoutException) {
                throw new FetchTimeoutException(productId, e);
            }
            throw new TransportException(productId, e.getMessage(), e);
        }

        if (body == null || body.isBlank()) {
            throw new ParseFailureException(productId, "empty response body");
        }
        log.debug("Fetched {} ({} chars)", productId, body.length());
        return body;
    }

    private static FetchException statusError(String productId, HttpStatusCode status) {
        int code = status.value();
        if (code == 404 || code == 410) return new SourceNotFoundException(productId);
        if (code == 429 || code == 403) return new RemoteRateLimitException(productId, code);
        return new TransportException(productId, "HTTP " + code, null);
    }
}
