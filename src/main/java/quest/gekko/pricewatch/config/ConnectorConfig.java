package quest.gekko.pricewatch.config;

import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.reactive.function.client.WebClient;
import quest.gekko.pricewatch.exception.FetchException;
import quest.gekko.pricewatch.exception.FetchTimeoutException;
import quest.gekko.pricewatch.exception.RemoteRateLimitException;
import quest.gekko.pricewatch.exception.TransportException;
import reactor.netty.http.client.HttpClient;

@Configuration
@Slf4j
public class ConnectorConfig {
    private static final int MAX_PAGE_BYTES = 8 * 1024 * 1024;

    @Bean
    public WebClient sourceWebClient(final PriceWatchProperties.Fetch fetch) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) fetch.timeout().toMillis())
                .responseTimeout(fetch.timeout())
                .followRedirect(true);

        return WebClient.builder()
                .baseUrl(fetch.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.USER_AGENT, fetch.userAgent())
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, "ru-RU,ru;q=0.9,en;q=0.8")
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_PAGE_BYTES))
                .build();
    }

    /**
     * Retries transient fetch failures only. Not-found and parse failures go straight back
     * to the caller.
     */
    @Bean
    public RetryTemplate fetchRetryTemplate(final PriceWatchProperties.Fetch fetch, final Sleeper sleeper) {
        ExponentialRandomBackOffPolicy backOff = new ExponentialRandomBackOffPolicy();
        backOff.setInitialInterval(fetch.backoffInitial().toMillis());
        backOff.setMultiplier(fetch.backoffMultiplier());
        backOff.setMaxInterval(fetch.backoffMax().toMillis());
        backOff.setSleeper(sleeper);

        return RetryTemplate.builder()
                .maxAttempts(fetch.maxAttempts())
                .retryOn(FetchTimeoutException.class)
                .retryOn(RemoteRateLimitException.class)
                .retryOn(TransportException.class)
                .customBackoff(backOff)
                .withListener(new RetryListener() {
                    @Override
                    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                                 Throwable throwable) {
                        if (throwable instanceof FetchException fe) {
                            log.warn("Fetch attempt {} for {} failed ({}): {}",
                                    context.getRetryCount(), fe.getProductId(), fe.getType(), fe.getMessage());
                        }
                    }
                })
                .build();
    }
}
