package quest.gekko.pricewatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.time.Clock;

/**
 * Clock and pause primitive shared by the rate limiter, retries and the collector,
 * so tests can replace both.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }
}
