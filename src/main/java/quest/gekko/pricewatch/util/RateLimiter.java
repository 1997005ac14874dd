package quest.gekko.pricewatch.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.stereotype.Component;
import quest.gekko.pricewatch.config.PriceWatchProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Supplier;

/**
 * Sliding-window limiter for outbound fetches. Callers over the limit are parked until
 * the oldest call leaves the window; nothing is ever rejected.
 */
@Component
@Slf4j
public class RateLimiter {
    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Deque<Instant> issued = new ArrayDeque<>();

    @Autowired
    public RateLimiter(PriceWatchProperties.Fetch fetch, Clock clock, Sleeper sleeper) {
        this(fetch.rateLimit(), fetch.rateWindow(), clock, sleeper);
    }

    public RateLimiter(int maxRequests, Duration window, Clock clock, Sleeper sleeper) {
        if (maxRequests < 1) throw new IllegalArgumentException("maxRequests must be positive");
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public <T> T call(Supplier<T> c) {
        acquire();
        return c.get();
    }

    public void acquire() {
        while (true) {
            long waitMillis;
            synchronized (this) {
                Instant now = clock.instant();
                evictExpired(now);
                if (issued.size() < maxRequests) {
                    issued.addLast(now);
                    return;
                }
                waitMillis = Math.max(1, Duration.between(now, issued.peekFirst().plus(window)).toMillis() + 1);
            }
            log.debug("Rate limit of {}/{} reached, waiting {} ms", maxRequests, window, waitMillis);
            try {
                sleeper.sleep(waitMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while waiting for a fetch slot", e);
            }
        }
    }

    public synchronized int inFlightWindow() {
        evictExpired(clock.instant());
        return issued.size();
    }

    private void evictExpired(Instant now) {
        while (!issued.isEmpty() && !issued.peekFirst().plus(window).isAfter(now)) {
            issued.pollFirst();
        }
    }
}
