package quest.gekko.pricewatch.dto;

public record FetchStats(long requests, long cacheHits, long cacheMisses, long successes, long failures,
                         long retries, long cacheSize) {}
