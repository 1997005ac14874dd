package quest.gekko.pricewatch.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Price statistics over the successful snapshots of a trailing window.
 * With no samples the average, min and max are null, never zero.
 */
public record WindowAggregate(Double average, Double min, Double max, Long sampleCount,
                              Instant firstDate, Instant lastDate) {

    public WindowAggregate {
        if (sampleCount == null) sampleCount = 0L;
    }

    public static WindowAggregate empty() {
        return new WindowAggregate(null, null, null, 0L, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sampleCount == 0;
    }
}
