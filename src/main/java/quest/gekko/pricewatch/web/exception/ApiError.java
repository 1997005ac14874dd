package quest.gekko.pricewatch.web.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    int status;
    String error;
    String message;
    String code;
    String path;
    Instant timestamp;
    List<FieldError> fieldErrors;
    /** Partial result that is still worth showing, e.g. a comparison that could not be saved. */
    Object payload;

    @Value
    @Builder
    public static class FieldError {
        String field;
        Object rejectedValue;
        String message;
    }
}
