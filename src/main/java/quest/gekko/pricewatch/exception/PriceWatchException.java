package quest.gekko.pricewatch.exception;

import lombok.Getter;

@Getter
public class PriceWatchException extends RuntimeException {
    private final String errorCode;

    public PriceWatchException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PriceWatchException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
