package quest.gekko.pricewatch.domain;

public enum ProductStatus {
    ACTIVE, INACTIVE, ERROR
}
