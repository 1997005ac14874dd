package quest.gekko.pricewatch.domain;

public enum GroupType {
    COMPARISON, VARIANTS, SIMILAR
}
