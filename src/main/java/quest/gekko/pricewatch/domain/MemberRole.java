package quest.gekko.pricewatch.domain;

public enum MemberRole {
    OWN, COMPETITOR, ITEM
}
