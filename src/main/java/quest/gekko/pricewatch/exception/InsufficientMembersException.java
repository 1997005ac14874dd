package quest.gekko.pricewatch.exception;

public class InsufficientMembersException extends PriceWatchException {
    public InsufficientMembersException(Long groupId, int members) {
        super("INSUFFICIENT_MEMBERS",
              "Group " + groupId + " has " + members + " member(s); at least 2 are needed to compare.");
    }
}
