package quest.gekko.pricewatch.exception;

public class DuplicateMemberException extends PriceWatchException {
    public DuplicateMemberException(Long groupId, String productId) {
        super("DUPLICATE_MEMBER", "Product '" + productId + "' is already a member of group " + groupId + ".");
    }
}
