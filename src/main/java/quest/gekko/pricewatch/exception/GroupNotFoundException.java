package quest.gekko.pricewatch.exception;

public class GroupNotFoundException extends PriceWatchException {
    public GroupNotFoundException(Long groupId) {
        super("GROUP_NOT_FOUND", "Comparison group " + groupId + " not found.");
    }
}
