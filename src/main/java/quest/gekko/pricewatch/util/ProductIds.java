package quest.gekko.pricewatch.util;

import java.util.regex.Pattern;

public class ProductIds {
    private static final Pattern FORMAT = Pattern.compile("[A-Za-z0-9]{5,20}");

    public static String normalize(String s) {
        String id = s == null ? "" : s.trim();
        if (!FORMAT.matcher(id).matches()) {
            throw new IllegalArgumentException("Product identifier must be 5-20 letters or digits, got '" + s + "'");
        }
        return id;
    }
}
