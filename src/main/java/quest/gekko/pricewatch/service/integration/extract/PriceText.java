package quest.gekko.pricewatch.service.integration.extract;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Number parsing for marketplace text such as "1 999 ₽", "1&nbsp;999,50" or "4,8".
 */
public class PriceText {
    private static final Pattern DECIMAL = Pattern.compile("\\d+(?:[.,]\\d+)?");
    private static final Pattern REVIEWS = Pattern.compile(
            "(\\d[\\d\\s\\u00A0\\u2009\\u202F]*)\\s*(?:отзыв|review|оцен)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    public static Double parse(String text) {
        if (text == null) return null;
        String cleaned = text.replaceAll("[^\\d,.]", "").replace(',', '.');
        if (cleaned.isEmpty() || !cleaned.matches(".*\\d.*")) return null;

        // Only the last dot can be a decimal separator
        String[] parts = cleaned.split("\\.", -1);
        if (parts.length > 2) {
            cleaned = String.join("", java.util.Arrays.copyOf(parts, parts.length - 1)) + "." + parts[parts.length - 1];
        }
        try {
            double value = Double.parseDouble(cleaned);
            return value > 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static Double firstDecimal(String text) {
        if (text == null) return null;
        Matcher m = DECIMAL.matcher(text);
        return m.find() ? Double.parseDouble(m.group().replace(',', '.')) : null;
    }

    public static Integer reviewCount(String text) {
        if (text == null) return null;
        Matcher m = REVIEWS.matcher(text);
        if (!m.find()) return null;
        String digits = m.group(1).replaceAll("\\D", "");
        try {
            return digits.isEmpty() ? null : Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
