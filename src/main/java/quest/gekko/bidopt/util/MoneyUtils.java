package quest.gekko.bidopt.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public class MoneyUtils {
    private MoneyUtils() {}

    /** Round to currency minor-unit precision (2 decimals, half up). */
    public static BigDecimal toMinorUnits(BigDecimal amount) {
        if (amount == null) return null;
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    /** Lenient parse of an amount the platform may send as string or number; null or garbage yields zero. */
    public static BigDecimal parse(Object raw) {
        if (raw == null) return BigDecimal.ZERO;
        if (raw instanceof BigDecimal d) return d;
        if (raw instanceof Number n) return new BigDecimal(n.toString());
        String s = raw.toString().trim();
        if (s.isEmpty()) return BigDecimal.ZERO;
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return BigDecimal.ZERO;
        }
    }

    /** Wire format for an amount: plain string with exactly two decimals. */
    public static String format(BigDecimal amount) {
        return toMinorUnits(amount).toPlainString();
    }
}
