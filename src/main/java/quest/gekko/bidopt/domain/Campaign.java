package quest.gekko.bidopt.domain;

import java.math.BigDecimal;

/**
 * Request-scoped copy of a campaign as reported by the ads platform.
 * {@code id} is always the normalized plain id, never a URN.
 */
public record Campaign(
        String id,
        String name,
        String status,
        String currencyCode,
        BigDecimal dailyBudget,
        BigDecimal currentBid
) {

    public boolean isActive() {
        return "ACTIVE".equalsIgnoreCase(status);
    }
}
