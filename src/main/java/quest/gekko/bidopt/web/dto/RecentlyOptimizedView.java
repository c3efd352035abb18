package quest.gekko.bidopt.web.dto;

import quest.gekko.bidopt.domain.CooldownEntry;

import java.math.BigDecimal;
import java.time.Instant;

public record RecentlyOptimizedView(String campaignId, Instant appliedAt, BigDecimal previousBid) {

    public static RecentlyOptimizedView of(CooldownEntry entry) {
        return new RecentlyOptimizedView(entry.campaignId(), entry.appliedAt(), entry.previousBid());
    }
}
