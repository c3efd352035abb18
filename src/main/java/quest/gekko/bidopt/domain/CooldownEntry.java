package quest.gekko.bidopt.domain;

import java.math.BigDecimal;
import java.time.Instant;

public record CooldownEntry(
        String tenantId,
        String accountId,
        String campaignId,
        Instant appliedAt,
        BigDecimal previousBid
) {}
