package quest.gekko.bidopt.domain;

import java.math.BigDecimal;

/**
 * A suggested bid change. {@code changePercent} is signed: positive for increases, negative for decreases.
 */
public record Recommendation(
        RecommendationAction action,
        BigDecimal currentBid,
        BigDecimal recommendedBid,
        int changePercent,
        String reason
) {}
