package quest.gekko.bidopt.domain;

import java.math.BigDecimal;

/** Average daily cost of one campaign over a trailing window of {@code windowDays}. */
public record SpendSample(String campaignId, BigDecimal averageDailyCost, int windowDays) {

    public static SpendSample zero(String campaignId, int windowDays) {
        return new SpendSample(campaignId, BigDecimal.ZERO, windowDays);
    }
}
