package quest.gekko.bidopt.web.dto;

import quest.gekko.bidopt.domain.Recommendation;

import java.math.BigDecimal;

/**
 * One row of the spend analysis. {@code recommendation} is null when the bid should stay as it is.
 */
public record CampaignSpendAnalysis(
        String id,
        String name,
        String status,
        String currencyCode,
        BigDecimal dailyBudget,
        BigDecimal dailySpend,
        BigDecimal spendPercentage,
        BigDecimal currentBid,
        Recommendation recommendation
) {}
