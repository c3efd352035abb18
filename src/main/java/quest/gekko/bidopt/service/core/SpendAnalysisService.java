package quest.gekko.bidopt.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.bidopt.domain.Campaign;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.domain.Recommendation;
import quest.gekko.bidopt.domain.SpendSample;
import quest.gekko.bidopt.service.analytics.SpendAnalyticsService;
import quest.gekko.bidopt.service.discovery.CampaignDiscoveryService;
import quest.gekko.bidopt.util.MoneyUtils;
import quest.gekko.bidopt.web.dto.CampaignSpendAnalysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

/**
 * Discovery, trailing spend and the recommendation rule composed into one row per active campaign.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpendAnalysisService {

    private final CampaignDiscoveryService discovery;
    private final SpendAnalyticsService analytics;
    private final BidRecommendationEngine engine;

    public List<CampaignSpendAnalysis> analyzeSpend(PlatformSession session, String accountId, Integer adjustmentPercent) {
        int percent = BidRecommendationEngine.normalizePercent(adjustmentPercent);
        List<Campaign> campaigns = discovery.fetchActiveCampaigns(session, accountId);
        Map<String, SpendSample> spend = analytics.averageDailySpend(session, accountId, campaigns);

        List<CampaignSpendAnalysis> rows = campaigns.stream()
                .map(c -> toRow(c, spend.get(c.id()), percent))
                .toList();
        log.debug("Account {}: analyzed {} campaigns at {}%", accountId, rows.size(), percent);
        return rows;
    }

    CampaignSpendAnalysis toRow(Campaign campaign, SpendSample sample, int percent) {
        BigDecimal budget = campaign.dailyBudget() != null ? campaign.dailyBudget() : BigDecimal.ZERO;
        BigDecimal bid = campaign.currentBid() != null ? campaign.currentBid() : BigDecimal.ZERO;
        BigDecimal dailySpend = sample != null ? sample.averageDailyCost() : BigDecimal.ZERO;

        BigDecimal spendPct = BidRecommendationEngine.spendPercentage(budget, dailySpend);
        Recommendation recommendation = engine.recommend(budget, bid, dailySpend, percent).orElse(null);

        return new CampaignSpendAnalysis(
                campaign.id(),
                campaign.name(),
                campaign.status() != null ? campaign.status() : CampaignDiscoveryService.ACTIVE,
                campaign.currencyCode(),
                budget,
                MoneyUtils.toMinorUnits(dailySpend),
                spendPct.setScale(1, RoundingMode.HALF_UP),
                bid,
                recommendation);
    }
}
