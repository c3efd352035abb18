package quest.gekko.bidopt.service.core;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import quest.gekko.bidopt.domain.Campaign;
import quest.gekko.bidopt.domain.CooldownEntry;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.exception.ValidationException;
import quest.gekko.bidopt.service.analytics.SpendAnalyticsService;
import quest.gekko.bidopt.service.cooldown.CooldownLedger;
import quest.gekko.bidopt.service.integration.connector.AdsPlatformConnector;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read side of a single account: its campaigns as the platform lists them (every status), one
 * campaign, today's cost and the campaigns still in cooldown.
 */
@Service
@RequiredArgsConstructor
public class CampaignService {

    private final AdsPlatformConnector connector;
    private final SpendAnalyticsService analytics;
    private final CooldownLedger ledger;

    public List<Campaign> listCampaigns(PlatformSession session, String accountId) {
        return connector.listCampaigns(session, accountId);
    }

    public Campaign getCampaign(PlatformSession session, String accountId, String campaignId) {
        requireCampaignId(campaignId);
        return connector.getCampaign(session, accountId, campaignId);
    }

    public BigDecimal getCampaignAnalytics(PlatformSession session, String accountId, String campaignId) {
        requireCampaignId(campaignId);
        return analytics.todayCost(session, accountId, campaignId);
    }

    public List<CooldownEntry> listRecentlyOptimized(PlatformSession session, String accountId) {
        return ledger.listRecent(session.tenantId(), accountId);
    }

    public boolean isServerTracking() {
        return ledger.isDurable();
    }

    private static void requireCampaignId(String campaignId) {
        if (campaignId == null || campaignId.isBlank()) {
            throw new ValidationException("campaignId required");
        }
    }
}
