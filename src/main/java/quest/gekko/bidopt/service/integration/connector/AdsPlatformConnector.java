package quest.gekko.bidopt.service.integration.connector;

import quest.gekko.bidopt.domain.AdAccount;
import quest.gekko.bidopt.domain.Campaign;
import quest.gekko.bidopt.domain.DateWindow;
import quest.gekko.bidopt.domain.PlatformSession;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Low-level calls against the ads platform. Every call needs a session with a credential and
 * fails with an {@link quest.gekko.bidopt.exception.OptimizerException} subtype on error.
 */
public interface AdsPlatformConnector {

    List<AdAccount> listAccounts(PlatformSession session);

    /** One page of the campaign search. {@code status} null means no status predicate. */
    CampaignPage searchCampaigns(PlatformSession session, String accountId, String status, int pageSize, String pageToken);

    /** Single unfiltered page of campaigns, as the platform returns it by default. */
    List<Campaign> listCampaigns(PlatformSession session, String accountId);

    Campaign getCampaign(PlatformSession session, String accountId, String campaignId);

    /** Status of the campaign's parent group, upper-cased; empty when the platform omits it. */
    Optional<String> fetchCampaignGroupStatus(PlatformSession session, String accountId, String campaignId);

    /** Per-day cost rows for one campaign over the window. Days without spend may be absent. */
    List<BigDecimal> fetchDailyCosts(PlatformSession session, String accountId, String campaignId, DateWindow window);

    /** Partial update of the campaign's bid. The platform requires the currency even when unchanged. */
    void updateBid(PlatformSession session, String accountId, String campaignId, BigDecimal amount, String currencyCode);
}
