package quest.gekko.bidopt.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.service.core.BidMutationService;
import quest.gekko.bidopt.service.core.CampaignService;
import quest.gekko.bidopt.service.core.SpendAnalysisService;
import quest.gekko.bidopt.util.PlatformIds;
import quest.gekko.bidopt.web.dto.BidUpdateRequest;
import quest.gekko.bidopt.web.dto.RecentlyOptimizedView;
import quest.gekko.bidopt.web.session.AccountIds;

import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignService campaignService;
    private final SpendAnalysisService spendAnalysisService;
    private final BidMutationService bidMutationService;

    @GetMapping("/campaigns")
    public Map<String, Object> campaigns(PlatformSession session,
                                         @RequestParam(required = false) String adAccountId,
                                         @RequestHeader(name = AccountIds.ACCOUNT_HEADER, required = false) String header) {
        String accountId = AccountIds.require(adAccountId, header);
        return Map.of("campaigns", campaignService.listCampaigns(session, accountId));
    }

    @GetMapping("/campaigns/{campaignId}")
    public Map<String, Object> campaign(PlatformSession session,
                                        @PathVariable String campaignId,
                                        @RequestParam(required = false) String adAccountId,
                                        @RequestHeader(name = AccountIds.ACCOUNT_HEADER, required = false) String header) {
        String accountId = AccountIds.require(adAccountId, header);
        return Map.of("campaign", campaignService.getCampaign(session, accountId, PlatformIds.normalize(campaignId)));
    }

    @GetMapping("/campaigns/{campaignId}/analytics")
    public Map<String, Object> analytics(PlatformSession session,
                                         @PathVariable String campaignId,
                                         @RequestParam(required = false) String adAccountId,
                                         @RequestHeader(name = AccountIds.ACCOUNT_HEADER, required = false) String header) {
        String accountId = AccountIds.require(adAccountId, header);
        var cost = campaignService.getCampaignAnalytics(session, accountId, PlatformIds.normalize(campaignId));
        return Map.of("analytics", Map.of("costInLocalCurrency", cost));
    }

    @PatchMapping("/campaigns/{campaignId}/bid")
    public Map<String, Object> updateBid(PlatformSession session,
                                         @PathVariable String campaignId,
                                         @RequestBody BidUpdateRequest body,
                                         @RequestParam(required = false) String adAccountId,
                                         @RequestHeader(name = AccountIds.ACCOUNT_HEADER, required = false) String header) {
        String accountId = AccountIds.require(adAccountId, body.adAccountId(), header);
        bidMutationService.applyBid(session, accountId, PlatformIds.normalize(campaignId),
                body.newBid(), body.previousBid(), body.isRevert());
        return Map.of("success", true, "message", "Bid updated successfully");
    }

    @GetMapping("/spend-analysis")
    public Map<String, Object> spendAnalysis(PlatformSession session,
                                             @RequestParam(required = false) String adAccountId,
                                             @RequestParam(required = false) Integer bidAdjustmentPercent,
                                             @RequestHeader(name = AccountIds.ACCOUNT_HEADER, required = false) String header) {
        String accountId = AccountIds.require(adAccountId, header);
        return Map.of("analysis", spendAnalysisService.analyzeSpend(session, accountId, bidAdjustmentPercent));
    }

    @GetMapping("/recently-optimized")
    public Map<String, Object> recentlyOptimized(PlatformSession session,
                                                 @RequestParam(required = false) String adAccountId,
                                                 @RequestHeader(name = AccountIds.ACCOUNT_HEADER, required = false) String header) {
        String accountId = AccountIds.require(adAccountId, header);
        var entries = campaignService.listRecentlyOptimized(session, accountId).stream()
                .map(RecentlyOptimizedView::of)
                .toList();
        return Map.of("entries", entries, "useServer", campaignService.isServerTracking());
    }
}
