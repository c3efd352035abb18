package quest.gekko.bidopt.web.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import quest.gekko.bidopt.config.BidOptimizerProperties;
import quest.gekko.bidopt.domain.CooldownEntry;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.domain.Recommendation;
import quest.gekko.bidopt.domain.RecommendationAction;
import quest.gekko.bidopt.exception.AuthException;
import quest.gekko.bidopt.exception.StorageException;
import quest.gekko.bidopt.exception.UpstreamRejectedException;
import quest.gekko.bidopt.exception.UpstreamTransientException;
import quest.gekko.bidopt.service.core.BidMutationService;
import quest.gekko.bidopt.service.core.CampaignService;
import quest.gekko.bidopt.service.core.SpendAnalysisService;
import quest.gekko.bidopt.web.dto.CampaignSpendAnalysis;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CampaignController.class)
@Import(BidOptimizerProperties.class)
class CampaignControllerTest {
    private static final PlatformSession SESSION = new PlatformSession("default", "tok");

    @Autowired private MockMvc mvc;

    @MockBean private CampaignService campaignService;
    @MockBean private SpendAnalysisService spendAnalysisService;
    @MockBean private BidMutationService bidMutationService;

    @Test
    void bidUpdateTakesAccountFromBodyAndNormalizesUrn() throws Exception {
        mvc.perform(patch("/api/campaigns/urn:li:sponsoredCampaign:11/bid")
                        .header("Authorization", "Bearer tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newBid\":2.1,\"previousBid\":2.0,\"adAccountId\":\"urn:li:sponsoredAccount:123\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(bidMutationService).applyBid(eq(SESSION), eq("123"), eq("11"),
                eq(new BigDecimal("2.1")), eq(new BigDecimal("2.0")), eq(false));
    }

    @Test
    void accountHeaderIsAccepted() throws Exception {
        mvc.perform(patch("/api/campaigns/11/bid")
                        .header("Authorization", "Bearer tok")
                        .header("X-Ad-Account-Id", "456")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newBid\":1.5,\"revert\":true}"))
                .andExpect(status().isOk());

        verify(bidMutationService).applyBid(eq(SESSION), eq("456"), eq("11"),
                eq(new BigDecimal("1.5")), isNull(), eq(true));
    }

    @Test
    void missingAccountIsValidationError() throws Exception {
        mvc.perform(get("/api/spend-analysis").header("Authorization", "Bearer tok"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.category").value("VALIDATION"));

        verifyNoInteractions(spendAnalysisService);
    }

    @Test
    void spendAnalysisRendersLowercaseAction() throws Exception {
        Recommendation r = new Recommendation(RecommendationAction.INCREASE, new BigDecimal("2.00"),
                new BigDecimal("2.10"), 5, "Only spending 20.0% of daily budget");
        when(spendAnalysisService.analyzeSpend(SESSION, "123", 5)).thenReturn(List.of(
                new CampaignSpendAnalysis("11", "Spring", "ACTIVE", "USD", new BigDecimal("100"),
                        new BigDecimal("20"), new BigDecimal("20.0"), new BigDecimal("2.00"), r)));

        mvc.perform(get("/api/spend-analysis?adAccountId=123&bidAdjustmentPercent=5")
                        .header("Authorization", "Bearer tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.analysis[0].id").value("11"))
                .andExpect(jsonPath("$.analysis[0].recommendation.action").value("increase"))
                .andExpect(jsonPath("$.analysis[0].recommendation.changePercent").value(5));
    }

    @Test
    void recentlyOptimizedReportsServerTracking() throws Exception {
        when(campaignService.listRecentlyOptimized(SESSION, "123")).thenReturn(List.of(
                new CooldownEntry("default", "123", "11", Instant.parse("2025-03-10T12:00:00Z"), new BigDecimal("2.00"))));
        when(campaignService.isServerTracking()).thenReturn(true);

        mvc.perform(get("/api/recently-optimized?adAccountId=123").header("Authorization", "Bearer tok"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.useServer").value(true))
                .andExpect(jsonPath("$.entries[0].campaignId").value("11"));
    }

    @Test
    void authFailureIs401() throws Exception {
        when(campaignService.listCampaigns(any(), eq("123"))).thenThrow(new AuthException("No valid session"));

        mvc.perform(get("/api/campaigns?adAccountId=123"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.category").value("AUTH"))
                .andExpect(jsonPath("$.error").value("No valid session"));
    }

    @Test
    void upstreamFailuresMapToGatewayStatuses() throws Exception {
        when(campaignService.getCampaign(SESSION, "123", "11"))
                .thenThrow(new UpstreamRejectedException("rejected", 404, "not found"));
        when(campaignService.getCampaign(SESSION, "123", "12"))
                .thenThrow(new UpstreamTransientException("timed out", null, true));

        mvc.perform(get("/api/campaigns/11?adAccountId=123").header("Authorization", "Bearer tok"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.details").value("not found"));
        mvc.perform(get("/api/campaigns/12?adAccountId=123").header("Authorization", "Bearer tok"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.category").value("UPSTREAM_TRANSIENT"));
    }

    @Test
    void storageFailureIs500() throws Exception {
        doThrow(new StorageException("Failed to record recently optimized campaign", null))
                .when(bidMutationService).applyBid(any(), any(), any(), any(), any(), anyBoolean());

        mvc.perform(patch("/api/campaigns/11/bid?adAccountId=123")
                        .header("Authorization", "Bearer tok")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"newBid\":2.1,\"previousBid\":2.0}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.category").value("STORAGE"));
    }
}
