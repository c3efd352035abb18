package quest.gekko.bidopt.service.integration.connector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import quest.gekko.bidopt.config.BidOptimizerProperties;
import quest.gekko.bidopt.domain.AdAccount;
import quest.gekko.bidopt.domain.Campaign;
import quest.gekko.bidopt.domain.DateWindow;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.exception.AuthException;
import quest.gekko.bidopt.exception.OptimizerException;
import quest.gekko.bidopt.exception.UpstreamRejectedException;
import quest.gekko.bidopt.exception.UpstreamTransientException;
import quest.gekko.bidopt.util.MoneyUtils;
import quest.gekko.bidopt.util.PlatformIds;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
@RequiredArgsConstructor
public class LinkedInAdsConnector implements AdsPlatformConnector {
    private static final String ACTIVE_SEARCH = "(status:(values:List(%s)))";

    private final WebClient http;
    private final BidOptimizerProperties.Platform platform;

    @Override
    public List<AdAccount> listAccounts(PlatformSession session) {
        Map<?, ?> resp = get(session, "/adAccounts?q=search", platform.requestTimeout());
        return safeElements(resp).stream()
                .map(this::mapAccount)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public CampaignPage searchCampaigns(PlatformSession session, String accountId, String status, int pageSize, String pageToken) {
        StringBuilder q = new StringBuilder(campaignsPath(accountId)).append("?q=search");
        if (status != null) {
            q.append("&search=").append(String.format(ACTIVE_SEARCH, status))
                    .append("&sortOrder=DESCENDING")
                    .append("&pageSize=").append(pageSize);
        }
        if (pageToken != null && !pageToken.isBlank()) {
            q.append("&pageToken=").append(PlatformIds.pathSegment(pageToken));
        }

        Map<?, ?> resp = get(session, q.toString(), platform.requestTimeout());
        List<Campaign> campaigns = safeElements(resp).stream()
                .map(this::mapCampaign)
                .filter(Objects::nonNull)
                .toList();
        return new CampaignPage(campaigns, nextPageToken(resp));
    }

    @Override
    public List<Campaign> listCampaigns(PlatformSession session, String accountId) {
        return searchCampaigns(session, accountId, null, 0, null).elements();
    }

    @Override
    @SuppressWarnings("unchecked")
    public Campaign getCampaign(PlatformSession session, String accountId, String campaignId) {
        Map<?, ?> resp = get(session, campaignPath(accountId, campaignId), platform.requestTimeout());
        Campaign campaign = resp == null ? null : mapCampaign((Map<String, Object>) resp);
        if (campaign == null) {
            throw new UpstreamTransientException("Malformed campaign response for " + campaignId, 0, null);
        }
        return campaign;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<String> fetchCampaignGroupStatus(PlatformSession session, String accountId, String campaignId) {
        Map<?, ?> resp = get(session, campaignPath(accountId, campaignId) + "?fields=campaignGroupInfo",
                platform.requestTimeout());
        if (resp == null) return Optional.empty();
        return Optional.ofNullable(groupStatusOf((Map<String, Object>) resp));
    }

    @Override
    public List<BigDecimal> fetchDailyCosts(PlatformSession session, String accountId, String campaignId, DateWindow window) {
        String q = "/adAnalytics?q=analytics"
                + "&dateRange=" + dateRange(window)
                + "&timeGranularity=DAILY"
                + "&accounts=" + PlatformIds.encodedUrnList(PlatformIds.accountUrn(accountId))
                + "&pivot=CAMPAIGN"
                + "&campaigns=" + PlatformIds.encodedUrnList(PlatformIds.campaignUrn(campaignId))
                + "&fields=costInLocalCurrency,dateRange";

        Map<?, ?> resp = get(session, q, platform.analyticsTimeout());
        List<BigDecimal> costs = new ArrayList<>();
        for (Map<String, Object> row : safeElements(resp)) {
            if (row != null && row.get("costInLocalCurrency") != null) {
                costs.add(MoneyUtils.parse(row.get("costInLocalCurrency")));
            }
        }
        return costs;
    }

    @Override
    public void updateBid(PlatformSession session, String accountId, String campaignId, BigDecimal amount, String currencyCode) {
        String token = requireCredential(session);
        URI uri = uri(campaignPath(accountId, campaignId));
        Map<String, Object> body = Map.of("patch", Map.of("$set", Map.of("unitCost", Map.of(
                "amount", MoneyUtils.format(amount),
                "currencyCode", currencyCode))));

        http.post()
                .uri(uri)
                .headers(h -> h.setBearerAuth(token))
                .header("X-RestLi-Method", "PARTIAL_UPDATE")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .toBodilessEntity()
                .timeout(platform.requestTimeout())
                .onErrorMap(e -> translate(uri, e))
                .block();
    }

    // ---- Helpers ----

    private Map<?, ?> get(PlatformSession session, String pathAndQuery, Duration timeout) {
        String token = requireCredential(session);
        URI uri = uri(pathAndQuery);
        return http.get()
                .uri(uri)
                .headers(h -> h.setBearerAuth(token))
                .retrieve()
                .bodyToMono(Map.class)
                .timeout(timeout)
                .onErrorMap(e -> translate(uri, e))
                .block();
    }

    private static String requireCredential(PlatformSession session) {
        if (session == null || !session.hasCredential()) {
            throw new AuthException("No valid session");
        }
        return session.accessToken();
    }

    private URI uri(String pathAndQuery) {
        String base = platform.baseUrl().endsWith("/")
                ? platform.baseUrl().substring(0, platform.baseUrl().length() - 1)
                : platform.baseUrl();
        return URI.create(base + pathAndQuery);
    }

    private Throwable translate(URI uri, Throwable e) {
        if (e instanceof OptimizerException) return e;
        if (e instanceof WebClientResponseException w) {
            int status = w.getStatusCode().value();
            String body = w.getResponseBodyAsString();
            log.warn("Ads platform returned {} for {}: {}", status, uri.getPath(), body);
            if (status == 401 || status == 403) {
                return new AuthException("Ads platform rejected the credential", status, body);
            }
            if (status >= 400 && status < 500) {
                return new UpstreamRejectedException("Ads platform rejected the request (HTTP " + status + ")", status, body);
            }
            return new UpstreamTransientException("Ads platform error (HTTP " + status + ")", status, body);
        }
        if (e instanceof TimeoutException) {
            return new UpstreamTransientException("Ads platform call timed out: " + uri.getPath(), e, true);
        }
        if (e instanceof WebClientRequestException) {
            return new UpstreamTransientException("Ads platform unreachable: " + e.getMessage(), e, false);
        }
        return new UpstreamTransientException("Unexpected ads platform response: " + e.getMessage(), e, false);
    }

    private static String campaignsPath(String accountId) {
        return "/adAccounts/" + PlatformIds.pathSegment(accountId) + "/adCampaigns";
    }

    private static String campaignPath(String accountId, String campaignId) {
        return campaignsPath(accountId) + "/" + PlatformIds.pathSegment(campaignId);
    }

    private static String dateRange(DateWindow window) {
        return "(start:" + date(window.start()) + ",end:" + date(window.end()) + ")";
    }

    private static String date(LocalDate d) {
        return "(year:" + d.getYear() + ",month:" + d.getMonthValue() + ",day:" + d.getDayOfMonth() + ")";
    }

    private AdAccount mapAccount(Map<String, Object> item) {
        if (item == null) return null;
        String id = PlatformIds.normalize(item.get("id"));
        if (id == null) return null;
        return new AdAccount(id,
                str(item.get("name")),
                str(item.get("currency")),
                str(item.get("status")),
                str(item.get("type")));
    }

    private Campaign mapCampaign(Map<String, Object> item) {
        if (item == null) return null;

        // id can be a number, a string, or missing in favour of $URN
        Object rawId = item.get("id") != null ? item.get("id") : item.get("$URN");
        String id = PlatformIds.normalize(rawId);
        if (id == null) return null;

        Map<String, Object> budget = asMap(item.get("dailyBudget"));
        Map<String, Object> unitCost = asMap(item.get("unitCost"));

        String currency = firstNonBlank(
                str(budget.get("currencyCode")),
                str(unitCost.get("currencyCode")),
                platform.defaultCurrency());

        return new Campaign(id,
                str(item.get("name")),
                str(item.get("status")),
                currency,
                MoneyUtils.parse(budget.get("amount")),
                MoneyUtils.parse(unitCost.get("amount")));
    }

    private static String groupStatusOf(Map<String, Object> item) {
        Map<String, Object> info = asMap(item.get("campaignGroupInfo") != null
                ? item.get("campaignGroupInfo") : item.get("campaigngroupinfo"));
        Object status = info.get("status") != null ? info.get("status") : info.get("Status");
        if (status == null) return null;
        String s = status.toString().trim().toUpperCase(Locale.ROOT);
        return s.isEmpty() ? null : s;
    }

    private static String nextPageToken(Map<?, ?> resp) {
        if (resp == null) return null;
        Object token = asMap(resp.get("metadata")).get("nextPageToken");
        return token == null ? null : token.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object o) {
        return o instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    private static List<Map<String, Object>> safeElements(Map<?, ?> obj) {
        if (obj == null) return List.of();
        if (!(obj.get("elements") instanceof List<?> list)) return List.of();
        List<Map<String, Object>> elements = new ArrayList<>(list.size());
        for (Object o : list) {
            if (o instanceof Map<?, ?>) elements.add(asMap(o));
        }
        return elements;
    }

    private static String str(Object o) {
        return o == null ? null : o.toString();
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
