package quest.gekko.bidopt.service.discovery;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.bidopt.config.BidOptimizerProperties;
import quest.gekko.bidopt.domain.Campaign;
import quest.gekko.bidopt.domain.LookupResult;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.exception.AuthException;
import quest.gekko.bidopt.exception.UpstreamRejectedException;
import quest.gekko.bidopt.exception.UpstreamTransientException;
import quest.gekko.bidopt.service.integration.connector.AdsPlatformConnector;
import quest.gekko.bidopt.service.integration.connector.CampaignPage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.*;

/**
 * Finds the campaigns of an account that are active and sit in an active campaign group.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignDiscoveryService {
    public static final String ACTIVE = "ACTIVE";

    private final AdsPlatformConnector connector;
    private final BidOptimizerProperties.Optimizer optimizer;

    /**
     * Paginated ACTIVE search followed by the group filter. A rejected or failed search, or one that
     * returns nothing, falls back to a single unfiltered page. Auth failures always propagate.
     */
    public List<Campaign> fetchActiveCampaigns(PlatformSession session, String accountId) {
        if (session == null || !session.hasCredential()) {
            log.error("fetchActiveCampaigns: no valid credential for account {}", accountId);
            throw new AuthException("No valid session");
        }

        try {
            List<Campaign> all = searchActive(session, accountId);
            if (!all.isEmpty()) {
                List<Campaign> filtered = filterByActiveGroup(session, accountId, all);
                if (filtered.isEmpty()) {
                    log.info("Account {}: all {} campaigns filtered out by group status, returning unfiltered",
                            accountId, all.size());
                    return all;
                }
                return filtered;
            }
            log.info("Account {}: ACTIVE search returned no campaigns, trying fallback listing", accountId);
        } catch (UpstreamRejectedException e) {
            log.warn("Account {}: campaign search rejected (HTTP {}), trying fallback listing",
                    accountId, e.getUpstreamStatus());
        } catch (UpstreamTransientException e) {
            log.warn("Account {}: campaign search failed ({}), trying fallback listing", accountId, e.getMessage());
        }

        return fallbackListing(session, accountId);
    }

    private List<Campaign> searchActive(PlatformSession session, String accountId) {
        List<Campaign> all = new ArrayList<>();
        String pageToken = null;

        for (int page = 0; page < optimizer.maxSearchPages(); page++) {
            CampaignPage result = connector.searchCampaigns(session, accountId, ACTIVE,
                    optimizer.searchPageSize(), pageToken);
            all.addAll(result.elements());
            if (!result.hasNext()) break;
            pageToken = result.nextPageToken();
        }
        return all;
    }

    private List<Campaign> fallbackListing(PlatformSession session, String accountId) {
        List<Campaign> raw = connector.listCampaigns(session, accountId);
        log.info("Account {}: fallback page returned {} campaigns", accountId, raw.size());

        // Some responses omit status entirely; then every campaign on the page is a candidate.
        List<Campaign> active = raw.stream().filter(Campaign::isActive).toList();
        List<Campaign> candidates = active.isEmpty() ? raw : active;

        List<Campaign> filtered = filterByActiveGroup(session, accountId, candidates);
        if (filtered.isEmpty() && !candidates.isEmpty()) {
            log.info("Account {}: fallback filtered to 0 by group status, returning unfiltered", accountId);
            return candidates;
        }
        return filtered;
    }

    /**
     * Keeps the campaigns whose group status resolves to ACTIVE. A failed lookup excludes the campaign.
     */
    List<Campaign> filterByActiveGroup(PlatformSession session, String accountId, List<Campaign> campaigns) {
        if (campaigns.isEmpty()) return List.of();

        int batchSize = Math.max(1, optimizer.groupLookupBatchSize());
        Set<String> activeIds = new HashSet<>();

        for (int i = 0; i < campaigns.size(); i += batchSize) {
            List<Campaign> batch = campaigns.subList(i, Math.min(i + batchSize, campaigns.size()));
            List<LookupResult<String>> results = Flux.fromIterable(batch)
                    .flatMap(c -> lookupGroupStatus(session, accountId, c.id()), batchSize)
                    .collectList()
                    .block();

            for (LookupResult<String> r : Objects.requireNonNull(results)) {
                if (r.isPresent() && ACTIVE.equalsIgnoreCase(r.value())) {
                    activeIds.add(r.campaignId());
                } else if (!r.isPresent()) {
                    log.debug("Group lookup for campaign {} failed: {}", r.campaignId(), r.failureReason());
                }
            }
        }

        return campaigns.stream().filter(c -> activeIds.contains(c.id())).toList();
    }

    private Mono<LookupResult<String>> lookupGroupStatus(PlatformSession session, String accountId, String campaignId) {
        return Mono.fromCallable(() -> connector.fetchCampaignGroupStatus(session, accountId, campaignId)
                        .map(status -> LookupResult.ok(campaignId, status))
                        .orElseGet(() -> LookupResult.<String>failed(campaignId, "no campaignGroupInfo")))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> Mono.just(LookupResult.<String>failed(campaignId, e.getMessage())));
    }
}
