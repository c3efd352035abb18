package quest.gekko.bidopt.service.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.bidopt.config.BidOptimizerProperties;
import quest.gekko.bidopt.domain.Campaign;
import quest.gekko.bidopt.domain.DateWindow;
import quest.gekko.bidopt.domain.LookupResult;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.domain.SpendSample;
import quest.gekko.bidopt.service.integration.connector.AdsPlatformConnector;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Trailing-window spend per campaign. Per-campaign failures become zero samples and never fail the batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpendAnalyticsService {

    private final AdsPlatformConnector connector;
    private final BidOptimizerProperties.Optimizer optimizer;
    private final Clock clock;

    /** The last {@code trailingDays} fully completed days; today is never included. */
    public DateWindow trailingWindow() {
        return DateWindow.trailing(today(), optimizer.trailingDays());
    }

    /**
     * Average daily cost per campaign id. Days without reported cost still count toward the denominator.
     * Returns an empty map if the aggregation as a whole breaks; callers treat missing ids as zero spend.
     */
    public Map<String, SpendSample> averageDailySpend(PlatformSession session, String accountId, List<Campaign> campaigns) {
        if (campaigns.isEmpty()) return Map.of();

        DateWindow window = trailingWindow();
        int batchSize = Math.max(1, optimizer.analyticsBatchSize());
        Map<String, SpendSample> samples = new HashMap<>();

        try {
            for (int i = 0; i < campaigns.size(); i += batchSize) {
                List<Campaign> batch = campaigns.subList(i, Math.min(i + batchSize, campaigns.size()));
                List<LookupResult<SpendSample>> results = Flux.fromIterable(batch)
                        .flatMap(c -> sample(session, accountId, c.id(), window), batchSize)
                        .collectList()
                        .block();

                for (LookupResult<SpendSample> r : results) {
                    if (r.isPresent()) {
                        samples.put(r.campaignId(), r.value());
                    } else {
                        log.debug("Analytics for campaign {} unavailable ({}), using zero", r.campaignId(), r.failureReason());
                        samples.put(r.campaignId(), SpendSample.zero(r.campaignId(), window.days()));
                    }
                }
            }
        } catch (RuntimeException e) {
            log.info("Analytics fetch failed for account {}, using zeros: {}", accountId, e.getMessage());
            return Map.of();
        }
        return samples;
    }

    /** Cost of one campaign for the current (possibly partial) day. */
    public BigDecimal todayCost(PlatformSession session, String accountId, String campaignId) {
        List<BigDecimal> costs = connector.fetchDailyCosts(session, accountId, campaignId, DateWindow.singleDay(today()));
        return costs.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private Mono<LookupResult<SpendSample>> sample(PlatformSession session, String accountId, String campaignId, DateWindow window) {
        return Mono.fromCallable(() -> {
                    List<BigDecimal> costs = connector.fetchDailyCosts(session, accountId, campaignId, window);
                    BigDecimal total = costs.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
                    BigDecimal average = total.divide(BigDecimal.valueOf(window.days()), MathContext.DECIMAL64);
                    return LookupResult.ok(campaignId, new SpendSample(campaignId, average, window.days()));
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> Mono.just(LookupResult.<SpendSample>failed(campaignId, e.getMessage())));
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(optimizer.zone()));
    }
}
