package quest.gekko.bidopt.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.bidopt.domain.CooldownEntry;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.service.cooldown.CooldownLedger;
import quest.gekko.bidopt.web.dto.CampaignSpendAnalysis;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers whether an account has at least one campaign with a pending recommendation,
 * ignoring campaigns still in their cooldown window.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OptimizationSummaryService {

    private final SpendAnalysisService analysis;
    private final CooldownLedger ledger;

    /**
     * @param clientExclusions campaign ids the caller tracks itself; only used when the ledger is not durable
     */
    public boolean hasOptimization(PlatformSession session, String accountId, int adjustmentPercent,
                                   Collection<String> clientExclusions) {
        try {
            Set<String> excluded = exclusions(session, accountId, clientExclusions);
            List<CampaignSpendAnalysis> rows = analysis.analyzeSpend(session, accountId, adjustmentPercent);
            return rows.stream()
                    .anyMatch(r -> r.recommendation() != null && !excluded.contains(r.id()));
        } catch (RuntimeException e) {
            log.warn("Optimization check failed for account {}: {}", accountId, e.getMessage());
            return false;
        }
    }

    private Set<String> exclusions(PlatformSession session, String accountId, Collection<String> clientExclusions) {
        if (ledger.isDurable()) {
            return ledger.listRecent(session.tenantId(), accountId).stream()
                    .map(CooldownEntry::campaignId)
                    .collect(Collectors.toSet());
        }
        return clientExclusions == null ? Set.of() : new HashSet<>(clientExclusions);
    }
}
