package quest.gekko.bidopt.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.bidopt.config.BidOptimizerProperties;
import quest.gekko.bidopt.domain.AdAccount;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.exception.ValidationException;
import quest.gekko.bidopt.service.cooldown.CooldownLedger;
import quest.gekko.bidopt.service.integration.connector.AdsPlatformConnector;
import quest.gekko.bidopt.service.settings.SettingsStore;
import quest.gekko.bidopt.util.PlatformIds;
import quest.gekko.bidopt.web.dto.AccountView;
import quest.gekko.bidopt.web.dto.SettingsAccounts;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Tenant-level operations: the visible accounts, the account selection and tenant data removal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private final AdsPlatformConnector connector;
    private final SettingsStore settings;
    private final CooldownLedger ledger;
    private final OptimizationSummaryService summary;
    private final BidOptimizerProperties.Optimizer optimizer;

    /**
     * Accounts of the caller narrowed to the tenant's selection. With {@code includeOptimization}
     * each account also says whether it has a pending recommendation.
     */
    public List<AccountView> listAccounts(PlatformSession session, boolean includeOptimization,
                                          Collection<String> clientExclusions) {
        List<AdAccount> accounts = connector.listAccounts(session);
        Optional<List<String>> selection = settings.getSelectedAccounts(session.tenantId());

        List<AccountView> views = accounts.stream()
                .filter(a -> selection.map(ids -> ids.contains(a.id())).orElse(true))
                .map(AccountView::of)
                .toList();

        if (!includeOptimization || views.isEmpty()) return views;

        int percent = optimizer.defaultAdjustmentPercent();
        int concurrency = Math.max(1, optimizer.summaryConcurrency());
        List<AccountView> withFlag = Flux.fromIterable(views)
                .flatMapSequential(v -> Mono.fromCallable(() ->
                                        v.withOptimization(summary.hasOptimization(session, v.id(), percent, clientExclusions)))
                                .subscribeOn(Schedulers.boundedElastic()),
                        concurrency)
                .collectList()
                .block();
        return Objects.requireNonNull(withFlag);
    }

    public SettingsAccounts listSettingsAccounts(PlatformSession session) {
        List<AdAccount> accounts = connector.listAccounts(session);
        List<String> selected = settings.getSelectedAccounts(session.tenantId()).orElse(null);
        return new SettingsAccounts(accounts, selected);
    }

    public Optional<List<String>> getSelectedAccounts(PlatformSession session) {
        return settings.getSelectedAccounts(session.tenantId());
    }

    /** Stores the selection with every id normalized; returns what was stored. */
    public List<String> setSelectedAccounts(PlatformSession session, List<?> rawIds) {
        if (rawIds == null) {
            throw new ValidationException("selectedIds must be an array");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (Object raw : rawIds) {
            String id = PlatformIds.normalize(raw);
            if (id != null) ids.add(id);
        }
        List<String> stored = List.copyOf(ids);
        settings.setSelectedAccounts(session.tenantId(), stored);
        log.info("Tenant {} selected {} accounts", session.tenantId(), stored.size());
        return stored;
    }

    public void deleteTenantData(PlatformSession session) {
        settings.deleteTenant(session.tenantId());
        ledger.deleteTenant(session.tenantId());
        log.info("Deleted stored data of tenant {}", session.tenantId());
    }
}
