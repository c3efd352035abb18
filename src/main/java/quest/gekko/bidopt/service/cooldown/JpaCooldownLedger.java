package quest.gekko.bidopt.service.cooldown;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import quest.gekko.bidopt.config.BidOptimizerProperties;
import quest.gekko.bidopt.domain.CooldownEntry;
import quest.gekko.bidopt.domain.RecentlyOptimized;
import quest.gekko.bidopt.exception.StorageException;
import quest.gekko.bidopt.repository.RecentlyOptimizedRepository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Ledger on the {@code recently_optimized} table. Read failures count as "nothing in cooldown";
 * write failures surface as {@link StorageException}.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaCooldownLedger implements CooldownLedger {

    private final RecentlyOptimizedRepository repo;
    private final BidOptimizerProperties.Optimizer optimizer;
    private final Clock clock;

    @Override
    public boolean isRecent(String tenantId, String accountId, String campaignId) {
        try {
            return repo.existsByTenantIdAndAccountIdAndCampaignIdAndAppliedAtGreaterThanEqual(
                    tenantId, accountId, campaignId, cutoff());
        } catch (DataAccessException e) {
            log.warn("Cooldown lookup failed for {}/{}/{}: {}", tenantId, accountId, campaignId, e.getMessage());
            return false;
        }
    }

    @Override
    public List<CooldownEntry> listRecent(String tenantId, String accountId) {
        try {
            return repo.findByTenantIdAndAccountIdAndAppliedAtGreaterThanEqualOrderByAppliedAtDesc(
                            tenantId, accountId, cutoff())
                    .stream()
                    .map(RecentlyOptimized::toEntry)
                    .toList();
        } catch (DataAccessException e) {
            log.warn("Reading recently optimized campaigns failed for {}/{}: {}", tenantId, accountId, e.getMessage());
            return List.of();
        }
    }

    // Delete and insert run as two statements; concurrent applies on the same campaign are last-writer-wins.
    @Override
    public void record(String tenantId, String accountId, String campaignId, BigDecimal previousBid) {
        try {
            repo.deleteEntry(tenantId, accountId, campaignId);

            RecentlyOptimized row = new RecentlyOptimized();
            row.setTenantId(tenantId);
            row.setAccountId(accountId);
            row.setCampaignId(campaignId);
            row.setAppliedAt(clock.instant());
            row.setPreviousBid(previousBid);
            repo.save(row);
        } catch (DataAccessException e) {
            log.error("Recording cooldown for {}/{}/{} failed", tenantId, accountId, campaignId, e);
            throw new StorageException("Failed to record recently optimized campaign", e);
        }
    }

    @Override
    public void remove(String tenantId, String accountId, String campaignId) {
        try {
            repo.deleteEntry(tenantId, accountId, campaignId);
        } catch (DataAccessException e) {
            log.error("Removing cooldown for {}/{}/{} failed", tenantId, accountId, campaignId, e);
            throw new StorageException("Failed to remove recently optimized campaign", e);
        }
    }

    @Override
    public void deleteTenant(String tenantId) {
        try {
            int removed = repo.deleteAllForTenant(tenantId);
            log.info("Deleted {} cooldown entries of tenant {}", removed, tenantId);
        } catch (DataAccessException e) {
            log.error("Deleting cooldown entries of tenant {} failed", tenantId, e);
            throw new StorageException("Failed to delete cooldown entries", e);
        }
    }

    @Override
    public boolean isDurable() {
        return true;
    }

    private Instant cutoff() {
        return clock.instant().minus(optimizer.cooldownWindow());
    }
}
