package quest.gekko.bidopt.service.cooldown;

import lombok.extern.slf4j.Slf4j;
import quest.gekko.bidopt.domain.CooldownEntry;

import java.math.BigDecimal;
import java.util.List;

/** Used when no database is configured: nothing is tracked and nothing is ever in cooldown. */
@Slf4j
public class DisabledCooldownLedger implements CooldownLedger {

    @Override
    public boolean isRecent(String tenantId, String accountId, String campaignId) {
        return false;
    }

    @Override
    public List<CooldownEntry> listRecent(String tenantId, String accountId) {
        return List.of();
    }

    @Override
    public void record(String tenantId, String accountId, String campaignId, BigDecimal previousBid) {
        log.debug("Cooldown tracking disabled, not recording {}/{}", accountId, campaignId);
    }

    @Override
    public void remove(String tenantId, String accountId, String campaignId) {
        log.debug("Cooldown tracking disabled, nothing to remove for {}/{}", accountId, campaignId);
    }

    @Override
    public void deleteTenant(String tenantId) {
        // nothing stored
    }

    @Override
    public boolean isDurable() {
        return false;
    }
}
