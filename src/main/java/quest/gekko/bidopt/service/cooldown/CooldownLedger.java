package quest.gekko.bidopt.service.cooldown;

import quest.gekko.bidopt.domain.CooldownEntry;

import java.math.BigDecimal;
import java.util.List;

/**
 * Remembers recent bid changes per (tenant, account, campaign) so they are not recommended again
 * inside the cooldown window. Expired entries are ignored on read, never purged.
 */
public interface CooldownLedger {

    boolean isRecent(String tenantId, String accountId, String campaignId);

    /** Unexpired entries of the account, newest first. */
    List<CooldownEntry> listRecent(String tenantId, String accountId);

    /** Replaces any existing entry, restarting the window. */
    void record(String tenantId, String accountId, String campaignId, BigDecimal previousBid);

    /** Drops the entry whatever its age. */
    void remove(String tenantId, String accountId, String campaignId);

    void deleteTenant(String tenantId);

    /** False when changes are not tracked at all and callers must supply their own exclusions. */
    boolean isDurable();
}
