package quest.gekko.bidopt.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.bidopt.domain.Campaign;
import quest.gekko.bidopt.domain.PlatformSession;
import quest.gekko.bidopt.exception.ValidationException;
import quest.gekko.bidopt.service.cooldown.CooldownLedger;
import quest.gekko.bidopt.service.integration.connector.AdsPlatformConnector;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Writes a new bid to the platform and keeps the cooldown ledger in step. The platform call and the
 * ledger write are not atomic: if the ledger write fails the bid has still changed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BidMutationService {

    private final AdsPlatformConnector connector;
    private final CooldownLedger ledger;

    public void applyBid(PlatformSession session, String accountId, String campaignId,
                         BigDecimal newBid, BigDecimal previousBid, boolean revert) {
        if (accountId == null || accountId.isBlank()) {
            throw new ValidationException("adAccountId required (query, body, or header X-Ad-Account-Id)");
        }
        if (campaignId == null || campaignId.isBlank()) {
            throw new ValidationException("campaignId required");
        }
        if (newBid == null || newBid.signum() <= 0) {
            throw new ValidationException("Invalid bid amount", Map.of("newBid", String.valueOf(newBid)));
        }

        Campaign campaign = connector.getCampaign(session, accountId, campaignId);
        connector.updateBid(session, accountId, campaignId, newBid, campaign.currencyCode());
        log.info("Account {}: campaign {} bid set to {} {}{}", accountId, campaignId, newBid,
                campaign.currencyCode(), revert ? " (revert)" : "");

        if (revert) {
            ledger.remove(session.tenantId(), accountId, campaignId);
        } else if (previousBid != null) {
            ledger.record(session.tenantId(), accountId, campaignId, previousBid);
        }
    }
}
