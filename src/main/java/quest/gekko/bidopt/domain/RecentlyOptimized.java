package quest.gekko.bidopt.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "recently_optimized",
        uniqueConstraints = @UniqueConstraint(columnNames = { "tenant_id", "ad_account_id", "campaign_id" }),
        indexes = @Index(name = "recently_optimized_account_applied_at", columnList = "tenant_id, ad_account_id, applied_at"))
@Getter @Setter
public class RecentlyOptimized {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "tenant_id", nullable = false)
    String tenantId;

    @Column(name = "ad_account_id", nullable = false)
    String accountId;

    @Column(name = "campaign_id", nullable = false)
    String campaignId;

    @Column(name = "applied_at", nullable = false)
    Instant appliedAt;

    @Column(name = "previous_bid", precision = 19, scale = 4)
    BigDecimal previousBid;

    public CooldownEntry toEntry() {
        return new CooldownEntry(tenantId, accountId, campaignId, appliedAt, previousBid);
    }
}
