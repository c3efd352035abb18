package quest.gekko.bidopt.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The accounts a tenant chose to show in the optimizer. A missing row means "no filter";
 * a row with no account ids means "show none".
 */
@Entity
@Table(name = "app_settings")
@Getter @Setter
public class AccountSelection {
    @Id
    @Column(name = "tenant_id")
    String tenantId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "app_settings_selected_account", joinColumns = @JoinColumn(name = "tenant_id"))
    @Column(name = "account_id", nullable = false)
    Set<String> selectedAccountIds = new LinkedHashSet<>();

    @Column(name = "updated_at", nullable = false)
    Instant updatedAt;
}
