package quest.gekko.bidopt.service.settings;

import java.util.List;
import java.util.Optional;

/**
 * Per-tenant allow-list of visible ad accounts. An empty Optional means the tenant never chose
 * (show every account); an empty list means the tenant chose none.
 */
public interface SettingsStore {

    Optional<List<String>> getSelectedAccounts(String tenantId);

    void setSelectedAccounts(String tenantId, List<String> accountIds);

    void deleteTenant(String tenantId);
}
