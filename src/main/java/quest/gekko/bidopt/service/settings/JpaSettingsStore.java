package quest.gekko.bidopt.service.settings;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import quest.gekko.bidopt.domain.AccountSelection;
import quest.gekko.bidopt.exception.StorageException;
import quest.gekko.bidopt.repository.AccountSelectionRepository;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class JpaSettingsStore implements SettingsStore {

    private final AccountSelectionRepository repo;
    private final Clock clock;

    @Override
    public Optional<List<String>> getSelectedAccounts(String tenantId) {
        try {
            return repo.findById(tenantId).map(s -> List.copyOf(s.getSelectedAccountIds()));
        } catch (DataAccessException e) {
            log.error("Reading selected accounts of tenant {} failed", tenantId, e);
            throw new StorageException("Failed to read selected accounts", e);
        }
    }

    @Override
    public void setSelectedAccounts(String tenantId, List<String> accountIds) {
        try {
            AccountSelection selection = repo.findById(tenantId).orElseGet(() -> {
                AccountSelection s = new AccountSelection();
                s.setTenantId(tenantId);
                return s;
            });
            selection.getSelectedAccountIds().clear();
            selection.getSelectedAccountIds().addAll(accountIds);
            selection.setUpdatedAt(clock.instant());
            repo.save(selection);
        } catch (DataAccessException e) {
            log.error("Saving selected accounts of tenant {} failed", tenantId, e);
            throw new StorageException("Failed to save selected accounts", e);
        }
    }

    @Override
    public void deleteTenant(String tenantId) {
        try {
            if (repo.existsById(tenantId)) {
                repo.deleteById(tenantId);
            }
        } catch (DataAccessException e) {
            log.error("Deleting settings of tenant {} failed", tenantId, e);
            throw new StorageException("Failed to delete settings", e);
        }
    }
}
