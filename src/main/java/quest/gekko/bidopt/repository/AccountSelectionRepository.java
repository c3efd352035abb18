package quest.gekko.bidopt.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.bidopt.domain.AccountSelection;

public interface AccountSelectionRepository extends JpaRepository<AccountSelection, String> {
}
