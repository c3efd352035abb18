package quest.gekko.bidopt.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.bidopt.domain.RecentlyOptimized;

import java.time.Instant;
import java.util.List;

public interface RecentlyOptimizedRepository extends JpaRepository<RecentlyOptimized, Long> {

    List<RecentlyOptimized> findByTenantIdAndAccountIdAndAppliedAtGreaterThanEqualOrderByAppliedAtDesc(
            String tenantId, String accountId, Instant cutoff);

    boolean existsByTenantIdAndAccountIdAndCampaignIdAndAppliedAtGreaterThanEqual(
            String tenantId, String accountId, String campaignId, Instant cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("delete from RecentlyOptimized r where r.tenantId=:t and r.accountId=:a and r.campaignId=:c")
    int deleteEntry(@Param("t") String tenantId, @Param("a") String accountId, @Param("c") String campaignId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("delete from RecentlyOptimized r where r.tenantId=:t")
    int deleteAllForTenant(@Param("t") String tenantId);
}
