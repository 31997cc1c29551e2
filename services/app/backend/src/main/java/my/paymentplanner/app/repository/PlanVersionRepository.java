package my.paymentplanner.app.repository;

import my.paymentplanner.app.domain.PlanVersion;
import my.paymentplanner.app.domain.PlanVersionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface PlanVersionRepository extends JpaRepository<PlanVersion, Long> {
	List<PlanVersion> findByCaseIdOrderByVersionNumberDesc(String caseId);

	List<PlanVersion> findByCaseIdAndPrimaryTrue(String caseId);

	List<PlanVersion> findByCaseIdAndStatus(String caseId, PlanVersionStatus status);

	boolean existsByCaseId(String caseId);

	long countByCaseIdAndPrimaryTrue(String caseId);

	@Query("select coalesce(max(v.versionNumber), 0) from PlanVersion v where v.caseId = :caseId")
	int findMaxVersionNumber(String caseId);
}
