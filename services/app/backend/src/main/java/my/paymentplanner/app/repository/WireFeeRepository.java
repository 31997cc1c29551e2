package my.paymentplanner.app.repository;

import my.paymentplanner.app.domain.WireFee;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface WireFeeRepository extends JpaRepository<WireFee, Long> {
	List<WireFee> findByScheduleItemIdInOrderByCreatedAtAsc(Collection<Long> scheduleItemIds);
}
