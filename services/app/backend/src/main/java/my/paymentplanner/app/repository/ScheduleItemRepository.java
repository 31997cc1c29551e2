package my.paymentplanner.app.repository;

import my.paymentplanner.app.domain.ScheduleItem;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ScheduleItemRepository extends JpaRepository<ScheduleItem, Long> {
}
