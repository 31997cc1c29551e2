package my.paymentplanner.app.service;

import my.paymentplanner.app.domain.PlanVersion;
import my.paymentplanner.app.domain.ScheduleItem;
import my.paymentplanner.app.domain.WireFee;
import my.paymentplanner.app.dto.WireFeeDto;
import my.paymentplanner.app.dto.WireFeeRequest;
import my.paymentplanner.app.error.PlanValidationException;
import my.paymentplanner.app.repository.PlanVersionRepository;
import my.paymentplanner.app.repository.ScheduleItemRepository;
import my.paymentplanner.app.repository.WireFeeRepository;
import my.paymentplanner.app.service.util.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wire fees hang off schedule items by id and never feed back into the schedule math. Fees are
 * recorded against the first item of a carry-forward chain, so a fee on a cleared row stays
 * visible in every later version that carries that row.
 */
@Service
public class WireFeeService {
	private static final Logger logger = LoggerFactory.getLogger(WireFeeService.class);
	public static final String DEFAULT_FEE_TYPE = "Wire Fee";

	private final WireFeeRepository wireFeeRepository;
	private final ScheduleItemRepository scheduleItemRepository;
	private final PlanVersionRepository planVersionRepository;
	private final PlanPolicyService planPolicyService;
	private final Clock clock;

	public WireFeeService(WireFeeRepository wireFeeRepository,
						  ScheduleItemRepository scheduleItemRepository,
						  PlanVersionRepository planVersionRepository,
						  PlanPolicyService planPolicyService,
						  Clock clock) {
		this.wireFeeRepository = wireFeeRepository;
		this.scheduleItemRepository = scheduleItemRepository;
		this.planVersionRepository = planVersionRepository;
		this.planPolicyService = planPolicyService;
		this.clock = clock;
	}

	@Transactional
	public WireFeeDto add(Long scheduleItemId, WireFeeRequest request) {
		ScheduleItem item = scheduleItemRepository.findById(scheduleItemId)
				.orElseThrow(() -> new IllegalArgumentException("Schedule item not found"));
		String feeType = request == null || request.feeType() == null || request.feeType().isBlank()
				? DEFAULT_FEE_TYPE
				: request.feeType().trim();
		if (!planPolicyService.wireFeeTypes().contains(feeType)) {
			throw new PlanValidationException("feeType", "Unknown wire fee type: " + feeType);
		}
		BigDecimal amount = request == null ? null : request.amount();
		if (amount != null && amount.signum() < 0) {
			throw new PlanValidationException("amount", amount, BigDecimal.ZERO, "Wire fee amount cannot be negative");
		}

		WireFee fee = new WireFee();
		fee.setScheduleItemId(item.lineageId());
		fee.setFeeType(feeType);
		fee.setAmount(amount == null ? null : Money.round(amount));
		fee.setCreatedAt(LocalDateTime.now(clock));
		WireFee saved = wireFeeRepository.save(fee);
		logger.info("Recorded {} on schedule item {} (fee={})", feeType, scheduleItemId, saved.getId());
		return toDto(saved, scheduleItemId);
	}

	@Transactional
	public void delete(Long wireFeeId) {
		if (!wireFeeRepository.existsById(wireFeeId)) {
			throw new IllegalArgumentException("Wire fee not found");
		}
		wireFeeRepository.deleteById(wireFeeId);
		logger.info("Deleted wire fee {}", wireFeeId);
	}

	@Transactional(readOnly = true)
	public Map<Long, List<WireFeeDto>> listByVersion(Long versionId) {
		PlanVersion version = planVersionRepository.findById(versionId)
				.orElseThrow(() -> new IllegalArgumentException("Plan version not found"));
		return feesByItem(version.getItems());
	}

	/**
	 * Fees keyed by the id of the item they show up on in this version. Fees whose item cannot be
	 * matched are skipped.
	 */
	public Map<Long, List<WireFeeDto>> feesByItem(List<ScheduleItem> items) {
		Map<Long, Long> itemByLineage = new HashMap<>();
		for (ScheduleItem item : items) {
			itemByLineage.put(item.lineageId(), item.getId());
		}
		Map<Long, List<WireFeeDto>> result = new LinkedHashMap<>();
		if (itemByLineage.isEmpty()) {
			return result;
		}
		for (WireFee fee : wireFeeRepository.findByScheduleItemIdInOrderByCreatedAtAsc(itemByLineage.keySet())) {
			Long itemId = itemByLineage.get(fee.getScheduleItemId());
			if (itemId == null) {
				logger.debug("Ignoring wire fee {} without a matching schedule item", fee.getId());
				continue;
			}
			result.computeIfAbsent(itemId, key -> new ArrayList<>()).add(toDto(fee, itemId));
		}
		return result;
	}

	public BigDecimal wiresReceived(List<ScheduleItem> items) {
		BigDecimal total = Money.ZERO;
		for (List<WireFeeDto> fees : feesByItem(items).values()) {
			for (WireFeeDto fee : fees) {
				total = total.add(Money.orZero(fee.amount()));
			}
		}
		return Money.round(total);
	}

	private WireFeeDto toDto(WireFee fee, Long itemId) {
		return new WireFeeDto(fee.getId(), itemId, fee.getFeeType(), fee.getAmount(), fee.getCreatedAt());
	}
}
