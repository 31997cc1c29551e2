package my.paymentplanner.app.service;

import my.paymentplanner.app.domain.PlanVersion;
import my.paymentplanner.app.domain.PlanVersionStatus;
import my.paymentplanner.app.domain.ScheduleItem;
import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.domain.SyncStatus;
import my.paymentplanner.app.dto.CreateVersionRequest;
import my.paymentplanner.app.dto.PlanVersionDto;
import my.paymentplanner.app.dto.RecalculateRequest;
import my.paymentplanner.app.dto.SaveEditsRequest;
import my.paymentplanner.app.dto.ScheduleItemDto;
import my.paymentplanner.app.dto.ScheduleRowEdit;
import my.paymentplanner.app.dto.ScheduleTotalsDto;
import my.paymentplanner.app.dto.VersionSummaryDto;
import my.paymentplanner.app.error.InvalidTransitionException;
import my.paymentplanner.app.error.PersistenceConflictException;
import my.paymentplanner.app.error.PlanValidationException;
import my.paymentplanner.app.model.PlanConfiguration;
import my.paymentplanner.app.model.PlanTotals;
import my.paymentplanner.app.model.ScheduleLine;
import my.paymentplanner.app.model.ScheduleResult;
import my.paymentplanner.app.repository.PlanVersionRepository;
import my.paymentplanner.app.service.util.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Append-only lifecycle of plan versions. Operations that change a schedule write a new version
 * and demote or archive the one they started from; nothing rewrites the items of an existing
 * version. Permitted operations per state live in {@link VersionAction}.
 */
@Service
public class PlanVersionService {
	private static final Logger logger = LoggerFactory.getLogger(PlanVersionService.class);
	private static final String SYSTEM_USER = "system";

	private final PlanVersionRepository planVersionRepository;
	private final PlanPolicyService planPolicyService;
	private final CalculationService calculationService;
	private final ScheduleCalculator scheduleCalculator;
	private final ScheduleTotalsCalculator totalsCalculator;
	private final WireFeeService wireFeeService;
	private final EditabilityPolicy editabilityPolicy;
	private final Clock clock;

	public PlanVersionService(PlanVersionRepository planVersionRepository,
							  PlanPolicyService planPolicyService,
							  CalculationService calculationService,
							  ScheduleCalculator scheduleCalculator,
							  ScheduleTotalsCalculator totalsCalculator,
							  WireFeeService wireFeeService,
							  EditabilityPolicy editabilityPolicy,
							  Clock clock) {
		this.planVersionRepository = planVersionRepository;
		this.planPolicyService = planPolicyService;
		this.calculationService = calculationService;
		this.scheduleCalculator = scheduleCalculator;
		this.totalsCalculator = totalsCalculator;
		this.wireFeeService = wireFeeService;
		this.editabilityPolicy = editabilityPolicy;
		this.clock = clock;
	}

	@Transactional(readOnly = true)
	public List<VersionSummaryDto> listVersions(String caseId) {
		return planVersionRepository.findByCaseIdOrderByVersionNumberDesc(caseId).stream()
				.map(this::toSummary)
				.toList();
	}

	@Transactional(readOnly = true)
	public PlanVersionDto getVersion(Long versionId) {
		PlanVersion version = planVersionRepository.findById(versionId)
				.orElseThrow(() -> new IllegalArgumentException("Plan version not found"));
		return toDto(version);
	}

	@Transactional(readOnly = true)
	public ScheduleTotalsDto totals(Long versionId) {
		PlanVersion version = planVersionRepository.findById(versionId)
				.orElseThrow(() -> new IllegalArgumentException("Plan version not found"));
		return totalsCalculator.totals(lines(version.getItems()), wireFeeService.wiresReceived(version.getItems()));
	}

	/**
	 * Footer totals for rows that have not been saved yet.
	 */
	public ScheduleTotalsDto previewTotals(List<ScheduleRowEdit> rows) {
		List<ScheduleLine> lines = new ArrayList<>(rows.size());
		int sequence = 1;
		for (ScheduleRowEdit row : rows) {
			lines.add(lineFromEdit(row, sequence++));
		}
		return totalsCalculator.totals(lines, Money.ZERO);
	}

	@Transactional
	public PlanVersionDto create(String caseId, CreateVersionRequest request) {
		if (caseId == null || caseId.isBlank()) {
			throw new IllegalArgumentException("Case id is required");
		}
		PlanConfiguration configuration = planPolicyService.resolve(request.plan());
		PlanTotals totals = request.plan().totals();
		ScheduleResult result = calculationService.calculate(configuration, totals);

		PlanVersion version = new PlanVersion();
		version.setCaseId(caseId.trim());
		version.setVersionNumber(planVersionRepository.findMaxVersionNumber(version.getCaseId()) + 1);
		version.setStatus(PlanVersionStatus.DRAFT);
		version.setSyncStatus(SyncStatus.IN_SYNC);
		version.setPrimary(!planVersionRepository.existsByCaseId(version.getCaseId()));
		version.setTotalDebt(totals.totalDebt());
		version.setCurrentPayment(totals.currentPayment());
		version.setConfiguration(configuration);
		version.setCreatedAt(LocalDateTime.now(clock));
		version.setCreatedBy(userOrSystem(request.createdBy()));
		for (ScheduleLine line : result.schedule()) {
			version.addItem(ScheduleItem.fromLine(line));
		}
		PlanVersion saved = planVersionRepository.save(version);
		logger.info("Created plan version {} (case={}, version={}, primary={}, payments={})",
				saved.getId(), saved.getCaseId(), saved.getVersionNumber(), saved.isPrimary(), saved.getItems().size());
		return toDto(saved);
	}

	/**
	 * Regenerates the scheduled rows of a version into a new version. Cleared, NSF and cancelled
	 * rows are carried over unchanged.
	 */
	@Transactional
	public PlanVersionDto recalculate(Long versionId, RecalculateRequest request) {
		PlanVersion source = require(versionId, VersionAction.RECALCULATE);
		BigDecimal totalDebt = request == null || request.totalDebt() == null ? source.getTotalDebt() : request.totalDebt();
		BigDecimal currentPayment = request == null || request.currentPayment() == null
				? source.getCurrentPayment()
				: request.currentPayment();
		PlanTotals totals = new PlanTotals(totalDebt, currentPayment);

		List<ScheduleItem> frozenItems = source.getItems().stream().filter(ScheduleItem::isFrozen).toList();
		ScheduleResult result = scheduleCalculator.regenerate(source.getConfiguration(), totals, lines(frozenItems));

		PlanVersion next = newVersionFrom(source, PlanVersionStatus.DRAFT, request == null ? null : request.createdBy());
		next.setTotalDebt(totalDebt);
		next.setCurrentPayment(currentPayment);
		for (ScheduleItem frozen : frozenItems) {
			next.addItem(frozen.carryForward());
		}
		for (ScheduleLine line : result.schedule().subList(frozenItems.size(), result.schedule().size())) {
			next.addItem(ScheduleItem.fromLine(line));
		}
		return supersede(source, next, "Recalculated");
	}

	@Transactional
	public PlanVersionDto recalculateRemainingBalance(Long versionId, String createdBy) {
		PlanVersion source = require(versionId, VersionAction.RECALCULATE_REMAINING);
		PlanTotals totals = new PlanTotals(source.getTotalDebt(), source.getCurrentPayment());
		List<ScheduleLine> rebalanced = scheduleCalculator.rebalanceRemaining(source.getConfiguration(), totals,
				lines(source.getItems()));

		PlanVersion next = newVersionFrom(source, PlanVersionStatus.DRAFT, createdBy);
		for (int i = 0; i < source.getItems().size(); i++) {
			ScheduleItem original = source.getItems().get(i);
			if (original.isFrozen()) {
				next.addItem(original.carryForward());
			} else {
				ScheduleItem item = ScheduleItem.fromLine(rebalanced.get(i));
				item.setOriginItemId(original.lineageId());
				next.addItem(item);
			}
		}
		return supersede(source, next, "Rebalanced remaining payments of");
	}

	/**
	 * Stores the editor's rows as a new draft. Rows that were frozen in the source version are
	 * taken from the source and a status change on them is refused; scheduled rows missing from the request are
	 * treated as deleted. On a version whose amounts are not editable only status changes apply.
	 */
	@Transactional
	public PlanVersionDto saveEdits(Long versionId, SaveEditsRequest request) {
		PlanVersion source = require(versionId, VersionAction.SAVE_EDITS);
		Map<Long, ScheduleItem> sourceItems = new HashMap<>();
		for (ScheduleItem item : source.getItems()) {
			sourceItems.put(item.getId(), item);
		}

		boolean amountsEditable = editabilityPolicy.isVersionEditable(source.getStatus());
		List<ScheduleItem> candidates = new ArrayList<>();
		Set<ScheduleItem> carriedFrozen = Collections.newSetFromMap(new IdentityHashMap<>());
		Set<Long> seen = new HashSet<>();
		for (ScheduleRowEdit edit : request.rows()) {
			if (edit.itemId() == null) {
				if (!amountsEditable) {
					throw new PlanValidationException("rows", "Rows cannot be added to a " + source.getStatus() + " version");
				}
				candidates.add(itemFromEdit(edit, null));
				continue;
			}
			ScheduleItem original = sourceItems.get(edit.itemId());
			if (original == null) {
				throw new PlanValidationException("itemId", "Schedule item " + edit.itemId() + " is not part of version " + versionId);
			}
			if (!seen.add(edit.itemId())) {
				throw new PlanValidationException("itemId", "Schedule item " + edit.itemId() + " was submitted twice");
			}
			if (original.isFrozen()) {
				if (edit.status() != null && edit.status() != original.getStatus()) {
					throw new PlanValidationException("status", "Schedule item " + edit.itemId() + " is "
							+ original.getStatus() + " and its status cannot be changed");
				}
				ScheduleItem copy = original.carryForward();
				carriedFrozen.add(copy);
				candidates.add(copy);
			} else if (amountsEditable) {
				candidates.add(itemFromEdit(edit, original));
			} else {
				ScheduleItem copy = original.carryForward();
				if (edit.status() != null) {
					copy.setStatus(edit.status());
				}
				candidates.add(copy);
			}
		}
		for (ScheduleItem item : source.getItems()) {
			if ((item.isFrozen() || !amountsEditable) && !seen.contains(item.getId())) {
				ScheduleItem copy = item.carryForward();
				if (item.isFrozen()) {
					carriedFrozen.add(copy);
				}
				candidates.add(copy);
			}
		}
		candidates.sort(Comparator.comparing(ScheduleItem::getPaymentDate)
				.thenComparing(item -> item.getSequenceNumber() == null ? Integer.MAX_VALUE : item.getSequenceNumber()));

		PlanVersion next = newVersionFrom(source, PlanVersionStatus.DRAFT, request.createdBy());
		BigDecimal balance = scheduleCalculator.programCost(source.getConfiguration(),
				new PlanTotals(source.getTotalDebt(), source.getCurrentPayment())).totalProgramCost();
		int sequence = 1;
		for (ScheduleItem item : candidates) {
			item.setSequenceNumber(sequence++);
			if (carriedFrozen.contains(item)) {
				balance = item.getRunningBalance();
			} else {
				if (item.getStatus().countsAsDraft()) {
					balance = Money.round(balance.subtract(item.getProgramFeePortion()).subtract(item.getEscrowAmount()));
				}
				item.setRunningBalance(balance);
			}
			next.addItem(item);
		}
		return supersede(source, next, "Saved edits of");
	}

	@Transactional
	public VersionSummaryDto setPrimary(Long versionId) {
		PlanVersion version = require(versionId, VersionAction.SET_PRIMARY);
		makePrimary(version);
		logger.info("Plan version {} is now primary for case {}", version.getId(), version.getCaseId());
		return toSummary(version);
	}

	/**
	 * Draft to active. The activated version becomes primary and any other active version of the
	 * case is archived.
	 */
	@Transactional
	public VersionSummaryDto activate(Long versionId) {
		PlanVersion version = require(versionId, VersionAction.ACTIVATE);
		for (PlanVersion other : planVersionRepository.findByCaseIdAndStatus(version.getCaseId(), PlanVersionStatus.ACTIVE)) {
			if (!other.getId().equals(version.getId())) {
				other.setStatus(PlanVersionStatus.ARCHIVED);
				logger.info("Archived plan version {} replaced by activation of {}", other.getId(), version.getId());
			}
		}
		version.setStatus(PlanVersionStatus.ACTIVE);
		makePrimary(version);
		logger.info("Activated plan version {} (case={})", version.getId(), version.getCaseId());
		return toSummary(version);
	}

	/**
	 * Cancels every scheduled row into a new suspended version; the active version is archived.
	 */
	@Transactional
	public PlanVersionDto suspend(Long versionId, String createdBy) {
		PlanVersion source = require(versionId, VersionAction.SUSPEND);
		PlanVersion next = newVersionFrom(source, PlanVersionStatus.SUSPENDED, createdBy);
		int cancelled = 0;
		for (ScheduleItem item : source.getItems()) {
			ScheduleItem copy = item.carryForward();
			if (!item.isFrozen()) {
				copy.setStatus(ScheduleItemStatus.CANCELLED);
				cancelled++;
			}
			next.addItem(copy);
		}
		source.setStatus(PlanVersionStatus.ARCHIVED);
		logger.info("Suspending plan version {}: {} scheduled payments cancelled", source.getId(), cancelled);
		return supersede(source, next, "Suspended");
	}

	@Transactional
	public void delete(Long versionId) {
		PlanVersion version = require(versionId, VersionAction.DELETE);
		planVersionRepository.delete(version);
		logger.info("Deleted plan version {} (case={}, version={})", version.getId(), version.getCaseId(),
				version.getVersionNumber());
	}

	/**
	 * Marks the case's drafts as out of sync after a related record changed.
	 */
	@Transactional
	public int invalidate(String caseId) {
		List<PlanVersion> drafts = planVersionRepository.findByCaseIdAndStatus(caseId, PlanVersionStatus.DRAFT);
		int marked = 0;
		for (PlanVersion draft : drafts) {
			if (draft.getSyncStatus() != SyncStatus.OUT_OF_SYNC) {
				draft.setSyncStatus(SyncStatus.OUT_OF_SYNC);
				marked++;
			}
		}
		logger.info("Invalidated {} draft plan versions for case {}", marked, caseId);
		return marked;
	}

	private PlanVersion require(Long versionId, VersionAction action) {
		PlanVersion version = planVersionRepository.findById(versionId)
				.orElseThrow(() -> InvalidTransitionException.missing(versionId, action.verb()));
		try {
			action.require(version);
		} catch (InvalidTransitionException ex) {
			logger.warn("Rejected transition: {}", ex.getMessage());
			throw ex;
		}
		return version;
	}

	private PlanVersion newVersionFrom(PlanVersion source, PlanVersionStatus status, String createdBy) {
		PlanVersion next = new PlanVersion();
		next.setCaseId(source.getCaseId());
		next.setVersionNumber(planVersionRepository.findMaxVersionNumber(source.getCaseId()) + 1);
		next.setStatus(status);
		next.setSyncStatus(SyncStatus.IN_SYNC);
		next.setPrimary(false);
		next.setSupersedesId(source.getId());
		next.setTotalDebt(source.getTotalDebt());
		next.setCurrentPayment(source.getCurrentPayment());
		next.setConfiguration(source.getConfiguration());
		next.setCreatedAt(LocalDateTime.now(clock));
		next.setCreatedBy(userOrSystem(createdBy));
		return next;
	}

	/**
	 * Persists {@code next} in place of {@code source}: primary moves over and a superseded draft is
	 * archived. An active source stays active until another version is activated.
	 */
	private PlanVersionDto supersede(PlanVersion source, PlanVersion next, String verb) {
		if (source.isPrimary()) {
			source.setPrimary(false);
			next.setPrimary(true);
		}
		if (source.getStatus() == PlanVersionStatus.DRAFT) {
			source.setStatus(PlanVersionStatus.ARCHIVED);
		}
		PlanVersion saved;
		try {
			planVersionRepository.save(source);
			saved = planVersionRepository.saveAndFlush(next);
		} catch (ObjectOptimisticLockingFailureException ex) {
			throw new PersistenceConflictException("Plan version " + source.getId() + " was changed concurrently; reload and retry", ex);
		}
		logger.info("{} plan version {} into version {} (case={}, version={}, status={})", verb, source.getId(),
				saved.getId(), saved.getCaseId(), saved.getVersionNumber(), saved.getStatus());
		return toDto(saved, source);
	}

	private void makePrimary(PlanVersion version) {
		try {
			for (PlanVersion other : planVersionRepository.findByCaseIdAndPrimaryTrue(version.getCaseId())) {
				if (!other.getId().equals(version.getId())) {
					other.setPrimary(false);
					planVersionRepository.save(other);
				}
			}
			version.setPrimary(true);
			planVersionRepository.saveAndFlush(version);
		} catch (ObjectOptimisticLockingFailureException ex) {
			throw new PersistenceConflictException("Another version of case " + version.getCaseId()
					+ " changed concurrently; reload and retry", ex);
		}
		long primaries = planVersionRepository.countByCaseIdAndPrimaryTrue(version.getCaseId());
		if (primaries > 1) {
			throw new PersistenceConflictException("Case " + version.getCaseId() + " has " + primaries
					+ " primary versions; reload and retry");
		}
	}

	private ScheduleItem itemFromEdit(ScheduleRowEdit edit, ScheduleItem original) {
		ScheduleItem item = ScheduleItem.fromLine(lineFromEdit(edit, original == null ? null : original.getSequenceNumber()));
		if (original != null) {
			item.setOriginItemId(original.lineageId());
		}
		return item;
	}

	/**
	 * Escrow is derived again from the submitted portions so the row adds up.
	 */
	private ScheduleLine lineFromEdit(ScheduleRowEdit edit, Integer sequenceNumber) {
		BigDecimal payment = Money.round(edit.paymentAmount());
		BigDecimal setup = Money.round(edit.setupFeePortion());
		BigDecimal program = Money.round(edit.programFeePortion());
		BigDecimal banking = Money.round(edit.bankingFeePortion());
		BigDecimal secondary = Money.round(edit.secondaryBankingFeePortion());
		BigDecimal products = Money.round(edit.additionalProductsPortion());
		BigDecimal escrow = payment.subtract(setup).subtract(program).subtract(banking).subtract(secondary).subtract(products);
		ScheduleItemStatus status = edit.status() == null ? ScheduleItemStatus.SCHEDULED : edit.status();
		return new ScheduleLine(sequenceNumber == null ? 0 : sequenceNumber, edit.paymentDate(), payment, setup, program,
				banking, secondary, products, escrow, Money.ZERO, status);
	}

	private List<ScheduleLine> lines(List<ScheduleItem> items) {
		return items.stream().map(ScheduleItem::toLine).toList();
	}

	private VersionSummaryDto toSummary(PlanVersion version) {
		return new VersionSummaryDto(version.getId(), version.getCaseId(), version.getVersionNumber(),
				version.getStatus(), version.isPrimary(), version.getSyncStatus(), version.getSupersedesId(),
				version.getCreatedAt(), version.getCreatedBy(), version.getItems().size(),
				VersionAction.availableFor(version));
	}

	private PlanVersionDto toDto(PlanVersion version) {
		PlanVersion previous = version.getSupersedesId() == null
				? null
				: planVersionRepository.findById(version.getSupersedesId()).orElse(null);
		return toDto(version, previous);
	}

	private PlanVersionDto toDto(PlanVersion version, PlanVersion previous) {
		List<ScheduleLine> current = lines(version.getItems());
		Map<Integer, Integer> draftNumbers = totalsCalculator.draftNumbers(current);
		Set<Integer> changed = totalsCalculator.changedFromPrevious(current,
				previous == null ? List.of() : lines(previous.getItems()));
		List<ScheduleItemDto> items = new ArrayList<>(version.getItems().size());
		for (ScheduleItem item : version.getItems()) {
			items.add(new ScheduleItemDto(
					item.getId(),
					item.getSequenceNumber(),
					draftNumbers.get(item.getSequenceNumber()),
					item.getPaymentDate(),
					item.getPaymentAmount(),
					item.getSetupFeePortion(),
					item.getProgramFeePortion(),
					item.getBankingFeePortion(),
					item.getSecondaryBankingFeePortion(),
					item.getAdditionalProductsPortion(),
					item.getEscrowAmount(),
					item.getRunningBalance(),
					item.getStatus(),
					item.isFrozen(),
					editabilityPolicy.isEditable(item.getStatus(), version.getStatus()),
					changed.contains(item.getSequenceNumber())
			));
		}
		return new PlanVersionDto(version.getId(), version.getCaseId(), version.getVersionNumber(), version.getStatus(),
				version.isPrimary(), version.getSyncStatus(), version.getSupersedesId(), version.getTotalDebt(),
				version.getCurrentPayment(), version.getConfiguration(), version.getCreatedAt(), version.getCreatedBy(),
				VersionAction.availableFor(version), items);
	}

	private String userOrSystem(String user) {
		return user == null || user.isBlank() ? SYSTEM_USER : user.trim();
	}
}
