package my.paymentplanner.app.editor;

import my.paymentplanner.app.domain.ScheduleItemStatus;
import my.paymentplanner.app.dto.PlanRequest;
import my.paymentplanner.app.dto.PlanVersionDto;
import my.paymentplanner.app.dto.SaveEditsRequest;
import my.paymentplanner.app.dto.VersionSummaryDto;
import my.paymentplanner.app.error.CalculationServiceException;
import my.paymentplanner.app.error.ErrorMessages;
import my.paymentplanner.app.error.PlanEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.UnaryOperator;

/**
 * Editor for the plan versions of one case. Grid operations are applied immediately; calculations
 * and footer totals are debounced, and every asynchronous outcome passes a {@link StalenessGuard}
 * so only the latest request of each kind reaches the listener. Outcomes are applied on
 * {@code eventLoop}; grid operations are expected to be called from it as well.
 */
public class PlanEditorSession {
	private static final Logger logger = LoggerFactory.getLogger(PlanEditorSession.class);

	private final String caseId;
	private final PlanEditorGateway gateway;
	private final InteractiveGridController controller;
	private final Executor eventLoop;
	private final EditorListener listener;
	private final Clock clock;
	private final Debouncer calculationDebouncer;
	private final Debouncer totalsDebouncer;
	private final StalenessGuard calculationGuard = new StalenessGuard("calculation");
	private final StalenessGuard versionListGuard = new StalenessGuard("version list");
	private final StalenessGuard versionGuard = new StalenessGuard("version");
	private final StalenessGuard totalsGuard = new StalenessGuard("totals");
	private final StalenessGuard primaryGuard = new StalenessGuard("primary");
	private final UndoBuffer<Long, List<VersionSummaryDto>> primaryUndo = new UndoBuffer<>();

	private volatile EditorState state = EditorState.empty();
	private volatile List<VersionSummaryDto> versions = List.of();
	private volatile List<VersionSummaryDto> confirmedVersions = List.of();
	private volatile RowDefaults rowDefaults;
	private volatile PlanRequest parameters;
	private volatile boolean closed;

	public PlanEditorSession(String caseId,
	                         PlanEditorGateway gateway,
	                         InteractiveGridController controller,
	                         RecomputeScheduler scheduler,
	                         Duration debounceDelay,
	                         Executor eventLoop,
	                         EditorListener listener,
	                         Clock clock) {
		this.caseId = caseId;
		this.gateway = gateway;
		this.controller = controller;
		this.eventLoop = eventLoop;
		this.listener = listener == null ? new EditorListener() {
		} : listener;
		this.clock = clock;
		this.calculationDebouncer = new Debouncer(scheduler, debounceDelay);
		this.totalsDebouncer = new Debouncer(scheduler, debounceDelay);
	}

	public String caseId() {
		return caseId;
	}

	public EditorState state() {
		return state;
	}

	public List<VersionSummaryDto> versions() {
		return versions;
	}

	/**
	 * Loads the case's versions and opens the primary one, if any.
	 */
	public CompletableFuture<Boolean> start() {
		return refreshVersions(true);
	}

	public CompletableFuture<Boolean> refreshVersions() {
		return refreshVersions(false);
	}

	// Calculation

	public void parametersChanged(PlanRequest request) {
		if (closed) {
			return;
		}
		parameters = request;
		calculationDebouncer.submit(() -> eventLoop.execute(this::calculateNow));
	}

	public CompletableFuture<Boolean> calculateNow() {
		PlanRequest request = parameters;
		if (closed || request == null) {
			return CompletableFuture.completedFuture(false);
		}
		calculationDebouncer.cancel();
		return calculationGuard.track(() -> gateway.calculate(request), eventLoop, listener::onCalculation, this::fail);
	}

	// Versions

	/**
	 * Opens a version. Pending timers are cancelled and outcomes of calls made for the previous
	 * version are discarded.
	 */
	public CompletableFuture<Boolean> selectVersion(Long versionId) {
		if (closed) {
			return CompletableFuture.completedFuture(false);
		}
		calculationDebouncer.cancel();
		totalsDebouncer.cancel();
		calculationGuard.invalidate();
		totalsGuard.invalidate();
		primaryGuard.invalidate();
		primaryUndo.clear();
		return versionGuard.track(() -> gateway.loadVersion(versionId), eventLoop, this::open, this::fail);
	}

	public CompletableFuture<Boolean> save(String createdBy) {
		EditorState current = state;
		if (closed || current.versionId() == null) {
			return CompletableFuture.completedFuture(false);
		}
		SaveEditsRequest request = new SaveEditsRequest(controller.toSubmission(current), createdBy);
		totalsDebouncer.cancel();
		return versionGuard.track(() -> gateway.saveEdits(current.versionId(), request), eventLoop, saved -> {
			open(saved);
			update(next -> next.withMessage("Saved as version " + saved.versionNumber()));
			refreshVersions(false);
		}, this::fail);
	}

	/**
	 * Shows {@code versionId} as primary right away. If the server refuses, the last list it
	 * confirmed is restored and then reloaded, since an earlier request may still have been
	 * accepted. Outcomes that arrive after a newer primary request are dropped.
	 */
	public CompletableFuture<Boolean> makePrimary(Long versionId) {
		if (closed) {
			return CompletableFuture.completedFuture(false);
		}
		primaryUndo.clear();
		primaryUndo.stage(versionId, confirmedVersions);
		setVersions(withPrimary(versions, versionId));
		return primaryGuard.track(() -> gateway.setPrimary(versionId), eventLoop, confirmed -> {
			primaryUndo.commit(versionId);
			refreshVersions(false);
		}, error -> {
			primaryUndo.rollback(versionId).ifPresent(this::setVersions);
			fail(error);
			refreshVersions(false);
		});
	}

	public CompletableFuture<Boolean> deleteVersion(Long versionId) {
		if (closed) {
			return CompletableFuture.completedFuture(false);
		}
		return versionListGuard.track(() -> gateway.delete(versionId), eventLoop, ignored -> {
			if (Objects.equals(state.versionId(), versionId)) {
				update(next -> EditorState.empty());
			}
			refreshVersions(false);
		}, this::fail);
	}

	/**
	 * Handles a change signal for a case. The open version is reloaded unless it has unsaved edits.
	 */
	public void onInvalidation(String changedCaseId) {
		if (closed || !Objects.equals(caseId, changedCaseId)) {
			return;
		}
		logger.debug("Case {} changed, refreshing plan versions", caseId);
		refreshVersions(false);
		EditorState current = state;
		if (current.versionId() == null) {
			return;
		}
		if (current.hasChanges()) {
			update(next -> next.withMessage("Plan versions changed; save or reload to see the latest"));
		} else {
			selectVersion(current.versionId());
		}
	}

	// Grid

	public void selectCell(int rowIndex, GridField field) {
		update(current -> controller.selectCell(current, rowIndex, field));
	}

	public void clearSelection() {
		update(controller::clearSelection);
	}

	public void editCell(int rowIndex, GridField field, String rawValue) {
		update(current -> controller.editCell(current, rowIndex, field, rawValue));
		scheduleTotals();
	}

	public void commitCell(int rowIndex, GridField field) {
		update(current -> controller.commitCell(current, rowIndex, field));
		scheduleTotals();
	}

	public void beginFillDrag(CellAddress source) {
		update(current -> controller.beginFillDrag(current, source));
	}

	public void updateFillDrag(int pointerRow) {
		update(current -> controller.updateFillDrag(current, pointerRow));
	}

	public void endFillDrag() {
		update(controller::endFillDrag);
		scheduleTotals();
	}

	public void cancelFillDrag() {
		update(controller::cancelFillDrag);
	}

	public void changeStatus(int rowIndex, ScheduleItemStatus status) {
		update(current -> controller.changeStatus(current, rowIndex, status));
		scheduleTotals();
	}

	public void addRow() {
		RowDefaults defaults = rowDefaults;
		if (defaults == null) {
			return;
		}
		update(current -> controller.addRow(current, defaults, LocalDate.now(clock)));
		scheduleTotals();
	}

	public void deleteRow(int rowIndex) {
		update(current -> controller.deleteRow(current, rowIndex));
		scheduleTotals();
	}

	public void close() {
		closed = true;
		calculationDebouncer.cancel();
		totalsDebouncer.cancel();
		calculationGuard.invalidate();
		versionListGuard.invalidate();
		versionGuard.invalidate();
		totalsGuard.invalidate();
		primaryGuard.invalidate();
		primaryUndo.clear();
		logger.debug("Closed plan editor for case {}", caseId);
	}

	private CompletableFuture<Boolean> refreshVersions(boolean openPrimary) {
		if (closed) {
			return CompletableFuture.completedFuture(false);
		}
		return versionListGuard.track(() -> gateway.loadVersions(caseId), eventLoop, loaded -> {
			confirmedVersions = List.copyOf(loaded);
			setVersions(loaded);
			if (openPrimary) {
				loaded.stream()
						.filter(VersionSummaryDto::primary)
						.findFirst()
						.ifPresent(primary -> selectVersion(primary.id()));
			}
		}, this::fail);
	}

	private void scheduleTotals() {
		if (closed || state.versionId() == null) {
			return;
		}
		totalsDebouncer.submit(() -> eventLoop.execute(this::previewTotals));
	}

	private void previewTotals() {
		if (closed) {
			return;
		}
		EditorState current = state;
		totalsGuard.track(() -> gateway.previewTotals(controller.toSubmission(current)), eventLoop,
				listener::onTotals, this::fail);
	}

	private void open(PlanVersionDto version) {
		rowDefaults = version.configuration() == null ? null : RowDefaults.from(version.configuration());
		update(ignored -> EditorState.of(version));
	}

	private void update(UnaryOperator<EditorState> transition) {
		if (closed) {
			return;
		}
		EditorState next = transition.apply(state);
		if (next != state) {
			state = next;
			listener.onStateChanged(next);
		}
	}

	private void setVersions(List<VersionSummaryDto> value) {
		versions = List.copyOf(value);
		listener.onVersionsChanged(versions);
	}

	private void fail(Throwable error) {
		PlanEngineException failure = error instanceof PlanEngineException engine
				? engine
				: new CalculationServiceException(ErrorMessages.reduce(error), error);
		logger.debug("Plan editor call failed for case {}: {}", caseId, failure.getMessage());
		listener.onError(failure);
	}

	private static List<VersionSummaryDto> withPrimary(List<VersionSummaryDto> versions, Long primaryId) {
		List<VersionSummaryDto> updated = new ArrayList<>(versions.size());
		for (VersionSummaryDto version : versions) {
			boolean primary = Objects.equals(version.id(), primaryId);
			updated.add(new VersionSummaryDto(version.id(), version.caseId(), version.versionNumber(), version.status(),
					primary, version.syncStatus(), version.supersedesId(), version.createdAt(), version.createdBy(),
					version.itemCount(), version.actions()));
		}
		return updated;
	}
}
