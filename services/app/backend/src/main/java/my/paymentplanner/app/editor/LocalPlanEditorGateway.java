package my.paymentplanner.app.editor;

import jakarta.annotation.PreDestroy;
import my.paymentplanner.app.dto.PlanRequest;
import my.paymentplanner.app.dto.PlanVersionDto;
import my.paymentplanner.app.dto.SaveEditsRequest;
import my.paymentplanner.app.dto.ScheduleRowEdit;
import my.paymentplanner.app.dto.ScheduleTotalsDto;
import my.paymentplanner.app.dto.VersionSummaryDto;
import my.paymentplanner.app.error.CalculationServiceException;
import my.paymentplanner.app.error.ErrorMessages;
import my.paymentplanner.app.error.PlanEngineException;
import my.paymentplanner.app.model.ScheduleResult;
import my.paymentplanner.app.service.CalculationService;
import my.paymentplanner.app.service.PlanVersionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs editor calls against the in-process services on a small worker pool.
 */
@Component
public class LocalPlanEditorGateway implements PlanEditorGateway {
	private static final Logger logger = LoggerFactory.getLogger(LocalPlanEditorGateway.class);

	private final CalculationService calculationService;
	private final PlanVersionService planVersionService;
	private final ExecutorService executor = Executors.newFixedThreadPool(4);

	public LocalPlanEditorGateway(CalculationService calculationService, PlanVersionService planVersionService) {
		this.calculationService = calculationService;
		this.planVersionService = planVersionService;
	}

	@PreDestroy
	public void shutdown() {
		executor.shutdownNow();
	}

	@Override
	public CompletableFuture<ScheduleResult> calculate(PlanRequest request) {
		return call("calculate", () -> calculationService.calculate(request));
	}

	@Override
	public CompletableFuture<List<VersionSummaryDto>> loadVersions(String caseId) {
		return call("loadVersions", () -> planVersionService.listVersions(caseId));
	}

	@Override
	public CompletableFuture<PlanVersionDto> loadVersion(Long versionId) {
		return call("loadVersion", () -> planVersionService.getVersion(versionId));
	}

	@Override
	public CompletableFuture<PlanVersionDto> saveEdits(Long versionId, SaveEditsRequest request) {
		return call("saveEdits", () -> planVersionService.saveEdits(versionId, request));
	}

	@Override
	public CompletableFuture<VersionSummaryDto> setPrimary(Long versionId) {
		return call("setPrimary", () -> planVersionService.setPrimary(versionId));
	}

	@Override
	public CompletableFuture<Void> delete(Long versionId) {
		return call("delete", () -> {
			planVersionService.delete(versionId);
			return null;
		});
	}

	@Override
	public CompletableFuture<ScheduleTotalsDto> previewTotals(List<ScheduleRowEdit> rows) {
		return call("previewTotals", () -> planVersionService.previewTotals(rows));
	}

	private <T> CompletableFuture<T> call(String operation, Supplier<T> work) {
		return CompletableFuture.supplyAsync(() -> {
			try {
				return work.get();
			} catch (PlanEngineException ex) {
				throw ex;
			} catch (RuntimeException ex) {
				logger.warn("Editor call {} failed: {}", operation, ErrorMessages.reduce(ex));
				throw new CalculationServiceException(operation + " failed: " + ErrorMessages.reduce(ex), ex);
			}
		}, executor);
	}
}
