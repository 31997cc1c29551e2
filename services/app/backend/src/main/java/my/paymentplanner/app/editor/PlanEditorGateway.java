package my.paymentplanner.app.editor;

import my.paymentplanner.app.dto.PlanRequest;
import my.paymentplanner.app.dto.PlanVersionDto;
import my.paymentplanner.app.dto.SaveEditsRequest;
import my.paymentplanner.app.dto.ScheduleRowEdit;
import my.paymentplanner.app.dto.ScheduleTotalsDto;
import my.paymentplanner.app.dto.VersionSummaryDto;
import my.paymentplanner.app.model.ScheduleResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous calls a plan editor session makes. Failures complete the future exceptionally with
 * a {@link my.paymentplanner.app.error.PlanEngineException}.
 */
public interface PlanEditorGateway {

	CompletableFuture<ScheduleResult> calculate(PlanRequest request);

	CompletableFuture<List<VersionSummaryDto>> loadVersions(String caseId);

	CompletableFuture<PlanVersionDto> loadVersion(Long versionId);

	CompletableFuture<PlanVersionDto> saveEdits(Long versionId, SaveEditsRequest request);

	CompletableFuture<VersionSummaryDto> setPrimary(Long versionId);

	CompletableFuture<Void> delete(Long versionId);

	CompletableFuture<ScheduleTotalsDto> previewTotals(List<ScheduleRowEdit> rows);
}
