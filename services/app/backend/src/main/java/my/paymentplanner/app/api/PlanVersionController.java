package my.paymentplanner.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.paymentplanner.app.dto.CreateVersionRequest;
import my.paymentplanner.app.dto.InvalidationResultDto;
import my.paymentplanner.app.dto.PlanVersionDto;
import my.paymentplanner.app.dto.RecalculateRequest;
import my.paymentplanner.app.dto.SaveEditsRequest;
import my.paymentplanner.app.dto.ScheduleTotalsDto;
import my.paymentplanner.app.dto.VersionSummaryDto;
import my.paymentplanner.app.service.PlanVersionService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Plan Versions")
public class PlanVersionController {
	private final PlanVersionService planVersionService;

	public PlanVersionController(PlanVersionService planVersionService) {
		this.planVersionService = planVersionService;
	}

	@GetMapping("/cases/{caseId}/versions")
	@Operation(summary = "List plan versions of a case, newest first")
	public List<VersionSummaryDto> list(@PathVariable String caseId) {
		return planVersionService.listVersions(caseId);
	}

	@PostMapping("/cases/{caseId}/versions")
	@ResponseStatus(HttpStatus.CREATED)
	@Operation(summary = "Calculate and store a new draft version")
	public PlanVersionDto create(@PathVariable String caseId, @Valid @RequestBody CreateVersionRequest request) {
		return planVersionService.create(caseId, request);
	}

	@PostMapping("/cases/{caseId}/invalidate")
	@Operation(summary = "Mark the drafts of a case as out of sync")
	public InvalidationResultDto invalidate(@PathVariable String caseId) {
		return new InvalidationResultDto(caseId, planVersionService.invalidate(caseId));
	}

	@GetMapping("/versions/{id}")
	public PlanVersionDto get(@PathVariable Long id) {
		return planVersionService.getVersion(id);
	}

	@GetMapping("/versions/{id}/totals")
	public ScheduleTotalsDto totals(@PathVariable Long id) {
		return planVersionService.totals(id);
	}

	@PostMapping("/versions/{id}/recalculate")
	@Operation(summary = "Regenerate the scheduled rows into a new version")
	public PlanVersionDto recalculate(@PathVariable Long id, @Valid @RequestBody(required = false) RecalculateRequest request) {
		return planVersionService.recalculate(id, request);
	}

	@PostMapping("/versions/{id}/recalculate-remaining")
	@Operation(summary = "Spread the remaining balance over the scheduled rows")
	public PlanVersionDto recalculateRemaining(@PathVariable Long id,
	                                           @RequestParam(required = false) String createdBy) {
		return planVersionService.recalculateRemainingBalance(id, createdBy);
	}

	@PostMapping("/versions/{id}/edits")
	@Operation(summary = "Save edited rows as a new version")
	public PlanVersionDto saveEdits(@PathVariable Long id, @Valid @RequestBody SaveEditsRequest request) {
		return planVersionService.saveEdits(id, request);
	}

	@PostMapping("/versions/{id}/primary")
	public VersionSummaryDto setPrimary(@PathVariable Long id) {
		return planVersionService.setPrimary(id);
	}

	@PostMapping("/versions/{id}/activate")
	public VersionSummaryDto activate(@PathVariable Long id) {
		return planVersionService.activate(id);
	}

	@PostMapping("/versions/{id}/suspend")
	@Operation(summary = "Cancel the scheduled payments of an active version")
	public PlanVersionDto suspend(@PathVariable Long id, @RequestParam(required = false) String createdBy) {
		return planVersionService.suspend(id, createdBy);
	}

	@DeleteMapping("/versions/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public void delete(@PathVariable Long id) {
		planVersionService.delete(id);
	}
}
