package my.paymentplanner.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.paymentplanner.app.dto.WireFeeDto;
import my.paymentplanner.app.dto.WireFeeRequest;
import my.paymentplanner.app.service.WireFeeService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Wire Fees")
public class WireFeeController {
	private final WireFeeService wireFeeService;

	public WireFeeController(WireFeeService wireFeeService) {
		this.wireFeeService = wireFeeService;
	}

	@GetMapping("/versions/{id}/wire-fees")
	@Operation(summary = "Wire fees of a version keyed by schedule item id")
	public Map<Long, List<WireFeeDto>> list(@PathVariable Long id) {
		return wireFeeService.listByVersion(id);
	}

	@PostMapping("/schedule-items/{itemId}/wire-fees")
	@ResponseStatus(HttpStatus.CREATED)
	public WireFeeDto add(@PathVariable Long itemId, @Valid @RequestBody(required = false) WireFeeRequest request) {
		return wireFeeService.add(itemId, request);
	}

	@DeleteMapping("/wire-fees/{id}")
	@ResponseStatus(HttpStatus.NO_CONTENT)
	public void delete(@PathVariable Long id) {
		wireFeeService.delete(id);
	}
}
