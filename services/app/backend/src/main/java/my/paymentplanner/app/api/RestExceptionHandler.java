package my.paymentplanner.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.paymentplanner.app.error.ConfigurationUnavailableException;
import my.paymentplanner.app.error.ErrorKind;
import my.paymentplanner.app.error.InvalidTransitionException;
import my.paymentplanner.app.error.PlanEngineException;
import my.paymentplanner.app.error.PlanValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.UUID;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

	@ExceptionHandler(ConfigurationUnavailableException.class)
	public ProblemDetail handleConfigurationUnavailable(ConfigurationUnavailableException ex, HttpServletRequest request) {
		logger.error("Plan policy unavailable on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.SERVICE_UNAVAILABLE, "Configuration unavailable", ex, request);
	}

	@ExceptionHandler(PlanValidationException.class)
	public ProblemDetail handlePlanValidation(PlanValidationException ex, HttpServletRequest request) {
		logger.warn("Rejected plan input on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = problem(HttpStatus.UNPROCESSABLE_ENTITY, "Validation failed", ex, request);
		detail.setProperty("field", ex.getField());
		if (ex.getRequested() != null) {
			detail.setProperty("requested", ex.getRequested());
		}
		if (ex.getBound() != null) {
			detail.setProperty("bound", ex.getBound());
			detail.setProperty("delta", ex.getDelta());
		}
		return detail;
	}

	@ExceptionHandler(InvalidTransitionException.class)
	public ProblemDetail handleInvalidTransition(InvalidTransitionException ex, HttpServletRequest request) {
		HttpStatus status = InvalidTransitionException.MISSING.equals(ex.getActual()) ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
		ProblemDetail detail = problem(status, "Invalid transition", ex, request);
		detail.setProperty("versionId", ex.getVersionId());
		detail.setProperty("attempted", ex.getAttempted());
		detail.setProperty("actual", ex.getActual());
		return detail;
	}

	@ExceptionHandler(PlanEngineException.class)
	public ProblemDetail handlePlanEngine(PlanEngineException ex, HttpServletRequest request) {
		if (ex.getKind() == ErrorKind.PERSISTENCE_CONFLICT) {
			logger.warn("Conflict on {}: {}", request.getRequestURI(), ex.getMessage());
			return problem(HttpStatus.CONFLICT, "Conflict", ex, request);
		}
		logger.warn("Calculation failed on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
		return problem(HttpStatus.BAD_GATEWAY, "Calculation service error", ex, request);
	}

	@ExceptionHandler(ObjectOptimisticLockingFailureException.class)
	public ProblemDetail handleOptimisticLock(ObjectOptimisticLockingFailureException ex, HttpServletRequest request) {
		logger.warn("Concurrent update on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.CONFLICT);
		detail.setTitle("Conflict");
		detail.setDetail("The plan version was changed concurrently; reload and retry.");
		detail.setProperty("kind", ErrorKind.PERSISTENCE_CONFLICT);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ProblemDetail handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
		String message = ex.getMessage() == null ? "Invalid request." : ex.getMessage();
		boolean notFound = message.endsWith("not found");
		logger.warn("{} on {}: {}", notFound ? "Not found" : "Bad request", request.getRequestURI(), message);
		ProblemDetail detail = ProblemDetail.forStatus(notFound ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST);
		detail.setTitle(notFound ? "Not Found" : "Bad Request");
		detail.setDetail(message);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
		logger.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Bad Request");
		detail.setDetail("Failed to read request body.");
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ProblemDetail handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
		detail.setTitle("Not Found");
		detail.setDetail("Resource not found.");
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
		logger.warn("Validation failed on {}", request.getRequestURI(), ex);
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Validation failed");
		List<String> errors = ex.getBindingResult().getFieldErrors().stream()
				.map(this::formatFieldError)
				.toList();
		detail.setProperty("errors", errors);
		detail.setProperty("kind", ErrorKind.VALIDATION);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		String reference = UUID.randomUUID().toString();
		logger.error("Unexpected error on {} (ref={})", request.getRequestURI(), reference, ex);
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
		detail.setTitle("Internal Server Error");
		detail.setDetail("Unexpected error");
		detail.setProperty("reference", reference);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private ProblemDetail problem(HttpStatus status, String title, PlanEngineException ex, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(status);
		detail.setTitle(title);
		detail.setDetail(ex.getMessage());
		detail.setProperty("kind", ex.getKind());
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private String formatFieldError(FieldError error) {
		return error.getField() + ": " + error.getDefaultMessage();
	}
}
