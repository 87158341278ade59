package my.portfoliorecommender.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.portfoliorecommender.app.service.RecommendationErrorCode;
import my.portfoliorecommender.app.service.RecommendationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

	@ExceptionHandler(RecommendationException.class)
	public ProblemDetail handleRecommendation(RecommendationException ex, HttpServletRequest request) {
		HttpStatus status = statusFor(ex.getCode());
		if (status.is5xxServerError()) {
			logger.error("Recommendation failed on {} ({}): {}", request.getRequestURI(), ex.getCode(), ex.getMessage(), ex);
		} else {
			logger.warn("Recommendation rejected on {} ({}): {}", request.getRequestURI(), ex.getCode(), ex.getMessage());
		}
		ProblemDetail detail = ProblemDetail.forStatus(status);
		detail.setTitle(titleFor(ex.getCode()));
		detail.setDetail(ex.getMessage());
		detail.setProperty("code", ex.getCode().name());
		detail.setProperty("context", ex.getContext());
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ProblemDetail handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
		logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Bad Request");
		detail.setDetail("Invalid request.");
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
		logger.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Bad Request");
		detail.setDetail("Request body is missing or malformed.");
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
		logger.warn("Validation failed on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Validation failed");
		List<String> errors = ex.getBindingResult().getFieldErrors().stream()
				.map(this::formatFieldError)
				.toList();
		detail.setProperty("errors", errors);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		logger.error("Unexpected error on {}", request.getRequestURI(), ex);
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.INTERNAL_SERVER_ERROR);
		detail.setTitle("Internal Server Error");
		detail.setDetail("Unexpected error");
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	static HttpStatus statusFor(RecommendationErrorCode code) {
		return switch (code) {
			case INVALID_TARGET -> HttpStatus.BAD_REQUEST;
			case INFEASIBLE_TARGET, INSUFFICIENT_HISTORY, NO_USABLE_INSTRUMENTS, ILL_CONDITIONED_COVARIANCE,
					DEGENERATE_BASELINE -> HttpStatus.UNPROCESSABLE_ENTITY;
			case SCORER_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
			case FEATURE_DIMENSION_MISMATCH -> HttpStatus.INTERNAL_SERVER_ERROR;
		};
	}

	private static String titleFor(RecommendationErrorCode code) {
		return switch (code) {
			case INVALID_TARGET -> "Invalid target return";
			case INFEASIBLE_TARGET -> "Target return not attainable";
			case INSUFFICIENT_HISTORY -> "Insufficient price history";
			case NO_USABLE_INSTRUMENTS -> "No usable instruments";
			case ILL_CONDITIONED_COVARIANCE -> "Ill-conditioned covariance";
			case DEGENERATE_BASELINE -> "Degenerate baseline portfolio";
			case SCORER_UNAVAILABLE -> "Scorer unavailable";
			case FEATURE_DIMENSION_MISMATCH -> "Feature dimension mismatch";
		};
	}

	private String formatFieldError(FieldError error) {
		String message = error.getDefaultMessage();
		if (message == null || message.isBlank()) {
			return error.getField();
		}
		return error.getField() + ": " + message;
	}
}
