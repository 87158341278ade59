package my.portfoliorecommender.app.api;

import my.portfoliorecommender.app.service.RecommendationErrorCode;
import my.portfoliorecommender.app.service.RecommendationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RestExceptionHandlerTest {
	private final RestExceptionHandler handler = new RestExceptionHandler();

	@Test
	void mapsEveryErrorCodeToAStatus() {
		assertThat(RestExceptionHandler.statusFor(RecommendationErrorCode.INVALID_TARGET)).isEqualTo(HttpStatus.BAD_REQUEST);
		assertThat(RestExceptionHandler.statusFor(RecommendationErrorCode.INFEASIBLE_TARGET)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
		assertThat(RestExceptionHandler.statusFor(RecommendationErrorCode.INSUFFICIENT_HISTORY)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
		assertThat(RestExceptionHandler.statusFor(RecommendationErrorCode.NO_USABLE_INSTRUMENTS)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
		assertThat(RestExceptionHandler.statusFor(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
		assertThat(RestExceptionHandler.statusFor(RecommendationErrorCode.DEGENERATE_BASELINE)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
		assertThat(RestExceptionHandler.statusFor(RecommendationErrorCode.SCORER_UNAVAILABLE)).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
		assertThat(RestExceptionHandler.statusFor(RecommendationErrorCode.FEATURE_DIMENSION_MISMATCH)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
	}

	@Test
	void scorerFailureRendersProblemWithCodeAndContext() {
		MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/recommendations");
		RecommendationException ex = new RecommendationException(RecommendationErrorCode.SCORER_UNAVAILABLE,
				"Scorer unreachable or timed out", Map.of("scorer", "http"));

		ProblemDetail detail = handler.handleRecommendation(ex, request);

		assertThat(detail.getStatus()).isEqualTo(503);
		assertThat(detail.getTitle()).isEqualTo("Scorer unavailable");
		assertThat(detail.getDetail()).isEqualTo("Scorer unreachable or timed out");
		assertThat(detail.getProperties())
				.containsEntry("code", "SCORER_UNAVAILABLE")
				.containsEntry("context", Map.of("scorer", "http"))
				.containsEntry("path", "/api/recommendations");
	}
}
