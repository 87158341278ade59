package my.portfoliorecommender.app.dto;

import jakarta.validation.Valid;

import java.util.List;

public record RecommendationRequestDto(
		List<@Valid HoldingDto> holdings,
		Double targetReturn,
		Double budget
) {
}
