package my.portfoliorecommender.app.dto;

import java.util.List;
import java.util.Map;

public record RecommendationResponseDto(
		List<RecommendationDto> recommendations,
		List<String> featureOrder,
		Integer schemaVersion,
		Double targetReturn,
		Map<String, Double> weights
) {
}
