package my.portfoliorecommender.app.api;

import jakarta.validation.Valid;
import my.portfoliorecommender.app.dto.FeatureSchemaDto;
import my.portfoliorecommender.app.dto.RecommendationRequestDto;
import my.portfoliorecommender.app.dto.RecommendationResponseDto;
import my.portfoliorecommender.app.model.FeatureSchema;
import my.portfoliorecommender.app.service.RecommendationService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/recommendations")
public class RecommendationController {
	private final RecommendationService recommendationService;

	public RecommendationController(RecommendationService recommendationService) {
		this.recommendationService = recommendationService;
	}

	@PostMapping
	public RecommendationResponseDto recommend(@Valid @RequestBody RecommendationRequestDto request) {
		return recommendationService.recommend(request);
	}

	@GetMapping("/feature-schema")
	public FeatureSchemaDto featureSchema() {
		FeatureSchema schema = recommendationService.featureSchema();
		return new FeatureSchemaDto(schema.version(), schema.columns());
	}
}
