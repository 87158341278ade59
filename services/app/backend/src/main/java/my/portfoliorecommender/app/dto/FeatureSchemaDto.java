package my.portfoliorecommender.app.dto;

import java.util.List;

public record FeatureSchemaDto(
		int version,
		List<String> columns
) {
}
