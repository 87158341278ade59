package my.portfoliorecommender.app.dto;

public record RecommendationDto(
		String ticker,
		double score,
		double price,
		long shares,
		String reason
) {
}
