package my.portfoliorecommender.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import my.portfoliorecommender.app.service.DonorPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid MarketData marketData,
		Analytics analytics,
		Scorer scorer,
		Ranking ranking
) {
	public record MarketData(
			@NotBlank String provider,
			@NotEmpty List<String> universe,
			String csvDirectory,
			String cacheDirectory,
			AlphaVantage alphavantage
	) {
		public record AlphaVantage(
				String apiKey,
				String baseUrl,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}
	}

	public record Analytics(
			Integer minObservations,
			Integer periodsPerYear,
			Double riskFreeRate,
			Double cvarConfidence,
			Double perturbationEpsilon,
			DonorPolicy donorPolicy
	) {
	}

	public record Scorer(
			String provider,
			String schemaResource,
			Http http,
			Linear linear
	) {
		public record Http(
				String baseUrl,
				String path,
				Integer connectTimeoutSeconds,
				Integer readTimeoutSeconds
		) {
		}

		public record Linear(
				Double intercept,
				Map<String, Double> coefficients
		) {
		}
	}

	public record Ranking(
			Integer topK
	) {
	}
}
