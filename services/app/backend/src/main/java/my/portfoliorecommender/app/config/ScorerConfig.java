package my.portfoliorecommender.app.config;

import my.portfoliorecommender.app.model.FeatureSchema;
import my.portfoliorecommender.app.scoring.FeatureScorer;
import my.portfoliorecommender.app.scoring.HttpFeatureScorer;
import my.portfoliorecommender.app.scoring.LinearFeatureScorer;
import my.portfoliorecommender.app.service.FeatureAssembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import tools.jackson.databind.ObjectMapper;

import java.io.InputStream;
import java.time.Duration;

@Configuration
public class ScorerConfig {
	private static final Logger logger = LoggerFactory.getLogger(ScorerConfig.class);
	static final String DEFAULT_SCHEMA_RESOURCE = "classpath:model/feature_schema.json";

	@Bean
	public FeatureSchema featureSchema(AppProperties properties, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
		String location = properties.scorer() == null || properties.scorer().schemaResource() == null
				? DEFAULT_SCHEMA_RESOURCE
				: properties.scorer().schemaResource();
		FeatureSchema schema = loadSchema(location, objectMapper, resourceLoader);
		FeatureSchema expected = FeatureAssembler.schema();
		if (schema.version() != expected.version() || !schema.columns().equals(expected.columns())) {
			throw new IllegalStateException("Feature schema " + location + " (version " + schema.version() + ", columns "
					+ schema.columns() + ") does not match assembler contract (version " + expected.version()
					+ ", columns " + expected.columns() + ")");
		}
		logger.info("Feature schema loaded from {} (version={}, columns={}).", location, schema.version(), schema.columnCount());
		return schema;
	}

	@Bean
	@ConditionalOnProperty(name = "app.scorer.provider", havingValue = "http")
	public FeatureScorer httpFeatureScorer(AppProperties properties, ObjectMapper objectMapper) {
		AppProperties.Scorer.Http http = properties.scorer().http();
		if (http == null || http.baseUrl() == null || http.baseUrl().isBlank()) {
			throw new IllegalStateException("app.scorer.http.base-url is required for provider=http");
		}
		Duration connectTimeout = http.connectTimeoutSeconds() == null ? null : Duration.ofSeconds(http.connectTimeoutSeconds());
		Duration readTimeout = http.readTimeoutSeconds() == null ? null : Duration.ofSeconds(http.readTimeoutSeconds());
		logger.info("Scorer enabled (provider=http, baseUrl={}).", http.baseUrl());
		return new HttpFeatureScorer(http.baseUrl(), http.path(), objectMapper, connectTimeout, readTimeout);
	}

	@Bean
	@ConditionalOnProperty(name = "app.scorer.provider", havingValue = "linear", matchIfMissing = true)
	public FeatureScorer linearFeatureScorer(AppProperties properties) {
		AppProperties.Scorer.Linear linear = properties.scorer() == null ? null : properties.scorer().linear();
		double intercept = linear == null || linear.intercept() == null ? 0.0 : linear.intercept();
		logger.info("Scorer enabled (provider=linear).");
		return new LinearFeatureScorer(intercept, linear == null ? null : linear.coefficients(), FeatureAssembler.FEATURE_ORDER);
	}

	private FeatureSchema loadSchema(String location, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			throw new IllegalStateException("Feature schema resource not found: " + location);
		}
		try (InputStream inputStream = resource.getInputStream()) {
			return objectMapper.readValue(inputStream, FeatureSchema.class);
		} catch (Exception ex) {
			throw new IllegalStateException("Failed to load feature schema from " + location + ": " + ex.getMessage(), ex);
		}
	}
}
