package my.portfoliorecommender.app.config;

import my.portfoliorecommender.app.marketdata.MarketDataProvider;
import my.portfoliorecommender.app.service.DonorPolicy;
import my.portfoliorecommender.app.service.FeatureAssembler;
import my.portfoliorecommender.app.service.FundamentalsService;
import my.portfoliorecommender.app.service.MarginalUtilityEngine;
import my.portfoliorecommender.app.service.MeanVarianceOptimizer;
import my.portfoliorecommender.app.service.Ranker;
import my.portfoliorecommender.app.service.StatisticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalyticsConfig {
	private static final Logger logger = LoggerFactory.getLogger(AnalyticsConfig.class);
	static final int DEFAULT_MIN_OBSERVATIONS = 30;
	static final int DEFAULT_PERIODS_PER_YEAR = 52;
	static final double DEFAULT_RISK_FREE_RATE = 0.043;
	static final double DEFAULT_CVAR_CONFIDENCE = 0.95;
	static final double DEFAULT_EPSILON = 0.01;
	static final int DEFAULT_TOP_K = 5;

	@Bean
	public StatisticsEngine statisticsEngine(AppProperties properties) {
		AppProperties.Analytics analytics = properties.analytics();
		int minObservations = analytics == null || analytics.minObservations() == null
				? DEFAULT_MIN_OBSERVATIONS
				: analytics.minObservations();
		int periodsPerYear = analytics == null || analytics.periodsPerYear() == null
				? DEFAULT_PERIODS_PER_YEAR
				: analytics.periodsPerYear();
		return new StatisticsEngine(minObservations, periodsPerYear);
	}

	@Bean
	public MeanVarianceOptimizer meanVarianceOptimizer() {
		return new MeanVarianceOptimizer();
	}

	@Bean
	public MarginalUtilityEngine marginalUtilityEngine(AppProperties properties) {
		AppProperties.Analytics analytics = properties.analytics();
		double riskFree = analytics == null || analytics.riskFreeRate() == null
				? DEFAULT_RISK_FREE_RATE
				: analytics.riskFreeRate();
		double confidence = analytics == null || analytics.cvarConfidence() == null
				? DEFAULT_CVAR_CONFIDENCE
				: analytics.cvarConfidence();
		double epsilon = analytics == null || analytics.perturbationEpsilon() == null
				? DEFAULT_EPSILON
				: analytics.perturbationEpsilon();
		DonorPolicy donorPolicy = analytics == null || analytics.donorPolicy() == null
				? DonorPolicy.LARGEST_HOLDING
				: analytics.donorPolicy();
		logger.info("Marginal utility engine (riskFree={}, cvarConfidence={}, epsilon={}, donorPolicy={}).",
				riskFree, confidence, epsilon, donorPolicy);
		return new MarginalUtilityEngine(riskFree, confidence, epsilon, donorPolicy);
	}

	@Bean
	public FeatureAssembler featureAssembler() {
		return new FeatureAssembler();
	}

	@Bean
	public Ranker ranker(AppProperties properties) {
		Integer topK = properties.ranking() == null ? null : properties.ranking().topK();
		return new Ranker(topK == null ? DEFAULT_TOP_K : topK);
	}

	@Bean
	public FundamentalsService fundamentalsService(MarketDataProvider marketDataProvider) {
		return new FundamentalsService(marketDataProvider);
	}
}
