package my.portfoliorecommender.app.service;

import my.portfoliorecommender.app.config.AppProperties;
import my.portfoliorecommender.app.dto.HoldingDto;
import my.portfoliorecommender.app.dto.RecommendationDto;
import my.portfoliorecommender.app.dto.RecommendationRequestDto;
import my.portfoliorecommender.app.dto.RecommendationResponseDto;
import my.portfoliorecommender.app.marketdata.MarketDataException;
import my.portfoliorecommender.app.marketdata.MarketDataProvider;
import my.portfoliorecommender.app.marketdata.PriceSeries;
import my.portfoliorecommender.app.model.FeatureSchema;
import my.portfoliorecommender.app.model.FundamentalRow;
import my.portfoliorecommender.app.model.MarginalMetrics;
import my.portfoliorecommender.app.model.PortfolioStatistics;
import my.portfoliorecommender.app.model.RankedSuggestion;
import my.portfoliorecommender.app.scoring.FeatureScorer;
import my.portfoliorecommender.app.scoring.ScorerRequestException;
import my.portfoliorecommender.app.service.util.PortfolioWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class RecommendationService {
	private static final Logger logger = LoggerFactory.getLogger(RecommendationService.class);

	private final AppProperties properties;
	private final MarketDataProvider marketDataProvider;
	private final StatisticsEngine statisticsEngine;
	private final MeanVarianceOptimizer optimizer;
	private final MarginalUtilityEngine marginalUtilityEngine;
	private final FundamentalsService fundamentalsService;
	private final FeatureAssembler featureAssembler;
	private final FeatureSchema featureSchema;
	private final FeatureScorer featureScorer;
	private final Ranker ranker;

	public RecommendationService(AppProperties properties,
								 MarketDataProvider marketDataProvider,
								 StatisticsEngine statisticsEngine,
								 MeanVarianceOptimizer optimizer,
								 MarginalUtilityEngine marginalUtilityEngine,
								 FundamentalsService fundamentalsService,
								 FeatureAssembler featureAssembler,
								 FeatureSchema featureSchema,
								 FeatureScorer featureScorer,
								 Ranker ranker) {
		this.properties = properties;
		this.marketDataProvider = marketDataProvider;
		this.statisticsEngine = statisticsEngine;
		this.optimizer = optimizer;
		this.marginalUtilityEngine = marginalUtilityEngine;
		this.fundamentalsService = fundamentalsService;
		this.featureAssembler = featureAssembler;
		this.featureSchema = featureSchema;
		this.featureScorer = featureScorer;
		this.ranker = ranker;
	}

	public RecommendationResponseDto recommend(RecommendationRequestDto request) {
		Double rawTarget = request == null ? null : request.targetReturn();
		if (rawTarget == null || !Double.isFinite(rawTarget)) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("targetReturn", rawTarget == null ? "null" : rawTarget.toString());
			throw new RecommendationException(RecommendationErrorCode.INVALID_TARGET,
					"targetReturn must be a finite number", context);
		}
		double targetReturn = rawTarget;
		double budget = request.budget() == null || !Double.isFinite(request.budget())
				? 0.0
				: Math.max(0.0, request.budget());

		Map<String, PriceSeries> seriesByTicker = loadSeries(universe());
		PortfolioStatistics statistics = statisticsEngine.computeStatistics(new ArrayList<>(seriesByTicker.values()));
		List<String> tickers = statistics.universe();
		double[] mu = statistics.mu();
		double[][] sigma = statistics.sigma();

		double[] weights = PortfolioWeights.sanitize(optimizer.optimize(mu, sigma, targetReturn));
		Set<String> held = heldTickers(request.holdings());
		Map<String, MarginalMetrics> marginal = marginalUtilityEngine.marginalUtilities(weights, mu, sigma, tickers, held);

		List<String> candidates = new ArrayList<>();
		for (String ticker : tickers) {
			if (marginal.containsKey(ticker)) {
				candidates.add(ticker);
			}
		}
		Map<String, Double> weightMap = weightsByTicker(tickers, weights);
		if (candidates.isEmpty()) {
			logger.info("No candidates outside current holdings (universe={}, held={}).", tickers.size(), held.size());
			return new RecommendationResponseDto(List.of(), List.of(), featureSchema.version(), targetReturn, weightMap);
		}

		Map<String, FundamentalRow> fundamentals = fundamentalsService.fundamentalsFor(candidates, seriesByTicker);
		double[][] features = featureAssembler.buildFeatures(candidates, marginal, fundamentals, targetReturn);
		FeatureAssembler.requireSchemaMatch(featureSchema, features);

		double[] scores = score(features);
		List<RankedSuggestion> ranked = ranker.rank(candidates, scores, statistics.latestPrices(), budget);
		logger.info("Recommendation computed (target={}, universe={}, candidates={}, topK={}, scorer={}).",
				targetReturn, tickers.size(), candidates.size(), ranker.getTopK(), featureScorer.name());

		List<RecommendationDto> recommendations = ranked.stream()
				.map(s -> new RecommendationDto(s.ticker(), s.score(), s.price(), s.shares(), s.reason()))
				.toList();
		return new RecommendationResponseDto(recommendations, featureSchema.columns(), featureSchema.version(),
				targetReturn, weightMap);
	}

	public FeatureSchema featureSchema() {
		return featureSchema;
	}

	private List<String> universe() {
		Set<String> tickers = new LinkedHashSet<>();
		if (properties.marketData() != null && properties.marketData().universe() != null) {
			for (String ticker : properties.marketData().universe()) {
				String normalized = MarginalUtilityEngine.normalizeTicker(ticker);
				if (!normalized.isEmpty()) {
					tickers.add(normalized);
				}
			}
		}
		return new ArrayList<>(tickers);
	}

	private Map<String, PriceSeries> loadSeries(List<String> tickers) {
		Map<String, PriceSeries> seriesByTicker = new LinkedHashMap<>();
		for (String ticker : tickers) {
			try {
				seriesByTicker.put(ticker, marketDataProvider.fetchWeeklySeries(ticker));
			} catch (MarketDataException ex) {
				logger.warn("Skipping {}: {}", ticker, ex.getMessage());
			}
		}
		return seriesByTicker;
	}

	private double[] score(double[][] features) {
		try {
			return featureScorer.score(features, featureSchema.columns());
		} catch (ScorerRequestException ex) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("scorer", featureScorer.name());
			if (ex.getStatusCode() != null) {
				context.put("status", ex.getStatusCode());
			}
			throw new RecommendationException(RecommendationErrorCode.SCORER_UNAVAILABLE, ex.getMessage(), context, ex);
		} catch (RuntimeException ex) {
			throw new RecommendationException(RecommendationErrorCode.SCORER_UNAVAILABLE,
					"Scorer failed: " + ex.getMessage(), Map.of("scorer", featureScorer.name()), ex);
		}
	}

	private static Set<String> heldTickers(List<HoldingDto> holdings) {
		Set<String> held = new LinkedHashSet<>();
		if (holdings == null) {
			return held;
		}
		for (HoldingDto holding : holdings) {
			if (holding == null) {
				continue;
			}
			String ticker = MarginalUtilityEngine.normalizeTicker(holding.ticker());
			if (!ticker.isEmpty()) {
				held.add(ticker);
			}
		}
		return held;
	}

	private static Map<String, Double> weightsByTicker(List<String> tickers, double[] weights) {
		Map<String, Double> out = new LinkedHashMap<>();
		for (int i = 0; i < tickers.size(); i++) {
			out.put(tickers.get(i), weights[i]);
		}
		return out;
	}
}
