package my.portfoliorecommender.app.service;

import my.portfoliorecommender.app.model.MarginalMetrics;
import my.portfoliorecommender.app.service.util.PortfolioMath;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Measures how a small reallocation into each non-held instrument changes the baseline portfolio's
 * Sharpe ratio and normal-approximation CVaR. Both deltas are oriented so that higher is better.
 */
public class MarginalUtilityEngine {
	private static final double MIN_VARIANCE = 1e-12;

	private final double riskFree;
	private final double cvarConfidence;
	private final double epsilon;
	private final DonorPolicy donorPolicy;

	public MarginalUtilityEngine(double riskFree, double cvarConfidence, double epsilon, DonorPolicy donorPolicy) {
		if (!Double.isFinite(riskFree)) {
			throw new IllegalArgumentException("riskFree must be finite");
		}
		PortfolioMath.tailFactor(cvarConfidence);
		if (!(epsilon > 0.0 && epsilon < 1.0)) {
			throw new IllegalArgumentException("epsilon must be in (0, 1): " + epsilon);
		}
		this.riskFree = riskFree;
		this.cvarConfidence = cvarConfidence;
		this.epsilon = epsilon;
		this.donorPolicy = donorPolicy == null ? DonorPolicy.LARGEST_HOLDING : donorPolicy;
	}

	public Map<String, MarginalMetrics> marginalUtilities(double[] baseline,
														  double[] mu,
														  double[][] sigma,
														  List<String> universe,
														  Collection<String> heldTickers) {
		if (baseline.length != universe.size() || mu.length != universe.size() || sigma.length != universe.size()) {
			throw new IllegalArgumentException("Weights, returns and covariance must align with the universe");
		}
		double baseVariance = PortfolioMath.variance(baseline, sigma);
		if (!Double.isFinite(baseVariance) || baseVariance <= MIN_VARIANCE) {
			throw new RecommendationException(RecommendationErrorCode.DEGENERATE_BASELINE,
					"Baseline portfolio has no variance; Sharpe ratio is undefined",
					Map.of("variance", baseVariance, "instruments", universe.size()));
		}
		double baseSharpe = PortfolioMath.sharpe(baseline, mu, sigma, riskFree);
		double baseCvar = PortfolioMath.normalCvar(baseline, mu, sigma, cvarConfidence);
		Set<String> held = normalize(heldTickers);

		Map<String, MarginalMetrics> metrics = new LinkedHashMap<>();
		for (int i = 0; i < universe.size(); i++) {
			String ticker = universe.get(i);
			if (held.contains(normalizeTicker(ticker))) {
				continue;
			}
			double[] perturbed = donorPolicy.perturb(baseline, i, epsilon);
			double variance = PortfolioMath.variance(perturbed, sigma);
			if (!Double.isFinite(variance) || variance <= MIN_VARIANCE) {
				throw new RecommendationException(RecommendationErrorCode.DEGENERATE_BASELINE,
						"Perturbed portfolio has no variance",
						Map.of("candidate", ticker, "variance", variance));
			}
			double sharpe = PortfolioMath.sharpe(perturbed, mu, sigma, riskFree);
			double cvar = PortfolioMath.normalCvar(perturbed, mu, sigma, cvarConfidence);
			metrics.put(ticker, new MarginalMetrics(ticker, sharpe - baseSharpe, baseCvar - cvar));
		}
		return metrics;
	}

	private static Set<String> normalize(Collection<String> tickers) {
		Set<String> out = new HashSet<>();
		if (tickers == null) {
			return out;
		}
		for (String ticker : tickers) {
			String normalized = normalizeTicker(ticker);
			if (!normalized.isEmpty()) {
				out.add(normalized);
			}
		}
		return out;
	}

	static String normalizeTicker(String ticker) {
		return ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
	}
}
