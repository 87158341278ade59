package my.portfoliorecommender.app.service;

import my.portfoliorecommender.app.model.RankedSuggestion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class Ranker {
	public static final String DEFAULT_REASON = "High P(improve Sharpe) for your target";

	private final int topK;

	public Ranker(int topK) {
		if (topK <= 0) {
			throw new IllegalArgumentException("topK must be positive");
		}
		this.topK = topK;
	}

	public List<RankedSuggestion> rank(List<String> candidates,
									   double[] scores,
									   Map<String, Double> prices,
									   double budget) {
		if (scores == null || scores.length != candidates.size()) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("candidates", candidates.size());
			context.put("scores", scores == null ? 0 : scores.length);
			throw new RecommendationException(RecommendationErrorCode.SCORER_UNAVAILABLE,
					"Scorer returned a different number of scores than candidates", context);
		}
		List<Scored> scored = new ArrayList<>(candidates.size());
		for (int i = 0; i < candidates.size(); i++) {
			if (!Double.isFinite(scores[i])) {
				throw new RecommendationException(RecommendationErrorCode.SCORER_UNAVAILABLE,
						"Scorer returned a non-finite score", Map.of("candidate", candidates.get(i), "row", i));
			}
			scored.add(new Scored(candidates.get(i), scores[i]));
		}
		// List.sort is stable, so equal scores keep candidate order.
		scored.sort(Comparator.comparingDouble(Scored::score).reversed());

		int k = Math.min(topK, scored.size());
		double bucket = budget > 0 && k > 0 ? budget / k : 0.0;
		List<RankedSuggestion> suggestions = new ArrayList<>(k);
		for (Scored entry : scored.subList(0, k)) {
			Double knownPrice = prices == null ? null : prices.get(entry.ticker());
			double price = knownPrice != null && Double.isFinite(knownPrice) && knownPrice > 0 ? knownPrice : 0.0;
			long shares = bucket > 0 && price > 0 ? (long) Math.floor(bucket / price) : 0L;
			suggestions.add(new RankedSuggestion(entry.ticker(), entry.score(), price, shares, DEFAULT_REASON));
		}
		return suggestions;
	}

	public int getTopK() {
		return topK;
	}

	private record Scored(String ticker, double score) {
	}
}
