package my.portfoliorecommender.app.scoring;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// Coefficient keys match column names ignoring case and dashes.
public class LinearFeatureScorer implements FeatureScorer {
	private final double intercept;
	private final Map<String, Double> coefficients;

	public LinearFeatureScorer(double intercept, Map<String, Double> coefficients, List<String> knownColumns) {
		Map<String, String> columnsByKey = new LinkedHashMap<>();
		for (String column : knownColumns) {
			columnsByKey.put(key(column), column);
		}
		Map<String, Double> copy = new LinkedHashMap<>();
		if (coefficients != null) {
			for (Map.Entry<String, Double> entry : coefficients.entrySet()) {
				String column = columnsByKey.get(key(entry.getKey()));
				if (column == null) {
					throw new IllegalArgumentException("Unknown feature column in scorer coefficients: " + entry.getKey());
				}
				if (entry.getValue() == null || !Double.isFinite(entry.getValue())) {
					throw new IllegalArgumentException("Coefficient for " + entry.getKey() + " must be finite");
				}
				copy.put(column, entry.getValue());
			}
		}
		this.intercept = intercept;
		this.coefficients = Map.copyOf(copy);
	}

	@Override
	public double[] score(double[][] features, List<String> featureOrder) {
		double[] weights = new double[featureOrder.size()];
		for (int c = 0; c < featureOrder.size(); c++) {
			weights[c] = coefficients.getOrDefault(featureOrder.get(c), 0.0);
		}
		double[] scores = new double[features.length];
		for (int r = 0; r < features.length; r++) {
			if (features[r].length != weights.length) {
				throw new ScorerRequestException("Row " + r + " has " + features[r].length
						+ " columns, expected " + weights.length, null, null);
			}
			double sum = intercept;
			for (int c = 0; c < weights.length; c++) {
				sum += weights[c] * features[r][c];
			}
			scores[r] = sum;
		}
		return scores;
	}

	@Override
	public String name() {
		return "linear";
	}

	private static String key(String column) {
		return column == null ? "" : column.replace("-", "").toLowerCase(Locale.ROOT);
	}
}
