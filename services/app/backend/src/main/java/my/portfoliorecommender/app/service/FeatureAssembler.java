package my.portfoliorecommender.app.service;

import my.portfoliorecommender.app.model.FeatureSchema;
import my.portfoliorecommender.app.model.FundamentalRow;
import my.portfoliorecommender.app.model.MarginalMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the scorer input matrix. Row {@code i} belongs to {@code candidates[i]}; columns follow
 * {@link #FEATURE_ORDER}. Missing or non-finite inputs become 0 so every row is well formed.
 */
public class FeatureAssembler {
	public static final int SCHEMA_VERSION = 1;
	public static final List<String> FEATURE_ORDER = List.of(
			"deltaSharpe",
			"deltaCvar",
			"mom6",
			"mom12",
			"beta",
			"divYield",
			"logCap",
			"targetReturn"
	);

	public static FeatureSchema schema() {
		return new FeatureSchema(SCHEMA_VERSION, FEATURE_ORDER);
	}

	public double[][] buildFeatures(List<String> candidates,
									Map<String, MarginalMetrics> marginal,
									Map<String, FundamentalRow> fundamentals,
									double targetReturn) {
		double[][] matrix = new double[candidates.size()][];
		for (int i = 0; i < candidates.size(); i++) {
			String ticker = candidates.get(i);
			MarginalMetrics m = marginal == null ? null : marginal.get(ticker);
			FundamentalRow f = fundamentals == null ? null : fundamentals.get(ticker);
			if (f == null) {
				f = FundamentalRow.empty();
			}
			matrix[i] = new double[]{
					m == null ? 0.0 : finiteOrZero(m.deltaSharpe()),
					m == null ? 0.0 : finiteOrZero(m.deltaCvar()),
					finiteOrZero(f.mom6()),
					finiteOrZero(f.mom12()),
					finiteOrZero(f.beta()),
					finiteOrZero(f.divYield()),
					finiteOrZero(f.logCap()),
					finiteOrZero(targetReturn)
			};
		}
		return matrix;
	}

	/**
	 * Fails with {@link RecommendationErrorCode#FEATURE_DIMENSION_MISMATCH} unless every row has exactly
	 * as many columns as the schema declares.
	 */
	public static void requireSchemaMatch(FeatureSchema schema, double[][] matrix) {
		for (int row = 0; row < matrix.length; row++) {
			int actual = matrix[row] == null ? 0 : matrix[row].length;
			if (actual != schema.columnCount()) {
				Map<String, Object> context = new LinkedHashMap<>();
				context.put("schemaVersion", schema.version());
				context.put("expectedColumns", schema.columnCount());
				context.put("actualColumns", actual);
				context.put("row", row);
				throw new RecommendationException(RecommendationErrorCode.FEATURE_DIMENSION_MISMATCH,
						"Feature matrix does not match the scorer column contract", context);
			}
		}
	}

	private static double finiteOrZero(double value) {
		return Double.isFinite(value) ? value : 0.0;
	}
}
