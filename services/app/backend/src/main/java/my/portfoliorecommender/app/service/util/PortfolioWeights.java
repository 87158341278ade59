package my.portfoliorecommender.app.service.util;

import my.portfoliorecommender.app.service.MeanVarianceOptimizer;

public final class PortfolioWeights {
	private PortfolioWeights() {
	}

	public static double[] sanitize(double[] weights) {
		if (weights == null || weights.length == 0) {
			throw new IllegalArgumentException("weights must not be empty");
		}
		double[] out = weights.clone();
		double sum = 0.0;
		for (int i = 0; i < out.length; i++) {
			if (!Double.isFinite(out[i]) || out[i] < -MeanVarianceOptimizer.CONSTRAINT_TOLERANCE) {
				throw new IllegalArgumentException("Weight " + i + " is out of range: " + out[i]);
			}
			if (out[i] < 0.0) {
				out[i] = 0.0;
			}
			sum += out[i];
		}
		if (Math.abs(sum - 1.0) > MeanVarianceOptimizer.CONSTRAINT_TOLERANCE) {
			throw new IllegalArgumentException("Weights do not sum to 1: " + sum);
		}
		for (int i = 0; i < out.length; i++) {
			out[i] = out[i] / sum;
		}
		return out;
	}
}
