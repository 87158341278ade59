package my.portfoliorecommender.app.service.util;

import org.apache.commons.math3.distribution.NormalDistribution;

public final class PortfolioMath {
	private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

	private PortfolioMath() {
	}

	public static double expectedReturn(double[] w, double[] mu) {
		double sum = 0.0;
		for (int i = 0; i < w.length; i++) {
			sum += w[i] * mu[i];
		}
		return sum;
	}

	public static double variance(double[] w, double[][] sigma) {
		double sum = 0.0;
		for (int i = 0; i < w.length; i++) {
			if (w[i] == 0.0) {
				continue;
			}
			double row = 0.0;
			for (int j = 0; j < w.length; j++) {
				row += sigma[i][j] * w[j];
			}
			sum += w[i] * row;
		}
		return sum;
	}

	public static double sharpe(double[] w, double[] mu, double[][] sigma, double riskFree) {
		return (expectedReturn(w, mu) - riskFree) / Math.sqrt(variance(w, sigma));
	}

	/**
	 * Expected shortfall of a normally distributed portfolio return at the given confidence level,
	 * expressed as a positive loss.
	 */
	public static double normalCvar(double[] w, double[] mu, double[][] sigma, double confidence) {
		double mean = expectedReturn(w, mu);
		double std = Math.sqrt(variance(w, sigma));
		return -(mean - std * tailFactor(confidence));
	}

	public static double tailFactor(double confidence) {
		if (!(confidence > 0.0 && confidence < 1.0)) {
			throw new IllegalArgumentException("Confidence level must be in (0, 1): " + confidence);
		}
		double z = STANDARD_NORMAL.inverseCumulativeProbability(confidence);
		return STANDARD_NORMAL.density(z) / (1.0 - confidence);
	}
}
