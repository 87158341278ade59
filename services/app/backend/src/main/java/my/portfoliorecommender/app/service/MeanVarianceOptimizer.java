package my.portfoliorecommender.app.service;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-only mean-variance optimizer: minimize {@code w'Σw} subject to {@code μ'w = target},
 * {@code Σw = 1} and {@code w >= 0}, solved with a primal active-set method.
 * <p>
 * The returned vector is never renormalized; a solution that violates the constraints beyond
 * {@link #CONSTRAINT_TOLERANCE} is reported as a failure instead.
 */
public class MeanVarianceOptimizer {
	private static final Logger logger = LoggerFactory.getLogger(MeanVarianceOptimizer.class);

	public static final double CONSTRAINT_TOLERANCE = 1e-6;
	private static final double TARGET_TOLERANCE = 1e-9;
	private static final double SYMMETRY_TOLERANCE = 1e-10;
	private static final double PSD_TOLERANCE = 1e-10;
	private static final double STEP_TOLERANCE = 1e-12;
	private static final double MULTIPLIER_TOLERANCE = 1e-12;
	private static final double SINGULARITY_THRESHOLD = 1e-14;

	public double[] optimize(double[] mu, double[][] sigma, double targetReturn) {
		int n = validateShape(mu, sigma);
		if (!Double.isFinite(targetReturn)) {
			throw new RecommendationException(RecommendationErrorCode.INVALID_TARGET,
					"Target return must be a finite number", Map.of("targetReturn", String.valueOf(targetReturn)));
		}
		requirePositiveSemiDefinite(sigma);

		int lowest = 0;
		int highest = 0;
		for (int i = 1; i < n; i++) {
			if (mu[i] < mu[lowest]) {
				lowest = i;
			}
			if (mu[i] > mu[highest]) {
				highest = i;
			}
		}
		if (targetReturn > mu[highest] + TARGET_TOLERANCE || targetReturn < mu[lowest] - TARGET_TOLERANCE) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("targetReturn", targetReturn);
			context.put("minAchievable", mu[lowest]);
			context.put("maxAchievable", mu[highest]);
			throw new RecommendationException(RecommendationErrorCode.INFEASIBLE_TARGET,
					"Target return is outside the achievable long-only range", context);
		}

		double[] w = feasibleStart(mu, lowest, highest, targetReturn);
		boolean[] atBound = new boolean[n];
		for (int i = 0; i < n; i++) {
			atBound[i] = w[i] == 0.0;
		}

		int maxIterations = 50 * n + 100;
		for (int iteration = 0; iteration < maxIterations; iteration++) {
			List<Integer> free = freeIndices(atBound);
			double[] gradient = gradient(sigma, w);
			boolean returnRowActive = hasReturnSpread(mu, free);
			KktSolution step = solveEqualityProblem(sigma, mu, gradient, free, returnRowActive, iteration);

			if (maxAbs(step.direction()) < STEP_TOLERANCE) {
				int release = -1;
				double mostNegative = -MULTIPLIER_TOLERANCE;
				for (int i = 0; i < n; i++) {
					if (!atBound[i]) {
						continue;
					}
					double multiplier = gradient[i] + step.budgetMultiplier()
							+ (returnRowActive ? step.returnMultiplier() * mu[i] : 0.0);
					if (multiplier < mostNegative) {
						mostNegative = multiplier;
						release = i;
					}
				}
				if (release < 0) {
					logger.debug("Optimizer converged after {} iterations ({} free instruments)", iteration, free.size());
					return verify(w, mu, targetReturn);
				}
				atBound[release] = false;
				continue;
			}

			double alpha = 1.0;
			int blocking = -1;
			double[] direction = step.direction();
			for (int k = 0; k < free.size(); k++) {
				if (direction[k] < -STEP_TOLERANCE) {
					int index = free.get(k);
					double ratio = -w[index] / direction[k];
					if (ratio < alpha) {
						alpha = ratio;
						blocking = index;
					}
				}
			}
			for (int k = 0; k < free.size(); k++) {
				w[free.get(k)] += alpha * direction[k];
			}
			if (blocking >= 0) {
				w[blocking] = 0.0;
				atBound[blocking] = true;
			}
		}
		throw new RecommendationException(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE,
				"Optimizer did not converge", Map.of("dimension", n, "iterations", maxIterations));
	}

	private int validateShape(double[] mu, double[][] sigma) {
		if (mu == null || sigma == null || mu.length == 0) {
			throw new RecommendationException(RecommendationErrorCode.NO_USABLE_INSTRUMENTS,
					"Optimizer requires at least one instrument", Map.of());
		}
		int n = mu.length;
		if (sigma.length != n) {
			throw new RecommendationException(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE,
					"Covariance matrix row count does not match expected returns",
					Map.of("expectedRows", n, "actualRows", sigma.length));
		}
		for (int i = 0; i < n; i++) {
			if (!Double.isFinite(mu[i])) {
				throw new RecommendationException(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE,
						"Expected return is not finite", Map.of("index", i));
			}
			if (sigma[i] == null || sigma[i].length != n) {
				throw new RecommendationException(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE,
						"Covariance matrix is not square",
						Map.of("row", i, "expectedColumns", n, "actualColumns", sigma[i] == null ? 0 : sigma[i].length));
			}
			for (int j = 0; j < n; j++) {
				if (!Double.isFinite(sigma[i][j])) {
					throw new RecommendationException(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE,
							"Covariance entry is not finite", Map.of("row", i, "column", j));
				}
			}
		}
		for (int i = 0; i < n; i++) {
			for (int j = i + 1; j < n; j++) {
				double scale = Math.max(1.0, Math.max(Math.abs(sigma[i][j]), Math.abs(sigma[j][i])));
				if (Math.abs(sigma[i][j] - sigma[j][i]) > SYMMETRY_TOLERANCE * scale) {
					throw new RecommendationException(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE,
							"Covariance matrix is not symmetric", Map.of("row", i, "column", j));
				}
			}
		}
		return n;
	}

	private void requirePositiveSemiDefinite(double[][] sigma) {
		double[] eigenvalues = new EigenDecomposition(new Array2DRowRealMatrix(sigma, false)).getRealEigenvalues();
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (double value : eigenvalues) {
			min = Math.min(min, value);
			max = Math.max(max, value);
		}
		if (min < -PSD_TOLERANCE * Math.max(1.0, max)) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("dimension", sigma.length);
			context.put("minEigenvalue", min);
			context.put("maxEigenvalue", max);
			throw new RecommendationException(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE,
					"Covariance matrix is not positive semi-definite", context);
		}
	}

	private double[] feasibleStart(double[] mu, int lowest, int highest, double targetReturn) {
		int n = mu.length;
		double[] w = new double[n];
		double spread = mu[highest] - mu[lowest];
		if (spread <= STEP_TOLERANCE) {
			for (int i = 0; i < n; i++) {
				w[i] = 1.0 / n;
			}
			return w;
		}
		double share = (targetReturn - mu[lowest]) / spread;
		share = Math.min(1.0, Math.max(0.0, share));
		w[highest] += share;
		w[lowest] += 1.0 - share;
		return w;
	}

	private KktSolution solveEqualityProblem(double[][] sigma,
											 double[] mu,
											 double[] gradient,
											 List<Integer> free,
											 boolean returnRowActive,
											 int iteration) {
		int k = free.size();
		int rows = returnRowActive ? 2 : 1;
		RealMatrix kkt = new Array2DRowRealMatrix(k + rows, k + rows);
		RealVector rhs = new ArrayRealVector(k + rows);
		for (int a = 0; a < k; a++) {
			int i = free.get(a);
			for (int b = 0; b < k; b++) {
				kkt.setEntry(a, b, 2.0 * sigma[i][free.get(b)]);
			}
			kkt.setEntry(a, k, 1.0);
			kkt.setEntry(k, a, 1.0);
			if (returnRowActive) {
				kkt.setEntry(a, k + 1, mu[i]);
				kkt.setEntry(k + 1, a, mu[i]);
			}
			rhs.setEntry(a, -gradient[i]);
		}
		DecompositionSolver solver = new LUDecomposition(kkt, SINGULARITY_THRESHOLD).getSolver();
		if (!solver.isNonSingular()) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("freeInstruments", k);
			context.put("iteration", iteration);
			throw new RecommendationException(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE,
					"Optimality system is singular; covariance does not determine a unique portfolio", context);
		}
		RealVector solution = solver.solve(rhs);
		double[] direction = new double[k];
		for (int a = 0; a < k; a++) {
			direction[a] = solution.getEntry(a);
		}
		double budgetMultiplier = solution.getEntry(k);
		double returnMultiplier = returnRowActive ? solution.getEntry(k + 1) : 0.0;
		return new KktSolution(direction, budgetMultiplier, returnMultiplier);
	}

	private double[] verify(double[] w, double[] mu, double targetReturn) {
		double sum = 0.0;
		double achieved = 0.0;
		double minWeight = Double.POSITIVE_INFINITY;
		for (int i = 0; i < w.length; i++) {
			sum += w[i];
			achieved += mu[i] * w[i];
			minWeight = Math.min(minWeight, w[i]);
		}
		if (Math.abs(sum - 1.0) > CONSTRAINT_TOLERANCE
				|| Math.abs(achieved - targetReturn) > CONSTRAINT_TOLERANCE
				|| minWeight < -CONSTRAINT_TOLERANCE) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("weightSum", sum);
			context.put("achievedReturn", achieved);
			context.put("targetReturn", targetReturn);
			context.put("minWeight", minWeight);
			throw new RecommendationException(RecommendationErrorCode.ILL_CONDITIONED_COVARIANCE,
					"Optimizer solution violates its constraints", context);
		}
		return w;
	}

	private static List<Integer> freeIndices(boolean[] atBound) {
		List<Integer> free = new ArrayList<>();
		for (int i = 0; i < atBound.length; i++) {
			if (!atBound[i]) {
				free.add(i);
			}
		}
		return free;
	}

	private static boolean hasReturnSpread(double[] mu, List<Integer> free) {
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (int i : free) {
			min = Math.min(min, mu[i]);
			max = Math.max(max, mu[i]);
		}
		return max - min > STEP_TOLERANCE;
	}

	private static double[] gradient(double[][] sigma, double[] w) {
		int n = w.length;
		double[] g = new double[n];
		for (int i = 0; i < n; i++) {
			double sum = 0.0;
			for (int j = 0; j < n; j++) {
				sum += sigma[i][j] * w[j];
			}
			g[i] = 2.0 * sum;
		}
		return g;
	}

	private static double maxAbs(double[] values) {
		double max = 0.0;
		for (double value : values) {
			max = Math.max(max, Math.abs(value));
		}
		return max;
	}

	private record KktSolution(double[] direction, double budgetMultiplier, double returnMultiplier) {
	}
}
