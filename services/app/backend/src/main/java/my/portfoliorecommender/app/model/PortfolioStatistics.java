package my.portfoliorecommender.app.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PortfolioStatistics(List<String> universe,
								  double[] mu,
								  double[][] sigma,
								  Map<String, Double> latestPrices,
								  List<LocalDate> alignedDates) {
	public PortfolioStatistics {
		universe = List.copyOf(universe);
		mu = mu.clone();
		sigma = copy(sigma);
		latestPrices = Collections.unmodifiableMap(new LinkedHashMap<>(latestPrices));
		alignedDates = List.copyOf(alignedDates);
		if (mu.length != universe.size() || sigma.length != universe.size()) {
			throw new IllegalArgumentException("Statistics dimensions do not match universe size " + universe.size());
		}
	}

	@Override
	public double[] mu() {
		return mu.clone();
	}

	@Override
	public double[][] sigma() {
		return copy(sigma);
	}

	private static double[][] copy(double[][] matrix) {
		double[][] out = new double[matrix.length][];
		for (int i = 0; i < matrix.length; i++) {
			out[i] = matrix[i].clone();
		}
		return out;
	}
}
