package my.portfoliorecommender.app.service;

import my.portfoliorecommender.app.marketdata.PriceSeries;
import my.portfoliorecommender.app.marketdata.WeeklyBar;
import my.portfoliorecommender.app.model.PortfolioStatistics;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.Covariance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns weekly price series into an aligned return matrix and annualized estimates.
 * <p>
 * Expected returns are annualized by compounding the mean weekly return, the covariance matrix by
 * linear scaling of the weekly sample covariance.
 */
public class StatisticsEngine {
	private static final Logger logger = LoggerFactory.getLogger(StatisticsEngine.class);
	private static final int MIN_ALIGNED_DATES = 3;

	private final int minObservations;
	private final int periodsPerYear;

	public StatisticsEngine(int minObservations, int periodsPerYear) {
		if (minObservations < 2) {
			throw new IllegalArgumentException("minObservations must be at least 2");
		}
		if (periodsPerYear <= 0) {
			throw new IllegalArgumentException("periodsPerYear must be positive");
		}
		this.minObservations = minObservations;
		this.periodsPerYear = periodsPerYear;
	}

	public PortfolioStatistics computeStatistics(List<PriceSeries> seriesList) {
		List<PriceSeries> withData = new ArrayList<>();
		if (seriesList != null) {
			for (PriceSeries series : seriesList) {
				if (series != null && !series.isEmpty()) {
					withData.add(series);
				}
			}
		}
		if (withData.isEmpty()) {
			throw new RecommendationException(RecommendationErrorCode.NO_USABLE_INSTRUMENTS,
					"No price series available to compute statistics",
					Map.of("requestedInstruments", seriesList == null ? 0 : seriesList.size()));
		}

		List<LocalDate> alignedDates = alignDates(withData);
		if (alignedDates.size() < MIN_ALIGNED_DATES) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("alignedDates", alignedDates.size());
			context.put("required", MIN_ALIGNED_DATES);
			context.put("instruments", tickersOf(withData));
			throw new RecommendationException(RecommendationErrorCode.INSUFFICIENT_HISTORY,
					"Not enough overlapping history to compute returns", context);
		}

		LocalDate lastDate = alignedDates.get(alignedDates.size() - 1);
		List<String> kept = new ArrayList<>();
		List<double[]> keptReturns = new ArrayList<>();
		Map<String, Double> latestPrices = new LinkedHashMap<>();
		Map<String, Integer> validCounts = new LinkedHashMap<>();
		for (PriceSeries series : withData) {
			Map<LocalDate, WeeklyBar> bars = series.byDate();
			double lastClose = closeOn(bars, lastDate);
			if (!isUsablePrice(lastClose)) {
				logger.warn("Dropping {}: no usable close on {}", series.ticker(), lastDate);
				validCounts.put(series.ticker(), 0);
				continue;
			}
			double[] returns = new double[alignedDates.size() - 1];
			int valid = 0;
			for (int i = 1; i < alignedDates.size(); i++) {
				double p0 = closeOn(bars, alignedDates.get(i - 1));
				double p1 = closeOn(bars, alignedDates.get(i));
				if (isUsablePrice(p0) && isUsablePrice(p1)) {
					returns[i - 1] = (p1 - p0) / p0;
					valid++;
				} else {
					returns[i - 1] = 0.0;
				}
			}
			validCounts.put(series.ticker(), valid);
			if (valid < minObservations) {
				logger.warn("Dropping {}: {} valid weekly returns (minimum {})", series.ticker(), valid, minObservations);
				continue;
			}
			kept.add(series.ticker());
			keptReturns.add(returns);
			latestPrices.put(series.ticker(), lastClose);
		}

		if (kept.isEmpty()) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("minObservations", minObservations);
			context.put("validReturns", validCounts);
			throw new RecommendationException(RecommendationErrorCode.NO_USABLE_INSTRUMENTS,
					"No instruments with sufficient overlapping history", context);
		}

		int n = kept.size();
		double[] mu = new double[n];
		for (int i = 0; i < n; i++) {
			double weeklyMean = StatUtils.mean(keptReturns.get(i));
			mu[i] = Math.pow(1.0 + weeklyMean, periodsPerYear) - 1.0;
		}
		double[][] sigma = annualizedCovariance(keptReturns);
		logger.debug("Computed statistics for {} instruments over {} aligned dates", n, alignedDates.size());
		return new PortfolioStatistics(kept, mu, sigma, latestPrices, alignedDates);
	}

	private double[][] annualizedCovariance(List<double[]> returns) {
		int n = returns.size();
		int observations = returns.get(0).length;
		double[][] data = new double[observations][n];
		for (int j = 0; j < n; j++) {
			double[] column = returns.get(j);
			for (int t = 0; t < observations; t++) {
				data[t][j] = column[t];
			}
		}
		double[][] weekly = new Covariance(data, true).getCovarianceMatrix().getData();
		double[][] annual = new double[n][n];
		for (int i = 0; i < n; i++) {
			for (int j = i; j < n; j++) {
				double value = weekly[i][j] * periodsPerYear;
				annual[i][j] = value;
				annual[j][i] = value;
			}
		}
		return annual;
	}

	private List<LocalDate> alignDates(List<PriceSeries> seriesList) {
		Set<LocalDate> common = null;
		for (PriceSeries series : seriesList) {
			Set<LocalDate> dates = series.byDate().keySet();
			if (common == null) {
				common = new TreeSet<>(dates);
			} else {
				common.retainAll(dates);
			}
		}
		return common == null ? List.of() : new ArrayList<>(common);
	}

	private List<String> tickersOf(List<PriceSeries> seriesList) {
		List<String> tickers = new ArrayList<>();
		for (PriceSeries series : seriesList) {
			tickers.add(series.ticker());
		}
		return tickers;
	}

	private static double closeOn(Map<LocalDate, WeeklyBar> bars, LocalDate date) {
		WeeklyBar bar = bars.get(date);
		return bar == null ? Double.NaN : bar.close();
	}

	private static boolean isUsablePrice(double price) {
		return Double.isFinite(price) && price > 0;
	}
}
