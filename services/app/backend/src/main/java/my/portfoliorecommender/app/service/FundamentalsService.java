package my.portfoliorecommender.app.service;

import my.portfoliorecommender.app.marketdata.InstrumentOverview;
import my.portfoliorecommender.app.marketdata.MarketDataException;
import my.portfoliorecommender.app.marketdata.MarketDataProvider;
import my.portfoliorecommender.app.marketdata.PriceSeries;
import my.portfoliorecommender.app.marketdata.WeeklyBar;
import my.portfoliorecommender.app.model.FundamentalRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class FundamentalsService {
	private static final Logger logger = LoggerFactory.getLogger(FundamentalsService.class);
	static final int DIVIDEND_WINDOW_WEEKS = 52;
	static final int MOMENTUM_6M_WEEKS = 26;
	static final int MOMENTUM_12M_WEEKS = 52;

	private final MarketDataProvider marketDataProvider;

	public FundamentalsService(MarketDataProvider marketDataProvider) {
		this.marketDataProvider = marketDataProvider;
	}

	public Map<String, FundamentalRow> fundamentalsFor(List<String> tickers, Map<String, PriceSeries> seriesByTicker) {
		Map<String, FundamentalRow> rows = new LinkedHashMap<>();
		for (String ticker : tickers) {
			PriceSeries series = seriesByTicker == null ? null : seriesByTicker.get(ticker);
			InstrumentOverview overview = overviewOrNull(ticker);
			rows.put(ticker, toRow(series, overview));
		}
		return rows;
	}

	FundamentalRow toRow(PriceSeries series, InstrumentOverview overview) {
		double beta = Double.NaN;
		double logCap = Double.NaN;
		String sector = null;
		if (overview != null) {
			if (overview.beta() != null && Double.isFinite(overview.beta())) {
				beta = overview.beta();
			}
			Double marketCap = overview.marketCapitalization();
			if (marketCap != null && Double.isFinite(marketCap) && marketCap > 0) {
				logCap = Math.log(marketCap);
			}
			sector = overview.sector();
		}
		List<WeeklyBar> bars = series == null ? List.of() : series.bars();
		return new FundamentalRow(
				beta,
				trailingDividendYield(bars),
				logCap,
				momentum(bars, MOMENTUM_6M_WEEKS),
				momentum(bars, MOMENTUM_12M_WEEKS),
				sector);
	}

	static double trailingDividendYield(List<WeeklyBar> bars) {
		if (bars.isEmpty()) {
			return 0.0;
		}
		double lastClose = bars.get(bars.size() - 1).close();
		if (!Double.isFinite(lastClose) || lastClose <= 0) {
			return 0.0;
		}
		double dividends = 0.0;
		for (WeeklyBar bar : bars.subList(Math.max(0, bars.size() - DIVIDEND_WINDOW_WEEKS), bars.size())) {
			if (Double.isFinite(bar.dividend())) {
				dividends += bar.dividend();
			}
		}
		return Math.max(0.0, dividends / lastClose);
	}

	static double momentum(List<WeeklyBar> bars, int weeks) {
		if (bars.size() < weeks + 1) {
			return 0.0;
		}
		double last = bars.get(bars.size() - 1).close();
		double previous = bars.get(bars.size() - 1 - weeks).close();
		if (!Double.isFinite(last) || !Double.isFinite(previous) || previous <= 0) {
			return 0.0;
		}
		return last / previous - 1.0;
	}

	private InstrumentOverview overviewOrNull(String ticker) {
		try {
			Optional<InstrumentOverview> overview = marketDataProvider.fetchOverview(ticker);
			return overview.orElse(null);
		} catch (MarketDataException ex) {
			logger.warn("Overview unavailable for {}: {}", ticker, ex.getMessage());
			return null;
		}
	}
}
