package my.portfoliorecommender.app.marketdata;

import java.util.function.Function;

// Entries never expire; a failing loader leaves no entry behind.
public interface MarketDataCache {
	PriceSeries weeklySeries(String ticker, Function<String, PriceSeries> loader);

	InstrumentOverview overview(String ticker, Function<String, InstrumentOverview> loader);
}
