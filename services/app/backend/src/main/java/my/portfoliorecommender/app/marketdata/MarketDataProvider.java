package my.portfoliorecommender.app.marketdata;

import java.util.Optional;

public interface MarketDataProvider {
	PriceSeries fetchWeeklySeries(String ticker);

	Optional<InstrumentOverview> fetchOverview(String ticker);
}
