package my.portfoliorecommender.app.marketdata;

import java.util.Optional;

public class CachingMarketDataProvider implements MarketDataProvider {
	private final MarketDataProvider delegate;
	private final MarketDataCache cache;

	public CachingMarketDataProvider(MarketDataProvider delegate, MarketDataCache cache) {
		this.delegate = delegate;
		this.cache = cache;
	}

	@Override
	public PriceSeries fetchWeeklySeries(String ticker) {
		return cache.weeklySeries(ticker, delegate::fetchWeeklySeries);
	}

	@Override
	public Optional<InstrumentOverview> fetchOverview(String ticker) {
		InstrumentOverview overview = cache.overview(ticker,
				key -> delegate.fetchOverview(key).orElseGet(() -> new InstrumentOverview(key, null, null, null)));
		if (overview.beta() == null && overview.marketCapitalization() == null && overview.sector() == null) {
			return Optional.empty();
		}
		return Optional.of(overview);
	}
}
