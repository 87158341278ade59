package my.portfoliorecommender.app.marketdata;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.ObjectMapper;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachingMarketDataProviderTest {
	@TempDir
	Path directory;

	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void loadsSeriesOnceAndPersistsIt() {
		CountingProvider delegate = new CountingProvider();
		CachingMarketDataProvider provider = new CachingMarketDataProvider(delegate,
				new FileMarketDataCache(directory, objectMapper));

		PriceSeries first = provider.fetchWeeklySeries("ko");
		PriceSeries second = provider.fetchWeeklySeries("KO");

		assertThat(delegate.seriesCalls.get()).isEqualTo(1);
		assertThat(second).isSameAs(first);
		assertThat(Files.exists(directory.resolve("weekly_KO.json"))).isTrue();
	}

	@Test
	void readsPersistedSeriesAfterRestart() {
		CountingProvider delegate = new CountingProvider();
		new CachingMarketDataProvider(delegate, new FileMarketDataCache(directory, objectMapper)).fetchWeeklySeries("KO");

		CountingProvider fresh = new CountingProvider();
		PriceSeries reloaded = new CachingMarketDataProvider(fresh, new FileMarketDataCache(directory, objectMapper))
				.fetchWeeklySeries("KO");

		assertThat(fresh.seriesCalls.get()).isZero();
		assertThat(reloaded.bars()).hasSize(2);
		assertThat(reloaded.bars().get(0).close()).isNaN();
		assertThat(reloaded.bars().get(1).close()).isEqualTo(61.0);
		assertThat(reloaded.bars().get(1).dividend()).isEqualTo(0.46);
	}

	@Test
	void cachesAbsentOverviewAsEmpty() {
		CountingProvider delegate = new CountingProvider();
		CachingMarketDataProvider provider = new CachingMarketDataProvider(delegate,
				new FileMarketDataCache(directory, objectMapper));

		assertThat(provider.fetchOverview("NONE")).isEmpty();
		assertThat(provider.fetchOverview("NONE")).isEmpty();
		assertThat(delegate.overviewCalls.get()).isEqualTo(1);
	}

	@Test
	void cachesPresentOverview() {
		CountingProvider delegate = new CountingProvider();
		CachingMarketDataProvider provider = new CachingMarketDataProvider(delegate,
				new FileMarketDataCache(directory, objectMapper));

		provider.fetchOverview("KO");
		Optional<InstrumentOverview> reloaded = new CachingMarketDataProvider(new CountingProvider(),
				new FileMarketDataCache(directory, objectMapper)).fetchOverview("KO");

		assertThat(reloaded).isPresent();
		assertThat(reloaded.get().beta()).isEqualTo(0.58);
		assertThat(reloaded.get().sector()).isEqualTo("Consumer Defensive");
	}

	@Test
	void failedLoadLeavesNoEntry() {
		CountingProvider delegate = new CountingProvider();
		delegate.failNext = true;
		CachingMarketDataProvider provider = new CachingMarketDataProvider(delegate,
				new FileMarketDataCache(directory, objectMapper));

		assertThatThrownBy(() -> provider.fetchWeeklySeries("KO")).isInstanceOf(MarketDataException.class);
		PriceSeries series = provider.fetchWeeklySeries("KO");

		assertThat(series.bars()).hasSize(2);
		assertThat(delegate.seriesCalls.get()).isEqualTo(2);
	}

	private static class CountingProvider implements MarketDataProvider {
		private final AtomicInteger seriesCalls = new AtomicInteger();
		private final AtomicInteger overviewCalls = new AtomicInteger();
		private boolean failNext;

		@Override
		public PriceSeries fetchWeeklySeries(String ticker) {
			seriesCalls.incrementAndGet();
			if (failNext) {
				failNext = false;
				throw new MarketDataException(ticker, "rate limited");
			}
			return new PriceSeries(ticker, List.of(
					new WeeklyBar(LocalDate.of(2024, 1, 5), Double.NaN, 0.0),
					new WeeklyBar(LocalDate.of(2024, 1, 12), 61.0, 0.46)));
		}

		@Override
		public Optional<InstrumentOverview> fetchOverview(String ticker) {
			overviewCalls.incrementAndGet();
			if ("KO".equals(ticker)) {
				return Optional.of(new InstrumentOverview(ticker, 0.58, 2.6e11, "Consumer Defensive"));
			}
			return Optional.empty();
		}
	}
}
