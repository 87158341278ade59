package my.portfoliorecommender.app.marketdata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

public class FileMarketDataCache implements MarketDataCache {
	private static final Logger logger = LoggerFactory.getLogger(FileMarketDataCache.class);

	private final Path directory;
	private final ObjectMapper objectMapper;
	private final Map<String, PriceSeries> seriesByTicker = new ConcurrentHashMap<>();
	private final Map<String, InstrumentOverview> overviewByTicker = new ConcurrentHashMap<>();

	public FileMarketDataCache(Path directory, ObjectMapper objectMapper) {
		this.directory = directory;
		this.objectMapper = objectMapper;
		try {
			Files.createDirectories(directory);
		} catch (IOException ex) {
			throw new IllegalStateException("Cannot create market data cache directory " + directory, ex);
		}
	}

	@Override
	public PriceSeries weeklySeries(String ticker, Function<String, PriceSeries> loader) {
		String key = key(ticker);
		return seriesByTicker.computeIfAbsent(key, k -> {
			Path file = directory.resolve("weekly_" + k + ".json");
			CachedSeries cached = readFile(file, CachedSeries.class);
			if (cached != null) {
				return cached.toSeries();
			}
			PriceSeries loaded = loader.apply(ticker);
			writeFile(file, CachedSeries.from(loaded));
			return loaded;
		});
	}

	@Override
	public InstrumentOverview overview(String ticker, Function<String, InstrumentOverview> loader) {
		String key = key(ticker);
		return overviewByTicker.computeIfAbsent(key, k -> {
			Path file = directory.resolve("overview_" + k + ".json");
			InstrumentOverview cached = readFile(file, InstrumentOverview.class);
			if (cached != null) {
				return cached;
			}
			InstrumentOverview loaded = loader.apply(ticker);
			writeFile(file, loaded);
			return loaded;
		});
	}

	private <T> T readFile(Path file, Class<T> type) {
		if (!Files.isRegularFile(file)) {
			return null;
		}
		try {
			return objectMapper.readValue(file.toFile(), type);
		} catch (JacksonException ex) {
			logger.warn("Ignoring unreadable cache file {}: {}", file, ex.getMessage());
			return null;
		}
	}

	private void writeFile(Path file, Object value) {
		Path temp = null;
		try {
			temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
			objectMapper.writeValue(temp.toFile(), value);
			try {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException ex) {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
			}
		} catch (IOException | JacksonException ex) {
			logger.warn("Failed to write cache file {}: {}", file, ex.getMessage());
			deleteQuietly(temp);
		}
	}

	private void deleteQuietly(Path temp) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		} catch (IOException ex) {
			logger.debug("Failed to delete temp cache file {}: {}", temp, ex.getMessage());
		}
	}

	private static String key(String ticker) {
		return ticker.trim().toUpperCase(Locale.ROOT);
	}

	public record CachedSeries(String ticker, List<CachedBar> bars) {
		static CachedSeries from(PriceSeries series) {
			List<CachedBar> bars = new ArrayList<>(series.bars().size());
			for (WeeklyBar bar : series.bars()) {
				bars.add(new CachedBar(bar.date().toString(),
						Double.isFinite(bar.close()) ? bar.close() : null,
						bar.dividend()));
			}
			return new CachedSeries(series.ticker(), bars);
		}

		PriceSeries toSeries() {
			List<WeeklyBar> out = new ArrayList<>();
			if (bars != null) {
				for (CachedBar bar : bars) {
					out.add(new WeeklyBar(LocalDate.parse(bar.date()),
							bar.close() == null ? Double.NaN : bar.close(),
							bar.dividend()));
				}
			}
			return new PriceSeries(ticker, out);
		}
	}

	public record CachedBar(String date, Double close, double dividend) {
	}
}
