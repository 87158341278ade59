package my.portfoliorecommender.app.marketdata;

import my.portfoliorecommender.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Reads weekly history from {@code <dir>/<TICKER>.csv} (columns {@code date,close,dividend}) and
 * fundamentals from {@code <dir>/fundamentals.csv} (columns {@code ticker,beta,market_cap,sector}).
 */
public class CsvMarketDataProvider implements MarketDataProvider {
	static final String FUNDAMENTALS_FILE = "fundamentals.csv";

	private final Path directory;

	public CsvMarketDataProvider(Path directory) {
		if (directory == null) {
			throw new IllegalArgumentException("CSV market data directory is required");
		}
		this.directory = directory;
	}

	@Override
	public PriceSeries fetchWeeklySeries(String ticker) {
		Path file = directory.resolve(ticker.toUpperCase(Locale.ROOT) + ".csv");
		if (!Files.isRegularFile(file)) {
			throw new MarketDataException(ticker, "No price file for " + ticker + ": " + file);
		}
		List<WeeklyBar> bars = new ArrayList<>();
		for (CSVRecord record : read(ticker, file)) {
			Map<String, String> row = normalizedRow(record);
			String rawDate = row.getOrDefault("date", "");
			if (rawDate.isBlank()) {
				continue;
			}
			LocalDate date;
			try {
				date = LocalDate.parse(rawDate.trim());
			} catch (DateTimeParseException ex) {
				throw new MarketDataException(ticker, "Invalid date '" + rawDate + "' in " + file, ex);
			}
			double close = CsvParsing.parseNumber(row.get("close"));
			double dividend = CsvParsing.parseNumber(row.get("dividend"));
			bars.add(new WeeklyBar(date, close, Double.isFinite(dividend) ? dividend : 0.0));
		}
		return new PriceSeries(ticker, bars);
	}

	@Override
	public Optional<InstrumentOverview> fetchOverview(String ticker) {
		Path file = directory.resolve(FUNDAMENTALS_FILE);
		if (!Files.isRegularFile(file)) {
			return Optional.empty();
		}
		for (CSVRecord record : read(ticker, file)) {
			Map<String, String> row = normalizedRow(record);
			String rowTicker = row.getOrDefault("ticker", "").trim();
			if (!rowTicker.equalsIgnoreCase(ticker)) {
				continue;
			}
			String sector = row.get("sector");
			return Optional.of(new InstrumentOverview(
					ticker,
					CsvParsing.parseOptionalNumber(row.get("beta")),
					CsvParsing.parseOptionalNumber(row.get("market_cap")),
					sector == null || sector.isBlank() ? null : sector.trim()));
		}
		return Optional.empty();
	}

	private List<CSVRecord> read(String ticker, Path file) {
		String text;
		try {
			text = CsvParsing.stripBom(Files.readString(file, StandardCharsets.UTF_8));
		} catch (IOException ex) {
			throw new MarketDataException(ticker, "Failed to read " + file, ex);
		}
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setDelimiter(CsvParsing.sniffDelimiter(text))
				.setHeader()
				.setSkipHeaderRecord(true)
				.setIgnoreEmptyLines(true)
				.setTrim(true)
				.build();
		try (CSVParser parser = CSVParser.parse(new StringReader(text), format)) {
			return parser.getRecords();
		} catch (IOException | IllegalArgumentException ex) {
			throw new MarketDataException(ticker, "Failed to parse " + file + ": " + ex.getMessage(), ex);
		}
	}

	private Map<String, String> normalizedRow(CSVRecord record) {
		Map<String, String> row = new HashMap<>();
		for (Map.Entry<String, String> entry : record.toMap().entrySet()) {
			if (entry.getKey() != null) {
				row.put(entry.getKey().trim().toLowerCase(Locale.ROOT), entry.getValue());
			}
		}
		return row;
	}
}
