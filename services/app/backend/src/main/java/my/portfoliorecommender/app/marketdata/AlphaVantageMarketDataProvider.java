package my.portfoliorecommender.app.marketdata;

import my.portfoliorecommender.app.util.CsvParsing;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class AlphaVantageMarketDataProvider implements MarketDataProvider {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
	private static final String WEEKLY_SERIES_KEY = "Weekly Adjusted Time Series";
	private static final String CLOSE_FIELD = "4. close";
	private static final String DIVIDEND_FIELD = "7. dividend amount";
	private static final List<String> ERROR_KEYS = List.of("Error Message", "Note", "Information");

	private final RestClient restClient;
	private final ObjectMapper objectMapper;
	private final String apiKey;

	public AlphaVantageMarketDataProvider(String baseUrl, String apiKey, ObjectMapper objectMapper) {
		this(baseUrl, apiKey, objectMapper, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public AlphaVantageMarketDataProvider(String baseUrl,
										  String apiKey,
										  ObjectMapper objectMapper,
										  Duration connectTimeout,
										  Duration readTimeout) {
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.objectMapper = objectMapper;
		this.apiKey = apiKey;
	}

	@Override
	public PriceSeries fetchWeeklySeries(String ticker) {
		JsonNode root = query("TIME_SERIES_WEEKLY_ADJUSTED", ticker);
		JsonNode series = root.get(WEEKLY_SERIES_KEY);
		if (series == null || !series.isObject()) {
			throw new MarketDataException(ticker, "Response has no '" + WEEKLY_SERIES_KEY + "' section");
		}
		List<WeeklyBar> bars = new ArrayList<>();
		for (Map.Entry<String, JsonNode> entry : series.properties()) {
			LocalDate date;
			try {
				date = LocalDate.parse(entry.getKey());
			} catch (DateTimeParseException ex) {
				throw new MarketDataException(ticker, "Invalid date key '" + entry.getKey() + "'", ex);
			}
			JsonNode bar = entry.getValue();
			double close = CsvParsing.parseNumber(text(bar, CLOSE_FIELD));
			double dividend = CsvParsing.parseNumber(text(bar, DIVIDEND_FIELD));
			bars.add(new WeeklyBar(date, close, Double.isFinite(dividend) ? dividend : 0.0));
		}
		return new PriceSeries(ticker, bars);
	}

	@Override
	public Optional<InstrumentOverview> fetchOverview(String ticker) {
		JsonNode root = query("OVERVIEW", ticker);
		if (root.isEmpty()) {
			return Optional.empty();
		}
		Double beta = CsvParsing.parseOptionalNumber(text(root, "Beta"));
		Double marketCap = CsvParsing.parseOptionalNumber(text(root, "MarketCapitalization"));
		String sector = text(root, "Sector");
		if (sector != null && (sector.isBlank() || "None".equalsIgnoreCase(sector))) {
			sector = null;
		}
		return Optional.of(new InstrumentOverview(ticker, beta, marketCap, sector));
	}

	private JsonNode query(String function, String ticker) {
		String body;
		try {
			body = restClient.get()
					.uri(uriBuilder -> uriBuilder.path("/query")
							.queryParam("function", function)
							.queryParam("symbol", ticker)
							.queryParam("apikey", apiKey)
							.build())
					.retrieve()
					.body(String.class);
		} catch (RestClientResponseException ex) {
			throw new MarketDataException(ticker, function + " failed with status " + ex.getStatusCode().value(), ex);
		} catch (RestClientException ex) {
			throw new MarketDataException(ticker, function + " request failed: " + ex.getMessage(), ex);
		}
		if (body == null || body.isBlank()) {
			throw new MarketDataException(ticker, function + " returned an empty body");
		}
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		} catch (JacksonException ex) {
			throw new MarketDataException(ticker, function + " returned invalid JSON", ex);
		}
		if (root == null || !root.isObject()) {
			throw new MarketDataException(ticker, function + " returned a non-object payload");
		}
		for (String key : ERROR_KEYS) {
			JsonNode message = root.get(key);
			if (message != null && !message.isNull()) {
				throw new MarketDataException(ticker, function + " rejected: " + message.asText());
			}
		}
		return root;
	}

	private static String text(JsonNode node, String field) {
		if (node == null) {
			return null;
		}
		JsonNode value = node.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}
}
