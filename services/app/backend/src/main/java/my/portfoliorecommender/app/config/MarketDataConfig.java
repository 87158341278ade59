package my.portfoliorecommender.app.config;

import my.portfoliorecommender.app.marketdata.AlphaVantageMarketDataProvider;
import my.portfoliorecommender.app.marketdata.CachingMarketDataProvider;
import my.portfoliorecommender.app.marketdata.CsvMarketDataProvider;
import my.portfoliorecommender.app.marketdata.FileMarketDataCache;
import my.portfoliorecommender.app.marketdata.MarketDataProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class MarketDataConfig {
	private static final Logger logger = LoggerFactory.getLogger(MarketDataConfig.class);
	private static final String DEFAULT_ALPHA_VANTAGE_URL = "https://www.alphavantage.co";
	private static final String DEFAULT_CSV_DIRECTORY = "data/weekly";

	@Bean
	@ConditionalOnProperty(name = "app.market-data.provider", havingValue = "alphavantage")
	public MarketDataProvider alphaVantageMarketDataProvider(AppProperties properties, ObjectMapper objectMapper) {
		AppProperties.MarketData.AlphaVantage settings = properties.marketData().alphavantage();
		String apiKey = settings == null ? null : settings.apiKey();
		if (apiKey == null || apiKey.isBlank()) {
			throw new IllegalStateException("app.market-data.alphavantage.api-key is required for provider=alphavantage");
		}
		String baseUrl = settings.baseUrl() == null || settings.baseUrl().isBlank()
				? DEFAULT_ALPHA_VANTAGE_URL
				: settings.baseUrl();
		Duration connectTimeout = settings.connectTimeoutSeconds() == null
				? null
				: Duration.ofSeconds(settings.connectTimeoutSeconds());
		Duration readTimeout = settings.readTimeoutSeconds() == null
				? null
				: Duration.ofSeconds(settings.readTimeoutSeconds());
		logger.info("Market data provider enabled (provider=alphavantage, baseUrl={}).", baseUrl);
		return withCache(new AlphaVantageMarketDataProvider(baseUrl, apiKey, objectMapper, connectTimeout, readTimeout),
				properties, objectMapper);
	}

	@Bean
	@ConditionalOnProperty(name = "app.market-data.provider", havingValue = "csv", matchIfMissing = true)
	public MarketDataProvider csvMarketDataProvider(AppProperties properties, ObjectMapper objectMapper) {
		String directory = properties.marketData().csvDirectory();
		Path path = Path.of(directory == null || directory.isBlank() ? DEFAULT_CSV_DIRECTORY : directory);
		logger.info("Market data provider enabled (provider=csv, directory={}).", path.toAbsolutePath());
		return withCache(new CsvMarketDataProvider(path), properties, objectMapper);
	}

	private MarketDataProvider withCache(MarketDataProvider provider, AppProperties properties, ObjectMapper objectMapper) {
		String cacheDirectory = properties.marketData().cacheDirectory();
		if (cacheDirectory == null || cacheDirectory.isBlank()) {
			return provider;
		}
		logger.info("Market data cache enabled (directory={}).", cacheDirectory);
		return new CachingMarketDataProvider(provider, new FileMarketDataCache(Path.of(cacheDirectory), objectMapper));
	}
}
