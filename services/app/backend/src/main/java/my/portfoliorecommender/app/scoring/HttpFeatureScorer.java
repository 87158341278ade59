package my.portfoliorecommender.app.scoring;

import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class HttpFeatureScorer implements FeatureScorer {
	private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
	private static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);

	private final RestClient restClient;
	private final ObjectMapper objectMapper;
	private final String path;

	public HttpFeatureScorer(String baseUrl, String path, ObjectMapper objectMapper) {
		this(baseUrl, path, objectMapper, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
	}

	public HttpFeatureScorer(String baseUrl,
							 String path,
							 ObjectMapper objectMapper,
							 Duration connectTimeout,
							 Duration readTimeout) {
		if (baseUrl == null || baseUrl.isBlank()) {
			throw new IllegalArgumentException("Scorer base URL is required");
		}
		SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
		requestFactory.setConnectTimeout(connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout);
		requestFactory.setReadTimeout(readTimeout == null ? DEFAULT_READ_TIMEOUT : readTimeout);
		this.restClient = RestClient.builder()
				.baseUrl(baseUrl)
				.requestFactory(requestFactory)
				.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
				.build();
		this.objectMapper = objectMapper;
		this.path = path == null || path.isBlank() ? "/score" : path;
	}

	@Override
	public double[] score(double[][] features, List<String> featureOrder) {
		Map<String, Object> request = new LinkedHashMap<>();
		request.put("columns", featureOrder);
		request.put("instances", features);
		String body;
		try {
			String payload = objectMapper.writeValueAsString(request);
			body = restClient.post()
					.uri(path)
					.contentType(MediaType.APPLICATION_JSON)
					.body(payload)
					.retrieve()
					.body(String.class);
		} catch (RestClientResponseException ex) {
			throw new ScorerRequestException("Scorer responded with status " + ex.getStatusCode().value(),
					ex.getStatusCode().value(), ex);
		} catch (ResourceAccessException ex) {
			throw new ScorerRequestException("Scorer unreachable or timed out: " + ex.getMessage(), null, ex);
		} catch (RestClientException ex) {
			throw new ScorerRequestException("Scorer request failed: " + ex.getMessage(), null, ex);
		} catch (JacksonException ex) {
			throw new ScorerRequestException("Failed to serialize scorer request", null, ex);
		}
		return parseScores(body, features.length);
	}

	@Override
	public String name() {
		return "http";
	}

	private double[] parseScores(String body, int expectedRows) {
		if (body == null || body.isBlank()) {
			throw new ScorerRequestException("Scorer returned an empty response", null, null);
		}
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		} catch (JacksonException ex) {
			throw new ScorerRequestException("Scorer returned invalid JSON", null, ex);
		}
		JsonNode scores = root == null ? null : root.get("scores");
		if (scores == null || !scores.isArray()) {
			throw new ScorerRequestException("Scorer response has no scores array", null, null);
		}
		if (scores.size() != expectedRows) {
			throw new ScorerRequestException("Scorer returned " + scores.size() + " scores for "
					+ expectedRows + " rows", null, null);
		}
		double[] out = new double[expectedRows];
		for (int i = 0; i < expectedRows; i++) {
			JsonNode node = scores.get(i);
			if (node == null || !node.isNumber()) {
				throw new ScorerRequestException("Score " + i + " is not a number", null, null);
			}
			out[i] = node.asDouble();
		}
		return out;
	}
}
