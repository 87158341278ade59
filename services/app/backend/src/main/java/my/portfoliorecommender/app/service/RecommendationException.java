package my.portfoliorecommender.app.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class RecommendationException extends RuntimeException {
	private final RecommendationErrorCode code;
	private final Map<String, Object> context;

	public RecommendationException(RecommendationErrorCode code, String message, Map<String, ?> context) {
		this(code, message, context, null);
	}

	public RecommendationException(RecommendationErrorCode code, String message, Map<String, ?> context, Throwable cause) {
		super(message, cause);
		this.code = code;
		this.context = context == null
				? Map.of()
				: Collections.unmodifiableMap(new LinkedHashMap<>(context));
	}

	public RecommendationErrorCode getCode() {
		return code;
	}

	public Map<String, Object> getContext() {
		return context;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + code + "]: " + getMessage() + " " + context;
	}
}
