package my.portfoliorecommender.app.scoring;

public class ScorerRequestException extends RuntimeException {
	private final Integer statusCode;

	public ScorerRequestException(String message, Integer statusCode, Throwable cause) {
		super(message, cause);
		this.statusCode = statusCode;
	}

	public Integer getStatusCode() {
		return statusCode;
	}
}
