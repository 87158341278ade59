package my.portfoliorecommender.app.marketdata;

public class MarketDataException extends RuntimeException {
	private final String ticker;

	public MarketDataException(String ticker, String message) {
		this(ticker, message, null);
	}

	public MarketDataException(String ticker, String message, Throwable cause) {
		super(message, cause);
		this.ticker = ticker;
	}

	public String getTicker() {
		return ticker;
	}
}
