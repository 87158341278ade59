package my.portfoliorecommender.app.model;

// NaN marks a value the provider did not supply.
public record FundamentalRow(double beta,
							 double divYield,
							 double logCap,
							 double mom6,
							 double mom12,
							 String sector) {
	public static FundamentalRow empty() {
		return new FundamentalRow(Double.NaN, 0.0, Double.NaN, 0.0, 0.0, null);
	}
}
