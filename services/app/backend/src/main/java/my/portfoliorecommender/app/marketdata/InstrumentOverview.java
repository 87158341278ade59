package my.portfoliorecommender.app.marketdata;

public record InstrumentOverview(String ticker, Double beta, Double marketCapitalization, String sector) {
}
