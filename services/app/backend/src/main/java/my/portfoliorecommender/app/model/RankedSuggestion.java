package my.portfoliorecommender.app.model;

public record RankedSuggestion(String ticker, double score, double price, long shares, String reason) {
}
