package my.portfoliorecommender.app.model;

public record MarginalMetrics(String ticker, double deltaSharpe, double deltaCvar) {
}
