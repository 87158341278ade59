package my.portfoliorecommender.app.marketdata;

import java.time.LocalDate;

public record WeeklyBar(LocalDate date, double close, double dividend) {
}
