package my.portfoliorecommender.app.marketdata;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PriceSeries(String ticker, List<WeeklyBar> bars) {
	public PriceSeries {
		if (ticker == null || ticker.isBlank()) {
			throw new IllegalArgumentException("ticker is required");
		}
		Map<LocalDate, WeeklyBar> byDate = new LinkedHashMap<>();
		if (bars != null) {
			for (WeeklyBar bar : bars) {
				if (bar == null || bar.date() == null) {
					continue;
				}
				byDate.put(bar.date(), bar);
			}
		}
		List<WeeklyBar> sorted = new ArrayList<>(byDate.values());
		sorted.sort(Comparator.comparing(WeeklyBar::date));
		bars = List.copyOf(sorted);
	}

	public boolean isEmpty() {
		return bars.isEmpty();
	}

	public Map<LocalDate, WeeklyBar> byDate() {
		Map<LocalDate, WeeklyBar> map = new LinkedHashMap<>();
		for (WeeklyBar bar : bars) {
			map.put(bar.date(), bar);
		}
		return map;
	}
}
