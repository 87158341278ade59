package my.portfoliorecommender.app.model;

import java.util.List;

public record FeatureSchema(int version, List<String> columns) {
	public FeatureSchema {
		if (version <= 0) {
			throw new IllegalArgumentException("Feature schema version must be positive");
		}
		if (columns == null || columns.isEmpty()) {
			throw new IllegalArgumentException("Feature schema must declare at least one column");
		}
		columns = List.copyOf(columns);
	}

	public int columnCount() {
		return columns.size();
	}
}
