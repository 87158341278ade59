package my.portfoliorecommender.app.util;

import java.util.Locale;

public final class CsvParsing {
	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		String header = sample.lines().findFirst().orElse("");
		boolean hasComma = header.indexOf(',') >= 0;
		boolean hasSemicolon = header.indexOf(';') >= 0;
		if (hasSemicolon && !hasComma) {
			return ';';
		}
		return ',';
	}

	public static double parseNumber(String raw) {
		if (raw == null) {
			return Double.NaN;
		}
		String trimmed = raw.trim();
		if (trimmed.isEmpty()) {
			return Double.NaN;
		}
		String lower = trimmed.toLowerCase(Locale.ROOT);
		if ("none".equals(lower) || "-".equals(lower) || "null".equals(lower) || "n/a".equals(lower)) {
			return Double.NaN;
		}
		try {
			return Double.parseDouble(trimmed);
		} catch (NumberFormatException ex) {
			return Double.NaN;
		}
	}

	public static Double parseOptionalNumber(String raw) {
		double value = parseNumber(raw);
		return Double.isFinite(value) ? value : null;
	}
}
