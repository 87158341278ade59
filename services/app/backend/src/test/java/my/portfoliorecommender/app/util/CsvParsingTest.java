package my.portfoliorecommender.app.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CsvParsingTest {
	@Test
	void stripBomRemovesLeadingMarker() {
		String value = "\uFEFFdate,close,dividend";
		assertThat(CsvParsing.stripBom(value)).isEqualTo("date,close,dividend");
	}

	@Test
	void stripBomHandlesNullAndEmpty() {
		assertThat(CsvParsing.stripBom(null)).isNull();
		assertThat(CsvParsing.stripBom("")).isEqualTo("");
	}

	@Test
	void sniffDelimiterPrefersSemicolonOnlyWhenHeaderHasNoComma() {
		assertThat(CsvParsing.sniffDelimiter("date;close;dividend\n2024-01-05;1,5;0")).isEqualTo(';');
		assertThat(CsvParsing.sniffDelimiter("date,close;x\n1,2;3")).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter("abc")).isEqualTo(',');
	}

	@Test
	void sniffDelimiterHandlesNullOrEmpty() {
		assertThat(CsvParsing.sniffDelimiter(null)).isEqualTo(',');
		assertThat(CsvParsing.sniffDelimiter("")).isEqualTo(',');
	}

	@Test
	void parseNumberMapsPlaceholdersToNaN() {
		assertThat(CsvParsing.parseNumber(" 12.5 ")).isEqualTo(12.5);
		assertThat(CsvParsing.parseNumber("None")).isNaN();
		assertThat(CsvParsing.parseNumber("-")).isNaN();
		assertThat(CsvParsing.parseNumber("")).isNaN();
		assertThat(CsvParsing.parseNumber(null)).isNaN();
		assertThat(CsvParsing.parseNumber("abc")).isNaN();
	}

	@Test
	void parseOptionalNumberReturnsNullForMissingValues() {
		assertThat(CsvParsing.parseOptionalNumber("1.25")).isEqualTo(1.25);
		assertThat(CsvParsing.parseOptionalNumber("n/a")).isNull();
		assertThat(CsvParsing.parseOptionalNumber("NaN")).isNull();
	}
}
