package my.portfoliorecommender.app.scoring;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearFeatureScorerTest {
	private static final List<String> COLUMNS = List.of("deltaSharpe", "deltaCvar", "mom6");

	@Test
	void scoresInterceptPlusWeightedSum() {
		LinearFeatureScorer scorer = new LinearFeatureScorer(0.5, Map.of("deltaSharpe", 10.0, "mom6", -1.0), COLUMNS);

		double[] scores = scorer.score(new double[][]{{0.01, 0.2, 0.1}, {0.0, 0.0, 0.0}}, COLUMNS);

		assertThat(scores[0]).isCloseTo(0.5, within(1e-12));
		assertThat(scores[1]).isCloseTo(0.5, within(1e-12));
		assertThat(scorer.name()).isEqualTo("linear");
	}

	@Test
	void coefficientKeysIgnoreCaseAndDashes() {
		LinearFeatureScorer scorer = new LinearFeatureScorer(0.0, Map.of("delta-cvar", 2.0, "MOM6", 1.0), COLUMNS);

		double[] scores = scorer.score(new double[][]{{1.0, 0.25, 0.5}}, COLUMNS);

		assertThat(scores[0]).isCloseTo(1.0, within(1e-12));
	}

	@Test
	void rejectsUnknownColumnsAndNonFiniteCoefficients() {
		assertThatThrownBy(() -> new LinearFeatureScorer(0.0, Map.of("sector", 1.0), COLUMNS))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("sector");
		assertThatThrownBy(() -> new LinearFeatureScorer(0.0, Map.of("mom6", Double.NaN), COLUMNS))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void rowWidthMismatchIsScorerError() {
		LinearFeatureScorer scorer = new LinearFeatureScorer(0.0, Map.of(), COLUMNS);

		assertThatThrownBy(() -> scorer.score(new double[][]{{1.0}}, COLUMNS))
				.isInstanceOf(ScorerRequestException.class);
	}
}
