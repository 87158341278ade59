package my.portfoliorecommender.app.service;

import my.portfoliorecommender.app.config.AppProperties;
import my.portfoliorecommender.app.dto.HoldingDto;
import my.portfoliorecommender.app.dto.RecommendationDto;
import my.portfoliorecommender.app.dto.RecommendationRequestDto;
import my.portfoliorecommender.app.dto.RecommendationResponseDto;
import my.portfoliorecommender.app.marketdata.MarketDataException;
import my.portfoliorecommender.app.marketdata.MarketDataProvider;
import my.portfoliorecommender.app.model.FeatureSchema;
import my.portfoliorecommender.app.scoring.FeatureScorer;
import my.portfoliorecommender.app.scoring.ScorerRequestException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static my.portfoliorecommender.app.support.PriceSeriesFixtures.fromReturns;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RecommendationServiceTest {
	private static final double[] RETURNS_A = {0.02, -0.01, 0.03, 0.0, 0.01, -0.02, 0.02, 0.01};
	private static final double[] RETURNS_B = {0.01, 0.02, -0.01, 0.03, 0.0, 0.01, -0.005, 0.02};
	private static final double[] RETURNS_C = {0.0, 0.005, 0.01, -0.005, 0.005, 0.0, 0.01, 0.0};

	@Mock
	private MarketDataProvider marketDataProvider;

	@Mock
	private FeatureScorer featureScorer;

	private RecommendationService service;

	@BeforeEach
	void setUp() {
		service = buildService(FeatureAssembler.schema());
		lenient().when(featureScorer.name()).thenReturn("mock");
	}

	@Test
	void recommendsCandidatesOutsideHoldingsRankedByScore() {
		stubSeries();
		when(featureScorer.score(any(), anyList())).thenReturn(new double[]{0.1, 0.7});

		RecommendationResponseDto response = service.recommend(request(List.of(holding(" a ")), 0.35, 1000.0));

		assertThat(response.recommendations()).extracting(RecommendationDto::ticker).containsExactly("C", "B");
		RecommendationDto top = response.recommendations().get(0);
		assertThat(top.score()).isEqualTo(0.7);
		assertThat(top.price()).isCloseTo(102.5175, within(1e-3));
		assertThat(top.shares()).isEqualTo(4L);
		assertThat(top.reason()).isEqualTo(Ranker.DEFAULT_REASON);
		assertThat(response.featureOrder()).isEqualTo(FeatureAssembler.FEATURE_ORDER);
		assertThat(response.schemaVersion()).isEqualTo(FeatureAssembler.SCHEMA_VERSION);
		assertThat(response.targetReturn()).isEqualTo(0.35);
		assertThat(response.weights()).containsOnlyKeys("A", "B", "C");
		assertThat(response.weights().get("C")).isCloseTo(0.5802, within(1e-3));

		ArgumentCaptor<double[][]> features = ArgumentCaptor.forClass(double[][].class);
		verify(featureScorer).score(features.capture(), eq(FeatureAssembler.FEATURE_ORDER));
		assertThat(features.getValue()).hasDimensions(2, 8);
		// C is the largest holding, so its own perturbation is a no-op.
		assertThat(features.getValue()[1][0]).isCloseTo(0.0, within(1e-12));
		assertThat(features.getValue()[0][7]).isEqualTo(0.35);
	}

	@Test
	void missingTargetIsRejectedBeforeLoadingData() {
		assertThatThrownBy(() -> service.recommend(request(List.of(), null, 100.0)))
				.isInstanceOf(RecommendationException.class)
				.extracting(ex -> ((RecommendationException) ex).getCode())
				.isEqualTo(RecommendationErrorCode.INVALID_TARGET);
		assertThatThrownBy(() -> service.recommend(request(List.of(), Double.POSITIVE_INFINITY, 100.0)))
				.isInstanceOf(RecommendationException.class)
				.extracting(ex -> ((RecommendationException) ex).getCode())
				.isEqualTo(RecommendationErrorCode.INVALID_TARGET);
		verifyNoInteractions(marketDataProvider);
	}

	@Test
	void scorerFailureFailsTheWholeRequest() {
		stubSeries();
		when(featureScorer.score(any(), anyList()))
				.thenThrow(new ScorerRequestException("Scorer responded with status 502", 502, null));

		assertThatThrownBy(() -> service.recommend(request(List.of(holding("A")), 0.35, 1000.0)))
				.isInstanceOf(RecommendationException.class)
				.satisfies(ex -> {
					RecommendationException error = (RecommendationException) ex;
					assertThat(error.getCode()).isEqualTo(RecommendationErrorCode.SCORER_UNAVAILABLE);
					assertThat(error.getContext()).containsEntry("status", 502).containsEntry("scorer", "mock");
				});
	}

	@Test
	void holdingEveryInstrumentReturnsEmptyResult() {
		stubSeries();

		RecommendationResponseDto response = service.recommend(
				request(List.of(holding("A"), holding("b"), holding("C")), 0.35, 1000.0));

		assertThat(response.recommendations()).isEmpty();
		assertThat(response.featureOrder()).isEmpty();
		verify(featureScorer, never()).score(any(), anyList());
	}

	@Test
	void skipsInstrumentsTheProviderCannotLoad() {
		when(marketDataProvider.fetchWeeklySeries("A")).thenReturn(fromReturns("A", RETURNS_A));
		when(marketDataProvider.fetchWeeklySeries("B")).thenReturn(fromReturns("B", RETURNS_B));
		when(marketDataProvider.fetchWeeklySeries("C")).thenThrow(new MarketDataException("C", "No price file"));
		when(featureScorer.score(any(), anyList())).thenReturn(new double[]{1.0});

		RecommendationResponseDto response = service.recommend(request(List.of(holding("A")), 0.5, 0.0));

		assertThat(response.weights()).containsOnlyKeys("A", "B");
		assertThat(response.recommendations()).extracting(RecommendationDto::ticker).containsExactly("B");
		assertThat(response.recommendations().get(0).shares()).isZero();
	}

	@Test
	void schemaMismatchStopsBeforeScoring() {
		stubSeries();
		RecommendationService mismatched = buildService(new FeatureSchema(1, List.of("deltaSharpe", "deltaCvar")));

		assertThatThrownBy(() -> mismatched.recommend(request(List.of(holding("A")), 0.35, 1000.0)))
				.isInstanceOf(RecommendationException.class)
				.extracting(ex -> ((RecommendationException) ex).getCode())
				.isEqualTo(RecommendationErrorCode.FEATURE_DIMENSION_MISMATCH);
		verify(featureScorer, never()).score(any(), anyList());
	}

	@Test
	void negativeBudgetIsTreatedAsZero() {
		stubSeries();
		when(featureScorer.score(any(), anyList())).thenReturn(new double[]{0.1, 0.7});

		RecommendationResponseDto response = service.recommend(request(List.of(holding("A")), 0.35, -50.0));

		assertThat(response.recommendations()).allSatisfy(r -> assertThat(r.shares()).isZero());
	}

	private void stubSeries() {
		when(marketDataProvider.fetchWeeklySeries("A")).thenReturn(fromReturns("A", RETURNS_A));
		when(marketDataProvider.fetchWeeklySeries("B")).thenReturn(fromReturns("B", RETURNS_B));
		when(marketDataProvider.fetchWeeklySeries("C")).thenReturn(fromReturns("C", RETURNS_C));
	}

	private RecommendationService buildService(FeatureSchema schema) {
		AppProperties properties = new AppProperties(
				new AppProperties.MarketData("csv", List.of("A", "b", "C"), null, null, null),
				null,
				null,
				null);
		return new RecommendationService(
				properties,
				marketDataProvider,
				new StatisticsEngine(4, 52),
				new MeanVarianceOptimizer(),
				new MarginalUtilityEngine(0.043, 0.95, 0.01, DonorPolicy.LARGEST_HOLDING),
				new FundamentalsService(marketDataProvider),
				new FeatureAssembler(),
				schema,
				featureScorer,
				new Ranker(5));
	}

	private static RecommendationRequestDto request(List<HoldingDto> holdings, Double target, Double budget) {
		return new RecommendationRequestDto(holdings, target, budget);
	}

	private static HoldingDto holding(String ticker) {
		return new HoldingDto(ticker, 10.0, 100.0);
	}
}
