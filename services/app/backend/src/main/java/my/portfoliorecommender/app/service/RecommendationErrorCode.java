package my.portfoliorecommender.app.service;

public enum RecommendationErrorCode {
	INSUFFICIENT_HISTORY,
	NO_USABLE_INSTRUMENTS,
	INFEASIBLE_TARGET,
	ILL_CONDITIONED_COVARIANCE,
	DEGENERATE_BASELINE,
	FEATURE_DIMENSION_MISMATCH,
	INVALID_TARGET,
	SCORER_UNAVAILABLE
}
