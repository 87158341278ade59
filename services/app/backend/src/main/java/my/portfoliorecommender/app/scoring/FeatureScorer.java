package my.portfoliorecommender.app.scoring;

import java.util.List;

public interface FeatureScorer {
	double[] score(double[][] features, List<String> featureOrder);

	String name();
}
