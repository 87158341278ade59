package my.portfoliorecommender.app.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class DonorPolicyTest {
	@Test
	void largestHoldingTakesEpsilonFromFirstMaximum() {
		double[] perturbed = DonorPolicy.LARGEST_HOLDING.perturb(new double[]{0.4, 0.4, 0.2, 0.0}, 3, 0.01);

		assertThat(perturbed).containsExactly(new double[]{0.39, 0.4, 0.2, 0.01}, within(1e-12));
	}

	@Test
	void largestHoldingFloorsDonorAtZero() {
		double[] perturbed = DonorPolicy.LARGEST_HOLDING.perturb(new double[]{0.005, 0.0}, 1, 0.01);

		assertThat(perturbed).containsExactly(new double[]{0.0, 0.01}, within(1e-12));
	}

	@Test
	void largestHoldingIntoDonorItselfIsNoChange() {
		double[] perturbed = DonorPolicy.LARGEST_HOLDING.perturb(new double[]{0.7, 0.3}, 0, 0.01);

		assertThat(perturbed).containsExactly(new double[]{0.7, 0.3}, within(1e-12));
	}

	@Test
	void proRataKeepsWeightsSummingToOne() {
		double[] perturbed = DonorPolicy.PRO_RATA.perturb(new double[]{0.5, 0.3, 0.2}, 2, 0.01);

		assertThat(perturbed).containsExactly(new double[]{0.49375, 0.29625, 0.21}, within(1e-12));
		assertThat(perturbed[0] + perturbed[1] + perturbed[2]).isCloseTo(1.0, within(1e-12));
	}

	@Test
	void proRataLeavesVectorWhenOthersHoldNothing() {
		double[] perturbed = DonorPolicy.PRO_RATA.perturb(new double[]{0.0, 1.0}, 1, 0.01);

		assertThat(perturbed).containsExactly(0.0, 1.0);
	}
}
