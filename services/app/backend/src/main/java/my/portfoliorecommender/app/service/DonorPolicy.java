package my.portfoliorecommender.app.service;

/**
 * Decides which holdings give up weight when a candidate receives an epsilon allocation.
 */
public enum DonorPolicy {
	LARGEST_HOLDING {
		@Override
		public double[] perturb(double[] weights, int candidate, double epsilon) {
			double[] out = weights.clone();
			int donor = 0;
			for (int i = 1; i < out.length; i++) {
				if (out[i] > out[donor]) {
					donor = i;
				}
			}
			out[donor] = Math.max(0.0, out[donor] - epsilon);
			out[candidate] += epsilon;
			return out;
		}
	},
	PRO_RATA {
		@Override
		public double[] perturb(double[] weights, int candidate, double epsilon) {
			double[] out = weights.clone();
			double others = 0.0;
			for (int i = 0; i < out.length; i++) {
				if (i != candidate) {
					others += out[i];
				}
			}
			if (others <= 0.0) {
				return out;
			}
			double taken = Math.min(epsilon, others);
			for (int i = 0; i < out.length; i++) {
				if (i != candidate) {
					out[i] -= taken * out[i] / others;
				}
			}
			out[candidate] += taken;
			return out;
		}
	};

	public abstract double[] perturb(double[] weights, int candidate, double epsilon);
}
