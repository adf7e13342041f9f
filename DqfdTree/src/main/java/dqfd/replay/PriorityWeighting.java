package dqfd.replay;

// Turns TD errors into pool priorities and draw probabilities into
// importance-sampling weights. Beta grows linearly from beta0 to 1,
// one increment per weight computation.
public class PriorityWeighting {

    // How importance weights are scaled.
    public enum WeightNormalization {
        // Divide by the largest possible weight, i.e. use the pool's minimum probability.
        GLOBAL_MIN,
        // Use the smallest probability of the current draw.
        BATCH_MIN,
        // Raw (N * p)^-beta.
        NONE
    }

    private final double alpha;
    private final double eps;
    private final Double errorMin;
    private final Double errorMax;
    private final WeightNormalization normalization;
    private final double betaIncrement;
    private double beta;

    // errorMin / errorMax clip |error| from below / above; null disables either side
    public PriorityWeighting(double alpha, double beta0, double betaSteps, double eps,
                             Double errorMin, Double errorMax, WeightNormalization normalization) {
        if (!(eps > 0.0)) {
            throw new ConfigurationException("eps must be positive so no priority is zero, got " + eps);
        }
        if (betaSteps <= 0) {
            throw new ConfigurationException("betaSteps must be positive, got " + betaSteps);
        }
        this.alpha = alpha;
        this.beta = beta0;
        this.betaIncrement = (1.0 - beta0) / betaSteps;
        this.eps = eps;
        this.errorMin = errorMin;
        this.errorMax = errorMax;
        this.normalization = normalization;
    }

    public double[] priorityFromErrors(double[] errors) {
        double[] priorities = new double[errors.length];
        for (int i = 0; i < errors.length; i++) {
            priorities[i] = Math.pow(clip(Math.abs(errors[i])) + eps, alpha);
        }
        return priorities;
    }

    // poolSize is the size of the pool the draw came from
    public double[] weightsFromProbabilities(double[] probabilities, double minProbability, int poolSize) {
        double[] weights = new double[probabilities.length];
        double reference = minProbability;
        if (normalization == WeightNormalization.BATCH_MIN) {
            reference = Double.POSITIVE_INFINITY;
            for (double p : probabilities) {
                reference = Math.min(reference, p);
            }
        }
        for (int i = 0; i < probabilities.length; i++) {
            if (normalization == WeightNormalization.NONE) {
                weights[i] = Math.pow(poolSize * probabilities[i], -beta);
            } else {
                weights[i] = Math.pow(probabilities[i] / reference, -beta);
            }
        }
        beta = Math.min(1.0, beta + betaIncrement);
        return weights;
    }

    public double beta() {
        return beta;
    }

    private double clip(double error) {
        double clipped = error;
        if (errorMin != null) {
            clipped = Math.max(errorMin, clipped);
        }
        if (errorMax != null) {
            clipped = Math.min(errorMax, clipped);
        }
        return clipped;
    }
}
