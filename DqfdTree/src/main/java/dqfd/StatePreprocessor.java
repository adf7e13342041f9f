package dqfd;

// Maps a raw observation to the feature vector the value estimator consumes.
// Must be pure; it is applied wherever states are batched.
public interface StatePreprocessor {

    double[] apply(double[] observation);

    static StatePreprocessor identity() {
        return observation -> observation;
    }
}
