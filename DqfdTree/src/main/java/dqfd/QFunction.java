package dqfd;

import org.nd4j.linalg.api.ndarray.INDArray;

/**
 * State-action value estimator with a frozen target copy.
 * All arrays are batches: states {@code [B, features]}, values {@code [B, actions]}.
 */
public interface QFunction {

    int actionSize();

    /** Online estimates, no parameter change. */
    INDArray qValues(INDArray states);

    /** Estimates of the target snapshot. */
    INDArray targetQValues(INDArray states);

    /**
     * Back-propagates {@code lossGradient} (dLoss/dQ for the online estimates of
     * {@code states}) and applies one optimizer step, weight decay included.
     */
    void fitGradient(INDArray states, INDArray lossGradient);

    /** Copies the online parameters into the target snapshot. */
    void syncTarget();

    /** target = tau * online + (1 - tau) * target */
    void softUpdateTarget(double tau);
}
