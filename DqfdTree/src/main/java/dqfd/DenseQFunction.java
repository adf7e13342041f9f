package dqfd;

import org.deeplearning4j.nn.gradient.Gradient;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.workspace.LayerWorkspaceMgr;
import org.deeplearning4j.util.ModelSerializer;
import org.nd4j.common.primitives.Pair;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

// QFunction over two identical DL4J dense networks: an online network
// trained with Adam (weight decay in the updater) and a target copy.
public class DenseQFunction implements QFunction {
    private static final Logger LOGGER = LoggerFactory.getLogger(DenseQFunction.class);

    private MultiLayerNetwork qNetworkLocal;
    private final MultiLayerNetwork qNetworkTarget;
    private final int actionSize;

    public DenseQFunction(Config config) {
        this(QNetworkBuilder.buildQNetwork(config.stateSize, config.actionSize, config.hiddenDim,
                        config.lr, config.lossCoeffL2, config.randomSeed + 1),
                QNetworkBuilder.buildQNetwork(config.stateSize, config.actionSize, config.hiddenDim,
                        config.lr, config.lossCoeffL2, config.randomSeed + 2),
                config.actionSize);
    }

    public DenseQFunction(MultiLayerNetwork local, MultiLayerNetwork target, int actionSize) {
        this.qNetworkLocal = local;
        this.qNetworkTarget = target;
        this.actionSize = actionSize;
        // Initialize target network with local network's weights
        syncTarget();
    }

    @Override
    public int actionSize() {
        return actionSize;
    }

    @Override
    public INDArray qValues(INDArray states) {
        return qNetworkLocal.output(toDouble(states), false);
    }

    @Override
    public INDArray targetQValues(INDArray states) {
        return qNetworkTarget.output(toDouble(states), false);
    }

    @Override
    public void fitGradient(INDArray states, INDArray lossGradient) {
        // Layer inputs may have been overwritten by other forward passes, replay the training pass
        qNetworkLocal.setInput(toDouble(states));
        qNetworkLocal.feedForward(true, false);
        Pair<Gradient, INDArray> backprop =
                qNetworkLocal.backpropGradient(toDouble(lossGradient), LayerWorkspaceMgr.noWorkspaces());
        Gradient gradient = backprop.getFirst();

        int iteration = qNetworkLocal.getIterationCount();
        int epoch = qNetworkLocal.getEpochCount();
        qNetworkLocal.getUpdater().update(qNetworkLocal, gradient, iteration, epoch,
                (int) states.size(0), LayerWorkspaceMgr.noWorkspaces());
        qNetworkLocal.params().subi(gradient.gradient());
        qNetworkLocal.setIterationCount(iteration + 1);
        qNetworkLocal.clear();
    }

    @Override
    public void syncTarget() {
        qNetworkTarget.setParams(qNetworkLocal.params().dup());
    }

    @Override
    public void softUpdateTarget(double tau) {
        INDArray localParams = qNetworkLocal.params();
        INDArray targetParams = qNetworkTarget.params();

        // target = tau * local + (1 - tau) * target
        INDArray updatedTargetParams = localParams.mul(tau).add(targetParams.mul(1.0 - tau));
        qNetworkTarget.setParams(updatedTargetParams);
    }

    public MultiLayerNetwork localNetwork() {
        return qNetworkLocal;
    }

    // --- Model Saving/Loading (using DL4J utilities) ---
    public void saveModel(String filePath) throws IOException {
        File file = new File(filePath);
        boolean saveUpdater = true; // Save optimizer state as well
        ModelSerializer.writeModel(qNetworkLocal, file, saveUpdater);
        LOGGER.info("Model saved to {}", filePath);
    }

    public void loadModel(String filePath) throws IOException {
        File file = new File(filePath);
        qNetworkLocal = ModelSerializer.restoreMultiLayerNetwork(file);
        // Important: Update target network after loading
        syncTarget();
        LOGGER.info("Model loaded from {}", filePath);
    }

    private static INDArray toDouble(INDArray array) {
        return array.dataType() == DataType.DOUBLE ? array : array.castTo(DataType.DOUBLE);
    }
}
