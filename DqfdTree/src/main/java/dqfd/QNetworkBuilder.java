package dqfd;

import org.deeplearning4j.nn.conf.MultiLayerConfiguration;
import org.deeplearning4j.nn.conf.NeuralNetConfiguration;
import org.deeplearning4j.nn.conf.WorkspaceMode;
import org.deeplearning4j.nn.conf.layers.DenseLayer;
import org.deeplearning4j.nn.multilayer.MultiLayerNetwork;
import org.deeplearning4j.nn.weights.WeightInit;
import org.nd4j.linalg.activations.Activation;
import org.nd4j.linalg.api.buffer.DataType;
import org.nd4j.linalg.learning.config.Adam;

// Helper class to build the DL4J network
public class QNetworkBuilder {

    // The last layer is a plain identity dense layer rather than an OutputLayer: the
    // DQfD loss is not one of DL4J's built-in losses, so its gradient is supplied
    // from outside through backpropGradient.
    public static MultiLayerNetwork buildQNetwork(int stateSize, int actionSize, int hiddenDim,
                                                  double learningRate, double weightDecay, long seed) {
        MultiLayerConfiguration conf = new NeuralNetConfiguration.Builder()
                .seed(seed)
                .dataType(DataType.DOUBLE)
                .weightInit(WeightInit.XAVIER)
                .updater(new Adam(learningRate))
                .weightDecay(weightDecay)
                .miniBatch(false) // externally supplied gradients are already batch-averaged
                .trainingWorkspaceMode(WorkspaceMode.NONE)
                .inferenceWorkspaceMode(WorkspaceMode.NONE)
                .list()
                .layer(0, new DenseLayer.Builder().nIn(stateSize).nOut(hiddenDim)
                        .activation(Activation.RELU)
                        .build())
                .layer(1, new DenseLayer.Builder().nIn(hiddenDim).nOut(hiddenDim)
                        .activation(Activation.RELU)
                        .build())
                .layer(2, new DenseLayer.Builder().nIn(hiddenDim).nOut(actionSize)
                        .activation(Activation.IDENTITY) // Linear output for Q-values
                        .build())
                .build();

        MultiLayerNetwork model = new MultiLayerNetwork(conf);
        model.init();
        model.initGradientsView();
        return model;
    }
}
