package com.safeops.anomaly.engine.autoencoder;

import java.util.Random;

/**
 * Fully connected layer with optional ReLU, trained with Adam.
 * Gradient and moment buffers are only touched while the owning network trains.
 */
final class DenseLayer {

    private static final double BETA1 = 0.9;
    private static final double BETA2 = 0.999;
    private static final double ADAM_EPSILON = 1e-7;

    private final int inputs;
    private final int outputs;
    private final boolean relu;

    private final double[][] weights;
    private final double[] bias;

    private final double[][] weightGrad;
    private final double[] biasGrad;
    private final double[][] weightM;
    private final double[][] weightV;
    private final double[] biasM;
    private final double[] biasV;

    private DenseLayer(int inputs, int outputs, boolean relu) {
        this.inputs = inputs;
        this.outputs = outputs;
        this.relu = relu;
        this.weights = new double[outputs][inputs];
        this.bias = new double[outputs];
        this.weightGrad = new double[outputs][inputs];
        this.biasGrad = new double[outputs];
        this.weightM = new double[outputs][inputs];
        this.weightV = new double[outputs][inputs];
        this.biasM = new double[outputs];
        this.biasV = new double[outputs];
    }

    /**
     * Glorot-uniform weights, zero bias.
     */
    static DenseLayer create(int inputs, int outputs, boolean relu, Random random) {
        DenseLayer layer = new DenseLayer(inputs, outputs, relu);
        double limit = Math.sqrt(6.0 / (inputs + outputs));
        for (int o = 0; o < outputs; o++) {
            for (int i = 0; i < inputs; i++) {
                layer.weights[o][i] = (random.nextDouble() * 2.0 - 1.0) * limit;
            }
        }
        return layer;
    }

    double[] forward(double[] input) {
        double[] out = new double[outputs];
        for (int o = 0; o < outputs; o++) {
            double z = bias[o];
            double[] row = weights[o];
            for (int i = 0; i < inputs; i++) {
                z += row[i] * input[i];
            }
            out[o] = relu && z < 0 ? 0.0 : z;
        }
        return out;
    }

    /**
     * Accumulate gradients for one sample and return the gradient with respect to the input.
     *
     * @param input      the sample's input to this layer
     * @param activation this layer's output for that input
     * @param gradOutput loss gradient with respect to {@code activation}
     */
    double[] backward(double[] input, double[] activation, double[] gradOutput) {
        double[] gradInput = new double[inputs];
        for (int o = 0; o < outputs; o++) {
            // ReLU passes gradient only where it was active.
            double delta = relu && activation[o] <= 0 ? 0.0 : gradOutput[o];
            if (delta == 0.0) continue;
            biasGrad[o] += delta;
            double[] row = weights[o];
            double[] gradRow = weightGrad[o];
            for (int i = 0; i < inputs; i++) {
                gradRow[i] += delta * input[i];
                gradInput[i] += delta * row[i];
            }
        }
        return gradInput;
    }

    /**
     * Apply one Adam update from the accumulated gradients, then clear them.
     *
     * @param step 1-based optimiser step used for bias correction
     */
    void applyAdam(double learningRate, int step) {
        double correction1 = 1.0 - Math.pow(BETA1, step);
        double correction2 = 1.0 - Math.pow(BETA2, step);
        for (int o = 0; o < outputs; o++) {
            for (int i = 0; i < inputs; i++) {
                double g = weightGrad[o][i];
                weightM[o][i] = BETA1 * weightM[o][i] + (1 - BETA1) * g;
                weightV[o][i] = BETA2 * weightV[o][i] + (1 - BETA2) * g * g;
                double mHat = weightM[o][i] / correction1;
                double vHat = weightV[o][i] / correction2;
                weights[o][i] -= learningRate * mHat / (Math.sqrt(vHat) + ADAM_EPSILON);
                weightGrad[o][i] = 0.0;
            }
            double g = biasGrad[o];
            biasM[o] = BETA1 * biasM[o] + (1 - BETA1) * g;
            biasV[o] = BETA2 * biasV[o] + (1 - BETA2) * g * g;
            double mHat = biasM[o] / correction1;
            double vHat = biasV[o] / correction2;
            bias[o] -= learningRate * mHat / (Math.sqrt(vHat) + ADAM_EPSILON);
            biasGrad[o] = 0.0;
        }
    }

    int getInputs() { return inputs; }
    int getOutputs() { return outputs; }
}
