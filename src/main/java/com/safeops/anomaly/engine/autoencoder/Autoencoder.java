package com.safeops.anomaly.engine.autoencoder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Symmetric bottleneck network trained to reproduce its (standardised) input.
 * The anomaly signal is the mean squared reconstruction error: rows unlike the training
 * history reconstruct poorly.
 *
 * Only {@link #train} mutates layers; a returned instance is read-only and thread-safe.
 */
public final class Autoencoder {

    /** Layer widths from input to output. */
    public static final int[] DEFAULT_WIDTHS = {7, 16, 8, 16, 7};

    private final List<DenseLayer> layers;

    private Autoencoder(List<DenseLayer> layers) {
        this.layers = layers;
    }

    /**
     * Train on the given rows, minimising mean squared reconstruction error with Adam.
     * Rows are shuffled each epoch with the seeded generator, so identical inputs and seed
     * give an identical network.
     */
    public static Autoencoder train(double[][] data, int[] widths, int epochs, int batchSize,
                                    double learningRate, long seed) {
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot train an autoencoder on an empty data set");
        }
        if (widths[0] != data[0].length || widths[widths.length - 1] != data[0].length) {
            throw new IllegalArgumentException("Input and output widths must match the feature count "
                    + data[0].length);
        }

        Random random = new Random(seed);
        List<DenseLayer> layers = new ArrayList<>(widths.length - 1);
        for (int l = 0; l < widths.length - 1; l++) {
            boolean hidden = l < widths.length - 2;
            layers.add(DenseLayer.create(widths[l], widths[l + 1], hidden, random));
        }
        Autoencoder network = new Autoencoder(Collections.unmodifiableList(layers));

        int batch = Math.max(1, batchSize);
        int dims = data[0].length;
        int[] order = new int[data.length];
        for (int i = 0; i < order.length; i++) order[i] = i;

        int step = 0;
        for (int epoch = 0; epoch < epochs; epoch++) {
            shuffle(order, random);
            for (int start = 0; start < order.length; start += batch) {
                int end = Math.min(start + batch, order.length);
                int size = end - start;
                for (int k = start; k < end; k++) {
                    network.accumulate(data[order[k]], 2.0 / (dims * size));
                }
                step++;
                for (DenseLayer layer : layers) {
                    layer.applyAdam(learningRate, step);
                }
            }
        }
        return network;
    }

    private void accumulate(double[] sample, double lossScale) {
        double[][] activations = new double[layers.size() + 1][];
        activations[0] = sample;
        for (int l = 0; l < layers.size(); l++) {
            activations[l + 1] = layers.get(l).forward(activations[l]);
        }

        double[] output = activations[layers.size()];
        double[] grad = new double[output.length];
        for (int j = 0; j < output.length; j++) {
            grad[j] = lossScale * (output[j] - sample[j]);
        }
        for (int l = layers.size() - 1; l >= 0; l--) {
            grad = layers.get(l).backward(activations[l], activations[l + 1], grad);
        }
    }

    public double[] reconstruct(double[] input) {
        double[] current = input;
        for (DenseLayer layer : layers) {
            current = layer.forward(current);
        }
        return current;
    }

    public double reconstructionError(double[] input) {
        double[] output = reconstruct(input);
        double sum = 0.0;
        for (int j = 0; j < input.length; j++) {
            double d = input[j] - output[j];
            sum += d * d;
        }
        return sum / input.length;
    }

    public int[] getWidths() {
        int[] widths = new int[layers.size() + 1];
        widths[0] = layers.get(0).getInputs();
        for (int l = 0; l < layers.size(); l++) {
            widths[l + 1] = layers.get(l).getOutputs();
        }
        return widths;
    }

    private static void shuffle(int[] values, Random random) {
        for (int i = values.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = values[i];
            values[i] = values[j];
            values[j] = tmp;
        }
    }
}
