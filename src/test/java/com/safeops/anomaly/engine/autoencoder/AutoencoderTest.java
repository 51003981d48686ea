package com.safeops.anomaly.engine.autoencoder;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AutoencoderTest {

    private static double[][] correlated(int rows, long seed) {
        Random random = new Random(seed);
        double[][] data = new double[rows][7];
        for (int i = 0; i < rows; i++) {
            double base = random.nextGaussian();
            for (int j = 0; j < 7; j++) {
                data[i][j] = base + 0.1 * random.nextGaussian();
            }
        }
        return data;
    }

    private static double meanError(Autoencoder network, double[][] data) {
        double total = 0.0;
        for (double[] row : data) {
            total += network.reconstructionError(row);
        }
        return total / data.length;
    }

    @Test
    void training_reducesReconstructionError() {
        double[][] data = correlated(200, 1);

        Autoencoder untrained = Autoencoder.train(data, Autoencoder.DEFAULT_WIDTHS, 0, 16, 0.001, 42);
        Autoencoder trained = Autoencoder.train(data, Autoencoder.DEFAULT_WIDTHS, 50, 16, 0.001, 42);

        assertThat(meanError(trained, data)).isLessThan(meanError(untrained, data));
    }

    @Test
    void sameSeed_sameNetwork() {
        double[][] data = correlated(50, 2);

        Autoencoder a = Autoencoder.train(data, Autoencoder.DEFAULT_WIDTHS, 3, 16, 0.001, 42);
        Autoencoder b = Autoencoder.train(data, Autoencoder.DEFAULT_WIDTHS, 3, 16, 0.001, 42);

        assertThat(a.reconstruct(data[0])).containsExactly(b.reconstruct(data[0]));
    }

    @Test
    void reconstruct_preservesDimension() {
        Autoencoder network = Autoencoder.train(correlated(20, 3), Autoencoder.DEFAULT_WIDTHS, 1, 16, 0.001, 42);

        assertThat(network.reconstruct(new double[7])).hasSize(7);
        assertThat(network.getWidths()).containsExactly(7, 16, 8, 16, 7);
    }

    @Test
    void outlier_reconstructsWorseThanTypicalRow() {
        double[][] data = correlated(200, 4);
        Autoencoder network = Autoencoder.train(data, Autoencoder.DEFAULT_WIDTHS, 30, 16, 0.001, 42);

        double[] outlier = {40, -40, 40, -40, 40, -40, 40};
        assertThat(network.reconstructionError(outlier)).isGreaterThan(meanError(network, data));
    }

    @Test
    void widthMismatch_throws() {
        assertThatThrownBy(() -> Autoencoder.train(new double[][]{{1, 2, 3}}, Autoencoder.DEFAULT_WIDTHS, 1, 16, 0.001, 42))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyData_throws() {
        assertThatThrownBy(() -> Autoencoder.train(new double[0][], Autoencoder.DEFAULT_WIDTHS, 1, 16, 0.001, 42))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
