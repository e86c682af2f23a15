package org.reactome.snf.network;

import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.reactome.snf.NumericInstabilityException;
import org.reactome.snf.ValidationException;
import org.reactome.snf.View;

/**
 * Matrix helpers shared by the fusion and clustering code.
 * @author wug
 *
 */
public class NetworkUtilities {

    private NetworkUtilities() {
    }

    /**
     * Make sure there are enough networks and they all share the sample order of the first one.
     * @param networks
     * @param minNetworks
     * @param stage
     */
    public static void checkAligned(List<SimilarityMatrix> networks,
                                    int minNetworks,
                                    String stage) {
        if (networks == null || networks.size() < minNetworks)
            throw new ValidationException(null, stage, "At least " + minNetworks + " network(s) needed, got " + (networks == null ? 0 : networks.size()) + ".");
        SimilarityMatrix first = networks.get(0);
        if (first.size() == 0)
            throw new ValidationException(first.getView(), stage, "The networks have no sample.");
        for (SimilarityMatrix network : networks) {
            if (!network.isAlignedWith(first))
                throw new ValidationException(network.getView(), stage, "The sample order differs from the one of " + first + ".");
        }
    }

    public static RealMatrix toRealMatrix(SimilarityMatrix network) {
        return new Array2DRowRealMatrix(network.toArray(), false);
    }

    /**
     * Divide each row by its sum.
     * @param matrix
     * @param view used in the error message
     * @param stage used in the error message
     * @return a new matrix
     */
    public static RealMatrix rowNormalize(RealMatrix matrix, View view, String stage) {
        double[][] data = matrix.getData();
        for (int i = 0; i < data.length; i++) {
            double sum = 0.0d;
            for (double value : data[i])
                sum += value;
            if (!(sum > 0.0d) || !Double.isFinite(sum))
                throw new NumericInstabilityException(view, stage, "Row " + i + " sums to " + sum + " and cannot be normalized.");
            for (int j = 0; j < data[i].length; j++)
                data[i][j] /= sum;
        }
        return new Array2DRowRealMatrix(data, false);
    }

    /**
     * @param matrix
     * @return (M + M^T) / 2
     */
    public static RealMatrix symmetrize(RealMatrix matrix) {
        return matrix.add(matrix.transpose()).scalarMultiply(0.5d);
    }

    /**
     * Keep the k largest entries in each row and set the others to 0. Ties go to the lower column
     * index.
     * @param matrix
     * @param k
     * @return a new matrix
     */
    public static RealMatrix keepNearestNeighbors(RealMatrix matrix, int k) {
        double[][] data = matrix.getData();
        int n = matrix.getColumnDimension();
        if (k >= n)
            return new Array2DRowRealMatrix(data, false);
        double[][] rtn = new double[data.length][n];
        for (int i = 0; i < data.length; i++) {
            double[] row = data[i];
            int[] order = IntStream.range(0, n)
                                   .boxed()
                                   .sorted(Comparator.comparingDouble((Integer j) -> row[j]).reversed())
                                   .mapToInt(Integer::intValue)
                                   .toArray();
            for (int j = 0; j < k; j++)
                rtn[i][order[j]] = row[order[j]];
        }
        return new Array2DRowRealMatrix(rtn, false);
    }

    public static void checkFinite(RealMatrix matrix, View view, String stage) {
        for (int i = 0; i < matrix.getRowDimension(); i++) {
            for (int j = 0; j < matrix.getColumnDimension(); j++) {
                if (!Double.isFinite(matrix.getEntry(i, j)))
                    throw new NumericInstabilityException(view, stage, "Non-finite value at (" + i + ", " + j + ").");
            }
        }
    }

}
