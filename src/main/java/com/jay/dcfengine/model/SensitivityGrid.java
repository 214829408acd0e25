package com.jay.dcfengine.model;

import java.util.Arrays;
import java.util.List;

/**
 * Intrinsic value per share across a WACC × terminal-growth grid.
 * valueMatrix[i][j] is the value at (waccAxis[i], growthAxis[j]); NaN marks a cell
 * whose discount rate does not exceed its growth rate.
 */
public record SensitivityGrid(
    List<Double> waccAxis,
    List<Double> growthAxis,
    double[][] valueMatrix,
    double baseCaseValue
) {

    public SensitivityGrid {
        waccAxis = List.copyOf(waccAxis);
        growthAxis = List.copyOf(growthAxis);
        valueMatrix = deepCopy(valueMatrix);
    }

    @Override
    public double[][] valueMatrix() {
        return deepCopy(valueMatrix);
    }

    public double valueAt(int waccIndex, int growthIndex) {
        return valueMatrix[waccIndex][growthIndex];
    }

    public boolean isValid(int waccIndex, int growthIndex) {
        return !Double.isNaN(valueMatrix[waccIndex][growthIndex]);
    }

    public int invalidCellCount() {
        int count = 0;
        for (double[] row : valueMatrix) {
            for (double v : row) {
                if (Double.isNaN(v)) count++;
            }
        }
        return count;
    }

    /** Lowest valid value in the grid, or NaN if no cell is valid. */
    public double minValue() {
        return Arrays.stream(valueMatrix).flatMapToDouble(Arrays::stream)
            .filter(v -> !Double.isNaN(v)).min().orElse(Double.NaN);
    }

    /** Highest valid value in the grid, or NaN if no cell is valid. */
    public double maxValue() {
        return Arrays.stream(valueMatrix).flatMapToDouble(Arrays::stream)
            .filter(v -> !Double.isNaN(v)).max().orElse(Double.NaN);
    }

    private static double[][] deepCopy(double[][] source) {
        double[][] copy = new double[source.length][];
        for (int i = 0; i < source.length; i++) {
            copy[i] = source[i].clone();
        }
        return copy;
    }
}
