package com.edge.precision.core.tau;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * tau 曲线：有限、可重复遍历的序列，每次遍历按网格重新调用打分函数
 */
public class TauCurve implements Iterable<TauCurvePoint> {
    private final double[] grid;
    private final LabeledScorer scorer;

    public TauCurve(double[] grid, LabeledScorer scorer) {
        this.grid = grid.clone();
        this.scorer = scorer;
    }

    public int size() {
        return grid.length;
    }

    public double[] getGrid() {
        return grid.clone();
    }

    @Override
    public Iterator<TauCurvePoint> iterator() {
        return new Iterator<>() {
            private int index = 0;

            @Override
            public boolean hasNext() {
                return index < grid.length;
            }

            @Override
            public TauCurvePoint next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return scorer.score(grid[index++]);
            }
        };
    }
}
