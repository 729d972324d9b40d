package com.example.smartcart.model;

import java.util.List;

public final class EvaluationReport {

    /** Averages over the rows that carry ground truth. */
    public static final class Metrics {
        public final double recallAt3;
        public final double precisionAt3;
        public final double top1Accuracy;
        public final int scoredRows;

        public Metrics(double recallAt3, double precisionAt3, double top1Accuracy, int scoredRows) {
            this.recallAt3 = recallAt3; this.precisionAt3 = precisionAt3;
            this.top1Accuracy = top1Accuracy; this.scoredRows = scoredRows;
        }

        @Override public String toString() {
            return String.format("Recall@3=%.4f  Precision@3=%.4f  Top-1=%.4f  (rows=%d)",
                    recallAt3, precisionAt3, top1Accuracy, scoredRows);
        }
    }

    public final List<EvaluationRow> rows;
    public final Metrics metrics;
    public final Metrics baseline; // nullable

    public EvaluationReport(List<EvaluationRow> rows, Metrics metrics, Metrics baseline) {
        this.rows = List.copyOf(rows);
        this.metrics = metrics;
        this.baseline = baseline;
    }

    /** Relative Recall@3 improvement over the baseline, or NaN without one. */
    public double recallLift() { return lift(metrics.recallAt3, baseline == null ? Double.NaN : baseline.recallAt3); }

    public double precisionLift() { return lift(metrics.precisionAt3, baseline == null ? Double.NaN : baseline.precisionAt3); }

    private static double lift(double value, double base) {
        if (Double.isNaN(base) || base == 0.0) return Double.NaN;
        return (value - base) / base;
    }
}
