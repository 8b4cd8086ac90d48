package com.driftguardian.analysis;

import lombok.Getter;

/**
 * Running confusion counts for one group of rows.
 */
@Getter
final class GroupTally {
    private long count;
    private long selected;
    private long labelled;
    private long correct;
    private long truePositives;
    private long falseNegatives;
    private long falsePositives;
    private long trueNegatives;

    void add(int prediction, Integer label, int positiveLabel) {
        boolean predictedPositive = prediction == positiveLabel;
        count++;
        if (predictedPositive) {
            selected++;
        }
        if (label == null) {
            return;
        }
        boolean actualPositive = label == positiveLabel;
        labelled++;
        if (predictedPositive == actualPositive) {
            correct++;
        }
        if (actualPositive) {
            if (predictedPositive) {
                truePositives++;
            } else {
                falseNegatives++;
            }
        } else if (predictedPositive) {
            falsePositives++;
        } else {
            trueNegatives++;
        }
    }

    double selectionRate() {
        return count == 0 ? 0.0 : (double) selected / count;
    }

    Double accuracy() {
        return labelled == 0 ? null : (double) correct / labelled;
    }

    Double truePositiveRate() {
        long positives = truePositives + falseNegatives;
        return positives == 0 ? null : (double) truePositives / positives;
    }

    Double falsePositiveRate() {
        long negatives = falsePositives + trueNegatives;
        return negatives == 0 ? null : (double) falsePositives / negatives;
    }
}
