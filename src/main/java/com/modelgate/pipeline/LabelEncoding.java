package com.modelgate.pipeline;

import java.util.List;
import java.util.TreeSet;

/**
 * Maps the two label values of a binary target onto 0 (negative) and 1 (positive).
 */
public record LabelEncoding(String negative, String positive) {

    /**
     * @param positiveLabel configured positive class, or null to take the greater of the two
     *                      sorted labels
     * @throws IllegalArgumentException when the labels do not hold exactly two classes
     */
    public static LabelEncoding fit(List<String> labels, String positiveLabel) {
        TreeSet<String> classes = new TreeSet<>(labels);
        if (classes.size() != 2) {
            throw new IllegalArgumentException("Binary target needs exactly two classes, found "
                    + classes.size() + " " + classes);
        }
        if (positiveLabel == null || positiveLabel.isBlank()) {
            return new LabelEncoding(classes.first(), classes.last());
        }
        if (!classes.contains(positiveLabel)) {
            throw new IllegalArgumentException("Positive label '" + positiveLabel + "' not among " + classes);
        }
        classes.remove(positiveLabel);
        return new LabelEncoding(classes.first(), positiveLabel);
    }

    public int encode(String label) {
        if (positive.equals(label)) {
            return 1;
        }
        if (negative.equals(label)) {
            return 0;
        }
        throw new IllegalArgumentException("Unknown label '" + label + "', expected " + negative + " or " + positive);
    }

    public String decode(int encoded) {
        return encoded == 1 ? positive : negative;
    }
}
