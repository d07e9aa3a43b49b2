package com.marketpool.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders outcome labels with their probabilities, e.g. {@code "Yes: 60.0%; No: 40.0%"}.
 */
public final class OutcomeFormatter {

    public static final String NOT_AVAILABLE = "N/A";

    private OutcomeFormatter() {
    }

    public static String format(List<String> outcomes, List<Double> probabilities) {
        if (outcomes == null || outcomes.isEmpty()) {
            return NOT_AVAILABLE;
        }
        boolean aligned = probabilities != null && probabilities.size() == outcomes.size();
        List<String> parts = new ArrayList<>(outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            Double probability = aligned ? probabilities.get(i) : null;
            parts.add(cleanLabel(outcomes.get(i)) + ": " + formatProbability(probability));
        }
        return String.join("; ", parts);
    }

    private static String formatProbability(Double probability) {
        if (probability == null || probability.isNaN()) {
            return NOT_AVAILABLE;
        }
        return String.format(Locale.ROOT, "%.1f%%", probability * 100.0);
    }

    private static String cleanLabel(String label) {
        if (label == null) {
            return "";
        }
        return label.replace("\n", "").replace("\r", "").trim();
    }
}
