package com.example.foodscan.service.text;

import com.example.foodscan.model.NormalizedText;
import com.example.foodscan.model.RawFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Groups positioned OCR fragments into logical lines and removes whitespace and comma noise.
 * Two fragments share a line when their vertical centers are within {@code lineTolerance} of the
 * first fragment of that line.
 */
public class TextNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TextNormalizer.class);

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern REPEATED_COMMAS = Pattern.compile(",(\\s*,)+");

    private final double lineTolerance;

    public TextNormalizer(double lineTolerance) {
        if (lineTolerance < 0) {
            throw new IllegalArgumentException("Line tolerance must not be negative");
        }
        this.lineTolerance = lineTolerance;
    }

    public NormalizedText normalize(List<RawFragment> fragments, double confidenceThreshold) {
        if (fragments == null) {
            throw new IllegalArgumentException("Fragments must not be null");
        }

        List<RawFragment> accepted = new ArrayList<>();
        for (RawFragment fragment : fragments) {
            if (fragment == null) {
                throw new IllegalArgumentException("Fragments must not contain null entries");
            }
            if (fragment.confidence() >= confidenceThreshold && !fragment.text().isBlank()) {
                accepted.add(fragment);
            }
        }
        if (accepted.isEmpty()) {
            log.debug("No fragments reached confidence {} out of {}", confidenceThreshold, fragments.size());
            return NormalizedText.empty();
        }

        // List.sort is stable, equal keys keep their original order
        accepted.sort(Comparator.comparingDouble(RawFragment::centerY));

        List<String> lines = new ArrayList<>();
        List<RawFragment> currentLine = new ArrayList<>();
        double anchorY = accepted.get(0).centerY();
        for (RawFragment fragment : accepted) {
            if (Math.abs(fragment.centerY() - anchorY) > lineTolerance) {
                addLine(lines, currentLine);
                currentLine = new ArrayList<>();
                anchorY = fragment.centerY();
            }
            currentLine.add(fragment);
        }
        addLine(lines, currentLine);

        log.debug("Normalized {} fragments into {} lines", accepted.size(), lines.size());
        return new NormalizedText(lines);
    }

    /**
     * Cleans a single line of text: collapses whitespace runs and repeated commas.
     */
    public static String cleanLine(String line) {
        String cleaned = WHITESPACE_RUN.matcher(line).replaceAll(" ");
        cleaned = REPEATED_COMMAS.matcher(cleaned).replaceAll(",");
        return cleaned.trim();
    }

    private void addLine(List<String> lines, List<RawFragment> lineFragments) {
        if (lineFragments.isEmpty()) {
            return;
        }
        lineFragments.sort(Comparator.comparingDouble(RawFragment::centerX));
        List<String> texts = new ArrayList<>(lineFragments.size());
        for (RawFragment fragment : lineFragments) {
            texts.add(fragment.text().trim());
        }
        String line = cleanLine(String.join(" ", texts));
        if (!line.isEmpty()) {
            lines.add(line);
        }
    }
}
