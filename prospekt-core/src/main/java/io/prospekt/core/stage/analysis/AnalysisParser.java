package io.prospekt.core.stage.analysis;

import io.prospekt.core.stage.StageOutput.MarketAnalysis;
import java.util.ArrayList;
import java.util.List;

/// Extracts structured sections from a free-text market analysis.
///
/// The analysis prompt asks for three headed sections: `KEY BUSINESS CHALLENGES`,
/// `OPPORTUNITIES` and `RECOMMENDED SALES APPROACH`. Each list section keeps at most
/// five non-empty lines with list markers (digits, dots, dashes, parentheses, bullets)
/// removed. The approach is the first three lines of its section joined by spaces.
///
/// Missing sections yield empty lists and {@link #DEFAULT_APPROACH}.
public final class AnalysisParser {

    static final String CHALLENGES_HEADING = "KEY BUSINESS CHALLENGES";
    static final String OPPORTUNITIES_HEADING = "OPPORTUNITIES";
    static final String APPROACH_HEADING = "RECOMMENDED SALES APPROACH";
    static final String APPROACH_PREFIX = "RECOMMENDED";

    public static final String DEFAULT_APPROACH = "Approach with value-focused messaging";

    private static final int MAX_ITEMS = 5;
    private static final int APPROACH_LINES = 3;
    private static final String MARKER_CHARS = "0123456789.-)*•: ";

    private AnalysisParser() {}

    /// Parses the full analysis text.
    ///
    /// @param analysisText model output, not null
    /// @return structured analysis, never null
    public static MarketAnalysis parse(String analysisText) {
        return new MarketAnalysis(
                analysisText,
                extractChallenges(analysisText),
                extractOpportunities(analysisText),
                extractApproach(analysisText));
    }

    static List<String> extractChallenges(String text) {
        return items(section(text, CHALLENGES_HEADING, OPPORTUNITIES_HEADING));
    }

    static List<String> extractOpportunities(String text) {
        return items(section(text, OPPORTUNITIES_HEADING, APPROACH_PREFIX));
    }

    static String extractApproach(String text) {
        String section = section(text, APPROACH_HEADING, null);
        if (section == null) {
            return DEFAULT_APPROACH;
        }
        List<String> lines = contentLines(section);
        if (lines.isEmpty()) {
            return DEFAULT_APPROACH;
        }
        List<String> cleaned = new ArrayList<>();
        for (String line : lines.subList(0, Math.min(APPROACH_LINES, lines.size()))) {
            String value = stripMarkers(line);
            if (!value.isEmpty()) {
                cleaned.add(value);
            }
        }
        return cleaned.isEmpty() ? DEFAULT_APPROACH : String.join(" ", cleaned);
    }

    /// Returns the text after the first `heading` up to its next occurrence, cut at
    /// `terminator` when given; null when the heading is absent.
    private static String section(String text, String heading, String terminator) {
        int start = text.indexOf(heading);
        if (start < 0) {
            return null;
        }
        String rest = text.substring(start + heading.length());
        int repeat = rest.indexOf(heading);
        if (repeat >= 0) {
            rest = rest.substring(0, repeat);
        }
        if (terminator != null) {
            int end = rest.indexOf(terminator);
            if (end >= 0) {
                rest = rest.substring(0, end);
            }
        }
        return rest;
    }

    private static List<String> items(String section) {
        if (section == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (String line : contentLines(section)) {
            String value = stripMarkers(line);
            if (!value.isEmpty()) {
                result.add(value);
            }
            if (result.size() == MAX_ITEMS) {
                break;
            }
        }
        return result;
    }

    private static List<String> contentLines(String section) {
        List<String> lines = new ArrayList<>();
        for (String raw : section.split("\n")) {
            String line = raw.strip();
            if (!line.isEmpty() && !line.startsWith("#")) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static String stripMarkers(String line) {
        int from = 0;
        while (from < line.length() && MARKER_CHARS.indexOf(line.charAt(from)) >= 0) {
            from++;
        }
        int to = line.length();
        while (to > from && line.charAt(to - 1) == '*') {
            to--;
        }
        return line.substring(from, to).strip();
    }
}
