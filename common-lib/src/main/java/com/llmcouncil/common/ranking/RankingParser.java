package com.llmcouncil.common.ranking;

import com.llmcouncil.common.anonymization.LabelMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction of a ranking from an evaluator's free-text answer.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Find the first ranking marker, case-insensitive: {@code FINAL RANKING:} (also with
 *       markdown emphasis or a plural) or a heading line reading only "Final Ranking".
 *       Everything after it is the ranking section; the commentary before it is ignored.</li>
 *   <li>In the section, lines that open with an ordinal ({@code 1.}, {@code 2)}, {@code #3},
 *       {@code 4th}, {@code Fifth:}) directly followed by a label are ranked by ordinal value,
 *       ties in order of appearance. Prose such as "First, it beats Response C" is not an
 *       item. Only the label right after the ordinal counts.</li>
 *   <li>If the section has no ordinal lines, every label mention in it is taken in order of
 *       appearance.</li>
 *   <li>Without a marker, the whole text is scanned for label mentions in order of
 *       appearance.</li>
 * </ol>
 * Repeated labels keep their first position; labels outside the known set are dropped.
 *
 * <p>Never throws. The worst case is an empty list, which the aggregate calculator treats
 * as "no vote". Stateless and thread-safe.
 */
public final class RankingParser {

    private static final Pattern COLON_MARKER =
        Pattern.compile("(?i)final\\s+rankings?\\s*[*_]*\\s*:");

    private static final Pattern HEADING_MARKER =
        Pattern.compile("(?im)^[\\s#*_>]*final\\s+rankings?[\\s*_]*$");

    private static final Pattern LABEL =
        Pattern.compile("(?i:response)\\s+([A-Z]{1,2})\\b");

    // ordinal token plus an optional ".", ")", ":" or dash; the label must come right after
    private static final Pattern ORDINAL_PREFIX = Pattern.compile(
        "(?i)^\\s*(?:[-*•]\\s*)?[*_]*\\s*(?:#?(\\d{1,3})(?:st|nd|rd|th)?"
            + "|(first|second|third|fourth|fifth|sixth|seventh|eighth|ninth|tenth))"
            + "(?![A-Za-z0-9])\\s*[*_]*\\s*(?:[.):\\-\\u2013\\u2014]\\s*)?[*_]*\\s*");

    private static final Map<String, Integer> ORDINAL_WORDS = Map.of(
        "first", 1, "second", 2, "third", 3, "fourth", 4, "fifth", 5,
        "sixth", 6, "seventh", 7, "eighth", 8, "ninth", 9, "tenth", 10
    );

    private RankingParser() { /* utility class */ }

    /**
     * Parses against any well-formed label ("Response A" … "Response ZZ").
     *
     * @param rawText evaluator output, may be {@code null}
     * @return labels best first, never {@code null}
     */
    public static List<String> parse(String rawText) {
        return parse(rawText, label -> true);
    }

    /**
     * Parses and keeps only labels issued by {@code labelMap}.
     */
    public static List<String> parse(String rawText, LabelMap labelMap) {
        return parse(rawText, labelMap::containsLabel);
    }

    /**
     * Parses and keeps only labels contained in {@code knownLabels}.
     */
    public static List<String> parse(String rawText, Collection<String> knownLabels) {
        Set<String> known = Set.copyOf(knownLabels);
        return parse(rawText, known::contains);
    }

    private static List<String> parse(String rawText, Predicate<String> isKnown) {
        if (rawText == null || rawText.isBlank()) {
            return List.of();
        }
        try {
            int sectionStart = findSectionStart(rawText);
            if (sectionStart < 0) {
                return labelsInOrder(rawText, isKnown);
            }
            String section = rawText.substring(sectionStart);
            List<String> ordinalRanking = fromOrdinalLines(section, isKnown);
            return ordinalRanking.isEmpty() ? labelsInOrder(section, isKnown) : ordinalRanking;
        } catch (RuntimeException e) {
            return List.of();
        }
    }

    /** Index just past the first ranking marker, or -1. */
    static int findSectionStart(String text) {
        int best = -1;
        Matcher colon = COLON_MARKER.matcher(text);
        if (colon.find()) {
            best = colon.end();
        }
        Matcher heading = HEADING_MARKER.matcher(text);
        if (heading.find() && (best < 0 || heading.start() < best)) {
            best = heading.end();
        }
        return best;
    }

    private static List<String> fromOrdinalLines(String section, Predicate<String> isKnown) {
        List<RankedLine> ranked = new ArrayList<>();
        String[] lines = section.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            Matcher ordinal = ORDINAL_PREFIX.matcher(lines[i]);
            if (!ordinal.find()) continue;
            Matcher label = LABEL.matcher(lines[i]).region(ordinal.end(), lines[i].length());
            if (!label.lookingAt()) continue;
            String candidate = normalize(label.group(1));
            if (isKnown.test(candidate)) {
                ranked.add(new RankedLine(ordinalValue(ordinal), i, candidate));
            }
        }
        ranked.sort(Comparator.comparingInt(RankedLine::ordinal).thenComparingInt(RankedLine::line));
        Set<String> ordered = new LinkedHashSet<>();
        ranked.forEach(r -> ordered.add(r.label()));
        return List.copyOf(ordered);
    }

    private static List<String> labelsInOrder(String text, Predicate<String> isKnown) {
        Set<String> ordered = new LinkedHashSet<>();
        Matcher label = LABEL.matcher(text);
        while (label.find()) {
            String candidate = normalize(label.group(1));
            if (isKnown.test(candidate)) {
                ordered.add(candidate);
            }
        }
        return List.copyOf(ordered);
    }

    private static int ordinalValue(Matcher ordinal) {
        if (ordinal.group(1) != null) {
            return Integer.parseInt(ordinal.group(1));
        }
        return ORDINAL_WORDS.getOrDefault(ordinal.group(2).toLowerCase(), Integer.MAX_VALUE);
    }

    private static String normalize(String letters) {
        return LabelMap.LABEL_PREFIX + letters;
    }

    private record RankedLine(int ordinal, int line, String label) {}
}
