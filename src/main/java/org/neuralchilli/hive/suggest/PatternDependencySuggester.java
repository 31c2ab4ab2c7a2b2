package org.neuralchilli.hive.suggest;

import org.neuralchilli.hive.domain.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Suggests dependencies from phrases like "after X", "requires X" or "before X".
 * <p>
 * The phrase following a keyword is compared with every candidate: naming a candidate id
 * as a whole token scores 1.0, otherwise the score is the share of phrase words found in
 * the candidate description, plus 0.5 when the description contains the whole phrase.
 * Only the best scoring candidate per phrase is suggested, and matches scoring at or
 * below the threshold are dropped.
 */
public class PatternDependencySuggester implements DependencySuggester {

    private static final Logger log = LoggerFactory.getLogger(PatternDependencySuggester.class);

    public static final double DEFAULT_THRESHOLD = 0.3;

    private static final double FILE_MATCH_CONFIDENCE = 0.8;
    private static final double SUBSTRING_BONUS = 0.5;

    private static final String PHRASE_END = "(?:[.,;!?]|$)";

    private static final List<Pattern> FORWARD_PATTERNS = List.of(
            Pattern.compile("\\bafter\\s+(.+?)" + PHRASE_END, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bonce\\s+(.+?)(?:\\s+(?:is|are|has been|have been)\\s+"
                    + "(?:done|complete|completed|finished))?" + PHRASE_END, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:requires|needs|depends\\s+on)\\s+(.+?)" + PHRASE_END, Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:prerequisite|prereq)s?\\s*:\\s*(.+?)" + PHRASE_END, Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> REVERSE_PATTERNS = List.of(
            Pattern.compile("\\b(?:before|prior\\s+to)\\s+(.+?)" + PHRASE_END, Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern FILE_REFERENCE = Pattern.compile(
            "\\b(?:using|reads|loads|imports)\\s+([\\w./-]+\\.(?:py|json|txt|csv|md))\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^A-Za-z0-9_\\-]+");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "with", "that", "this", "from", "into", "then", "task",
            "done", "complete", "completed", "finished");

    private final double threshold;

    public PatternDependencySuggester() {
        this(DEFAULT_THRESHOLD);
    }

    public PatternDependencySuggester(double threshold) {
        if (threshold < 0.0 || threshold >= 1.0) {
            throw new IllegalArgumentException("Threshold must be in [0.0, 1.0), got: " + threshold);
        }
        this.threshold = threshold;
    }

    public double threshold() {
        return threshold;
    }

    @Override
    public List<SuggestedDependency> suggest(String taskId, String description, Collection<Task> candidates) {
        if (description == null || description.isBlank()) {
            return List.of();
        }
        List<Task> others = candidates.stream()
                .filter(c -> !c.id().equals(taskId))
                .toList();
        if (others.isEmpty()) {
            return List.of();
        }

        Map<String, SuggestedDependency> best = new LinkedHashMap<>();

        for (Pattern pattern : FORWARD_PATTERNS) {
            for (String phrase : phrases(pattern, description)) {
                bestMatch(phrase, others).ifPresent(match -> keep(best, new SuggestedDependency(
                        taskId, match.task().id(), match.score(), "'" + phrase + "' matches " + match.task().id())));
            }
        }

        for (Pattern pattern : REVERSE_PATTERNS) {
            for (String phrase : phrases(pattern, description)) {
                bestMatch(phrase, others).ifPresent(match -> keep(best, new SuggestedDependency(
                        match.task().id(), taskId, match.score(), "must run before '" + phrase + "'")));
            }
        }

        Matcher files = FILE_REFERENCE.matcher(description);
        while (files.find()) {
            String file = files.group(1).toLowerCase(Locale.ROOT);
            for (Task candidate : others) {
                if (FILE_MATCH_CONFIDENCE > threshold
                        && candidate.description().toLowerCase(Locale.ROOT).contains(file)) {
                    keep(best, new SuggestedDependency(taskId, candidate.id(), FILE_MATCH_CONFIDENCE,
                            "uses " + file + " mentioned by " + candidate.id()));
                }
            }
        }

        List<SuggestedDependency> suggestions = new ArrayList<>(best.values());
        suggestions.sort(Comparator.comparingDouble(SuggestedDependency::confidence).reversed());
        log.debug("Suggested {} dependencies for task {}", suggestions.size(), taskId);
        return suggestions;
    }

    private record Match(Task task, double score) {
    }

    /**
     * Highest scoring candidate above the threshold; the earliest candidate wins a tie.
     */
    private Optional<Match> bestMatch(String phrase, List<Task> candidates) {
        Match best = null;
        for (Task candidate : candidates) {
            double score = score(phrase, candidate);
            if (score > threshold && (best == null || score > best.score())) {
                best = new Match(candidate, score);
            }
        }
        return Optional.ofNullable(best);
    }

    private static List<String> phrases(Pattern pattern, String description) {
        List<String> phrases = new ArrayList<>();
        Matcher matcher = pattern.matcher(description);
        while (matcher.find()) {
            String phrase = matcher.group(1).trim();
            if (!phrase.isEmpty()) {
                phrases.add(phrase);
            }
        }
        return phrases;
    }

    static double score(String phrase, Task candidate) {
        for (String token : TOKEN_SPLIT.split(phrase)) {
            if (token.equalsIgnoreCase(candidate.id())) {
                return 1.0;
            }
        }

        Set<String> phraseWords = words(phrase);
        if (phraseWords.isEmpty()) {
            return 0.0;
        }
        String candidateText = candidate.description().toLowerCase(Locale.ROOT);
        Set<String> candidateWords = words(candidateText);

        long shared = phraseWords.stream().filter(candidateWords::contains).count();
        double score = (double) shared / phraseWords.size();
        if (candidateText.contains(phrase.toLowerCase(Locale.ROOT))) {
            score += SUBSTRING_BONUS;
        }
        return Math.min(1.0, score);
    }

    private static Set<String> words(String text) {
        Set<String> words = new LinkedHashSet<>();
        for (String token : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() >= 3 && !STOP_WORDS.contains(token)) {
                words.add(token);
            }
        }
        return words;
    }

    private static void keep(Map<String, SuggestedDependency> best, SuggestedDependency suggestion) {
        String key = suggestion.taskId() + "->" + suggestion.dependencyId();
        best.merge(key, suggestion, (a, b) -> a.confidence() >= b.confidence() ? a : b);
    }
}
