/*
 * ContextLabelStrategy.java - Strategy detecting PII anchored by a label such as "MRN:" or "Patient Name:"
 */
package com.cgi.medscrub.strategy;

import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.DetectorRun;
import com.cgi.medscrub.model.ErrorCollector;
import com.cgi.medscrub.model.PlaceholderToken;
import com.cgi.medscrub.model.ScrubConfig;
import com.cgi.medscrub.model.enums.DetectionMethod;
import com.cgi.medscrub.model.enums.EntityType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Heuristic strategy for values that have no fixed syntax but a fixed surrounding context.
 * A label alternation locates the anchor, then a narrower pattern extracts only the value that follows it.
 */
@Component
public class ContextLabelStrategy extends AbstractPIIDetectionStrategy {
    static final double MRN_CONFIDENCE = 0.92;
    static final double NAME_CONFIDENCE = 0.90;

    // Values are looked for within this many characters after the label
    private static final int VALUE_WINDOW = 80;

    private static final List<String> MRN_LABELS = List.of(
            "MRN", "MR#", "Medical Record Number", "Medical Record No", "Patient ID", "Patient Number",
            "Record Number", "Chart Number", "Account Number", "Member ID", "Subscriber ID",
            "Policy Number", "Insurance ID");

    private static final List<String> NAME_LABELS = List.of(
            "Patient Name", "Name", "Full Name", "Legal Name", "Patient", "Pt Name", "Patient's Name",
            "Name of Patient", "patientName", "patient_name", "fullName", "full_name",
            "Attending", "Attending Physician", "Referring Physician", "Primary Care Physician",
            "Emergency Contact", "Next of Kin", "Guardian");

    private static final Pattern MRN_LABEL_PATTERN = labelPattern(MRN_LABELS);
    private static final Pattern NAME_LABEL_PATTERN = labelPattern(NAME_LABELS);

    // At least one digit, so that ordinary words after a label are never taken for identifiers
    private static final Pattern MRN_VALUE = Pattern.compile("(?=[A-Za-z]{0,11}\\d)[A-Za-z0-9]{6,12}+\\b");

    private static final String NAME_WORD =
            "[A-Z](?:'[A-Z])?[a-z]{1,20}+(?:[A-Z][a-z]{1,20}+)?(?:-[A-Z][a-z]{1,20}+)?";

    // Group 1 is the name; a leading courtesy title stays in the text
    private static final Pattern NAME_VALUE = Pattern.compile(
            "(?:(?:Dr|Mr|Ms|Mrs|Miss|Prof)\\.?[ \\t]{1,3})?("
                    + NAME_WORD + ",[ \\t]{0,3}" + NAME_WORD + "(?:[ \\t]{1,3}[A-Z]\\.)?"
                    + "|" + NAME_WORD + "(?:[ \\t]{1,3}(?:[A-Z]\\.[ \\t]{1,3})?" + NAME_WORD + "){1,3}"
                    + "|[A-Z]{2,20}+(?:,?[ \\t]{1,3}[A-Z]{2,20}+){1,3}"
                    + ")");

    private static final Pattern WORD = Pattern.compile("[A-Za-z][A-Za-z'-]*");

    @Override
    public String getName() {
        return "ContextLabelStrategy";
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.CONTEXT;
    }

    @Override
    public boolean isApplicable(ScrubConfig config) {
        return config.isEnableContextDetector();
    }

    @Override
    public List<DetectorRun> detect(String text, ScrubConfig config, ErrorCollector errors) {
        BitSet placeholders = PlaceholderToken.coveredPositions(text);
        List<DetectorRun> runs = new ArrayList<>(2);

        long startTime = System.currentTimeMillis();
        List<Detection> mrns = detectMedicalRecordNumbers(text, placeholders);
        runs.add(new DetectorRun(getName(), "MRN_LABELS", mrns, elapsedSince(startTime)));

        startTime = System.currentTimeMillis();
        List<Detection> names = detectLabeledNames(text, placeholders);
        runs.add(new DetectorRun(getName(), "NAME_LABELS", names, elapsedSince(startTime)));

        log.debug("Context pass found {} record number(s) and {} name(s)", mrns.size(), names.size());
        return runs;
    }

    private List<Detection> detectMedicalRecordNumbers(String text, BitSet placeholders) {
        List<Detection> detections = new ArrayList<>();
        Matcher label = MRN_LABEL_PATTERN.matcher(text).useTransparentBounds(true);
        Matcher value = MRN_VALUE.matcher(text).useTransparentBounds(true);

        int from = 0;
        while (from < text.length() && label.find(from)) {
            from = label.end();
            value.region(label.end(), Math.min(text.length(), label.end() + VALUE_WINDOW));
            if (!value.lookingAt() || touchesPlaceholder(placeholders, value.start(), value.end())) {
                continue;
            }
            detections.add(createDetection(text, value.start(), value.end(),
                    EntityType.MEDICAL_RECORD_NUMBER, MRN_CONFIDENCE, "MRN_LABELS"));
            from = value.end();
        }
        return detections;
    }

    private List<Detection> detectLabeledNames(String text, BitSet placeholders) {
        List<Detection> detections = new ArrayList<>();
        Matcher label = NAME_LABEL_PATTERN.matcher(text).useTransparentBounds(true);
        Matcher value = NAME_VALUE.matcher(text).useTransparentBounds(true);

        int from = 0;
        while (from < text.length() && label.find(from)) {
            from = label.end();
            value.region(label.end(), Math.min(text.length(), label.end() + VALUE_WINDOW));
            if (!value.lookingAt()) {
                continue;
            }
            int start = value.start(1);
            int end = trimTrailingVocabulary(text, start, value.end(1));
            String name = text.substring(start, end);
            if (ClinicalWhitelist.isEntirelyWhitelisted(name)
                    || touchesPlaceholder(placeholders, start, end)) {
                continue;
            }
            detections.add(createDetection(text, start, end, EntityType.PERSON, NAME_CONFIDENCE, "NAME_LABELS"));
            from = end;
        }
        return detections;
    }

    /**
     * Drops trailing clinical words swallowed by the name pattern ("John Smith Admission").
     * The first two words are always kept, so a surname that doubles as a month stays in the name.
     *
     * @return New end offset of the name
     */
    private int trimTrailingVocabulary(String text, int start, int end) {
        List<int[]> words = new ArrayList<>();
        Matcher word = WORD.matcher(text).region(start, end);
        while (word.find()) {
            words.add(new int[]{word.start(), word.end()});
        }
        int keep = words.size();
        while (keep > 2) {
            int[] last = words.get(keep - 1);
            if (!ClinicalWhitelist.isTerm(text.substring(last[0], last[1]))) {
                break;
            }
            keep--;
        }
        return keep == 0 ? end : words.get(keep - 1)[1];
    }

    /**
     * Builds a case-insensitive alternation of labels, longest first so that
     * "Patient Name" is preferred over "Patient".
     */
    private static Pattern labelPattern(List<String> labels) {
        String alternation = labels.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?i)(?<![A-Za-z_])(?:" + alternation + ")[:#\\s\"']{1,5}+");
    }
}
