/*
 * StructuralPatternStrategy.java - Strategy using regular expressions to detect syntactically regular PII
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
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strategy based on regular expressions for PII with a fixed syntax.
 * Every pattern uses bounded or possessive repetition so that matching stays linear in the input length.
 */
@Component
public class StructuralPatternStrategy extends AbstractPIIDetectionStrategy {
    private static final List<PatternRule> RULES = new ArrayList<>();
    private static final Pattern NAME_PART_SEPARATOR = Pattern.compile("['-]");

    private static final String MONTHS_FULL =
            "January|February|March|April|May|June|July|August|September|October|November|December";
    private static final String MONTHS =
            "Jan(?:uary)?|Feb(?:ruary)?|Mar(?:ch)?|Apr(?:il)?|May|June?|July?|Aug(?:ust)?"
                    + "|Sept?(?:ember)?|Oct(?:ober)?|Nov(?:ember)?|Dec(?:ember)?";
    private static final String STREET_SUFFIXES =
            "Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd|Lane|Ln|Drive|Dr|Court|Ct|Parkway|Pkwy"
                    + "|Place|Pl|Terrace|Ter|Highway|Hwy|Circle|Cir|Way";

    static {
        RULES.add(new PatternRule("EMAIL", EntityType.EMAIL, 0.98,
                "(?<![A-Za-z0-9._%+-])[A-Za-z0-9._%+-]{1,64}+@(?:[A-Za-z0-9-]{1,63}+\\.){1,8}[A-Za-z]{2,24}+\\b",
                s -> s.indexOf('@') >= 0));

        RULES.add(new PatternRule("SSN", EntityType.NATIONAL_ID, 0.99,
                "\\b\\d{3}-\\d{2}-\\d{4}\\b",
                StructuralPatternStrategy::hasDigit));

        // Masked or spoken forms: "xxx-xx-1234", "last 4: 1234". Only the digits are redacted.
        RULES.add(new PatternRule("SSN_PARTIAL", EntityType.NATIONAL_ID, 0.90,
                "(?i)(?:(?<![\\w-])(?:xxx|\\*{3})-(?:xx|\\*{2})-|\\blast\\s{0,3}4\\s{0,3}[-:]?\\s{0,3})(\\d{4})\\b",
                1, StructuralPatternStrategy::hasDigit, null));

        RULES.add(new PatternRule("CREDIT_CARD", EntityType.CREDIT_CARD, 0.97,
                "(?<!\\d)\\d{4}([- ]?)\\d{4}\\1\\d{4}\\1\\d{4}(?!\\d)",
                s -> countDigits(s) >= 16));

        RULES.add(new PatternRule("PHONE", EntityType.PHONE, 0.95,
                "(?<![\\d-])(?:\\+?1[-. ]?)?(?:\\(\\d{3}\\)|\\d{3})[-. ]?\\d{3}[-. ]?\\d{4}(?![\\d-])",
                s -> countDigits(s) >= 10));

        RULES.add(new PatternRule("ZIP", EntityType.ZIP, 0.96,
                "\\b\\d{5}(?:-\\d{4})?\\b",
                StructuralPatternStrategy::hasDigit));

        RULES.add(new PatternRule("DATE_NUMERIC", EntityType.DATE, 0.85,
                "\\b\\d{1,2}[/-]\\d{1,2}[/-](?:\\d{4}|\\d{2})\\b",
                StructuralPatternStrategy::hasDigit));

        RULES.add(new PatternRule("DATE_ISO", EntityType.DATE, 0.85,
                "\\b\\d{4}-\\d{2}-\\d{2}\\b",
                StructuralPatternStrategy::hasDigit));

        RULES.add(new PatternRule("DATE_WRITTEN", EntityType.DATE, 0.85,
                "\\b(?:" + MONTHS + ")\\.?\\s{1,3}\\d{1,2}(?:st|nd|rd|th)?(?:,?\\s{1,3}\\d{4})?\\b",
                StructuralPatternStrategy::hasDigit));

        RULES.add(new PatternRule("DATE_DAY_FIRST", EntityType.DATE, 0.85,
                "\\b\\d{1,2}(?:st|nd|rd|th)?\\s{1,3}(?:of\\s{1,3})?(?:" + MONTHS_FULL + ")(?:,?\\s{1,3}\\d{4})?\\b",
                StructuralPatternStrategy::hasDigit));

        RULES.add(new PatternRule("ADDRESS", EntityType.ADDRESS, 0.88,
                "\\b\\d{1,6}+\\s{1,3}+(?:[A-Z][a-z]{1,30}+\\s{1,3}+){1,4}(?i:" + STREET_SUFFIXES + ")\\b",
                StructuralPatternStrategy::hasDigit));

        RULES.add(new PatternRule("PO_BOX", EntityType.PO_BOX, 0.94,
                "(?i)\\bP\\.?\\s?O\\.?\\s?Box\\s{0,3}#?\\s{0,3}\\d{1,10}\\b",
                s -> s.toLowerCase(Locale.ROOT).contains("box")));

        RULES.add(new PatternRule("CITY_STATE", EntityType.CITY_STATE, 0.75,
                "\\b([A-Z][a-z]{1,20}+(?: [A-Z][a-z]{1,20}+){0,2}+), ?([A-Z]{2})\\b",
                0, s -> s.indexOf(',') >= 0,
                m -> ClinicalWhitelist.isUsState(m.group(2)) && !ClinicalWhitelist.isEntirelyWhitelisted(m.group(1))));

        RULES.add(new PatternRule("NAME_WITH_SUFFIX", EntityType.PERSON, 0.85,
                "\\b[A-Z][a-z]{1,20}+(?: [A-Z][a-z]{1,20}+){1,2},? (?:Jr|Sr|II|III|IV)\\b",
                0, s -> true,
                m -> !ClinicalWhitelist.containsWhitelisted(m.group())));

        // O'Brien, D'Angelo, McDonald, MacArthur, Mary-Jane, Smith-Jones
        RULES.add(new PatternRule("NAME_APOSTROPHE", EntityType.PERSON, 0.80,
                "\\b(?:(?:[A-Z]'|Ma?c)[A-Z][a-z]{1,20}+(?:-[A-Z][a-z]{1,20}+){0,2}+"
                        + "|[A-Z][a-z]{1,20}+(?:-[A-Z][a-z]{1,20}+){1,2}+)\\b",
                0, s -> s.indexOf('\'') >= 0 || s.indexOf('-') >= 0 || s.contains("Mc") || s.contains("Mac"),
                m -> Arrays.stream(NAME_PART_SEPARATOR.split(m.group())).noneMatch(ClinicalWhitelist::isTerm)));

        RULES.add(new PatternRule("ALL_CAPS_NAME", EntityType.PERSON, 0.80,
                "\\b[A-Z]{2,20}+(?:,? [A-Z]{2,20}+){1,3}+\\b",
                0, StructuralPatternStrategy::hasUpperRun,
                m -> !ClinicalWhitelist.containsWhitelisted(m.group())));

        RULES.add(new PatternRule("ALL_CAPS_SINGLE", EntityType.PERSON, 0.70,
                "\\b[A-Z]{3,20}+\\b",
                0, StructuralPatternStrategy::hasUpperRun,
                m -> !ClinicalWhitelist.isAcronym(m.group())));
    }

    @Override
    public String getName() {
        return "StructuralPatternStrategy";
    }

    @Override
    public DetectionMethod getMethod() {
        return DetectionMethod.REGEX;
    }

    @Override
    public boolean isApplicable(ScrubConfig config) {
        return true;
    }

    @Override
    public List<DetectorRun> detect(String text, ScrubConfig config, ErrorCollector errors) {
        List<DetectorRun> runs = new ArrayList<>(RULES.size());
        BitSet placeholders = PlaceholderToken.coveredPositions(text);
        int total = 0;

        for (PatternRule rule : RULES) {
            long startTime = System.currentTimeMillis();

            // Quick rejection before running the pattern over the whole text
            if (!rule.quickCheck.check(text)) {
                runs.add(new DetectorRun(getName(), rule.name, Collections.emptyList(), 0));
                continue;
            }

            List<Detection> detections = new ArrayList<>();
            Matcher matcher = rule.pattern.matcher(text);
            while (matcher.find()) {
                int start = matcher.start(rule.valueGroup);
                int end = matcher.end(rule.valueGroup);
                if (start < 0 || start == end || touchesPlaceholder(placeholders, start, end)) {
                    continue;
                }
                if (rule.filter != null && !rule.filter.accept(matcher)) {
                    continue;
                }
                detections.add(createDetection(text, start, end, rule.type, rule.confidence, rule.name));
            }

            long elapsed = elapsedSince(startTime);
            log.debug("Pattern {} found {} match(es) in {} ms", rule.name, detections.size(), elapsed);
            total += detections.size();
            runs.add(new DetectorRun(getName(), rule.name, detections, elapsed));
        }

        log.debug("Structural pass found {} match(es) over {} patterns", total, RULES.size());
        return runs;
    }

    /**
     * Names of the pattern families, in evaluation order.
     *
     * @return Pattern names
     */
    public List<String> getPatternNames() {
        return RULES.stream().map(rule -> rule.name).toList();
    }

    private static boolean hasDigit(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isDigit(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static int countDigits(String s) {
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (Character.isDigit(s.charAt(i))) {
                count++;
            }
        }
        return count;
    }

    private static boolean hasUpperRun(String s) {
        int run = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            run = (c >= 'A' && c <= 'Z') ? run + 1 : 0;
            if (run >= 2) {
                return true;
            }
        }
        return false;
    }

    private static final class PatternRule {
        private final String name;
        private final EntityType type;
        private final double confidence;
        private final Pattern pattern;
        private final int valueGroup;
        private final QuickCheckFunction quickCheck;
        private final MatchFilter filter;

        private PatternRule(String name, EntityType type, double confidence, String regex,
                            QuickCheckFunction quickCheck) {
            this(name, type, confidence, regex, 0, quickCheck, null);
        }

        private PatternRule(String name, EntityType type, double confidence, String regex, int valueGroup,
                            QuickCheckFunction quickCheck, MatchFilter filter) {
            this.name = name;
            this.type = type;
            this.confidence = confidence;
            this.pattern = Pattern.compile(regex);
            this.valueGroup = valueGroup;
            this.quickCheck = quickCheck;
            this.filter = filter;
        }
    }

    @FunctionalInterface
    private interface QuickCheckFunction {
        boolean check(String input);
    }

    @FunctionalInterface
    private interface MatchFilter {
        boolean accept(Matcher match);
    }
}
