package com.cgi.medscrub.service;

import com.cgi.medscrub.model.PlaceholderToken;
import com.cgi.medscrub.strategy.ClinicalWhitelist;
import org.springframework.stereotype.Component;

import java.util.BitSet;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks for text in the scrubbed output that still resembles personal information.
 * Advisory only: it counts suspicious fragments, it never redacts.
 */
@Component
public class ResidualRiskScanner {

    public enum RiskCategory {
        CAPITALIZED_SEQUENCE,
        LONG_NUMBER,
        EMAIL_LIKE,
        PHONE_LIKE
    }

    private static final Map<RiskCategory, Pattern> PATTERNS = new EnumMap<>(RiskCategory.class);

    static {
        PATTERNS.put(RiskCategory.CAPITALIZED_SEQUENCE,
                Pattern.compile("\\b[A-Z][a-z]{2,20}+(?:[ \\t][A-Z][a-z]{2,20}+){1,3}+\\b"));
        PATTERNS.put(RiskCategory.LONG_NUMBER, Pattern.compile("(?<!\\w)\\d{6,}+(?!\\w)"));
        PATTERNS.put(RiskCategory.EMAIL_LIKE, Pattern.compile("[^\\s@]{1,64}+@[^\\s@]{1,255}+"));
        PATTERNS.put(RiskCategory.PHONE_LIKE, Pattern.compile("(?<!\\w)\\d{3}[-.]\\d{4}(?!\\w)"));
    }

    /**
     * Counts suspicious fragments per category, ignoring placeholders.
     *
     * @param scrubbedText Output text
     * @return Count per category, only categories with at least one match
     */
    public Map<RiskCategory, Integer> scan(String scrubbedText) {
        Map<RiskCategory, Integer> findings = new EnumMap<>(RiskCategory.class);
        BitSet placeholders = PlaceholderToken.coveredPositions(scrubbedText);

        for (Map.Entry<RiskCategory, Pattern> entry : PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(scrubbedText);
            int count = 0;
            while (matcher.find()) {
                if (PlaceholderToken.intersects(placeholders, matcher.start(), matcher.end())) {
                    continue;
                }
                if (entry.getKey() == RiskCategory.CAPITALIZED_SEQUENCE
                        && ClinicalWhitelist.containsWhitelisted(matcher.group())) {
                    continue;
                }
                count++;
            }
            if (count > 0) {
                findings.put(entry.getKey(), count);
            }
        }
        return findings;
    }
}
