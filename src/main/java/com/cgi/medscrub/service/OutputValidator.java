package com.cgi.medscrub.service;

import com.cgi.medscrub.model.AuditEntry;
import com.cgi.medscrub.model.Detection;
import com.cgi.medscrub.model.MergeOutcome;
import com.cgi.medscrub.model.ScrubResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Checks the invariants of a finished scrub result.
 * Violations are returned, not thrown: the caller logs them and still returns the result.
 */
@Component
public class OutputValidator {

    /**
     * @param originalText Input text
     * @param result Result to check
     * @param outcome Merge outcome the result was built from
     * @return Violation messages, empty if the result is consistent
     */
    public List<String> validate(String originalText, ScrubResult result, MergeOutcome outcome) {
        List<String> violations = new ArrayList<>();

        if (result.getCount() != result.getReplacements().size()
                || result.getCount() != result.getDetections().size()) {
            violations.add(String.format("count=%d but %d replacement(s) and %d detection(s)",
                    result.getCount(), result.getReplacements().size(), result.getDetections().size()));
        }

        if (result.getConfidence() < 0.0 || result.getConfidence() > 1.0) {
            violations.add("confidence out of range: " + result.getConfidence());
        }

        if (new HashSet<>(result.getReplacements().values()).size() != result.getReplacements().size()) {
            violations.add("two different values share one placeholder");
        }

        for (Map.Entry<String, String> replacement : result.getReplacements().entrySet()) {
            if (!result.getText().contains(replacement.getValue())) {
                violations.add("placeholder " + replacement.getValue() + " missing from output");
            }
        }

        long expectedLength = originalText.length();
        for (Detection span : outcome.getSpans()) {
            String placeholder = result.getReplacements().get(span.getEntityText());
            if (placeholder != null) {
                expectedLength += placeholder.length() - span.length();
            }
        }
        if (expectedLength != result.getText().length()) {
            violations.add(String.format("output length %d, expected %d from applied replacements",
                    result.getText().length(), expectedLength));
        }

        if (result.getAuditTrail() != null) {
            for (AuditEntry entry : result.getAuditTrail().getEntries()) {
                if (entry.getMatchCount() != entry.getReplacements().size()) {
                    violations.add("audit entry " + entry.getPatternOrLabel() + " has inconsistent match count");
                }
            }
        }
        return violations;
    }
}
