/*
 * ScrubReportGeneratorImpl.java - Summary and export of scrub results
 */
package com.cgi.medscrub.service;

import com.cgi.medscrub.api.ScrubReportGenerator;
import com.cgi.medscrub.exception.ReportExportException;
import com.cgi.medscrub.model.AuditEntry;
import com.cgi.medscrub.model.AuditSummary;
import com.cgi.medscrub.model.RedactionRecord;
import com.cgi.medscrub.model.ScrubResult;
import com.cgi.medscrub.model.ScrubWarning;
import com.cgi.medscrub.model.enums.EntityType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

/**
 * Implementation of the scrub report generator.
 */
@Component
public class ScrubReportGeneratorImpl implements ScrubReportGenerator {
    private static final Logger log = LoggerFactory.getLogger(ScrubReportGeneratorImpl.class);

    // Object mapper for JSON serialization
    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public String generateSummary(ScrubResult result) {
        StringBuilder summary = new StringBuilder();
        summary.append("== Scrub Summary ==\n\n");
        summary.append(String.format(Locale.ROOT, "Replacements: %d\n", result.getCount()));
        summary.append(String.format(Locale.ROOT, "Confidence: %.1f%%\n", result.getConfidence() * 100));

        AuditSummary audit = result.getAuditTrail() != null ? result.getAuditTrail().getSummary() : null;
        if (audit != null) {
            summary.append(String.format(Locale.ROOT, "Duration: %d ms\n", audit.getDurationMs()));
            summary.append(String.format(Locale.ROOT, "Redacted characters: %d of %d (%.2f%%)\n",
                    audit.getRedactedChars(), audit.getOriginalLength(), audit.getDensity() * 100));
            summary.append(String.format(Locale.ROOT, "Statistical pass: %s (%d chunk(s))\n",
                    audit.isStatisticalPassRan() ? "yes" : "no", audit.getChunkCount()));

            if (!audit.getByCategory().isEmpty()) {
                summary.append("\nBy category:\n");
                audit.getByCategory().entrySet().stream()
                        .sorted(Map.Entry.<EntityType, Integer>comparingByValue().reversed())
                        .forEach(entry -> summary.append(String.format(Locale.ROOT, "- %s: %d\n",
                                entry.getKey(), entry.getValue())));
            }
        }

        if (!result.getWarnings().isEmpty()) {
            summary.append("\nWarnings:\n");
            for (ScrubWarning warning : result.getWarnings()) {
                summary.append(String.format(Locale.ROOT, "- [%s] %s\n", warning.getType(), warning.getMessage()));
            }
        }
        return summary.toString();
    }

    @Override
    public byte[] exportResult(ScrubResult result, String format) {
        if ("json".equalsIgnoreCase(format)) {
            return exportToJson(result);
        } else if ("csv".equalsIgnoreCase(format)) {
            return exportToCsv(result);
        }
        throw new IllegalArgumentException("Unsupported format: " + format);
    }

    private byte[] exportToJson(ScrubResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(result);
        } catch (JsonProcessingException e) {
            log.error("Error exporting results: {}", e.getMessage(), e);
            throw new ReportExportException("Error exporting results as JSON", e);
        }
    }

    /**
     * One row per audited match.
     */
    private byte[] exportToCsv(ScrubResult result) {
        StringBuilder csv = new StringBuilder();
        csv.append("Detector,Pattern,Original,Placeholder,Offset,Applied,ElapsedMs\n");

        if (result.getAuditTrail() != null) {
            for (AuditEntry entry : result.getAuditTrail().getEntries()) {
                for (RedactionRecord record : entry.getReplacements()) {
                    csv.append(escapeCsv(entry.getDetectorName())).append(',')
                            .append(escapeCsv(entry.getPatternOrLabel())).append(',')
                            .append(escapeCsv(record.getOriginal())).append(',')
                            .append(escapeCsv(record.getPlaceholder())).append(',')
                            .append(record.getStartOffset()).append(',')
                            .append(record.isApplied()).append(',')
                            .append(entry.getElapsedMs()).append('\n');
                }
            }
        }
        return csv.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String escapeCsv(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
