package com.cgi.medscrub.api;

import com.cgi.medscrub.model.ScrubResult;

/**
 * Interface for rendering scrub results for audit.
 */
public interface ScrubReportGenerator {
    /**
     * Generates a plain-text summary of a scrub.
     *
     * @param result Scrub result
     * @return Formatted summary
     */
    String generateSummary(ScrubResult result);

    /**
     * Exports a scrub result in a specific format.
     *
     * @param result Scrub result
     * @param format Export format (JSON or CSV)
     * @return Exported data
     */
    byte[] exportResult(ScrubResult result, String format);
}
