package com.cgi.medscrub.api.dto;

import com.cgi.medscrub.model.ScrubConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Body of a scrub request. Unset options fall back to the server configuration.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrubRequest {
    @ToString.Exclude
    private String text;

    /**
     * Salt shared by the documents of one session, so that the same value gets the same placeholder.
     */
    @ToString.Exclude
    private String sessionSalt;

    private Boolean enableStatisticalDetector;
    private Boolean enableContextDetector;
    private Double confidenceThreshold;

    /**
     * Applies the request options on top of a base configuration.
     *
     * @param base Server configuration
     * @return Configuration for this request
     */
    public ScrubConfig toConfig(ScrubConfig base) {
        ScrubConfig.ScrubConfigBuilder builder = base.toBuilder();
        if (sessionSalt != null && !sessionSalt.isBlank()) {
            builder.sessionSalt(sessionSalt);
        }
        if (enableStatisticalDetector != null) {
            builder.enableStatisticalDetector(enableStatisticalDetector);
        }
        if (enableContextDetector != null) {
            builder.enableContextDetector(enableContextDetector);
        }
        if (confidenceThreshold != null) {
            builder.confidenceThreshold(confidenceThreshold);
            if (base.getWarningThreshold() > confidenceThreshold) {
                builder.warningThreshold(confidenceThreshold);
            }
        }
        return builder.build();
    }
}
