package com.cgi.medscrub.api;

import com.cgi.medscrub.model.DetectorRun;
import com.cgi.medscrub.model.ErrorCollector;
import com.cgi.medscrub.model.ScrubConfig;
import com.cgi.medscrub.model.enums.DetectionMethod;

import java.util.List;

/**
 * Interface for PII detection strategies.
 * Implements the Strategy pattern.
 */
public interface PIIDetectionStrategy {
    /**
     * Unique name of the strategy.
     *
     * @return Strategy name
     */
    String getName();

    /**
     * Method stamped on every detection this strategy produces.
     *
     * @return Detection method
     */
    DetectionMethod getMethod();

    /**
     * Detects PII in a document.
     * Implementations do not throw for recoverable problems: they report them to the collector.
     *
     * @param text Validated document text
     * @param config Scrub configuration
     * @param errors Collector for recoverable problems
     * @return One run per pattern, label group or chunk that was evaluated
     */
    List<DetectorRun> detect(String text, ScrubConfig config, ErrorCollector errors);

    /**
     * Indicates if this strategy is enabled for the given configuration.
     *
     * @param config Scrub configuration
     * @return true if the strategy should run
     */
    boolean isApplicable(ScrubConfig config);
}
