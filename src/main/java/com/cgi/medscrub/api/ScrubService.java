package com.cgi.medscrub.api;

import com.cgi.medscrub.model.ScrubConfig;
import com.cgi.medscrub.model.ScrubResult;

import java.util.concurrent.CompletableFuture;

/**
 * Main interface of the de-identification engine.
 */
public interface ScrubService {
    /**
     * De-identifies a document with the default configuration and a fresh session salt.
     *
     * @param text Document text
     * @return Scrub result
     * @throws com.cgi.medscrub.exception.InputRejectedException if the input is too large or malformed
     */
    ScrubResult scrub(String text);

    /**
     * De-identifies a document.
     * Only input validation failures are thrown; every other problem is reported in the result warnings.
     *
     * @param text Document text
     * @param config Scrub configuration
     * @return Scrub result
     * @throws com.cgi.medscrub.exception.InputRejectedException if the input is too large or malformed
     * @throws IllegalArgumentException if the configuration is invalid
     */
    ScrubResult scrub(String text, ScrubConfig config);

    /**
     * De-identifies a document on a worker thread.
     * Validation failures complete the future exceptionally.
     *
     * @param text Document text
     * @param config Scrub configuration
     * @return Future result
     */
    CompletableFuture<ScrubResult> scrubAsync(String text, ScrubConfig config);

    /**
     * Configuration used when the caller does not supply one.
     *
     * @return Default configuration, without a session salt
     */
    ScrubConfig getDefaultConfig();
}
