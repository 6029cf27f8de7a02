package com.cgi.medscrub.service;

import com.cgi.medscrub.api.ScrubStageListener;
import com.cgi.medscrub.model.enums.ScrubStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs every pipeline state transition at debug level.
 */
@Component
public class LoggingStageListener implements ScrubStageListener {
    private static final Logger log = LoggerFactory.getLogger(LoggingStageListener.class);

    @Override
    public void onStageChanged(ScrubStage previous, ScrubStage next) {
        if (next == ScrubStage.FAILED) {
            log.debug("Scrub failed during {}", previous);
        } else {
            log.debug("Scrub stage {} -> {}", previous, next);
        }
    }
}
