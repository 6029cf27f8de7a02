package com.cgi.medscrub.model;

import com.cgi.medscrub.model.enums.WarningType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gathers recoverable problems during one scrub.
 * Statistical chunk tasks report from worker threads, so additions are synchronized.
 */
public class ErrorCollector {
    private final List<ScrubWarning> warnings = new ArrayList<>();

    public synchronized void add(ScrubWarning warning) {
        warnings.add(warning);
    }

    public synchronized List<ScrubWarning> getWarnings() {
        return Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public synchronized long count(WarningType type) {
        return warnings.stream().filter(w -> w.getType() == type).count();
    }
}
