package com.cgi.medscrub.api;

import com.cgi.medscrub.model.enums.ScrubStage;

/**
 * Observer of pipeline state transitions.
 * Called on the thread running the scrub; implementations must not block.
 */
public interface ScrubStageListener {
    /**
     * Called every time the pipeline enters a new state.
     *
     * @param previous State being left, null for the first transition
     * @param next State being entered
     */
    void onStageChanged(ScrubStage previous, ScrubStage next);
}
