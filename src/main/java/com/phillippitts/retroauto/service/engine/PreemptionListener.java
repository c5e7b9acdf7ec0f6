package com.phillippitts.retroauto.service.engine;

/**
 * Executor-side notifications about a {@link PreemptionRequest}, called on the executor thread.
 * The interrupt supervisor implements this to leave its suspended state.
 */
public interface PreemptionListener {

    PreemptionListener NO_OP = new PreemptionListener() {
        @Override
        public void onPreemptionApplied(PreemptionRequest request) {
        }

        @Override
        public void onPreemptionCompleted(PreemptionRequest request) {
        }

        @Override
        public void onPreemptionDropped(PreemptionRequest request) {
        }
    };

    /** The target flow's frame was pushed. */
    void onPreemptionApplied(PreemptionRequest request);

    /** The target flow ran to completion and its frame was popped. */
    void onPreemptionCompleted(PreemptionRequest request);

    /** The request was never applied, or its flow was abandoned by stop or a fatal error. */
    void onPreemptionDropped(PreemptionRequest request);
}
