package com.phillippitts.retroauto.service.events;

import java.time.Instant;

/** Published by the executor when it applies a preemption and enters the rule's flow. */
public record InterruptFiredEvent(String sessionId,
                                  String ruleId,
                                  String targetFlow,
                                  String preemptedFlow,
                                  int preemptedInstruction,
                                  Instant at) {
    public InterruptFiredEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
