package com.phillippitts.retroauto.service.engine;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debugger breakpoints {@code (flow, instructionIndex)}. Written by the REST thread, read by
 * the executor at each statement boundary.
 */
public final class Breakpoints {

    public record Breakpoint(String flow, int instructionIndex) {
        public Breakpoint {
            if (flow == null || flow.isBlank()) {
                throw new IllegalArgumentException("flow must not be blank");
            }
            if (instructionIndex < 0) {
                throw new IllegalArgumentException("instructionIndex must be >= 0: " + instructionIndex);
            }
        }
    }

    private final Set<Breakpoint> points = ConcurrentHashMap.newKeySet();

    public boolean add(String flow, int instructionIndex) {
        return points.add(new Breakpoint(flow, instructionIndex));
    }

    public boolean remove(String flow, int instructionIndex) {
        return points.remove(new Breakpoint(flow, instructionIndex));
    }

    public void clear() {
        points.clear();
    }

    public boolean contains(String flow, int instructionIndex) {
        return !points.isEmpty() && points.contains(new Breakpoint(flow, instructionIndex));
    }

    public List<Breakpoint> list() {
        return points.stream()
                .sorted(Comparator.comparing(Breakpoint::flow).thenComparingInt(Breakpoint::instructionIndex))
                .toList();
    }
}
