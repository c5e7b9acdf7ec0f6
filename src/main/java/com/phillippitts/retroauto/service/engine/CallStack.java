package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.exception.RecursionLimitException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Bounded stack of execution frames. The entry frame counts toward the bound, so with a
 * depth limit of N the (N+1)-th push fails.
 */
public final class CallStack {

    public static final int DEFAULT_MAX_DEPTH = 100;

    private final List<ExecutionFrame> frames = new ArrayList<>();
    private final int maxDepth;
    private int pushes;

    public CallStack(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Pushes a frame. The caller's instruction pointer must still address the instruction
     * doing the push, so a failure reports that location.
     *
     * @throws RecursionLimitException if the stack already holds {@code maxDepth} frames
     */
    public void push(ExecutionFrame frame) {
        if (frames.size() >= maxDepth) {
            ExecutionFrame caller = peek();
            throw new RecursionLimitException(frame.flowName(), maxDepth,
                    caller == null ? frame.flowName() : caller.flowName(),
                    caller == null ? 0 : caller.instructionPointer());
        }
        frames.add(frame);
        pushes++;
    }

    public ExecutionFrame pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Call stack is empty");
        }
        return frames.remove(frames.size() - 1);
    }

    /** Top frame, or {@code null} when empty. */
    public ExecutionFrame peek() {
        return frames.isEmpty() ? null : frames.get(frames.size() - 1);
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int depth() {
        return frames.size();
    }

    public int maxDepth() {
        return maxDepth;
    }

    /** Total successful pushes since creation. */
    public int pushCount() {
        return pushes;
    }

    public void clear() {
        frames.clear();
    }

    /** Bottom-to-top view. */
    public List<ExecutionFrame> frames() {
        return Collections.unmodifiableList(frames);
    }
}
