package com.phillippitts.retroauto.service.engine;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lowered flow: ordered instructions plus the label offsets within them.
 *
 * @param name flow name
 * @param instructions instructions addressed by the frame's instruction pointer
 * @param labels label name to instruction index
 * @param loopSlots number of loop counters a frame of this flow may need
 */
public record CompiledFlow(String name, List<Instruction> instructions, Map<String, Integer> labels, int loopSlots) {

    public CompiledFlow {
        instructions = List.copyOf(instructions);
        labels = Map.copyOf(labels);
    }

    public int size() {
        return instructions.size();
    }

    public Instruction at(int index) {
        return instructions.get(index);
    }

    public Optional<Integer> labelIndex(String label) {
        return Optional.ofNullable(labels.get(label));
    }
}
