package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.dsl.ScriptRenderer;
import com.phillippitts.retroauto.dsl.ast.ActionCall;
import com.phillippitts.retroauto.dsl.ast.Expression;

/**
 * Flat, index-addressed form of a statement. Structured control flow is lowered to jumps,
 * so an execution frame only ever needs a flow and an instruction pointer.
 */
public interface Instruction {

    /** Short human-readable form, used by the debugger snapshot. */
    String describe();

    record Action(ActionCall call) implements Instruction {
        @Override
        public String describe() {
            return call.kind().keyword() + "(...)";
        }
    }

    record Assign(String variable, Expression value) implements Instruction {
        @Override
        public String describe() {
            return "$" + variable + " = " + ScriptRenderer.render(value);
        }
    }

    /** Label position; executes as a no-op. */
    record Label(String name) implements Instruction {
        @Override
        public String describe() {
            return "label " + name;
        }
    }

    /** Unconditional jump, produced by goto, break, continue and the end of loop and if bodies. */
    record Jump(int target, String origin) implements Instruction {
        @Override
        public String describe() {
            return origin + " -> " + target;
        }
    }

    record BranchIfFalse(Expression condition, int target) implements Instruction {
        @Override
        public String describe() {
            return "unless " + ScriptRenderer.render(condition) + " -> " + target;
        }
    }

    /** Resets the counter of the loop occupying {@code slot} before the loop is entered from the top. */
    record LoopInit(int slot) implements Instruction {
        @Override
        public String describe() {
            return "loop init #" + slot;
        }
    }

    /**
     * Head of a counted loop. A missing counter is initialised from {@code count}; an exhausted
     * counter is removed and control jumps to {@code exit}. A {@code null} count never exhausts.
     */
    record LoopCheck(int slot, Expression count, int exit) implements Instruction {
        @Override
        public String describe() {
            return "loop #" + slot + (count == null ? "" : " " + ScriptRenderer.render(count)) + " exit " + exit;
        }
    }

    record RunFlow(String flowName) implements Instruction {
        @Override
        public String describe() {
            return "run " + flowName;
        }
    }
}
