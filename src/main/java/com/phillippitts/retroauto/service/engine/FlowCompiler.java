package com.phillippitts.retroauto.service.engine;

import com.phillippitts.retroauto.dsl.ast.ActionCall;
import com.phillippitts.retroauto.dsl.ast.AssignStatement;
import com.phillippitts.retroauto.dsl.ast.BreakStatement;
import com.phillippitts.retroauto.dsl.ast.ConditionalBranch;
import com.phillippitts.retroauto.dsl.ast.ContinueStatement;
import com.phillippitts.retroauto.dsl.ast.Flow;
import com.phillippitts.retroauto.dsl.ast.GotoStatement;
import com.phillippitts.retroauto.dsl.ast.IfStatement;
import com.phillippitts.retroauto.dsl.ast.LabelStatement;
import com.phillippitts.retroauto.dsl.ast.LoopStatement;
import com.phillippitts.retroauto.dsl.ast.Program;
import com.phillippitts.retroauto.dsl.ast.RunFlowStatement;
import com.phillippitts.retroauto.dsl.ast.Statement;
import com.phillippitts.retroauto.dsl.ast.WhileStatement;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers structured flows into {@link CompiledFlow} instruction lists.
 *
 * <p>Jump targets are emitted as placeholders and patched once the target index is known.
 * Gotos are resolved after the whole flow is emitted so forward labels work.
 */
public final class FlowCompiler {

    private final List<Instruction> code = new ArrayList<>();
    private final Map<String, Integer> labels = new HashMap<>();
    private final Map<Integer, String> pendingGotos = new HashMap<>();
    private final Deque<LoopContext> loops = new ArrayDeque<>();
    private int loopSlots = 0;

    /** Break sites are patched when the loop's exit index is known. */
    private static final class LoopContext {
        final int continueTarget;
        final List<Integer> breakSites = new ArrayList<>();

        LoopContext(int continueTarget) {
            this.continueTarget = continueTarget;
        }
    }

    private FlowCompiler() {
    }

    public static FlowRegistry compile(Program program) {
        Map<String, CompiledFlow> compiled = new LinkedHashMap<>();
        for (Flow flow : program.flows().values()) {
            compiled.put(flow.name(), compile(flow));
        }
        return new FlowRegistry(compiled);
    }

    public static CompiledFlow compile(Flow flow) {
        FlowCompiler compiler = new FlowCompiler();
        compiler.emitBlock(flow.body());
        compiler.resolveGotos(flow.name());
        return new CompiledFlow(flow.name(), compiler.code, compiler.labels, compiler.loopSlots);
    }

    private void emitBlock(List<Statement> body) {
        for (Statement stmt : body) {
            emit(stmt);
        }
    }

    private void emit(Statement stmt) {
        if (stmt instanceof ActionCall call) {
            code.add(new Instruction.Action(call));
        } else if (stmt instanceof AssignStatement assign) {
            code.add(new Instruction.Assign(assign.variable(), assign.value()));
        } else if (stmt instanceof LabelStatement label) {
            labels.put(label.name(), code.size());
            code.add(new Instruction.Label(label.name()));
        } else if (stmt instanceof GotoStatement jump) {
            pendingGotos.put(code.size(), jump.label());
            code.add(null);
        } else if (stmt instanceof RunFlowStatement run) {
            code.add(new Instruction.RunFlow(run.flowName()));
        } else if (stmt instanceof IfStatement ifStmt) {
            emitIf(ifStmt);
        } else if (stmt instanceof LoopStatement loop) {
            emitLoop(loop);
        } else if (stmt instanceof WhileStatement loop) {
            emitWhile(loop);
        } else if (stmt instanceof BreakStatement) {
            loops.peek().breakSites.add(code.size());
            code.add(null);
        } else if (stmt instanceof ContinueStatement) {
            code.add(new Instruction.Jump(loops.peek().continueTarget, "continue"));
        } else {
            throw new IllegalArgumentException("Unsupported statement: " + stmt);
        }
    }

    private void emitIf(IfStatement ifStmt) {
        List<Integer> endJumps = new ArrayList<>();
        for (ConditionalBranch branch : ifStmt.branches()) {
            int test = code.size();
            code.add(null);
            emitBlock(branch.body());
            endJumps.add(code.size());
            code.add(null);
            code.set(test, new Instruction.BranchIfFalse(branch.condition(), code.size()));
        }
        emitBlock(ifStmt.elseBody());
        int end = code.size();
        for (int site : endJumps) {
            code.set(site, new Instruction.Jump(end, "end if"));
        }
    }

    private void emitLoop(LoopStatement loop) {
        int slot = loopSlots++;
        code.add(new Instruction.LoopInit(slot));
        int head = code.size();
        code.add(null);
        LoopContext ctx = new LoopContext(head);
        loops.push(ctx);
        emitBlock(loop.body());
        loops.pop();
        code.add(new Instruction.Jump(head, "loop"));
        int exit = code.size();
        code.set(head, new Instruction.LoopCheck(slot, loop.count(), exit));
        patchBreaks(ctx, exit);
    }

    private void emitWhile(WhileStatement loop) {
        int head = code.size();
        code.add(null);
        LoopContext ctx = new LoopContext(head);
        loops.push(ctx);
        emitBlock(loop.body());
        loops.pop();
        code.add(new Instruction.Jump(head, "while"));
        int exit = code.size();
        code.set(head, new Instruction.BranchIfFalse(loop.condition(), exit));
        patchBreaks(ctx, exit);
    }

    private void patchBreaks(LoopContext ctx, int exit) {
        for (int site : ctx.breakSites) {
            code.set(site, new Instruction.Jump(exit, "break"));
        }
    }

    private void resolveGotos(String flowName) {
        for (Map.Entry<Integer, String> e : pendingGotos.entrySet()) {
            Integer target = labels.get(e.getValue());
            if (target == null) {
                throw new IllegalStateException("Unknown label '" + e.getValue() + "' in flow '" + flowName + "'");
            }
            code.set(e.getKey(), new Instruction.Jump(target, "goto " + e.getValue()));
        }
    }
}
