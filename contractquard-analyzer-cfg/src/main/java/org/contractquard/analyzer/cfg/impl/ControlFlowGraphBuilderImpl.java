package org.contractquard.analyzer.cfg.impl;

import org.contractquard.analyzer.cfg.*;
import org.contractquard.analyzer.cfg.analysis.Reachability;
import org.contractquard.analyzer.ir.expression.Literal;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.statement.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Single forward pass over the function body. Nested statement lists are handled with an explicit stack
 * of frames rather than recursion, so the depth of the source nesting does not matter.
 * <p>
 * Statements following a flow-interrupting statement in the same list go into a fresh block without
 * predecessors; they stay part of the graph and show up as unreachable.
 * Edges from the tails of if- and try-branches to the merge block are always added, also when the tail
 * ends in a return. A loop body's tail only links back to the loop header when it completes normally.
 */
public class ControlFlowGraphBuilderImpl implements ControlFlowGraphBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ControlFlowGraphBuilderImpl.class);

    @Override
    public ControlFlowGraph build(IRFunction function) {
        Construction construction = new Construction();
        construction.run(function.body());
        ControlFlowGraph cfg = construction.result(function.name());
        LOGGER.debug("CFG of {}: {} nodes, {} edges, exits {}", function.name(), cfg.nodeCount(),
                cfg.edgeCount(), cfg.exitNodes());
        return cfg;
    }

    private static final class BasicBlock {
        final String id;
        final List<IRStatement> statements = new ArrayList<>();
        boolean entry;
        boolean exit;
        boolean branch;
        boolean merge;
        boolean terminated;
        String jumpTarget;

        BasicBlock(String id) {
            this.id = id;
        }

        CFGNode toNode(boolean isExit) {
            return new CFGNode(id, statements, entry, isExit, branch, merge, terminated, jumpTarget);
        }
    }

    private abstract static class Frame {
        Iterator<IRStatement> iterator;

        Frame(List<IRStatement> statements) {
            this.iterator = statements.iterator();
        }

        // switch to the next statement list of this construct; false when there is none
        boolean nextPhase(Construction c) {
            return false;
        }

        void complete(Construction c) {
        }
    }

    private static final class SequenceFrame extends Frame {
        SequenceFrame(List<IRStatement> statements) {
            super(statements);
        }
    }

    private static final class IfFrame extends Frame {
        final BasicBlock elseStart;
        final List<IRStatement> elseStatements;
        final BasicBlock merge;
        BasicBlock thenTail;

        IfFrame(List<IRStatement> thenStatements, BasicBlock elseStart, List<IRStatement> elseStatements,
                BasicBlock merge) {
            super(thenStatements);
            this.elseStart = elseStart;
            this.elseStatements = elseStatements;
            this.merge = merge;
        }

        @Override
        boolean nextPhase(Construction c) {
            if (thenTail == null && elseStart != null) {
                thenTail = c.current;
                c.current = elseStart;
                iterator = elseStatements.iterator();
                return true;
            }
            return false;
        }

        @Override
        void complete(Construction c) {
            if (thenTail != null) c.edge(thenTail, merge, EdgeKind.CONTROL_FLOW);
            c.edge(c.current, merge, EdgeKind.CONTROL_FLOW);
            c.current = merge;
        }
    }

    private static final class LoopFrame extends Frame {
        final BasicBlock bodyStart;
        final BasicBlock header;
        final BasicBlock exit;
        final BasicBlock update;
        final IRStatement updateStatement;
        final BasicBlock continueTarget;
        final boolean doWhile;
        final boolean infinite;

        LoopFrame(List<IRStatement> body, BasicBlock bodyStart, BasicBlock header, BasicBlock exit,
                  BasicBlock update, IRStatement updateStatement, boolean doWhile, boolean infinite) {
            super(body);
            this.bodyStart = bodyStart;
            this.header = header;
            this.exit = exit;
            this.update = update;
            this.updateStatement = updateStatement;
            this.continueTarget = update != null ? update : header;
            this.doWhile = doWhile;
            this.infinite = infinite;
        }

        @Override
        void complete(Construction c) {
            BasicBlock tail = c.current;
            if (doWhile) {
                if (!tail.terminated) c.edge(tail, header, EdgeKind.CONTROL_FLOW);
                c.edge(header, bodyStart, EdgeKind.LOOP_BACK);
                if (!infinite) c.edge(header, exit, EdgeKind.CONDITIONAL_FALSE);
            } else if (update != null) {
                if (!tail.terminated) c.edge(tail, update, EdgeKind.CONTROL_FLOW);
                update.statements.add(updateStatement);
                c.edge(update, header, EdgeKind.LOOP_BACK);
            } else if (!tail.terminated) {
                c.edge(tail, header, EdgeKind.LOOP_BACK);
            }
            c.current = exit;
        }
    }

    private static final class TryFrame extends Frame {
        final List<BasicBlock> catchStarts;
        final List<List<IRStatement>> catchBodies;
        final BasicBlock merge;
        final List<BasicBlock> tails = new ArrayList<>();
        int index = -1;

        TryFrame(List<IRStatement> body, List<BasicBlock> catchStarts, List<List<IRStatement>> catchBodies,
                 BasicBlock merge) {
            super(body);
            this.catchStarts = catchStarts;
            this.catchBodies = catchBodies;
            this.merge = merge;
        }

        @Override
        boolean nextPhase(Construction c) {
            tails.add(c.current);
            index++;
            if (index < catchStarts.size()) {
                c.current = catchStarts.get(index);
                iterator = catchBodies.get(index).iterator();
                return true;
            }
            return false;
        }

        @Override
        void complete(Construction c) {
            for (BasicBlock tail : tails) {
                c.edge(tail, merge, EdgeKind.CONTROL_FLOW);
            }
            c.current = merge;
        }
    }

    private static final class Construction {
        final List<BasicBlock> blocks = new ArrayList<>();
        final List<GraphEdge> edges = new ArrayList<>();
        BasicBlock current;

        BasicBlock newBlock() {
            BasicBlock block = new BasicBlock("bb" + blocks.size());
            blocks.add(block);
            return block;
        }

        void edge(BasicBlock from, BasicBlock to, EdgeKind kind) {
            edges.add(new GraphEdge(from.id, to.id, kind));
        }

        void run(List<IRStatement> body) {
            current = newBlock();
            current.entry = true;
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new SequenceFrame(body));
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.iterator.hasNext()) {
                    process(frame.iterator.next(), stack);
                } else if (!frame.nextPhase(this)) {
                    stack.pop();
                    frame.complete(this);
                }
            }
        }

        private void process(IRStatement statement, Deque<Frame> stack) {
            if (current.terminated) {
                current = newBlock();
            }
            if (statement instanceof IfElseStatement ifElse) {
                processIf(ifElse, stack);
            } else if (statement instanceof LoopStatement loop) {
                processLoop(loop, stack);
            } else if (statement instanceof TryStatement tryStatement) {
                processTry(tryStatement, stack);
            } else if (statement instanceof ReturnStatement) {
                current.statements.add(statement);
                current.terminated = true;
                current.exit = true;
            } else if (statement instanceof BreakStatement || statement instanceof ContinueStatement) {
                current.statements.add(statement);
                LoopFrame loopFrame = innermostLoop(stack);
                if (loopFrame != null) {
                    BasicBlock target = statement instanceof BreakStatement ? loopFrame.exit : loopFrame.continueTarget;
                    current.terminated = true;
                    current.jumpTarget = target.id;
                    // in a do-while the condition header follows the body
                    boolean backward = target == loopFrame.header && !loopFrame.doWhile;
                    edge(current, target, backward ? EdgeKind.LOOP_BACK : EdgeKind.CONTROL_FLOW);
                } else {
                    LOGGER.debug("{} outside a loop, ignored", statement);
                }
            } else if (statement instanceof Block block && !block.isPlaceholder()) {
                stack.push(new SequenceFrame(block.statements()));
            } else {
                current.statements.add(statement);
                if (statement.isAbnormalExit()) current.terminated = true;
            }
        }

        private void processIf(IfElseStatement ifElse, Deque<Frame> stack) {
            current.statements.add(ifElse);
            current.branch = true;
            BasicBlock branch = current;
            BasicBlock thenStart = newBlock();
            edge(branch, thenStart, EdgeKind.CONDITIONAL_TRUE);
            BasicBlock elseStart = null;
            if (ifElse.hasElse()) {
                elseStart = newBlock();
                edge(branch, elseStart, EdgeKind.CONDITIONAL_FALSE);
            }
            BasicBlock merge = newBlock();
            merge.merge = true;
            if (elseStart == null) edge(branch, merge, EdgeKind.CONDITIONAL_FALSE);
            current = thenStart;
            stack.push(new IfFrame(ifElse.thenBlock(), elseStart, ifElse.elseBlock(), merge));
        }

        private void processLoop(LoopStatement loop, Deque<Frame> stack) {
            if (loop.initialization() != null) current.statements.add(loop.initialization());
            boolean infinite = loop.condition() == null
                               || loop.condition() instanceof Literal literal && literal.isTrue();
            if (loop.isDoWhile()) {
                BasicBlock body = newBlock();
                edge(current, body, EdgeKind.CONTROL_FLOW);
                BasicBlock header = newBlock();
                header.branch = true;
                header.statements.add(loop);
                BasicBlock exit = newBlock();
                current = body;
                stack.push(new LoopFrame(loop.body(), body, header, exit, null, null, true, infinite));
            } else {
                BasicBlock header = newBlock();
                header.branch = true;
                header.statements.add(loop);
                edge(current, header, EdgeKind.CONTROL_FLOW);
                BasicBlock body = newBlock();
                edge(header, body, EdgeKind.CONDITIONAL_TRUE);
                BasicBlock update = loop.update() == null ? null : newBlock();
                BasicBlock exit = newBlock();
                if (!infinite) edge(header, exit, EdgeKind.CONDITIONAL_FALSE);
                current = body;
                stack.push(new LoopFrame(loop.body(), body, header, exit, update, loop.update(), false, infinite));
            }
        }

        private void processTry(TryStatement tryStatement, Deque<Frame> stack) {
            current.statements.add(tryStatement);
            BasicBlock origin = current;
            if (!tryStatement.catchClauses().isEmpty()) origin.branch = true;
            BasicBlock body = newBlock();
            edge(origin, body, EdgeKind.CONTROL_FLOW);
            List<BasicBlock> catchStarts = new ArrayList<>();
            List<List<IRStatement>> catchBodies = new ArrayList<>();
            for (TryStatement.CatchClause clause : tryStatement.catchClauses()) {
                BasicBlock catchStart = newBlock();
                edge(origin, catchStart, EdgeKind.EXCEPTION);
                catchStarts.add(catchStart);
                catchBodies.add(clause.body());
            }
            BasicBlock merge = newBlock();
            merge.merge = true;
            current = body;
            stack.push(new TryFrame(tryStatement.body(), catchStarts, catchBodies, merge));
        }

        private static LoopFrame innermostLoop(Deque<Frame> stack) {
            for (Frame frame : stack) {
                if (frame instanceof LoopFrame loopFrame) return loopFrame;
            }
            return null;
        }

        /*
        only live blocks are exits: a return in a block without path from the entry is dead code.
        The last block falls through to the end of the function and is an exit when it can be reached.
         */
        ControlFlowGraph result(String functionName) {
            List<CFGNode> nodes = blocks.stream().map(b -> b.toNode(false)).toList();
            Set<String> live = Reachability.live(new ControlFlowGraphImpl(functionName, nodes, edges));
            boolean fallThrough = !current.terminated && !current.exit;
            List<CFGNode> withExits = blocks.stream()
                    .map(b -> b.toNode(live.contains(b.id) && (b.exit || fallThrough && b == current)))
                    .toList();
            return new ControlFlowGraphImpl(functionName, withExits, edges);
        }
    }
}
