package org.contractquard.analyzer.ir;

import org.contractquard.analyzer.ir.element.NodeIdGenerator;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.*;
import org.contractquard.analyzer.ir.info.IRContract;
import org.contractquard.analyzer.ir.info.IRFunction;
import org.contractquard.analyzer.ir.info.IRModule;
import org.contractquard.analyzer.ir.info.IRVariable;
import org.contractquard.analyzer.ir.statement.*;
import org.contractquard.analyzer.ir.type.IRType;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Short-hand construction of IR trees, for front-ends that build IR programmatically and for tests.
 * All nodes created by one factory share its identifier sequence and its current source location.
 */
public class IRFactory {
    private final NodeIdGenerator ids;
    private SourceLocation sourceLocation;

    public IRFactory() {
        this(new NodeIdGenerator());
    }

    public IRFactory(NodeIdGenerator ids) {
        this.ids = ids;
    }

    public IRFactory at(SourceLocation sourceLocation) {
        this.sourceLocation = sourceLocation;
        return this;
    }

    public IRFactory at(String filePath, int line) {
        return at(SourceLocation.of(filePath, line));
    }

    public String newId(String prefix) {
        return ids.next(prefix);
    }

    // modules, contracts, functions

    public IRModule.Builder newModuleBuilder(String name) {
        return new IRModule.Builder(ids.next("module")).setName(name).setSourceLocation(sourceLocation);
    }

    public IRContract.Builder newContractBuilder(String name) {
        return new IRContract.Builder(ids.next("contract")).setName(name).setSourceLocation(sourceLocation);
    }

    public IRFunction.Builder newFunctionBuilder(String name) {
        return new IRFunction.Builder(ids.next("function")).setName(name).setSourceLocation(sourceLocation);
    }

    public IRVariable.Builder newVariableBuilder(String name, IRType type) {
        return new IRVariable.Builder(ids.next("variable")).setName(name).setType(type)
                .setSourceLocation(sourceLocation);
    }

    // expressions

    public Identifier identifier(String name) {
        return new Identifier(ids.next("expr"), sourceLocation, null, null, name);
    }

    public Literal number(long value) {
        return new Literal(ids.next("expr"), sourceLocation, null, null, Long.toString(value), "number");
    }

    public Literal bool(boolean value) {
        return new Literal(ids.next("expr"), sourceLocation, null, IRType.primitive("bool"),
                Boolean.toString(value), "bool");
    }

    public Literal string(String value) {
        return new Literal(ids.next("expr"), sourceLocation, null, IRType.primitive("string"), value, "string");
    }

    public BinaryOperation binary(IRExpression left, String operator, IRExpression right) {
        return new BinaryOperation(ids.next("expr"), sourceLocation, null, null, operator, left, right);
    }

    public UnaryOperation unary(String operator, IRExpression operand, boolean prefix) {
        return new UnaryOperation(ids.next("expr"), sourceLocation, Map.of(UnaryOperation.METADATA_PREFIX, prefix),
                null, operator, operand);
    }

    public FunctionCall call(String functionName, IRExpression... arguments) {
        return FunctionCall.internal(ids.next("expr"), sourceLocation, functionName, Arrays.asList(arguments));
    }

    public FunctionCall memberCall(IRExpression base, String functionName, IRExpression... arguments) {
        return new FunctionCall(ids.next("expr"), sourceLocation, null, null, functionName, base,
                Arrays.asList(arguments), true, base.toString());
    }

    public MemberAccess member(IRExpression base, String member) {
        return new MemberAccess(ids.next("expr"), sourceLocation, null, null, base, member);
    }

    public MemberAccess msgSender() {
        return member(identifier("msg"), "sender");
    }

    public IndexAccess index(IRExpression base, IRExpression index) {
        return new IndexAccess(ids.next("expr"), sourceLocation, null, null, base, index);
    }

    public Conditional conditional(IRExpression condition, IRExpression ifTrue, IRExpression ifFalse) {
        return new Conditional(ids.next("expr"), sourceLocation, null, null, condition, ifTrue, ifFalse);
    }

    public Cast cast(IRType targetType, IRExpression expression) {
        return new Cast(ids.next("expr"), sourceLocation, null, targetType, expression);
    }

    // statements

    public AssignmentStatement assign(IRExpression target, IRExpression value) {
        return new AssignmentStatement(ids.next("stmt"), sourceLocation, null, target, value, "=");
    }

    public AssignmentStatement assign(IRExpression target, String operator, IRExpression value) {
        return new AssignmentStatement(ids.next("stmt"), sourceLocation, null, target, value, operator);
    }

    public IfElseStatement ifThen(IRExpression condition, List<IRStatement> thenBlock) {
        return ifThenElse(condition, thenBlock, List.of());
    }

    public IfElseStatement ifThenElse(IRExpression condition, List<IRStatement> thenBlock,
                                      List<IRStatement> elseBlock) {
        return new IfElseStatement(ids.next("stmt"), sourceLocation, null, condition, thenBlock, elseBlock);
    }

    public LoopStatement whileLoop(IRExpression condition, List<IRStatement> body) {
        return LoopStatement.whileLoop(ids.next("stmt"), sourceLocation, condition, body);
    }

    public LoopStatement forLoop(IRStatement initialization, IRExpression condition, IRStatement update,
                                 List<IRStatement> body) {
        return new LoopStatement(ids.next("stmt"), sourceLocation, null, StatementKind.FOR, initialization,
                condition, update, body);
    }

    public ReturnStatement returnStatement(IRExpression value) {
        return new ReturnStatement(ids.next("stmt"), sourceLocation, null, value);
    }

    public CallStatement callStatement(FunctionCall call) {
        return new CallStatement(ids.next("stmt"), sourceLocation, null, call);
    }

    public CallStatement require(IRExpression condition) {
        return callStatement(call("require", condition));
    }

    public VariableDeclarationStatement declare(String name, IRType type, IRExpression initialValue) {
        IRVariable variable = newVariableBuilder(name, type).build();
        return new VariableDeclarationStatement(ids.next("stmt"), sourceLocation, null, List.of(variable),
                initialValue);
    }

    public Block block(List<IRStatement> statements) {
        return new Block(ids.next("stmt"), sourceLocation, null, statements);
    }

    public BreakStatement breakStatement() {
        return new BreakStatement(ids.next("stmt"), sourceLocation, null);
    }

    public ContinueStatement continueStatement() {
        return new ContinueStatement(ids.next("stmt"), sourceLocation, null);
    }

    public ThrowStatement throwStatement(IRExpression value) {
        return new ThrowStatement(ids.next("stmt"), sourceLocation, null, value);
    }

    public TryStatement tryCatch(IRExpression guarded, List<IRStatement> body,
                                 List<TryStatement.CatchClause> catchClauses) {
        return new TryStatement(ids.next("stmt"), sourceLocation, null, guarded, body, catchClauses);
    }
}
