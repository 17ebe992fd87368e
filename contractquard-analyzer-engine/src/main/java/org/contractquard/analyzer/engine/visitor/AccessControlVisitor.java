package org.contractquard.analyzer.engine.visitor;

import org.contractquard.analyzer.engine.FunctionContext;
import org.contractquard.analyzer.engine.finding.Finding;
import org.contractquard.analyzer.engine.finding.Severity;
import org.contractquard.analyzer.ir.element.IRNode;
import org.contractquard.analyzer.ir.expression.*;
import org.contractquard.analyzer.ir.info.*;
import org.contractquard.analyzer.ir.statement.*;

import java.util.*;
import java.util.function.Predicate;

/**
 * Exposed functions that change state, perform privileged operations, or carry a sensitive name, without
 * any sign of authorization. Authorization is either a modifier (recognized by name, or by a body that checks
 * {@code msg.sender} or {@code tx.origin}), or such a check in the function body itself: a
 * {@code require}/{@code assert} on the sender, or an {@code if} on the sender that reverts.
 */
public class AccessControlVisitor extends FindingVisitor {
    public static final String DETECTOR = "access_control_analyzer";

    static final List<String> MODIFIER_KEYWORDS = List.of("only", "owner", "admin", "auth", "role",
            "permission", "require");
    static final List<String> SENSITIVE_NAMES = List.of("withdraw", "transfer", "send", "mint", "burn",
            "destroy", "admin", "owner", "upgrade", "pause", "emergency", "set", "update", "change", "modify",
            "configure");
    private static final Set<String> PRIVILEGED_CALLS = Set.of("selfdestruct", "suicide");
    private static final Set<String> PRIVILEGED_MEMBER_CALLS = Set.of("transfer", "send", "call", "delegatecall");
    private static final Set<String> CHECKS = Set.of("require", "assert");

    private final Map<String, IRFunction> modifiersByName;

    public AccessControlVisitor() {
        this(List.of());
    }

    /**
     * @param modules used to find modifiers declared in base contracts
     */
    public AccessControlVisitor(List<IRModule> modules) {
        Map<String, IRFunction> map = new HashMap<>();
        for (IRModule module : modules) {
            for (IRContract contract : module.contracts()) {
                for (IRFunction modifier : contract.modifiers()) {
                    map.putIfAbsent(modifier.name(), modifier);
                }
            }
        }
        this.modifiersByName = map;
    }

    @Override
    protected void checkFunction(FunctionContext context) {
        IRFunction function = context.function();
        IRContract contract = context.contract();
        if (contract == null || contract.isInterface() || !function.isImplemented() || function.isModifier()
            || function.isConstructor() || function.isView() || function.isPure()
            || !function.visibility().isExposed()) {
            return;
        }
        List<String> reasons = new ArrayList<>();
        if (modifiesState(function)) reasons.add("modifies state");
        if (performsPrivilegedOperation(function)) reasons.add("performs privileged operations");
        if (reasons.isEmpty() && hasSensitiveName(function.name())) reasons.add("has a sensitive name");
        if (reasons.isEmpty()) return;

        if (function.modifiers().stream().anyMatch(m -> isAccessControlModifier(m, contract))) return;
        if (hasAuthorizationCheck(function.body())) return;

        String name = context.qualifiedName();
        findings.add(new Finding.Builder("missing_access_control_" + name)
                .setTitle("Missing Access Control")
                .setDescription("Exposed function " + name + " " + String.join(" and ", reasons)
                                + ", but has no access control modifier or sender check")
                .setSeverity(Severity.MEDIUM)
                .setLocation(context.location())
                .setCategory("access_control")
                .setDetector(DETECTOR)
                .setConfidence(0.6)
                .setRecommendation("Restrict the function with a modifier such as onlyOwner, or require a check "
                                   + "on msg.sender at the start of the function")
                .putMetadata("reasons", reasons)
                .putMetadata("modifiers", function.modifiers())
                .build());
    }

    boolean isAccessControlModifier(String modifierName, IRContract contract) {
        String lower = modifierName.toLowerCase();
        if (MODIFIER_KEYWORDS.stream().anyMatch(lower::contains)) return true;
        IRFunction modifier = contract.findModifier(modifierName).orElse(modifiersByName.get(modifierName));
        return modifier != null && hasAuthorizationCheck(modifier.body());
    }

    static boolean hasSensitiveName(String name) {
        String lower = name.toLowerCase();
        return SENSITIVE_NAMES.stream().anyMatch(lower::contains);
    }

    private static Set<String> localNames(IRFunction function) {
        Set<String> names = new HashSet<>();
        function.parameters().forEach(p -> names.add(p.name()));
        for (IRStatement statement : function.body()) {
            statement.visit(node -> {
                if (node instanceof VariableDeclarationStatement vds) {
                    vds.variables().forEach(v -> names.add(v.name()));
                }
                return node instanceof IRStatement;
            });
        }
        return names;
    }

    static boolean modifiesState(IRFunction function) {
        Set<String> locals = localNames(function);
        return anyNode(function.body(), node -> {
            if (node instanceof AssignmentStatement assignment) {
                return writesState(assignment.target(), locals);
            }
            if (node instanceof UnaryOperation unary
                && (unary.isIncrementOrDecrement() || "delete".equals(unary.operator()))) {
                return writesState(unary.operand(), locals);
            }
            return false;
        });
    }

    private static boolean writesState(IRExpression target, Set<String> locals) {
        IRExpression root = target;
        while (true) {
            if (root instanceof MemberAccess memberAccess) {
                root = memberAccess.base();
            } else if (root instanceof IndexAccess indexAccess) {
                root = indexAccess.base();
            } else {
                break;
            }
        }
        if (root instanceof Identifier identifier) {
            return !locals.contains(identifier.name());
        }
        // tuples, calls: assume the worst
        return true;
    }

    static boolean performsPrivilegedOperation(IRFunction function) {
        return anyNode(function.body(), node -> node instanceof FunctionCall call && isPrivileged(call));
    }

    private static boolean isPrivileged(FunctionCall call) {
        Set<String> names = call.external() ? PRIVILEGED_MEMBER_CALLS : PRIVILEGED_CALLS;
        return names.contains(call.functionName());
    }

    static boolean hasAuthorizationCheck(List<IRStatement> body) {
        return anyNode(body, node -> {
            if (node instanceof FunctionCall call && !call.external() && CHECKS.contains(call.functionName())) {
                return call.arguments().stream().anyMatch(AccessControlVisitor::referencesSender);
            }
            if (node instanceof IfElseStatement ifElse && referencesSender(ifElse.condition())) {
                return revertsImmediately(ifElse.thenBlock()) || revertsImmediately(ifElse.elseBlock());
            }
            return false;
        });
    }

    private static boolean revertsImmediately(List<IRStatement> statements) {
        return statements.stream().anyMatch(IRStatement::isAbnormalExit);
    }

    static boolean referencesSender(IRExpression expression) {
        if (expression == null) return false;
        boolean[] found = new boolean[1];
        expression.visit(node -> {
            if (node instanceof MemberAccess ma && ma.base() instanceof Identifier id
                && ("msg".equals(id.name()) && "sender".equals(ma.member())
                    || "tx".equals(id.name()) && "origin".equals(ma.member()))) {
                found[0] = true;
            }
            return !found[0];
        });
        return found[0];
    }

    private static boolean anyNode(List<IRStatement> statements, Predicate<IRNode> predicate) {
        boolean[] found = new boolean[1];
        for (IRStatement statement : statements) {
            statement.visit(node -> {
                if (found[0]) return false;
                if (predicate.test(node)) {
                    found[0] = true;
                    return false;
                }
                return true;
            });
            if (found[0]) return true;
        }
        return false;
    }
}
