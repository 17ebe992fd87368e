package org.contractquard.analyzer.transform.solidity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.contractquard.analyzer.ir.element.NodeIdGenerator;
import org.contractquard.analyzer.ir.element.SourceLocation;
import org.contractquard.analyzer.ir.expression.*;
import org.contractquard.analyzer.ir.info.*;
import org.contractquard.analyzer.ir.statement.*;
import org.contractquard.analyzer.ir.type.IRType;
import org.contractquard.analyzer.transform.SourceLanguage;
import org.contractquard.analyzer.transform.Transformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transforms the solc compact JSON AST of one source unit. The standard-json output entry of a file
 * (an object with an {@code ast} field) is accepted as well.
 * <p>
 * Trees nested deeper than {@link #MAX_DEPTH} statements and expressions are cut off with a placeholder,
 * so that neither this transformer nor the recursive consumers of its output can run out of stack.
 * A statement that cannot be transformed becomes a placeholder; a contract member that cannot be transformed
 * is left out. Both add an entry to the {@link #METADATA_WARNINGS} of the module.
 */
public class SolidityTransformer implements Transformer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SolidityTransformer.class);

    public static final int MAX_DEPTH = 256;
    public static final String METADATA_LANGUAGE = "language";
    public static final String METADATA_FREE_FUNCTION = "freeFunction";
    public static final String METADATA_IMMUTABLE = "immutable";
    public static final String METADATA_STATE_VARIABLE = "stateVariable";
    public static final String METADATA_ASSIGNMENT = "assignment";
    public static final String METADATA_RETURN_COUNT = "returnCount";
    public static final String METADATA_WARNINGS = "transformWarnings";
    public static final String PLACEHOLDER_ERROR = "transformError";

    private final SolidityTypeParser typeParser;

    public SolidityTransformer() {
        this(new SolidityTypeParser());
    }

    SolidityTransformer(SolidityTypeParser typeParser) {
        this.typeParser = typeParser;
    }

    private static final class Context {
        final String filePath;
        final LineIndex lineIndex;
        final NodeIdGenerator ids = new NodeIdGenerator();
        final List<String> warnings = new ArrayList<>();
        int depth;
        boolean depthWarning;

        Context(String filePath, LineIndex lineIndex) {
            this.filePath = filePath;
            this.lineIndex = lineIndex;
        }

        boolean enter() {
            if (depth >= MAX_DEPTH) {
                if (!depthWarning) {
                    depthWarning = true;
                    warnings.add("Nesting deeper than " + MAX_DEPTH + " levels replaced by placeholders");
                    LOGGER.warn("Nesting deeper than {} levels in {}, replaced by placeholders", MAX_DEPTH, filePath);
                }
                return false;
            }
            depth++;
            return true;
        }

        void exit() {
            depth--;
        }

        SourceLocation location(JsonNode node) {
            return lineIndex.location(node.path("src").asText(""));
        }
    }

    @Override
    public SourceLanguage language() {
        return SourceLanguage.SOLIDITY;
    }

    @Override
    public IRModule transform(JsonNode parseTree, String filePath, String sourceText) {
        Context context = new Context(filePath, new LineIndex(filePath, sourceText));
        JsonNode sourceUnit = unwrap(parseTree);
        IRModule.Builder builder = new IRModule.Builder(context.ids.next("module"))
                .setName(filePath)
                .setSourceLocation(context.location(sourceUnit))
                .putMetadata(METADATA_LANGUAGE, SourceLanguage.SOLIDITY.name());
        if (!"SourceUnit".equals(nodeType(sourceUnit))) {
            LOGGER.warn("No SourceUnit for {}, returning an empty module", filePath);
            return builder.putMetadata(METADATA_WARNINGS, List.of("No SourceUnit")).build();
        }
        Set<String> interfaceNames = new HashSet<>();
        for (JsonNode node : sourceUnit.path("nodes")) {
            if ("ContractDefinition".equals(nodeType(node)) && "interface".equals(node.path("contractKind").asText())) {
                interfaceNames.add(node.path("name").asText());
            }
        }
        for (JsonNode node : sourceUnit.path("nodes")) {
            String nodeType = nodeType(node);
            try {
                switch (nodeType) {
                    case "ImportDirective" -> {
                        String imported = node.path("absolutePath").asText(node.path("file").asText(""));
                        if (!imported.isEmpty()) builder.addImport(imported);
                    }
                    case "ContractDefinition" -> builder.addContract(contract(node, context, interfaceNames));
                    case "FunctionDefinition" -> builder.addFunction(function(node, context));
                    case "VariableDeclaration" -> builder.addVariable(variable(node, context, Visibility.INTERNAL));
                    default -> LOGGER.debug("Skipping top-level {} in {}", nodeType, filePath);
                }
            } catch (RuntimeException re) {
                LOGGER.warn("Cannot transform {} in {}: {}", nodeType, filePath, re.toString());
                context.warnings.add("Skipped " + nodeType + ": " + re.getMessage());
            }
        }
        if (!context.warnings.isEmpty()) {
            builder.putMetadata(METADATA_WARNINGS, List.copyOf(context.warnings));
        }
        IRModule module = builder.build();
        LOGGER.debug("Transformed {}: {} contracts, {} nodes", filePath, module.contracts().size(),
                context.ids.generated());
        return module;
    }

    private static JsonNode unwrap(JsonNode parseTree) {
        if (parseTree == null) return MissingNode.getInstance();
        if (parseTree.path("ast").isObject()) return parseTree.path("ast");
        return parseTree;
    }

    private static String nodeType(JsonNode node) {
        return node.path("nodeType").asText("");
    }

    // ---------------------------------------------------------------------------------- declarations

    private IRContract contract(JsonNode node, Context c, Set<String> interfaceNames) {
        String kind = node.path("contractKind").asText("contract");
        IRContract.Builder builder = new IRContract.Builder(c.ids.next("contract"))
                .setName(node.path("name").asText("unknown"))
                .setSourceLocation(c.location(node))
                .setAbstract(node.path("abstract").asBoolean(false))
                .setInterface("interface".equals(kind))
                .putMetadata(IRContract.METADATA_CONTRACT_KIND, kind);
        for (JsonNode base : node.path("baseContracts")) {
            JsonNode baseName = base.path("baseName");
            String name = baseName.path("name").asText(baseName.path("namePath").asText(""));
            if (!name.isEmpty()) {
                builder.addInheritance(name);
                if (interfaceNames.contains(name)) builder.addInterface(name);
            }
        }
        String contractName = node.path("name").asText("unknown");
        for (JsonNode member : node.path("nodes")) {
            String nodeType = nodeType(member);
            try {
                switch (nodeType) {
                    case "FunctionDefinition" -> builder.addFunction(function(member, c));
                    case "ModifierDefinition" -> builder.addModifier(modifier(member, c));
                    case "VariableDeclaration" -> builder.addVariable(variable(member, c, Visibility.INTERNAL));
                    default -> LOGGER.debug("Skipping contract member {}", nodeType);
                }
            } catch (RuntimeException re) {
                String memberName = member.path("name").asText("");
                LOGGER.warn("Cannot transform {} {} of {} in {}: {}", nodeType, memberName, contractName,
                        c.filePath, re.toString());
                c.warnings.add("Skipped " + nodeType + " " + memberName + " in " + contractName + ": "
                               + re.getMessage());
            }
        }
        return builder.build();
    }

    private IRFunction function(JsonNode node, Context c) {
        String kind = node.path("kind").asText("function");
        boolean isConstructor = "constructor".equals(kind) || node.path("isConstructor").asBoolean(false);
        boolean isReceive = "receive".equals(kind);
        boolean isFallback = "fallback".equals(kind) || isReceive;
        String name = node.path("name").asText("");
        if (name.isEmpty()) {
            name = isConstructor ? "constructor" : isReceive ? "receive" : isFallback ? "fallback" : "unknown";
        }
        String mutability = node.path("stateMutability").asText("nonpayable");
        IRFunction.Builder builder = new IRFunction.Builder(c.ids.next("function"))
                .setName(name)
                .setSourceLocation(c.location(node))
                .setVisibility(Visibility.from(node.path("visibility").asText(), Visibility.PUBLIC))
                .setConstructor(isConstructor)
                .setFallback(isFallback)
                .setPayable("payable".equals(mutability))
                .setView("view".equals(mutability))
                .setPure("pure".equals(mutability));
        if (isReceive) builder.putMetadata(IRFunction.METADATA_RECEIVE, true);
        if ("freeFunction".equals(kind)) builder.putMetadata(METADATA_FREE_FUNCTION, true);

        parameters(node.path("parameters"), c).forEach(builder::addParameter);
        JsonNode returns = node.path("returnParameters").path("parameters");
        if (returns.isArray() && !returns.isEmpty()) {
            builder.setReturnType(type(returns.get(0)));
            if (!returns.get(0).path("name").asText("").isEmpty()) {
                builder.putMetadata(IRFunction.METADATA_NAMED_RETURN, true);
            }
            if (returns.size() > 1) builder.putMetadata(METADATA_RETURN_COUNT, returns.size());
        }
        for (JsonNode invocation : node.path("modifiers")) {
            if ("baseConstructorSpecifier".equals(invocation.path("kind").asText())) continue;
            JsonNode modifierName = invocation.path("modifierName");
            String modifier = modifierName.path("name").asText(modifierName.path("namePath").asText(""));
            if (!modifier.isEmpty()) builder.addModifier(modifier);
        }
        JsonNode body = node.path("body");
        builder.setImplemented(node.path("implemented").asBoolean(body.isObject()));
        if (body.isObject()) builder.addStatements(statements(body, c));
        return builder.build();
    }

    private IRFunction modifier(JsonNode node, Context c) {
        IRFunction.Builder builder = new IRFunction.Builder(c.ids.next("function"))
                .setName(node.path("name").asText("unknown"))
                .setSourceLocation(c.location(node))
                .setVisibility(Visibility.from(node.path("visibility").asText(), Visibility.INTERNAL))
                .putMetadata(IRFunction.METADATA_MODIFIER, true);
        parameters(node.path("parameters"), c).forEach(builder::addParameter);
        JsonNode body = node.path("body");
        builder.setImplemented(body.isObject());
        if (body.isObject()) builder.addStatements(statements(body, c));
        return builder.build();
    }

    private List<IRParameter> parameters(JsonNode parameterList, Context c) {
        List<IRParameter> list = new ArrayList<>();
        for (JsonNode p : parameterList.path("parameters")) {
            List<String> annotations = new ArrayList<>();
            String location = p.path("storageLocation").asText("default");
            if (!location.isEmpty() && !"default".equals(location)) annotations.add(location);
            if (p.path("indexed").asBoolean(false)) annotations.add("indexed");
            list.add(new IRParameter(p.path("name").asText(""), type(p), true, null, annotations));
        }
        return list;
    }

    private IRVariable variable(JsonNode node, Context c, Visibility defaultVisibility) {
        String mutability = node.path("mutability").asText("");
        boolean constant = node.path("constant").asBoolean(false) || "constant".equals(mutability);
        boolean immutable = "immutable".equals(mutability);
        IRVariable.Builder builder = new IRVariable.Builder(c.ids.next("variable"))
                .setName(node.path("name").asText("unknown"))
                .setType(type(node))
                .setVisibility(Visibility.from(node.path("visibility").asText(), defaultVisibility))
                .setConstant(constant)
                .setMutable(!constant && !immutable)
                .setSourceLocation(c.location(node));
        if (immutable) builder.putMetadata(METADATA_IMMUTABLE, true);
        if (node.path("stateVariable").asBoolean(false)) builder.putMetadata(METADATA_STATE_VARIABLE, true);
        JsonNode value = node.path("value");
        if (value.isObject()) builder.setInitialValue(expression(value, c));
        return builder.build();
    }

    private IRType type(JsonNode node) {
        String typeString = node.path("typeDescriptions").path("typeString").asText("");
        if (typeString.isEmpty()) {
            typeString = node.path("typeName").path("typeDescriptions").path("typeString").asText("");
        }
        if (typeString.isEmpty()) typeString = node.path("typeName").path("name").asText("");
        return typeString.isEmpty() ? IRType.UNKNOWN : typeParser.parse(typeString);
    }

    // ---------------------------------------------------------------------------------- statements

    /*
    if and loop bodies are either a Block or a single statement; both become a statement list
     */
    private List<IRStatement> statements(JsonNode node, Context c) {
        String nodeType = nodeType(node);
        if ("Block".equals(nodeType) || "UncheckedBlock".equals(nodeType)) {
            List<IRStatement> list = new ArrayList<>();
            for (JsonNode statement : node.path("statements")) {
                list.add(recoveringStatement(statement, c));
            }
            return list;
        }
        if (node.isObject()) return List.of(recoveringStatement(node, c));
        return List.of();
    }

    private IRStatement recoveringStatement(JsonNode node, Context c) {
        try {
            return statement(node, c);
        } catch (RuntimeException re) {
            String nodeType = nodeType(node);
            LOGGER.warn("Cannot transform statement {} in {}: {}", nodeType, c.filePath, re.toString());
            c.warnings.add("Placeholder for " + (nodeType.isEmpty() ? "unknown" : nodeType) + ": "
                           + re.getMessage());
            return Block.placeholder(c.ids.next("stmt"), SourceLocation.unknown(c.filePath), PLACEHOLDER_ERROR);
        }
    }

    private IRStatement statement(JsonNode node, Context c) {
        if (!c.enter()) return Block.placeholder(c.ids.next("stmt"), c.location(node), "depthLimit");
        try {
            String nodeType = nodeType(node);
            SourceLocation loc = c.location(node);
            return switch (nodeType) {
                case "ExpressionStatement" -> expressionStatement(node, loc, c);
                case "VariableDeclarationStatement" -> {
                    String id = c.ids.next("stmt");
                    List<IRVariable> variables = new ArrayList<>();
                    for (JsonNode declaration : node.path("declarations")) {
                        if (declaration.isObject()) variables.add(variable(declaration, c, Visibility.INTERNAL));
                    }
                    yield new VariableDeclarationStatement(id, loc, null, variables,
                            optionalExpression(node.path("initialValue"), c));
                }
                case "IfStatement" -> {
                    String id = c.ids.next("stmt");
                    IRExpression condition = expression(node.path("condition"), c);
                    List<IRStatement> thenBlock = statements(node.path("trueBody"), c);
                    List<IRStatement> elseBlock = statements(node.path("falseBody"), c);
                    yield new IfElseStatement(id, loc, null, condition, thenBlock, elseBlock);
                }
                case "WhileStatement" -> {
                    String id = c.ids.next("stmt");
                    IRExpression condition = expression(node.path("condition"), c);
                    yield LoopStatement.whileLoop(id, loc, condition, statements(node.path("body"), c));
                }
                case "DoWhileStatement" -> {
                    String id = c.ids.next("stmt");
                    IRExpression condition = expression(node.path("condition"), c);
                    yield new LoopStatement(id, loc, Map.of(LoopStatement.METADATA_DO_WHILE, true),
                            StatementKind.WHILE, null, condition, null, statements(node.path("body"), c));
                }
                case "ForStatement" -> forStatement(node, loc, c);
                case "Return" -> {
                    String id = c.ids.next("stmt");
                    yield new ReturnStatement(id, loc, null, optionalExpression(node.path("expression"), c));
                }
                case "Block" -> {
                    String id = c.ids.next("stmt");
                    yield new Block(id, loc, null, statements(node, c));
                }
                case "UncheckedBlock" -> {
                    String id = c.ids.next("stmt");
                    yield new Block(id, loc, Map.of(Block.METADATA_UNCHECKED, true), statements(node, c));
                }
                case "Break" -> new BreakStatement(c.ids.next("stmt"), loc, null);
                case "Continue" -> new ContinueStatement(c.ids.next("stmt"), loc, null);
                case "Throw" -> new ThrowStatement(c.ids.next("stmt"), loc, null, null);
                case "RevertStatement" -> {
                    String id = c.ids.next("stmt");
                    yield new ThrowStatement(id, loc, null, expression(node.path("errorCall"), c));
                }
                case "EmitStatement" -> {
                    String id = c.ids.next("stmt");
                    IRExpression event = expression(node.path("eventCall"), c);
                    if (event instanceof FunctionCall call) {
                        yield new CallStatement(id, loc, Map.of(CallStatement.METADATA_EMIT, true), call);
                    }
                    yield Block.placeholder(id, loc, nodeType);
                }
                case "TryStatement" -> tryStatement(node, loc, c);
                default -> {
                    LOGGER.debug("Placeholder for statement {}", nodeType);
                    yield Block.placeholder(c.ids.next("stmt"), loc, nodeType.isEmpty() ? "unknown" : nodeType);
                }
            };
        } finally {
            c.exit();
        }
    }

    private IRStatement expressionStatement(JsonNode node, SourceLocation loc, Context c) {
        JsonNode e = node.path("expression");
        String nodeType = nodeType(e);
        if ("Assignment".equals(nodeType)) {
            String id = c.ids.next("stmt");
            IRExpression target = expression(e.path("leftHandSide"), c);
            IRExpression value = expression(e.path("rightHandSide"), c);
            return new AssignmentStatement(id, loc, null, target, value, e.path("operator").asText("="));
        }
        String id = c.ids.next("stmt");
        IRExpression expression = expression(e, c);
        if (expression instanceof UnaryOperation unary
            && (unary.isIncrementOrDecrement() || "delete".equals(unary.operator()))) {
            return new AssignmentStatement(id, loc, null, unary.operand(), unary, unary.operator());
        }
        if (expression instanceof FunctionCall call) {
            return new CallStatement(id, loc, null, call);
        }
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(Block.METADATA_PLACEHOLDER, "ExpressionStatement");
        metadata.put("expression", expression.toString());
        return new Block(id, loc, metadata, List.of());
    }

    private IRStatement forStatement(JsonNode node, SourceLocation loc, Context c) {
        String id = c.ids.next("stmt");
        JsonNode init = node.path("initializationExpression");
        IRStatement initialization = init.isObject() ? statement(init, c) : null;
        IRExpression condition = optionalExpression(node.path("condition"), c);
        JsonNode loopExpression = node.path("loopExpression");
        IRStatement update = loopExpression.isObject() ? statement(loopExpression, c) : null;
        List<IRStatement> body = statements(node.path("body"), c);
        return new LoopStatement(id, loc, null, StatementKind.FOR, initialization, condition, update, body);
    }

    /*
    the first clause of a solc TryStatement is the success block
     */
    private IRStatement tryStatement(JsonNode node, SourceLocation loc, Context c) {
        String id = c.ids.next("stmt");
        IRExpression guarded = optionalExpression(node.path("externalCall"), c);
        List<IRStatement> body = List.of();
        List<TryStatement.CatchClause> catchClauses = new ArrayList<>();
        boolean first = true;
        for (JsonNode clause : node.path("clauses")) {
            List<IRParameter> parameters = parameters(clause.path("parameters"), c);
            List<IRStatement> block = statements(clause.path("block"), c);
            if (first) {
                body = block;
                first = false;
            } else {
                String errorName = clause.path("errorName").asText("");
                catchClauses.add(new TryStatement.CatchClause(errorName.isEmpty() ? null : errorName, parameters,
                        block));
            }
        }
        return new TryStatement(id, loc, null, guarded, body, catchClauses);
    }

    // ---------------------------------------------------------------------------------- expressions

    private IRExpression optionalExpression(JsonNode node, Context c) {
        return node.isObject() ? expression(node, c) : null;
    }

    private IRExpression expression(JsonNode node, Context c) {
        if (!node.isObject()) return Identifier.unknown(c.ids.next("expr"), c.location(node), "missing");
        if (!c.enter()) return Identifier.unknown(c.ids.next("expr"), c.location(node), "depthLimit");
        try {
            String nodeType = nodeType(node);
            String id = c.ids.next("expr");
            SourceLocation loc = c.location(node);
            IRType type = type(node);
            return switch (nodeType) {
                case "Literal" -> literal(id, loc, type, node);
                case "Identifier" -> new Identifier(id, loc, null, type, node.path("name").asText("unknown"));
                case "BinaryOperation" -> {
                    IRExpression left = expression(node.path("leftExpression"), c);
                    IRExpression right = expression(node.path("rightExpression"), c);
                    yield new BinaryOperation(id, loc, null, type, node.path("operator").asText("?"), left, right);
                }
                case "Assignment" -> {
                    IRExpression left = expression(node.path("leftHandSide"), c);
                    IRExpression right = expression(node.path("rightHandSide"), c);
                    yield new BinaryOperation(id, loc, Map.of(METADATA_ASSIGNMENT, true), type,
                            node.path("operator").asText("="), left, right);
                }
                case "UnaryOperation" -> {
                    IRExpression operand = expression(node.path("subExpression"), c);
                    yield new UnaryOperation(id, loc,
                            Map.of(UnaryOperation.METADATA_PREFIX, node.path("prefix").asBoolean(true)),
                            type, node.path("operator").asText("?"), operand);
                }
                case "FunctionCall" -> functionCall(id, loc, type, node, c);
                case "MemberAccess" -> {
                    IRExpression base = expression(node.path("expression"), c);
                    yield new MemberAccess(id, loc, null, type, base, node.path("memberName").asText("unknown"));
                }
                case "IndexAccess" -> {
                    IRExpression base = expression(node.path("baseExpression"), c);
                    IRExpression index = optionalExpression(node.path("indexExpression"), c);
                    yield new IndexAccess(id, loc, null, type, base, index);
                }
                case "IndexRangeAccess" -> {
                    IRExpression base = expression(node.path("baseExpression"), c);
                    yield new IndexAccess(id, loc, Map.of("range", true), type, base, null);
                }
                case "Conditional" -> {
                    IRExpression condition = expression(node.path("condition"), c);
                    IRExpression ifTrue = expression(node.path("trueExpression"), c);
                    IRExpression ifFalse = expression(node.path("falseExpression"), c);
                    yield new Conditional(id, loc, null, type, condition, ifTrue, ifFalse);
                }
                case "TupleExpression" -> tuple(id, loc, type, node, c);
                case "ElementaryTypeNameExpression" -> new Identifier(id, loc, null, type, elementaryTypeName(node));
                case "NewExpression" -> new Identifier(id, loc, Map.of("new", true), type,
                        "new " + typeName(node.path("typeName")));
                case "FunctionCallOptions" -> expression(node.path("expression"), c);
                default -> {
                    LOGGER.debug("Placeholder for expression {}", nodeType);
                    yield Identifier.unknown(id, loc, nodeType.isEmpty() ? "unknown" : nodeType);
                }
            };
        } finally {
            c.exit();
        }
    }

    private static IRExpression literal(String id, SourceLocation loc, IRType type, JsonNode node) {
        JsonNode value = node.path("value");
        String text = value.isValueNode() ? value.asText() : node.path("hexValue").asText("");
        String subdenomination = node.path("subdenomination").asText("");
        Map<String, Object> metadata = subdenomination.isEmpty() ? null : Map.of("subdenomination", subdenomination);
        return new Literal(id, loc, metadata, type, text, node.path("kind").asText("unknown"));
    }

    private IRExpression functionCall(String id, SourceLocation loc, IRType type, JsonNode node, Context c) {
        JsonNode callee = node.path("expression");
        while ("FunctionCallOptions".equals(nodeType(callee))) {
            callee = callee.path("expression");
        }
        String kind = node.path("kind").asText("functionCall");
        Map<String, Object> metadata = "functionCall".equals(kind) ? null : Map.of("kind", kind);
        String calleeType = nodeType(callee);

        IRExpression base = null;
        String name;
        if ("MemberAccess".equals(calleeType)) {
            base = expression(callee.path("expression"), c);
            name = callee.path("memberName").asText("unknown");
        } else {
            name = switch (calleeType) {
                case "Identifier" -> callee.path("name").asText("unknown");
                case "NewExpression" -> "new " + typeName(callee.path("typeName"));
                case "ElementaryTypeNameExpression" -> elementaryTypeName(callee);
                default -> Identifier.UNKNOWN;
            };
        }
        List<IRExpression> arguments = new ArrayList<>();
        for (JsonNode argument : node.path("arguments")) {
            arguments.add(expression(argument, c));
        }
        if ("typeConversion".equals(kind) && base == null && arguments.size() == 1) {
            IRType target = type == IRType.UNKNOWN ? typeParser.parse(name) : type;
            return new Cast(id, loc, null, target, arguments.get(0));
        }
        if (base != null) {
            return new FunctionCall(id, loc, metadata, type, name, base, arguments, true, base.toString());
        }
        return new FunctionCall(id, loc, metadata, type, name, null, arguments, false, null);
    }

    private IRExpression tuple(String id, SourceLocation loc, IRType type, JsonNode node, Context c) {
        JsonNode components = node.path("components");
        boolean inlineArray = node.path("isInlineArray").asBoolean(false);
        if (components.size() == 1 && components.get(0).isObject() && !inlineArray) {
            return expression(components.get(0), c);
        }
        List<IRExpression> elements = new ArrayList<>();
        for (JsonNode component : components) {
            elements.add(component.isObject() ? expression(component, c)
                    : new Identifier(c.ids.next("expr"), loc, null, null, "_"));
        }
        Map<String, Object> metadata = inlineArray ? Map.of("inlineArray", true) : null;
        return new FunctionCall(id, loc, metadata, type, "tuple", null, elements, false, null);
    }

    private static String elementaryTypeName(JsonNode node) {
        JsonNode typeName = node.path("typeName");
        if (typeName.isTextual()) return typeName.asText();
        return typeName.path("name").asText("unknown");
    }

    private String typeName(JsonNode typeName) {
        String typeString = typeName.path("typeDescriptions").path("typeString").asText("");
        if (!typeString.isEmpty()) return typeParser.parse(typeString).toString();
        JsonNode pathNode = typeName.path("pathNode");
        if (pathNode.isObject()) return pathNode.path("name").asText("unknown");
        return typeName.path("name").asText("unknown");
    }
}
