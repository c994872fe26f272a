package ai.canopy.builder;

import static ai.canopy.builder.python.PythonTreeSitterNodeTypes.*;

import ai.canopy.exception.AstBuildingException;
import ai.canopy.exception.AstSyntaxException;
import ai.canopy.tree.Context;
import ai.canopy.tree.Empty;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.PythonDialect;
import ai.canopy.tree.nodes.AnnAssign;
import ai.canopy.tree.nodes.Arguments;
import ai.canopy.tree.nodes.Assert;
import ai.canopy.tree.nodes.Assign;
import ai.canopy.tree.nodes.AssignAttr;
import ai.canopy.tree.nodes.AssignName;
import ai.canopy.tree.nodes.AsyncFor;
import ai.canopy.tree.nodes.AsyncFunctionDef;
import ai.canopy.tree.nodes.AsyncWith;
import ai.canopy.tree.nodes.Attribute;
import ai.canopy.tree.nodes.AugAssign;
import ai.canopy.tree.nodes.Await;
import ai.canopy.tree.nodes.BinOp;
import ai.canopy.tree.nodes.BoolOp;
import ai.canopy.tree.nodes.Break;
import ai.canopy.tree.nodes.Call;
import ai.canopy.tree.nodes.ClassDef;
import ai.canopy.tree.nodes.Compare;
import ai.canopy.tree.nodes.Comprehension;
import ai.canopy.tree.nodes.Const;
import ai.canopy.tree.nodes.Continue;
import ai.canopy.tree.nodes.Decorators;
import ai.canopy.tree.nodes.DelAttr;
import ai.canopy.tree.nodes.DelName;
import ai.canopy.tree.nodes.Delete;
import ai.canopy.tree.nodes.Dict;
import ai.canopy.tree.nodes.DictComp;
import ai.canopy.tree.nodes.DictUnpack;
import ai.canopy.tree.nodes.Ellipsis;
import ai.canopy.tree.nodes.ExceptHandler;
import ai.canopy.tree.nodes.Exec;
import ai.canopy.tree.nodes.Expr;
import ai.canopy.tree.nodes.ExtSlice;
import ai.canopy.tree.nodes.For;
import ai.canopy.tree.nodes.FunctionDef;
import ai.canopy.tree.nodes.GeneratorExp;
import ai.canopy.tree.nodes.Global;
import ai.canopy.tree.nodes.If;
import ai.canopy.tree.nodes.IfExp;
import ai.canopy.tree.nodes.Import;
import ai.canopy.tree.nodes.ImportFrom;
import ai.canopy.tree.nodes.ImportName;
import ai.canopy.tree.nodes.Index;
import ai.canopy.tree.nodes.Keyword;
import ai.canopy.tree.nodes.Lambda;
import ai.canopy.tree.nodes.ListComp;
import ai.canopy.tree.nodes.ListNode;
import ai.canopy.tree.nodes.Module;
import ai.canopy.tree.nodes.Name;
import ai.canopy.tree.nodes.NameConstant;
import ai.canopy.tree.nodes.Nonlocal;
import ai.canopy.tree.nodes.Pass;
import ai.canopy.tree.nodes.Print;
import ai.canopy.tree.nodes.Raise;
import ai.canopy.tree.nodes.Return;
import ai.canopy.tree.nodes.SetComp;
import ai.canopy.tree.nodes.SetNode;
import ai.canopy.tree.nodes.Singleton;
import ai.canopy.tree.nodes.Slice;
import ai.canopy.tree.nodes.Starred;
import ai.canopy.tree.nodes.Subscript;
import ai.canopy.tree.nodes.TryExcept;
import ai.canopy.tree.nodes.TryFinally;
import ai.canopy.tree.nodes.Tuple;
import ai.canopy.tree.nodes.UnaryOp;
import ai.canopy.tree.nodes.While;
import ai.canopy.tree.nodes.With;
import ai.canopy.tree.nodes.WithItem;
import ai.canopy.tree.nodes.Yield;
import ai.canopy.tree.nodes.YieldFrom;
import com.google.common.collect.ImmutableMap;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Converts a TreeSitter Python syntax tree into canopy nodes.
 *
 * <p>Expressions in load context go through a table keyed by raw node type; statements have their own table.
 * Assignment and deletion targets are converted separately so that names, attributes and subscripts carry the right
 * context. A raw node type with no entry fails the build rather than being dropped.
 *
 * <p>An instance converts a single module and is not thread safe.
 */
final class TreeRebuilder {
    private static final Logger logger = LogManager.getLogger(TreeRebuilder.class);

    /** Names that read as constants rather than variables. */
    static final Map<String, Object> BUILTIN_NAMES = Map.of(
            "None", Singleton.NONE,
            "True", Boolean.TRUE,
            "False", Boolean.FALSE,
            "NotImplemented", Singleton.NOT_IMPLEMENTED);

    @FunctionalInterface
    interface Converter {
        PyNode convert(TSNode node) throws AstBuildingException;
    }

    private final SourceText source;
    private final PythonDialect dialect;
    private final String moduleName;
    private final @Nullable Path path;
    private final Map<String, Converter> expressions;
    private final Map<String, Converter> statements;
    private final Set<String> seenKinds = new HashSet<>();

    TreeRebuilder(SourceText source, PythonDialect dialect, String moduleName, @Nullable Path path) {
        this.source = source;
        this.dialect = dialect;
        this.moduleName = moduleName;
        this.path = path;
        this.expressions = ImmutableMap.<String, Converter>builder()
                .put(IDENTIFIER, this::name)
                .put(KEYWORD_IDENTIFIER, this::name)
                .put(ATTRIBUTE, n -> attribute(n, Context.LOAD))
                .put(SUBSCRIPT, n -> subscript(n, Context.LOAD))
                .put(CALL, this::call)
                .put(BINARY_OPERATOR, this::binaryOperator)
                .put(UNARY_OPERATOR, this::unaryOperator)
                .put(NOT_OPERATOR, this::notOperator)
                .put(BOOLEAN_OPERATOR, this::booleanOperator)
                .put(COMPARISON_OPERATOR, this::comparison)
                .put(CONDITIONAL_EXPRESSION, this::conditional)
                .put(LAMBDA, this::lambda)
                .put(AWAIT, this::awaitExpression)
                .put(YIELD, this::yieldExpression)
                .put(PARENTHESIZED_EXPRESSION, n -> expression(single(n)))
                .put(EXPRESSION_LIST, n -> tuple(n, Context.LOAD))
                .put(PATTERN_LIST, n -> tuple(n, Context.LOAD))
                .put(TUPLE, n -> tuple(n, Context.LOAD))
                .put(LIST, n -> list(n, Context.LOAD))
                .put(SET, this::set)
                .put(DICTIONARY, this::dictionary)
                .put(LIST_COMPREHENSION, this::listComprehension)
                .put(SET_COMPREHENSION, this::setComprehension)
                .put(DICTIONARY_COMPREHENSION, this::dictComprehension)
                .put(GENERATOR_EXPRESSION, this::generatorExpression)
                .put(LIST_SPLAT, n -> starred(n, Context.LOAD))
                .put(STRING, this::string)
                .put(CONCATENATED_STRING, this::string)
                .put(INTEGER, this::number)
                .put(FLOAT, this::number)
                .put(TRUE, n -> new NameConstant(position(n), Boolean.TRUE))
                .put(FALSE, n -> new NameConstant(position(n), Boolean.FALSE))
                .put(NONE, n -> new NameConstant(position(n), Singleton.NONE))
                .put(ELLIPSIS, n -> new Ellipsis(position(n)))
                .put(TYPE, n -> expression(single(n)))
                .buildOrThrow();
        this.statements = ImmutableMap.<String, Converter>builder()
                .put(EXPRESSION_STATEMENT, this::expressionStatement)
                .put(RETURN_STATEMENT, this::returnStatement)
                .put(PASS_STATEMENT, n -> new Pass(position(n)))
                .put(BREAK_STATEMENT, n -> new Break(position(n)))
                .put(CONTINUE_STATEMENT, n -> new Continue(position(n)))
                .put(DELETE_STATEMENT, this::deleteStatement)
                .put(RAISE_STATEMENT, this::raiseStatement)
                .put(ASSERT_STATEMENT, this::assertStatement)
                .put(GLOBAL_STATEMENT, n -> new Global(position(n), identifiers(n)))
                .put(NONLOCAL_STATEMENT, this::nonlocalStatement)
                .put(IMPORT_STATEMENT, this::importStatement)
                .put(IMPORT_FROM_STATEMENT, this::importFromStatement)
                .put(FUTURE_IMPORT_STATEMENT, this::futureImportStatement)
                .put(PRINT_STATEMENT, this::printStatement)
                .put(EXEC_STATEMENT, this::execStatement)
                .put(IF_STATEMENT, this::ifStatement)
                .put(FOR_STATEMENT, this::forStatement)
                .put(WHILE_STATEMENT, this::whileStatement)
                .put(TRY_STATEMENT, this::tryStatement)
                .put(WITH_STATEMENT, this::withStatement)
                .put(FUNCTION_DEFINITION, n -> functionDefinition(n, null))
                .put(CLASS_DEFINITION, n -> classDefinition(n, null))
                .put(DECORATED_DEFINITION, this::decoratedDefinition)
                .buildOrThrow();
    }

    PythonDialect dialect() {
        return dialect;
    }

    /** Converts the root {@code module} node. */
    Module rebuild(TSNode root, boolean isPackage, @Nullable String fileEncoding) throws AstBuildingException {
        if (!MODULE.equals(root.getType())) {
            throw buildingError("Expected a module node at the root, got '" + root.getType() + "'");
        }
        var body = body(root);
        var module = new Module(moduleName, body.doc(), fileEncoding, isPackage, source.text(), path);
        module.postinit(body.statements());
        logger.debug("Rebuilt module {} with {} top-level statements", moduleName, body.statements().size());
        return module;
    }

    // ---------------------------------------------------------------------------------------------------------
    // Dispatch

    PyNode expression(TSNode node) throws AstBuildingException {
        return dispatch(expressions, node);
    }

    private PyNode statement(TSNode node) throws AstBuildingException {
        return dispatch(statements, node);
    }

    private PyNode dispatch(Map<String, Converter> table, TSNode node) throws AstBuildingException {
        String type = node.getType();
        var converter = table.get(type);
        if (converter == null) {
            throw buildingError("No conversion available for raw node kind '" + type + "' at " + position(node));
        }
        if (seenKinds.add(type)) {
            logger.trace("First conversion of raw kind {} in {}", type, moduleName);
        }
        return converter.convert(node);
    }

    private @Nullable PyNode optionalExpression(@Nullable TSNode node) throws AstBuildingException {
        return node == null ? null : expression(node);
    }

    private PyNode expressionOrEmpty(@Nullable TSNode node) throws AstBuildingException {
        return node == null ? Empty.INSTANCE : expression(node);
    }

    private NodeSequence expressions(List<TSNode> nodes) throws AstBuildingException {
        var result = new ArrayList<PyNode>(nodes.size());
        for (TSNode node : nodes) {
            result.add(expression(node));
        }
        return NodeSequence.copyOf(result);
    }

    // ---------------------------------------------------------------------------------------------------------
    // Blocks and docstrings

    private record Body(NodeSequence statements, @Nullable String doc) {}

    private Body body(TSNode block) throws AstBuildingException {
        var raw = namedChildren(block);
        String doc = raw.isEmpty() ? null : docstring(raw.get(0));
        var result = new ArrayList<PyNode>(raw.size());
        for (int i = doc == null ? 0 : 1; i < raw.size(); i++) {
            result.add(statement(raw.get(i)));
        }
        return new Body(NodeSequence.copyOf(result), doc);
    }

    private NodeSequence block(@Nullable TSNode block) throws AstBuildingException {
        if (block == null) {
            return NodeSequence.empty();
        }
        var result = new ArrayList<PyNode>();
        for (TSNode child : namedChildren(block)) {
            result.add(statement(child));
        }
        return NodeSequence.copyOf(result);
    }

    /** The text of a leading string statement, unless it is a bytes or formatted literal. */
    private @Nullable String docstring(TSNode statement) throws AstBuildingException {
        if (!EXPRESSION_STATEMENT.equals(statement.getType())) {
            return null;
        }
        var children = namedChildren(statement);
        if (children.size() != 1) {
            return null;
        }
        TSNode value = children.get(0);
        if (!STRING.equals(value.getType()) && !CONCATENATED_STRING.equals(value.getType())) {
            return null;
        }
        var literal = stringLiteral(value);
        return literal.bytes() || literal.formatted() ? null : literal.value();
    }

    // ---------------------------------------------------------------------------------------------------------
    // Names and targets

    private PyNode name(TSNode node) {
        String id = text(node);
        var constant = BUILTIN_NAMES.get(id);
        if (constant != null) {
            return new NameConstant(position(node), constant);
        }
        return new Name(position(node), id);
    }

    /** Converts an assignment, deletion or loop target. */
    PyNode target(TSNode node, Context ctx) throws AstBuildingException {
        return switch (node.getType()) {
            case IDENTIFIER, KEYWORD_IDENTIFIER -> ctx == Context.DEL
                    ? new DelName(position(node), text(node))
                    : new AssignName(position(node), text(node));
            case ATTRIBUTE -> attribute(node, ctx);
            case SUBSCRIPT -> subscript(node, ctx);
            case PATTERN_LIST, TUPLE_PATTERN, TUPLE, EXPRESSION_LIST -> tuple(node, ctx);
            case LIST_PATTERN, LIST -> list(node, ctx);
            case LIST_SPLAT, LIST_SPLAT_PATTERN -> starred(node, ctx);
            case PARENTHESIZED_EXPRESSION -> target(single(node), ctx);
            case AS_PATTERN_TARGET -> asPatternTarget(node, ctx);
            case TRUE, FALSE -> {
                if (!dialect.booleansAreNames()) {
                    throw syntaxError(node, "cannot " + (ctx == Context.DEL ? "delete" : "assign to") + " " + text(node));
                }
                yield ctx == Context.DEL
                        ? new DelName(position(node), text(node))
                        : new AssignName(position(node), text(node));
            }
            case NONE -> throw syntaxError(node, "cannot " + (ctx == Context.DEL ? "delete" : "assign to") + " None");
            default -> throw syntaxError(node, "cannot " + (ctx == Context.DEL ? "delete" : "assign to") + " "
                    + node.getType().replace('_', ' '));
        };
    }

    private PyNode element(TSNode node, Context ctx) throws AstBuildingException {
        return ctx == Context.LOAD ? expression(node) : target(node, ctx);
    }

    // The alias of an as_pattern is the target expression renamed, so its shape is read off its tokens.
    private PyNode asPatternTarget(TSNode node, Context ctx) throws AstBuildingException {
        var named = namedChildren(node);
        if (named.isEmpty()) {
            return new AssignName(position(node), text(node));
        }
        String first = node.getChildCount() > 0 ? node.getChild(0).getType() : "";
        if (first.equals("(")) {
            return new Tuple(position(node), ctx).postinit(elements(named, ctx));
        }
        if (first.equals("[")) {
            return new ListNode(position(node), ctx).postinit(elements(named, ctx));
        }
        if (named.size() == 1) {
            return target(named.get(0), ctx);
        }
        if (hasToken(node, ".")) {
            var expr = expression(named.get(0));
            String attr = text(named.get(named.size() - 1));
            return ctx == Context.DEL
                    ? new DelAttr(position(node), attr).postinit(expr)
                    : new AssignAttr(position(node), attr).postinit(expr);
        }
        if (hasToken(node, "[")) {
            return new Subscript(position(node), ctx)
                    .postinit(expression(named.get(0)), subscriptSlice(node, named.subList(1, named.size())));
        }
        return new Tuple(position(node), ctx).postinit(elements(named, ctx));
    }

    private NodeSequence elements(List<TSNode> nodes, Context ctx) throws AstBuildingException {
        var result = new ArrayList<PyNode>(nodes.size());
        for (TSNode node : nodes) {
            result.add(element(node, ctx));
        }
        return NodeSequence.copyOf(result);
    }

    // ---------------------------------------------------------------------------------------------------------
    // Expressions

    private PyNode attribute(TSNode node, Context ctx) throws AstBuildingException {
        var expr = expression(requiredField(node, "object"));
        String attrname = text(requiredField(node, "attribute"));
        return switch (ctx) {
            case LOAD -> new Attribute(position(node), attrname).postinit(expr);
            case STORE -> new AssignAttr(position(node), attrname).postinit(expr);
            case DEL -> new DelAttr(position(node), attrname).postinit(expr);
        };
    }

    private PyNode subscript(TSNode node, Context ctx) throws AstBuildingException {
        var named = namedChildren(node);
        var value = expression(named.get(0));
        return new Subscript(position(node), ctx).postinit(value, subscriptSlice(node, named.subList(1, named.size())));
    }

    /**
     * One plain index gives an {@link Index}, one slice a {@link Slice}. Several dimensions give an {@link ExtSlice}
     * when any of them is a slice and an index over a tuple otherwise.
     */
    private PyNode subscriptSlice(TSNode subscript, List<TSNode> dims) throws AstBuildingException {
        boolean tupleIndex = dims.size() > 1 || countTokens(subscript, ",") > 0;
        if (!tupleIndex) {
            TSNode dim = dims.get(0);
            return SLICE.equals(dim.getType()) ? slice(dim) : new Index(position(dim)).postinit(expression(dim));
        }
        boolean anySlice = false;
        for (TSNode dim : dims) {
            anySlice |= SLICE.equals(dim.getType());
        }
        var position = position(dims.get(0));
        if (anySlice) {
            var result = new ArrayList<PyNode>(dims.size());
            for (TSNode dim : dims) {
                result.add(SLICE.equals(dim.getType()) ? slice(dim) : new Index(position(dim)).postinit(expression(dim)));
            }
            return new ExtSlice(position).postinit(NodeSequence.copyOf(result));
        }
        var tuple = new Tuple(position, Context.LOAD).postinit(expressions(dims));
        return new Index(position).postinit(tuple);
    }

    // The bounds of a slice are only told apart by the colons between them.
    private PyNode slice(TSNode node) throws AstBuildingException {
        var parts = new ArrayList<@Nullable TSNode>();
        parts.add(null);
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (isExtra(child)) {
                continue;
            }
            if (":".equals(child.getType())) {
                parts.add(null);
            } else if (child.isNamed()) {
                parts.set(parts.size() - 1, child);
            }
        }
        PyNode lower = expressionOrEmpty(parts.get(0));
        PyNode upper = parts.size() > 1 ? expressionOrEmpty(parts.get(1)) : Empty.INSTANCE;
        PyNode step = parts.size() > 2 ? expressionOrEmpty(parts.get(2)) : Empty.INSTANCE;
        return new Slice(position(node)).postinit(lower, upper, step);
    }

    private PyNode call(TSNode node) throws AstBuildingException {
        var func = expression(requiredField(node, "function"));
        TSNode arguments = requiredField(node, "arguments");
        if (GENERATOR_EXPRESSION.equals(arguments.getType())) {
            return new Call(position(node)).postinit(func, NodeSequence.of(expression(arguments)), NodeSequence.empty());
        }
        var args = new ArrayList<PyNode>();
        var keywords = new ArrayList<PyNode>();
        callArguments(arguments, args, keywords);
        return new Call(position(node)).postinit(func, NodeSequence.copyOf(args), NodeSequence.copyOf(keywords));
    }

    /** Sorts an argument list into positional arguments (starred ones included) and keywords. */
    private void callArguments(TSNode argumentList, List<PyNode> args, List<PyNode> keywords)
            throws AstBuildingException {
        for (TSNode argument : namedChildren(argumentList)) {
            switch (argument.getType()) {
                case KEYWORD_ARGUMENT -> keywords.add(new Keyword(position(argument),
                                text(requiredField(argument, "name")))
                        .postinit(expression(requiredField(argument, "value"))));
                case DICTIONARY_SPLAT -> keywords.add(
                        new Keyword(position(argument), null).postinit(expression(single(argument))));
                default -> args.add(expression(argument));
            }
        }
    }

    private PyNode starred(TSNode node, Context ctx) throws AstBuildingException {
        TSNode inner = single(node);
        return new Starred(position(node), ctx).postinit(element(inner, ctx));
    }

    private PyNode binaryOperator(TSNode node) throws AstBuildingException {
        String op = requiredField(node, "operator").getType();
        if (!Operators.isBinary(op)) {
            throw buildingError("Unknown binary operator '" + op + "' at " + position(node));
        }
        if (Operators.isMatrixMultiplication(op) && dialect == PythonDialect.PY2) {
            throw syntaxError(node, "matrix multiplication is not supported");
        }
        var left = expression(requiredField(node, "left"));
        var right = expression(requiredField(node, "right"));
        return new BinOp(position(node), op).postinit(left, right);
    }

    private PyNode unaryOperator(TSNode node) throws AstBuildingException {
        String op = requiredField(node, "operator").getType();
        if (!Operators.UNARY.contains(op)) {
            throw buildingError("Unknown unary operator '" + op + "' at " + position(node));
        }
        return new UnaryOp(position(node), op).postinit(expression(requiredField(node, "argument")));
    }

    private PyNode notOperator(TSNode node) throws AstBuildingException {
        return new UnaryOp(position(node), "not").postinit(expression(requiredField(node, "argument")));
    }

    /** Chains of the same operator collapse into one node; parenthesised groups stay nested. */
    private PyNode booleanOperator(TSNode node) throws AstBuildingException {
        String op = requiredField(node, "operator").getType();
        if (!Operators.BOOLEAN.contains(op)) {
            throw buildingError("Unknown boolean operator '" + op + "' at " + position(node));
        }
        var values = new ArrayList<PyNode>();
        collectBooleanOperands(requiredField(node, "left"), op, values);
        collectBooleanOperands(requiredField(node, "right"), op, values);
        return new BoolOp(position(node), op).postinit(NodeSequence.copyOf(values));
    }

    private void collectBooleanOperands(TSNode operand, String op, List<PyNode> values) throws AstBuildingException {
        if (BOOLEAN_OPERATOR.equals(operand.getType()) && op.equals(requiredField(operand, "operator").getType())) {
            collectBooleanOperands(requiredField(operand, "left"), op, values);
            collectBooleanOperands(requiredField(operand, "right"), op, values);
        } else {
            values.add(expression(operand));
        }
    }

    private PyNode comparison(TSNode node) throws AstBuildingException {
        var operands = new ArrayList<TSNode>();
        var ops = new ArrayList<String>();
        String pending = null;
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (isExtra(child)) {
                continue;
            }
            if (child.isNamed()) {
                if (pending != null) {
                    ops.add(pending);
                    pending = null;
                }
                operands.add(child);
                continue;
            }
            String token = child.getType();
            if (pending != null && (pending + " " + token).equals("not in")) {
                pending = "not in";
            } else if (pending != null && (pending + " " + token).equals("is not")) {
                pending = "is not";
            } else {
                pending = token;
            }
        }
        for (String op : ops) {
            if (!Operators.isComparison(op)) {
                throw buildingError("Unknown comparison operator '" + op + "' at " + position(node));
            }
            if (op.equals("<>") && dialect == PythonDialect.PY3) {
                throw syntaxError(node, "the '<>' operator is not supported");
            }
        }
        if (operands.size() != ops.size() + 1) {
            throw buildingError("Comparison at " + position(node) + " has " + operands.size() + " operands for "
                    + ops.size() + " operators");
        }
        var left = expression(operands.get(0));
        var comparators = expressions(operands.subList(1, operands.size()));
        return new Compare(position(node), ops).postinit(left, comparators);
    }

    private PyNode conditional(TSNode node) throws AstBuildingException {
        var named = namedChildren(node);
        if (named.size() != 3) {
            throw buildingError("Conditional expression at " + position(node) + " has " + named.size() + " parts");
        }
        var body = expression(named.get(0));
        var test = expression(named.get(1));
        var orelse = expression(named.get(2));
        return new IfExp(position(node)).postinit(test, body, orelse);
    }

    private PyNode lambda(TSNode node) throws AstBuildingException {
        TSNode parameters = field(node, "parameters");
        Arguments args = new ParameterBuilder(this).build(parameters, position(parameters == null ? node : parameters));
        var body = expression(requiredField(node, "body"));
        return new Lambda(position(node)).postinit(args, body);
    }

    private PyNode awaitExpression(TSNode node) throws AstBuildingException {
        return new Await(position(node)).postinit(expression(single(node)));
    }

    private PyNode yieldExpression(TSNode node) throws AstBuildingException {
        var named = namedChildren(node);
        PyNode value = named.isEmpty() ? Empty.INSTANCE : expression(named.get(0));
        if (hasToken(node, "from")) {
            if (dialect == PythonDialect.PY2) {
                throw syntaxError(node, "'yield from' is not supported");
            }
            return new YieldFrom(position(node)).postinit(value);
        }
        return new Yield(position(node)).postinit(value);
    }

    private PyNode tuple(TSNode node, Context ctx) throws AstBuildingException {
        return new Tuple(position(node), ctx).postinit(elements(namedChildren(node), ctx));
    }

    private PyNode list(TSNode node, Context ctx) throws AstBuildingException {
        return new ListNode(position(node), ctx).postinit(elements(namedChildren(node), ctx));
    }

    private PyNode set(TSNode node) throws AstBuildingException {
        return new SetNode(position(node)).postinit(expressions(namedChildren(node)));
    }

    private PyNode dictionary(TSNode node) throws AstBuildingException {
        var keys = new ArrayList<PyNode>();
        var values = new ArrayList<PyNode>();
        for (TSNode entry : namedChildren(node)) {
            if (PAIR.equals(entry.getType())) {
                keys.add(expression(requiredField(entry, "key")));
                values.add(expression(requiredField(entry, "value")));
            } else if (DICTIONARY_SPLAT.equals(entry.getType())) {
                keys.add(new DictUnpack(position(entry)));
                values.add(expression(single(entry)));
            } else {
                throw buildingError("Unexpected dictionary entry '" + entry.getType() + "' at " + position(entry));
            }
        }
        return new Dict(position(node)).postinit(NodeSequence.copyOf(keys), NodeSequence.copyOf(values));
    }

    private PyNode listComprehension(TSNode node) throws AstBuildingException {
        var generators = comprehensions(node);
        return new ListComp(position(node)).postinit(generators, expression(requiredField(node, "body")));
    }

    private PyNode setComprehension(TSNode node) throws AstBuildingException {
        var generators = comprehensions(node);
        return new SetComp(position(node)).postinit(generators, expression(requiredField(node, "body")));
    }

    private PyNode generatorExpression(TSNode node) throws AstBuildingException {
        var generators = comprehensions(node);
        return new GeneratorExp(position(node)).postinit(generators, expression(requiredField(node, "body")));
    }

    private PyNode dictComprehension(TSNode node) throws AstBuildingException {
        TSNode pair = requiredField(node, "body");
        var generators = comprehensions(node);
        var key = expression(requiredField(pair, "key"));
        var value = expression(requiredField(pair, "value"));
        return new DictComp(position(node)).postinit(generators, key, value);
    }

    /** One {@link Comprehension} per {@code for} clause, each collecting the {@code if} clauses after it. */
    private NodeSequence comprehensions(TSNode node) throws AstBuildingException {
        var result = new ArrayList<PyNode>();
        TSNode pendingFor = null;
        var pendingIfs = new ArrayList<PyNode>();
        for (TSNode child : namedChildren(node)) {
            if (FOR_IN_CLAUSE.equals(child.getType())) {
                if (pendingFor != null) {
                    result.add(comprehension(pendingFor, pendingIfs));
                }
                pendingFor = child;
                pendingIfs = new ArrayList<>();
            } else if (IF_CLAUSE.equals(child.getType())) {
                pendingIfs.add(expression(single(child)));
            }
        }
        if (pendingFor == null) {
            throw buildingError("Comprehension at " + position(node) + " has no 'for' clause");
        }
        result.add(comprehension(pendingFor, pendingIfs));
        return NodeSequence.copyOf(result);
    }

    private PyNode comprehension(TSNode clause, List<PyNode> ifs) throws AstBuildingException {
        boolean isAsync = clause.getChildCount() > 0 && "async".equals(clause.getChild(0).getType());
        var target = target(requiredField(clause, "left"), Context.STORE);
        var iterables = namedChildrenAfter(clause, "in");
        if (iterables.isEmpty()) {
            throw buildingError("Comprehension clause at " + position(clause) + " has nothing to iterate");
        }
        PyNode iter = iterables.size() == 1
                ? expression(iterables.get(0))
                : new Tuple(position(iterables.get(0)), Context.LOAD).postinit(expressions(iterables));
        return new Comprehension(position(clause), isAsync).postinit(target, iter, NodeSequence.copyOf(ifs));
    }

    private PyNode string(TSNode node) throws AstBuildingException {
        var literal = stringLiteral(node);
        Object value = literal.bytes() ? new Const.Bytes(literal.value()) : literal.value();
        return new Const(position(node), value);
    }

    /** Decodes a string or an implicit concatenation of strings. */
    private StringLiterals.Literal stringLiteral(TSNode node) throws AstBuildingException {
        if (STRING.equals(node.getType())) {
            return decodeString(node);
        }
        var parts = namedChildren(node);
        var value = new StringBuilder();
        Boolean bytes = null;
        boolean formatted = false;
        for (TSNode part : parts) {
            var literal = decodeString(part);
            if (bytes != null && bytes != literal.bytes()) {
                throw syntaxError(part, "cannot mix bytes and nonbytes literals");
            }
            bytes = literal.bytes();
            formatted |= literal.formatted();
            value.append(literal.value());
        }
        return new StringLiterals.Literal(value.toString(), bytes != null && bytes, formatted);
    }

    private StringLiterals.Literal decodeString(TSNode node) throws AstBuildingException {
        try {
            return StringLiterals.decode(text(node));
        } catch (IllegalArgumentException e) {
            throw syntaxError(node, e.getMessage());
        }
    }

    private PyNode number(TSNode node) throws AstBuildingException {
        try {
            return new Const(position(node), NumberLiterals.parse(text(node), dialect));
        } catch (NumberFormatException e) {
            throw syntaxError(node, "invalid number literal '" + text(node) + "'");
        }
    }

    // ---------------------------------------------------------------------------------------------------------
    // Simple statements

    private PyNode expressionStatement(TSNode node) throws AstBuildingException {
        var named = namedChildren(node);
        if (named.size() == 1 && countTokens(node, ",") == 0) {
            TSNode only = named.get(0);
            switch (only.getType()) {
                case ASSIGNMENT:
                    return assignment(only);
                case AUGMENTED_ASSIGNMENT:
                    return augmentedAssignment(only);
                case IDENTIFIER:
                    if (dialect == PythonDialect.PY2 && text(only).equals("print")) {
                        return new Print(position(node), true).postinit(Empty.INSTANCE, NodeSequence.empty());
                    }
                    break;
                default:
                    break;
            }
            return new Expr(position(node)).postinit(expression(only));
        }
        var tuple = new Tuple(position(named.get(0)), Context.LOAD).postinit(expressions(named));
        return new Expr(position(node)).postinit(tuple);
    }

    /** A chain {@code a = b = value} becomes one node with a target per link. */
    private PyNode assignment(TSNode node) throws AstBuildingException {
        TSNode annotation = field(node, "type");
        if (annotation != null) {
            if (!dialect.supportsAnnotations()) {
                throw syntaxError(annotation, "variable annotations are not supported");
            }
            TSNode left = requiredField(node, "left");
            boolean simple = IDENTIFIER.equals(left.getType());
            var target = target(left, Context.STORE);
            var type = expression(annotation);
            var value = expressionOrEmpty(field(node, "right"));
            return new AnnAssign(position(node), simple).postinit(target, type, value);
        }
        var targets = new ArrayList<PyNode>();
        TSNode current = node;
        while (true) {
            targets.add(target(requiredField(current, "left"), Context.STORE));
            TSNode right = requiredField(current, "right");
            if (ASSIGNMENT.equals(right.getType()) && field(right, "type") == null) {
                current = right;
                continue;
            }
            if (ASSIGNMENT.equals(right.getType()) || AUGMENTED_ASSIGNMENT.equals(right.getType())) {
                throw syntaxError(right, "invalid assignment chain");
            }
            return new Assign(position(node)).postinit(NodeSequence.copyOf(targets), expression(right));
        }
    }

    private PyNode augmentedAssignment(TSNode node) throws AstBuildingException {
        String op = requiredField(node, "operator").getType();
        if (!Operators.isAugmented(op)) {
            throw buildingError("Unknown augmented assignment operator '" + op + "' at " + position(node));
        }
        if (Operators.isMatrixMultiplication(op) && dialect == PythonDialect.PY2) {
            throw syntaxError(node, "matrix multiplication is not supported");
        }
        var target = target(requiredField(node, "left"), Context.STORE);
        var value = expression(requiredField(node, "right"));
        return new AugAssign(position(node), op).postinit(target, value);
    }

    private PyNode returnStatement(TSNode node) throws AstBuildingException {
        var named = namedChildren(node);
        return new Return(position(node)).postinit(named.isEmpty() ? Empty.INSTANCE : expression(named.get(0)));
    }

    private PyNode deleteStatement(TSNode node) throws AstBuildingException {
        TSNode operand = single(node);
        var targets = new ArrayList<PyNode>();
        if (EXPRESSION_LIST.equals(operand.getType())) {
            for (TSNode element : namedChildren(operand)) {
                targets.add(target(element, Context.DEL));
            }
        } else {
            targets.add(target(operand, Context.DEL));
        }
        return new Delete(position(node)).postinit(NodeSequence.copyOf(targets));
    }

    private PyNode raiseStatement(TSNode node) throws AstBuildingException {
        TSNode causeNode = field(node, "cause");
        TSNode excNode = null;
        for (TSNode child : namedChildren(node)) {
            if (causeNode == null || !isSameNode(child, causeNode)) {
                excNode = child;
                break;
            }
        }
        if (causeNode != null && dialect == PythonDialect.PY2) {
            throw syntaxError(causeNode, "'raise ... from' is not supported");
        }
        if (excNode != null && EXPRESSION_LIST.equals(excNode.getType())) {
            if (dialect == PythonDialect.PY3) {
                throw syntaxError(excNode, "multiple exception parts in raise are not supported");
            }
            var parts = namedChildren(excNode);
            if (parts.size() > 3) {
                throw syntaxError(excNode, "raise takes at most three expressions");
            }
            return new Raise(position(node)).postinit(
                    expression(parts.get(0)),
                    parts.size() > 1 ? expression(parts.get(1)) : Empty.INSTANCE,
                    parts.size() > 2 ? expression(parts.get(2)) : Empty.INSTANCE);
        }
        return new Raise(position(node)).postinit(expressionOrEmpty(excNode), expressionOrEmpty(causeNode), Empty.INSTANCE);
    }

    private PyNode assertStatement(TSNode node) throws AstBuildingException {
        var named = namedChildren(node);
        var test = expression(named.get(0));
        PyNode fail = named.size() > 1 ? expression(named.get(1)) : Empty.INSTANCE;
        return new Assert(position(node)).postinit(test, fail);
    }

    private PyNode nonlocalStatement(TSNode node) throws AstBuildingException {
        if (dialect == PythonDialect.PY2) {
            throw syntaxError(node, "'nonlocal' is not supported");
        }
        return new Nonlocal(position(node), identifiers(node));
    }

    private List<String> identifiers(TSNode node) {
        var names = new ArrayList<String>();
        for (TSNode child : namedChildren(node)) {
            names.add(text(child));
        }
        return names;
    }

    private PyNode importStatement(TSNode node) throws AstBuildingException {
        return new Import(position(node), importNames(node));
    }

    private PyNode importFromStatement(TSNode node) throws AstBuildingException {
        TSNode module = requiredField(node, "module_name");
        String modname;
        Integer level = null;
        if (RELATIVE_IMPORT.equals(module.getType())) {
            modname = "";
            for (TSNode part : namedChildren(module)) {
                if (IMPORT_PREFIX.equals(part.getType())) {
                    level = (int) text(part).chars().filter(c -> c == '.').count();
                } else if (DOTTED_NAME.equals(part.getType())) {
                    modname = dottedName(part);
                }
            }
        } else {
            modname = dottedName(module);
        }
        for (TSNode child : namedChildren(node)) {
            if (WILDCARD_IMPORT.equals(child.getType())) {
                return new ImportFrom(position(node), modname, List.of(new ImportName("*", null)), level);
            }
        }
        return new ImportFrom(position(node), modname, importNames(node), level);
    }

    private PyNode futureImportStatement(TSNode node) throws AstBuildingException {
        return new ImportFrom(position(node), "__future__", importNames(node), null);
    }

    /** The children of {@code node} in its {@code name} field: plain or aliased dotted names. */
    private List<ImportName> importNames(TSNode node) throws AstBuildingException {
        var names = new ArrayList<ImportName>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (!"name".equals(node.getFieldNameForChild(i))) {
                continue;
            }
            TSNode child = node.getChild(i);
            if (ALIASED_IMPORT.equals(child.getType())) {
                names.add(new ImportName(
                        dottedName(requiredField(child, "name")), text(requiredField(child, "alias"))));
            } else {
                names.add(new ImportName(dottedName(child), null));
            }
        }
        if (names.isEmpty()) {
            throw buildingError("Import at " + position(node) + " names nothing");
        }
        return names;
    }

    private String dottedName(TSNode node) {
        return text(node).replaceAll("\\s+", "");
    }

    private PyNode printStatement(TSNode node) throws AstBuildingException {
        if (dialect == PythonDialect.PY3) {
            throw syntaxError(node, "Missing parentheses in call to 'print'");
        }
        PyNode dest = Empty.INSTANCE;
        var values = new ArrayList<PyNode>();
        for (TSNode child : namedChildren(node)) {
            if (CHEVRON.equals(child.getType())) {
                dest = expression(single(child));
            } else {
                values.add(expression(child));
            }
        }
        TSNode last = lastToken(node);
        boolean nl = last == null || !",".equals(last.getType());
        return new Print(position(node), nl).postinit(dest, NodeSequence.copyOf(values));
    }

    private PyNode execStatement(TSNode node) throws AstBuildingException {
        if (dialect == PythonDialect.PY3) {
            throw syntaxError(node, "Missing parentheses in call to 'exec'");
        }
        var code = expression(requiredField(node, "code"));
        var scopes = namedChildrenAfter(node, "in");
        PyNode globals = scopes.isEmpty() ? Empty.INSTANCE : expression(scopes.get(0));
        PyNode locals = scopes.size() > 1 ? expression(scopes.get(1)) : Empty.INSTANCE;
        return new Exec(position(node)).postinit(code, globals, locals);
    }

    // ---------------------------------------------------------------------------------------------------------
    // Compound statements

    /** {@code elif} chains nest as an {@code If} inside the else branch of the previous one. */
    private PyNode ifStatement(TSNode node) throws AstBuildingException {
        var alternatives = childrenOfField(node, "alternative");
        NodeSequence orelse = NodeSequence.empty();
        for (int i = alternatives.size() - 1; i >= 0; i--) {
            TSNode alternative = alternatives.get(i);
            if (ELSE_CLAUSE.equals(alternative.getType())) {
                orelse = block(field(alternative, "body"));
            } else {
                var test = expression(requiredField(alternative, "condition"));
                var body = block(field(alternative, "consequence"));
                orelse = NodeSequence.of(new If(position(alternative)).postinit(test, body, orelse));
            }
        }
        var test = expression(requiredField(node, "condition"));
        var body = block(field(node, "consequence"));
        return new If(position(node)).postinit(test, body, orelse);
    }

    private PyNode forStatement(TSNode node) throws AstBuildingException {
        boolean isAsync = node.getChildCount() > 0 && "async".equals(node.getChild(0).getType());
        var target = target(requiredField(node, "left"), Context.STORE);
        var iter = expression(requiredField(node, "right"));
        var body = block(field(node, "body"));
        var orelse = elseBlock(node);
        For loop = isAsync ? new AsyncFor(position(node)) : new For(position(node));
        return loop.postinit(target, iter, body, orelse);
    }

    private PyNode whileStatement(TSNode node) throws AstBuildingException {
        var test = expression(requiredField(node, "condition"));
        var body = block(field(node, "body"));
        return new While(position(node)).postinit(test, body, elseBlock(node));
    }

    private NodeSequence elseBlock(TSNode node) throws AstBuildingException {
        TSNode alternative = field(node, "alternative");
        return alternative == null ? NodeSequence.empty() : block(field(alternative, "body"));
    }

    /**
     * Handlers and a finally clause together become a {@code TryFinally} wrapping a {@code TryExcept}, both at the
     * position of the {@code try} keyword.
     */
    private PyNode tryStatement(TSNode node) throws AstBuildingException {
        var body = block(field(node, "body"));
        var handlers = new ArrayList<PyNode>();
        NodeSequence orelse = NodeSequence.empty();
        NodeSequence finalbody = null;
        for (TSNode child : namedChildren(node)) {
            switch (child.getType()) {
                case EXCEPT_CLAUSE -> handlers.add(exceptClause(child));
                case ELSE_CLAUSE -> orelse = block(field(child, "body"));
                case FINALLY_CLAUSE -> finalbody = block(firstOfType(child, BLOCK));
                case EXCEPT_GROUP_CLAUSE -> throw buildingError(
                        "No conversion available for raw node kind '" + EXCEPT_GROUP_CLAUSE + "' at " + position(child));
                default -> {}
            }
        }
        Position position = position(node);
        PyNode result = null;
        if (!handlers.isEmpty()) {
            result = new TryExcept(position).postinit(body, NodeSequence.copyOf(handlers), orelse);
            body = NodeSequence.of(result);
        }
        if (finalbody != null) {
            result = new TryFinally(position).postinit(body, finalbody);
        }
        if (result == null) {
            throw syntaxError(node, "expected 'except' or 'finally' block");
        }
        return result;
    }

    private ExceptHandler exceptClause(TSNode node) throws AstBuildingException {
        TSNode blockNode = firstOfType(node, BLOCK);
        var parts = new ArrayList<TSNode>();
        for (TSNode child : namedChildren(node)) {
            if (!BLOCK.equals(child.getType())) {
                parts.add(child);
            }
        }
        PyNode type = Empty.INSTANCE;
        PyNode name = Empty.INSTANCE;
        if (parts.size() == 1 && AS_PATTERN.equals(parts.get(0).getType())) {
            TSNode pattern = parts.get(0);
            type = expression(namedChildren(pattern).get(0));
            name = target(requiredField(pattern, "alias"), Context.STORE);
        } else if (!parts.isEmpty()) {
            if (parts.size() > 2) {
                throw buildingError("Except clause at " + position(node) + " has " + parts.size() + " parts");
            }
            type = expression(parts.get(0));
            if (parts.size() == 2) {
                if (dialect == PythonDialect.PY3 && hasToken(node, ",")) {
                    throw syntaxError(node, "multiple exception types must be parenthesized");
                }
                name = target(parts.get(1), Context.STORE);
            }
        }
        return new ExceptHandler(position(node)).postinit(type, name, block(blockNode));
    }

    private PyNode withStatement(TSNode node) throws AstBuildingException {
        boolean isAsync = node.getChildCount() > 0 && "async".equals(node.getChild(0).getType());
        var items = new ArrayList<PyNode>();
        TSNode clause = firstOfType(node, WITH_CLAUSE);
        if (clause == null) {
            throw buildingError("With statement at " + position(node) + " has no items");
        }
        for (TSNode item : namedChildren(clause)) {
            if (WITH_ITEM.equals(item.getType())) {
                items.add(withItem(item));
            }
        }
        var body = block(field(node, "body"));
        With with = isAsync ? new AsyncWith(position(node)) : new With(position(node));
        return with.postinit(NodeSequence.copyOf(items), body);
    }

    private PyNode withItem(TSNode item) throws AstBuildingException {
        TSNode value = field(item, "value");
        if (value == null) {
            value = single(item);
        }
        if (AS_PATTERN.equals(value.getType())) {
            var contextExpr = expression(namedChildren(value).get(0));
            var optionalVars = target(requiredField(value, "alias"), Context.STORE);
            return new WithItem(position(item)).postinit(contextExpr, optionalVars);
        }
        return new WithItem(position(item)).postinit(expression(value), Empty.INSTANCE);
    }

    private PyNode decoratedDefinition(TSNode node) throws AstBuildingException {
        var decorators = new ArrayList<PyNode>();
        TSNode first = null;
        for (TSNode child : namedChildren(node)) {
            if (DECORATOR.equals(child.getType())) {
                if (first == null) {
                    first = child;
                }
                decorators.add(expression(single(child)));
            }
        }
        var decoratorsNode = first == null
                ? Empty.INSTANCE
                : new Decorators(position(first)).postinit(NodeSequence.copyOf(decorators));
        TSNode definition = requiredField(node, "definition");
        var defPosition = position(node);
        return switch (definition.getType()) {
            case FUNCTION_DEFINITION -> functionDefinition(definition, new Decorated(decoratorsNode, defPosition));
            case CLASS_DEFINITION -> classDefinition(definition, new Decorated(decoratorsNode, defPosition));
            default -> throw buildingError(
                    "No conversion available for decorated '" + definition.getType() + "' at " + defPosition);
        };
    }

    /** Decorators of a definition and the position of the first of them. */
    private record Decorated(PyNode decorators, Position position) {}

    private PyNode functionDefinition(TSNode node, @Nullable Decorated decorated) throws AstBuildingException {
        boolean isAsync = node.getChildCount() > 0 && "async".equals(node.getChild(0).getType());
        String name = text(requiredField(node, "name"));
        TSNode parameters = requiredField(node, "parameters");
        Arguments args = new ParameterBuilder(this).build(parameters, position(parameters));
        TSNode returnType = field(node, "return_type");
        if (returnType != null && !dialect.supportsAnnotations()) {
            throw syntaxError(returnType, "return annotations are not supported");
        }
        PyNode returns = expressionOrEmpty(returnType);
        var body = body(requiredField(node, "body"));
        Position position = decorated == null ? position(node) : decorated.position();
        PyNode decorators = decorated == null ? Empty.INSTANCE : decorated.decorators();
        FunctionDef function = isAsync
                ? new AsyncFunctionDef(position, name, body.doc())
                : new FunctionDef(position, name, body.doc());
        return function.postinit(decorators, args, body.statements(), returns);
    }

    private PyNode classDefinition(TSNode node, @Nullable Decorated decorated) throws AstBuildingException {
        String name = text(requiredField(node, "name"));
        var bases = new ArrayList<PyNode>();
        var keywords = new ArrayList<PyNode>();
        TSNode superclasses = field(node, "superclasses");
        if (superclasses != null) {
            callArguments(superclasses, bases, keywords);
        }
        var body = body(requiredField(node, "body"));
        Position position = decorated == null ? position(node) : decorated.position();
        PyNode decorators = decorated == null ? Empty.INSTANCE : decorated.decorators();
        return new ClassDef(position, name, body.doc())
                .postinit(decorators, NodeSequence.copyOf(bases), body.statements(), NodeSequence.copyOf(keywords));
    }

    // ---------------------------------------------------------------------------------------------------------
    // Raw tree helpers

    Position position(TSNode node) {
        var point = node.getStartPoint();
        return new Position(point.getRow() + 1, point.getColumn());
    }

    String text(TSNode node) {
        return source.of(node);
    }

    static boolean isExtra(TSNode node) {
        String type = node.getType();
        return COMMENT.equals(type) || LINE_CONTINUATION.equals(type);
    }

    /** Named children, comments and line continuations left out. */
    static List<TSNode> namedChildren(TSNode node) {
        var result = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (child != null && !child.isNull() && !isExtra(child)) {
                result.add(child);
            }
        }
        return result;
    }

    private static List<TSNode> namedChildrenAfter(TSNode node, String token) {
        var result = new ArrayList<TSNode>();
        boolean seen = false;
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (isExtra(child)) {
                continue;
            }
            if (!child.isNamed() && token.equals(child.getType())) {
                seen = true;
            } else if (seen && child.isNamed()) {
                result.add(child);
            }
        }
        return result;
    }

    private static List<TSNode> childrenOfField(TSNode node, String fieldName) {
        var result = new ArrayList<TSNode>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (fieldName.equals(node.getFieldNameForChild(i))) {
                result.add(node.getChild(i));
            }
        }
        return result;
    }

    private static @Nullable TSNode firstOfType(TSNode node, String type) {
        for (TSNode child : namedChildren(node)) {
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static boolean hasToken(TSNode node, String token) {
        return countTokens(node, token) > 0;
    }

    private static int countTokens(TSNode node, String token) {
        int count = 0;
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (!child.isNamed() && token.equals(child.getType())) {
                count++;
            }
        }
        return count;
    }

    private static @Nullable TSNode lastToken(TSNode node) {
        for (int i = node.getChildCount() - 1; i >= 0; i--) {
            TSNode child = node.getChild(i);
            if (!isExtra(child)) {
                return child;
            }
        }
        return null;
    }

    private static boolean isSameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte() && a.getEndByte() == b.getEndByte() && a.getType().equals(b.getType());
    }

    static @Nullable TSNode field(TSNode node, String name) {
        TSNode child = node.getChildByFieldName(name);
        return child == null || child.isNull() ? null : child;
    }

    TSNode requiredField(TSNode node, String name) throws AstBuildingException {
        TSNode child = field(node, name);
        if (child == null) {
            throw buildingError("Raw node '" + node.getType() + "' at " + position(node) + " has no '" + name + "' field");
        }
        return child;
    }

    /** The only named child of a wrapper node such as a parenthesised expression or a decorator. */
    TSNode single(TSNode node) throws AstBuildingException {
        var named = namedChildren(node);
        if (named.isEmpty()) {
            throw buildingError("Raw node '" + node.getType() + "' at " + position(node) + " is empty");
        }
        return named.get(0);
    }

    AstBuildingException buildingError(String message) {
        return new AstBuildingException(moduleName, path, message);
    }

    AstSyntaxException syntaxError(TSNode node, String message) {
        var point = node.getStartPoint();
        return new AstSyntaxException(
                moduleName, path, source.line(point.getRow()), point.getRow() + 1, point.getColumn(), message);
    }
}
