package ai.canopy.tree;

import java.util.List;

/**
 * The closed set of node variants. Each kind knows its display name, the ordered names of its child fields and of its
 * other (non-child) fields, and whether it is a statement.
 */
public enum NodeKind {
    EMPTY("Empty", fields(), fields(), false),
    MODULE("Module", fields("body"), fields("name", "doc", "fileEncoding", "isPackage", "sourceCode", "sourceFile"), false),
    ARGUMENTS("Arguments", fields("args", "vararg", "kwarg", "keywordOnly", "positionalOnly"), fields(), false),
    PARAMETER("Parameter", fields("defaultValue", "annotation"), fields("name"), false),
    ASSIGN_NAME("AssignName", fields(), fields("name"), false),
    DEL_NAME("DelName", fields(), fields("name"), false),
    NAME("Name", fields(), fields("name"), false),
    ASSIGN_ATTR("AssignAttr", fields("expr"), fields("attrname"), false),
    DEL_ATTR("DelAttr", fields("expr"), fields("attrname"), false),
    ATTRIBUTE("Attribute", fields("expr"), fields("attrname"), false),
    ASSERT("Assert", fields("test", "fail"), fields(), true),
    ASSIGN("Assign", fields("targets", "value"), fields(), true),
    ANN_ASSIGN("AnnAssign", fields("target", "annotation", "value"), fields("simple"), true),
    AUG_ASSIGN("AugAssign", fields("target", "value"), fields("op"), true),
    BIN_OP("BinOp", fields("left", "right"), fields("op"), false),
    BOOL_OP("BoolOp", fields("values"), fields("op"), false),
    BREAK("Break", fields(), fields(), true),
    CALL("Call", fields("func", "args", "keywords"), fields(), false),
    COMPARE("Compare", fields("left", "comparators"), fields("ops"), false),
    COMPREHENSION("Comprehension", fields("target", "iter", "ifs"), fields("isAsync"), false),
    CONST("Const", fields(), fields("value"), false),
    NAME_CONSTANT("NameConstant", fields(), fields("value"), false),
    CONTINUE("Continue", fields(), fields(), true),
    DECORATORS("Decorators", fields("nodes"), fields(), false),
    DELETE("Delete", fields("targets"), fields(), true),
    DICT("Dict", fields("keys", "values"), fields(), false),
    DICT_UNPACK("DictUnpack", fields(), fields(), false),
    EXPR("Expr", fields("value"), fields(), true),
    ELLIPSIS("Ellipsis", fields(), fields(), false),
    EXCEPT_HANDLER("ExceptHandler", fields("type", "name", "body"), fields(), true),
    EXEC("Exec", fields("expr", "globals", "locals"), fields(), true),
    EXT_SLICE("ExtSlice", fields("dims"), fields(), false),
    FOR("For", fields("target", "iter", "body", "orelse"), fields(), true),
    ASYNC_FOR("AsyncFor", fields("target", "iter", "body", "orelse"), fields(), true),
    AWAIT("Await", fields("value"), fields(), false),
    IMPORT_FROM("ImportFrom", fields(), fields("modname", "names", "level"), true),
    GLOBAL("Global", fields(), fields("names"), true),
    NONLOCAL("Nonlocal", fields(), fields("names"), true),
    IF("If", fields("test", "body", "orelse"), fields(), true),
    IF_EXP("IfExp", fields("test", "body", "orelse"), fields(), false),
    IMPORT("Import", fields(), fields("names"), true),
    INDEX("Index", fields("value"), fields(), false),
    KEYWORD("Keyword", fields("value"), fields("arg"), false),
    LIST("List", fields("elts"), fields("ctx"), false),
    TUPLE("Tuple", fields("elts"), fields("ctx"), false),
    SET("Set", fields("elts"), fields(), false),
    PASS("Pass", fields(), fields(), true),
    PRINT("Print", fields("dest", "values"), fields("nl"), true),
    RAISE("Raise", fields("exc", "cause", "traceback"), fields(), true),
    RETURN("Return", fields("value"), fields(), true),
    SLICE("Slice", fields("lower", "upper", "step"), fields(), false),
    STARRED("Starred", fields("value"), fields("ctx"), false),
    SUBSCRIPT("Subscript", fields("value", "slice"), fields("ctx"), false),
    TRY_EXCEPT("TryExcept", fields("body", "handlers", "orelse"), fields(), true),
    TRY_FINALLY("TryFinally", fields("body", "finalbody"), fields(), true),
    UNARY_OP("UnaryOp", fields("operand"), fields("op"), false),
    WHILE("While", fields("test", "body", "orelse"), fields(), true),
    WITH("With", fields("items", "body"), fields(), true),
    ASYNC_WITH("AsyncWith", fields("items", "body"), fields(), true),
    WITH_ITEM("WithItem", fields("contextExpr", "optionalVars"), fields(), false),
    YIELD("Yield", fields("value"), fields(), false),
    YIELD_FROM("YieldFrom", fields("value"), fields(), false),
    GENERATOR_EXP("GeneratorExp", fields("generators", "elt"), fields(), false),
    LIST_COMP("ListComp", fields("generators", "elt"), fields(), false),
    SET_COMP("SetComp", fields("generators", "elt"), fields(), false),
    DICT_COMP("DictComp", fields("generators", "key", "value"), fields(), false),
    LAMBDA("Lambda", fields("args", "body"), fields(), false),
    FUNCTION_DEF("FunctionDef", fields("decorators", "args", "body", "returns"), fields("name", "doc"), true),
    ASYNC_FUNCTION_DEF(
            "AsyncFunctionDef", fields("decorators", "args", "body", "returns"), fields("name", "doc"), true),
    CLASS_DEF("ClassDef", fields("decorators", "bases", "body", "keywords"), fields("name", "doc"), true);

    private final String displayName;
    private final List<String> childFields;
    private final List<String> otherFields;
    private final boolean statement;

    NodeKind(String displayName, List<String> childFields, List<String> otherFields, boolean statement) {
        this.displayName = displayName;
        this.childFields = childFields;
        this.otherFields = otherFields;
        this.statement = statement;
    }

    private static List<String> fields(String... names) {
        return List.of(names);
    }

    public String displayName() {
        return displayName;
    }

    /** Names of the child fields, in the order their values are stored. */
    public List<String> childFields() {
        return childFields;
    }

    public List<String> otherFields() {
        return otherFields;
    }

    public boolean isStatement() {
        return statement;
    }

    public int childFieldIndex(String field) {
        int index = childFields.indexOf(field);
        if (index < 0) {
            throw new IllegalArgumentException(displayName + " has no child field '" + field + "'");
        }
        return index;
    }

    /** Kinds whose body is a function, class or module frame. */
    public boolean isFrame() {
        return switch (this) {
            case MODULE, FUNCTION_DEF, ASYNC_FUNCTION_DEF, LAMBDA, CLASS_DEF -> true;
            default -> false;
        };
    }

    public boolean isFunction() {
        return this == FUNCTION_DEF || this == ASYNC_FUNCTION_DEF;
    }

    public boolean isComprehension() {
        return switch (this) {
            case GENERATOR_EXP, LIST_COMP, SET_COMP, DICT_COMP -> true;
            default -> false;
        };
    }
}
