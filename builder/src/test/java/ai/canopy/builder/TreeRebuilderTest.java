package ai.canopy.builder;

import static org.junit.jupiter.api.Assertions.*;

import ai.canopy.exception.AstBuildingException;
import ai.canopy.exception.AstSyntaxException;
import ai.canopy.tree.Context;
import ai.canopy.tree.Empty;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.PythonDialect;
import ai.canopy.tree.nodes.AnnAssign;
import ai.canopy.tree.nodes.Assign;
import ai.canopy.tree.nodes.AssignAttr;
import ai.canopy.tree.nodes.AssignName;
import ai.canopy.tree.nodes.AsyncFunctionDef;
import ai.canopy.tree.nodes.AugAssign;
import ai.canopy.tree.nodes.Await;
import ai.canopy.tree.nodes.BoolOp;
import ai.canopy.tree.nodes.Call;
import ai.canopy.tree.nodes.ClassDef;
import ai.canopy.tree.nodes.Compare;
import ai.canopy.tree.nodes.Const;
import ai.canopy.tree.nodes.DelAttr;
import ai.canopy.tree.nodes.DelName;
import ai.canopy.tree.nodes.Delete;
import ai.canopy.tree.nodes.ExceptHandler;
import ai.canopy.tree.nodes.Exec;
import ai.canopy.tree.nodes.Expr;
import ai.canopy.tree.nodes.ExtSlice;
import ai.canopy.tree.nodes.FunctionDef;
import ai.canopy.tree.nodes.Global;
import ai.canopy.tree.nodes.If;
import ai.canopy.tree.nodes.Import;
import ai.canopy.tree.nodes.ImportFrom;
import ai.canopy.tree.nodes.ImportName;
import ai.canopy.tree.nodes.Index;
import ai.canopy.tree.nodes.Lambda;
import ai.canopy.tree.nodes.ListComp;
import ai.canopy.tree.nodes.Module;
import ai.canopy.tree.nodes.Name;
import ai.canopy.tree.nodes.NameConstant;
import ai.canopy.tree.nodes.Print;
import ai.canopy.tree.nodes.Raise;
import ai.canopy.tree.nodes.Singleton;
import ai.canopy.tree.nodes.Slice;
import ai.canopy.tree.nodes.Starred;
import ai.canopy.tree.nodes.Subscript;
import ai.canopy.tree.nodes.TryExcept;
import ai.canopy.tree.nodes.TryFinally;
import ai.canopy.tree.nodes.Tuple;
import ai.canopy.tree.nodes.With;
import ai.canopy.tree.nodes.YieldFrom;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

class TreeRebuilderTest {

    private final AstBuilder py3 = new AstBuilder(BuilderSettings.DEFAULTS);
    private final AstBuilder py2 = new AstBuilder(BuilderSettings.DEFAULTS.withDialect(PythonDialect.PY2));

    private Module build(String code) throws AstBuildingException {
        return py3.buildFromText(code, "test", null);
    }

    private static <T extends PyNode> T first(Module module, Class<T> type) {
        PyNode statement = module.body().get(0);
        assertInstanceOf(type, statement, "Unexpected first statement " + statement);
        return type.cast(statement);
    }

    private <T extends PyNode> T statement(String code, Class<T> type) throws AstBuildingException {
        return first(build(code), type);
    }

    private PyNode expression(String code) throws AstBuildingException {
        return statement(code, Expr.class).value();
    }

    // A leading bare string would be taken as the docstring, so string literals are read from an assignment.
    private Object assignedConstant(String literal) throws AstBuildingException {
        var value = statement("x = " + literal, Assign.class).value();
        assertInstanceOf(Const.class, value, literal);
        return ((Const) value).value();
    }

    private static String name(PyNode node) {
        if (node instanceof Name name) {
            return name.name();
        }
        if (node instanceof AssignName name) {
            return name.name();
        }
        fail("Not a name: " + node);
        return "";
    }

    @Test
    void testDumpOfASimpleModule() throws AstBuildingException {
        assertEquals("""
                Module(
                   name='test',
                   doc=None,
                   fileEncoding='utf-8',
                   isPackage=False,
                   sourceCode='x = 1\\n',
                   sourceFile=None,
                   body=[Assign(
                         targets=[AssignName(name='x')],
                         value=Const(value=1))])""", build("x = 1").dump());
    }

    @Test
    void testAssignmentChain() throws AstBuildingException {
        var assign = statement("a = b = 2", Assign.class);
        assertEquals(List.of("a", "b"), assign.targets().stream().map(TreeRebuilderTest::name).toList());
        assertEquals(2L, ((Const) assign.value()).value());
        assertEquals(1, assign.line());
        assertEquals(0, assign.column());
    }

    @Test
    void testAnnotatedAndAugmentedAssignment() throws AstBuildingException {
        var annotated = statement("x: int = 3", AnnAssign.class);
        assertTrue(annotated.simple(), "a bare name target is simple");
        assertEquals("x", name(annotated.target()));
        assertEquals("int", name(annotated.annotation()));
        assertEquals(3L, ((Const) annotated.value()).value());

        var bare = statement("o.x: int", AnnAssign.class);
        assertFalse(bare.simple());
        assertInstanceOf(AssignAttr.class, bare.target());
        assertSame(Empty.INSTANCE, bare.value());

        var augmented = statement("x += 1", AugAssign.class);
        assertEquals("+=", augmented.op());
        assertInstanceOf(AssignName.class, augmented.target());
    }

    @Test
    void testTargetsCarryTheirContext() throws AstBuildingException {
        var unpack = statement("a, *b = c", Assign.class);
        var tuple = (Tuple) unpack.targets().get(0);
        assertEquals(Context.STORE, tuple.ctx());
        assertInstanceOf(AssignName.class, tuple.elts().get(0));
        var starred = (Starred) tuple.elts().get(1);
        assertEquals(Context.STORE, starred.ctx());
        assertInstanceOf(AssignName.class, starred.value());

        var item = statement("d[k] = 1", Assign.class);
        var subscript = (Subscript) item.targets().get(0);
        assertEquals(Context.STORE, subscript.ctx());
        assertEquals("k", name(((Index) subscript.slice()).value()));

        var delete = statement("del a, o.b", Delete.class);
        assertInstanceOf(DelName.class, delete.targets().get(0));
        assertEquals("b", ((DelAttr) delete.targets().get(1)).attrname());
    }

    @Test
    void testBuiltinNamesBecomeConstants() throws AstBuildingException {
        assertEquals(Singleton.NONE, ((NameConstant) expression("None")).value());
        assertEquals(Boolean.TRUE, ((NameConstant) expression("True")).value());
        assertEquals(Singleton.NOT_IMPLEMENTED, ((NameConstant) expression("NotImplemented")).value());
        assertInstanceOf(Name.class, expression("none"));
    }

    @Test
    void testLiterals() throws AstBuildingException {
        assertEquals(16L, ((Const) expression("0x10")).value());
        assertEquals(1.5, ((Const) expression("1.5")).value());
        assertEquals(new Const.Imaginary(2.0), ((Const) expression("2j")).value());
        assertEquals(new BigInteger("123456789012345678901234567890"),
                ((Const) expression("123456789012345678901234567890")).value());
        assertEquals("ab", assignedConstant("'a' 'b'"));
        assertEquals("tab\there", assignedConstant("'tab\\there'"));
        assertEquals("raw\\n", assignedConstant("r'raw\\n'"));
        assertEquals(new Const.Bytes("xy"), assignedConstant("b'xy'"));
        assertEquals(new Const.Bytes("xy"), ((Const) expression("b'xy'")).value(), "bytes are never a docstring");
    }

    @Test
    void testBooleanChainsFlatten() throws AstBuildingException {
        var flat = (BoolOp) expression("a and b and c");
        assertEquals("and", flat.op());
        assertEquals(3, flat.values().size());

        var grouped = (BoolOp) expression("a and (b or c)");
        assertEquals(2, grouped.values().size());
        assertEquals("or", ((BoolOp) grouped.values().get(1)).op());
    }

    @Test
    void testComparisonOperators() throws AstBuildingException {
        var compare = (Compare) expression("a < b is not c not in d");
        assertEquals(List.of("<", "is not", "not in"), compare.ops());
        assertEquals("a", name(compare.left()));
        assertEquals(3, compare.pairs().size());
    }

    @Test
    void testComprehensionClauses() throws AstBuildingException {
        var comp = (ListComp) expression("[i for i in y if i for j in i]");
        assertEquals(2, comp.generators().size());
        assertEquals(1, comp.generators().get(0).ifs().size());
        assertEquals("y", name(comp.generators().get(0).iter()));
        assertEquals("j", name(comp.generators().get(1).target()));
        assertEquals("i", name(comp.elt()));
    }

    @Test
    void testCallArguments() throws AstBuildingException {
        var call = (Call) expression("f(a, *b, k=1, **d)");
        assertEquals("f", name(call.func()));
        assertEquals(2, call.args().size());
        assertEquals(1, call.starArgs().size());
        assertEquals("k", call.keywords().get(0).arg());
        assertNull(call.keywords().get(1).arg(), "a ** argument has no keyword name");
        assertEquals(1, call.kwArgs().size());
    }

    @Test
    void testSubscriptSlices() throws AstBuildingException {
        var slice = (Slice) ((Subscript) expression("x[1:2]")).slice();
        assertEquals(1L, ((Const) slice.lower()).value());
        assertEquals(2L, ((Const) slice.upper()).value());
        assertSame(Empty.INSTANCE, slice.step());

        var stepOnly = (Slice) ((Subscript) expression("x[::2]")).slice();
        assertSame(Empty.INSTANCE, stepOnly.lower());
        assertSame(Empty.INSTANCE, stepOnly.upper());
        assertEquals(2L, ((Const) stepOnly.step()).value());

        var ext = (ExtSlice) ((Subscript) expression("x[1:2, 3]")).slice();
        assertInstanceOf(Slice.class, ext.dims().get(0));
        assertInstanceOf(Index.class, ext.dims().get(1));

        var tupleIndex = (Index) ((Subscript) expression("x[1, 2]")).slice();
        assertEquals(2, ((Tuple) tupleIndex.value()).elts().size());
    }

    @Test
    void testElifNestsInTheElseBranch() throws AstBuildingException {
        var node = statement("""
                if a:
                    pass
                elif b:
                    pass
                else:
                    x = 1
                """, If.class);
        var elif = (If) node.orelse().get(0);
        assertEquals("b", name(elif.test()));
        assertEquals(3, elif.line());
        assertInstanceOf(Assign.class, elif.orelse().get(0));
    }

    @Test
    void testTryWithHandlersAndFinally() throws AstBuildingException {
        var node = statement("""
                try:
                    pass
                except E as e:
                    pass
                except:
                    pass
                finally:
                    pass
                """, TryFinally.class);
        var inner = (TryExcept) node.body().get(0);
        assertEquals(node.line(), inner.line(), "the split nodes share the try position");
        assertEquals(2, inner.handlers().size());
        ExceptHandler handler = inner.handlers().get(0);
        assertEquals("E", name(handler.type()));
        assertEquals("e", name(handler.name()));
        assertSame(Empty.INSTANCE, inner.handlers().get(1).type());
        assertEquals(1, node.finalbody().size());
    }

    @Test
    void testFunctionDefinition() throws AstBuildingException {
        var module = build("""
                @d
                def f(a, b=1, *args, c, d=2, **kw):
                    '''doc'''
                    return a
                """);
        var function = first(module, FunctionDef.class);
        assertEquals("f", function.name());
        assertEquals("doc", function.doc());
        assertEquals(1, function.body().size(), "the docstring is not a statement");
        assertEquals(1, function.line(), "a decorated definition starts at its first decorator");
        assertEquals("a, b=..., *args, c, d=..., **kw", function.args().formatArgs());
        assertEquals(1, function.decorators().children().size());
    }

    @Test
    void testPositionalOnlyAndKeywordOnlyParameters() throws AstBuildingException {
        assertEquals("a, /, b", statement("def f(a, /, b): pass", FunctionDef.class).args().formatArgs());
        assertEquals("*, k=...", statement("def f(*, k=1): pass", FunctionDef.class).args().formatArgs());
        var lambda = (Lambda) ((Assign) build("g = lambda x, y=1: x").body().get(0)).value();
        assertEquals("x, y=...", lambda.args().formatArgs());
        assertEquals("x", name(lambda.body()));
    }

    @Test
    void testClassDefinition() throws AstBuildingException {
        var cls = statement("""
                class C(B, metaclass=M):
                    "doc"
                    x = 1
                """, ClassDef.class);
        assertEquals("C", cls.name());
        assertEquals("doc", cls.doc());
        assertEquals("B", name(cls.bases().get(0)));
        assertEquals("metaclass", cls.keywords().get(0).arg());
        assertSame(Empty.INSTANCE, cls.decorators());
    }

    @Test
    void testImports() throws AstBuildingException {
        var plain = statement("import os.path as p, sys", Import.class);
        assertEquals(List.of(new ImportName("os.path", "p"), new ImportName("sys", null)), plain.names());

        var relative = statement("from ..a import b", ImportFrom.class);
        assertEquals("a", relative.modname());
        assertEquals(Integer.valueOf(2), relative.level());

        var here = statement("from . import c", ImportFrom.class);
        assertEquals("", here.modname());
        assertEquals(Integer.valueOf(1), here.level());

        var absolute = statement("from x.y import z", ImportFrom.class);
        assertNull(absolute.level(), "absolute imports have no level");

        var star = statement("from x import *", ImportFrom.class);
        assertEquals("*", star.names().get(0).name());

        var module = build("from __future__ import division\nimport os\n");
        assertTrue(module.futureImports().contains("division"));
    }

    @Test
    void testWithItems() throws AstBuildingException {
        var with = statement("with a as b, c:\n    pass\n", With.class);
        assertEquals(2, with.items().size());
        assertEquals("a", name(with.items().get(0).contextExpr()));
        assertEquals("b", name(with.items().get(0).optionalVars()));
        assertSame(Empty.INSTANCE, with.items().get(1).optionalVars());
    }

    @Test
    void testAsyncAndGenerators() throws AstBuildingException {
        var function = statement("async def f():\n    await g()\n", AsyncFunctionDef.class);
        assertInstanceOf(Await.class, ((Expr) function.body().get(0)).value());

        var generator = statement("def f():\n    yield from g()\n", FunctionDef.class);
        assertInstanceOf(YieldFrom.class, ((Expr) generator.body().get(0)).value());
        assertTrue(generator.isGenerator());
    }

    @Test
    void testRaiseAndGlobal() throws AstBuildingException {
        var raise = statement("raise E from c", Raise.class);
        assertEquals("E", name(raise.exc()));
        assertEquals("c", name(raise.cause()));
        assertSame(Empty.INSTANCE, statement("raise", Raise.class).exc());
        assertEquals(List.of("a", "b"), statement("global a, b", Global.class).names());
    }

    @Test
    void testDocstrings() throws AstBuildingException {
        var module = build("'''module doc'''\nx = 1\n");
        assertEquals("module doc", module.doc());
        assertEquals(1, module.body().size());
        assertInstanceOf(Assign.class, module.body().get(0));

        var bytesFirst = build("b'not a doc'\n");
        assertNull(bytesFirst.doc());
        assertEquals(1, bytesFirst.body().size());
    }

    @Test
    void testUnknownRawKindFailsTheBuild() {
        var error = assertThrows(AstBuildingException.class,
                () -> build("match x:\n    case 1:\n        pass\n"));
        assertTrue(error.getMessage().contains("No conversion available for raw node kind 'match_statement'"),
                error.getMessage());
    }

    @Test
    void testParameterErrors() {
        var order = assertThrows(AstSyntaxException.class, () -> build("def f(a=1, b): pass"));
        assertEquals("non-default argument follows default argument", order.error());
        assertEquals(1, order.line());

        var nested = assertThrows(AstBuildingException.class,
                () -> py2.buildFromText("def f((a, b)): pass", "old", null));
        assertTrue(nested.getMessage().startsWith("Nested tuple parameters are not supported"), nested.getMessage());
    }

    @Test
    void testPython2OnlySyntaxIsRejectedInPython3() {
        for (String code : List.of("print 'x'", "exec 'x = 1'", "a <> b", "raise E, v, tb")) {
            assertThrows(AstSyntaxException.class, () -> build(code), "should reject: " + code);
        }
    }

    @Test
    void testPython3OnlySyntaxIsRejectedInPython2() {
        for (String code : List.of(
                "def f(a: int): pass",
                "def f() -> int: pass",
                "x: int = 1",
                "nonlocal x",
                "a @ b",
                "a @= b",
                "raise E from c",
                "def f():\n    yield from g()\n")) {
            assertThrows(AstSyntaxException.class, () -> py2.buildFromText(code, "old", null), "should reject: " + code);
        }
    }

    @Test
    void testPython2Statements() throws AstBuildingException {
        var module = py2.buildFromText("print 'x', y,\nprint >>f, 'z'\nprint\nexec 'code' in g, l\nraise E, v, tb\n",
                "old", null);
        var trailingComma = (Print) module.body().get(0);
        assertFalse(trailingComma.nl(), "a trailing comma suppresses the newline");
        assertEquals(2, trailingComma.values().size());
        assertSame(Empty.INSTANCE, trailingComma.dest());

        var chevron = (Print) module.body().get(1);
        assertEquals("f", name(chevron.dest()));
        assertTrue(chevron.nl());

        var bare = (Print) module.body().get(2);
        assertTrue(bare.nl());
        assertTrue(bare.values().isEmpty());

        var exec = (Exec) module.body().get(3);
        assertEquals("g", name(exec.globals()));
        assertEquals("l", name(exec.locals()));

        var raise = (Raise) module.body().get(4);
        assertEquals("v", name(raise.cause()));
        assertEquals("tb", name(raise.traceback()));
    }

    @Test
    void testPython2BooleansCanBeBoundAndDeleted() throws AstBuildingException {
        var module = py2.buildFromText("True = 1\ndel False\nx = True\n", "old", null);
        var assign = (Assign) module.body().get(0);
        var target = (AssignName) assign.targets().get(0);
        assertEquals("True", target.name());
        assertEquals(1L, ((Const) assign.value()).value());

        var delete = (Delete) module.body().get(1);
        assertEquals("False", ((DelName) delete.targets().get(0)).name());

        var read = (Assign) module.body().get(2);
        assertInstanceOf(NameConstant.class, read.value(), "a boolean read stays a constant");
    }

    @Test
    void testNoneIsNeverATargetAndBooleansOnlyInPython2() {
        assertThrows(AstSyntaxException.class, () -> build("del False"));
        var none = assertThrows(AstSyntaxException.class, () -> py2.buildFromText("del None", "old", null));
        assertEquals("cannot delete None", none.error());
    }

    @Test
    void testOctalLiteralsDependOnTheDialect() throws AstBuildingException {
        var old = (Assign) py2.buildFromText("x = 0777", "old", null).body().get(0);
        assertEquals(511L, ((Const) old.value()).value());
        var error = assertThrows(AstSyntaxException.class, () -> build("x = 0777"));
        assertEquals("invalid number literal '0777'", error.error());
    }

    @Test
    void testMatrixMultiplicationInPython3() throws AstBuildingException {
        var augmented = statement("a @= b", AugAssign.class);
        assertEquals("@=", augmented.op());
    }
}
