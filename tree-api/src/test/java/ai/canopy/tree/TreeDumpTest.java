package ai.canopy.tree;

import static ai.canopy.tree.testutil.Trees.pos;
import static org.junit.jupiter.api.Assertions.*;

import ai.canopy.tree.nodes.Assign;
import ai.canopy.tree.nodes.AssignName;
import ai.canopy.tree.nodes.Const;
import ai.canopy.tree.nodes.Expr;
import ai.canopy.tree.nodes.ListNode;
import ai.canopy.tree.nodes.Name;
import ai.canopy.tree.nodes.Return;
import ai.canopy.tree.testutil.Trees;
import org.junit.jupiter.api.Test;

class TreeDumpTest {

    @Test
    void testSingleFieldStaysOnOneLine() {
        var expr = new Expr(null).postinit(new Name(null, "x"));
        assertEquals("Expr(value=Name(name='x'))", expr.dump());
    }

    @Test
    void testSeveralFieldsBreakOntoIndentedLines() {
        var assign = new Assign(null)
                .postinit(NodeSequence.of(new AssignName(null, "x")), new Const(null, 1L));
        assertEquals("""
                Assign(
                   targets=[AssignName(name='x')],
                   value=Const(value=1))""", assign.dump());
    }

    @Test
    void testCustomIndent() {
        var assign = new Assign(null)
                .postinit(NodeSequence.of(new AssignName(null, "x")), new Const(null, 1L));
        assertEquals("Assign(\n\ttargets=[AssignName(name='x')],\n\tvalue=Const(value=1))",
                assign.dump(DumpOptions.DEFAULT.withIndent("\t")));
    }

    @Test
    void testMaxDepthElidesDeeperNodes() {
        var expr = new Expr(null).postinit(new Name(null, "x"));
        assertEquals("Expr(value=...)", expr.dump(DumpOptions.DEFAULT.withMaxDepth(1)));
    }

    @Test
    void testPositionsAreShownOnRequest() {
        var name = new Name(pos(3, 4), "x");
        assertEquals("""
                Name(
                   line=3,
                   column=4,
                   name='x')""", name.dump(DumpOptions.DEFAULT.withPosition()));
    }

    @Test
    void testRepeatedNodeIsPrintedOnce() {
        var name = new Name(null, "x");
        var list = new ListNode(null, Context.LOAD).postinit(NodeSequence.of(name, name));
        String dump = list.dump();
        assertTrue(dump.startsWith("List(\n   ctx=Load,\n   elts=[Name(name='x'), <Recursion on Name with id=0x"), dump);
    }

    @Test
    void testScalarsUsePythonSpelling() {
        assertEquals("Const(value=\"it's\")", new Const(null, "it's").dump());
        assertEquals("Const(value=b'ab')", new Const(null, new Const.Bytes("ab")).dump());
        assertEquals("Const(value=2.5)", new Const(null, 2.5).dump());
        assertEquals("Const(value=True)", new Const(null, Boolean.TRUE).dump());
    }

    @Test
    void testLongStringsAreWrapped() {
        var constant = new Const(null, "alpha beta gamma delta epsilon");
        assertEquals("Const(value=('alpha beta '\n    'gamma delta '\n    'epsilon'))",
                constant.dump(DumpOptions.DEFAULT.withMaxWidth(20)));
    }

    @Test
    void testDerivedStateNeedsAnAttachedNode() {
        var module = Trees.sample();
        var ret = Trees.find(module, Return.class, r -> true);
        String dump = ret.dump(DumpOptions.DEFAULT.withDerivedState());
        assertTrue(dump.contains("scope=<FunctionDef.f l.1>"), dump);
        assertTrue(dump.contains("lines=(3, 3)"), dump);

        var detached = new Expr(null).postinit(new Name(null, "x"));
        assertEquals("Expr(value=Name(name='x'))", detached.dump(DumpOptions.DEFAULT.withDerivedState()));
    }

    @Test
    void testDerivedScopeFollowsTheDialect() {
        var element = Trees.name(Trees.sample(), "i");
        String py3 = element.dump(DumpOptions.DEFAULT.withDerivedState());
        assertTrue(py3.contains("scope=<ListComp"), py3);
        String py2 = element.dump(DumpOptions.DEFAULT.withDerivedState().withDialect(PythonDialect.PY2));
        assertTrue(py2.contains("scope=<Module"), py2);
    }

    @Test
    void testInvalidOptionsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> DumpOptions.DEFAULT.withMaxDepth(-1));
        assertThrows(IllegalArgumentException.class, () -> DumpOptions.DEFAULT.withMaxWidth(0));
    }
}
