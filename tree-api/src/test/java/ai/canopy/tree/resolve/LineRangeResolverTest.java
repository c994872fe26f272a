package ai.canopy.tree.resolve;

import static ai.canopy.tree.testutil.Trees.pos;
import static org.junit.jupiter.api.Assertions.*;

import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.nodes.Expr;
import ai.canopy.tree.nodes.FunctionDef;
import ai.canopy.tree.nodes.If;
import ai.canopy.tree.nodes.Name;
import ai.canopy.tree.nodes.Pass;
import ai.canopy.tree.testutil.Trees;
import org.junit.jupiter.api.Test;

class LineRangeResolverTest {

    @Test
    void testFunctionStartsAfterItsDecorators() {
        var module = Trees.sample();
        var function = (FunctionDef) module.body().get(0);
        assertEquals(0, LineRangeResolver.firstLine(module));
        assertEquals(2, LineRangeResolver.firstLine(function));
        assertEquals(3, LineRangeResolver.lastLine(function));
        assertEquals(4, LineRangeResolver.lastLine(module));
        assertEquals(2, LineRangeResolver.blockStartLastLine(function));
        assertEquals(new BlockRange(0, 4), LineRangeResolver.blockRange(module, 3));
    }

    @Test
    void testUnpositionedNodeUsesItsFirstChild() {
        var expr = new Expr(null).postinit(new Name(pos(7, 2), "q"));
        assertEquals(7, LineRangeResolver.firstLine(expr));
    }

    @Test
    void testIfBranches() {
        var node = new If(pos(1, 0)).postinit(
                new Name(pos(1, 3), "c"),
                NodeSequence.of(new Pass(pos(2, 4)), new Pass(pos(3, 4))),
                NodeSequence.of(new Pass(pos(5, 4))));
        assertEquals(1, LineRangeResolver.blockStartLastLine(node));
        assertEquals(new BlockRange(1, 3), LineRangeResolver.blockRange(node, 1));
        assertEquals(new BlockRange(2, 2), LineRangeResolver.blockRange(node, 2));
        assertEquals(new BlockRange(3, 3), LineRangeResolver.blockRange(node, 3));
        assertEquals(new BlockRange(4, 4), LineRangeResolver.blockRange(node, 4));
        assertEquals(new BlockRange(5, 5), LineRangeResolver.blockRange(node, 5));
    }

    @Test
    void testBlockRangeFormatting() {
        var range = new BlockRange(2, 5);
        assertEquals("(2, 5)", range.toString());
        assertTrue(range.contains(2));
        assertFalse(range.contains(6));
        assertEquals(BlockRange.line(3), new BlockRange(3, 3));
    }
}
