package ai.canopy.builder;

import static org.junit.jupiter.api.Assertions.*;

import ai.canopy.exception.AstBuildingException;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.nodes.For;
import ai.canopy.tree.nodes.FunctionDef;
import ai.canopy.tree.nodes.If;
import ai.canopy.tree.nodes.Module;
import ai.canopy.tree.nodes.TryExcept;
import ai.canopy.tree.nodes.TryFinally;
import ai.canopy.tree.resolve.BlockRange;
import ai.canopy.tree.resolve.LineRangeResolver;
import org.junit.jupiter.api.Test;

class BlockRangeTest {

    private final AstBuilder builder = new AstBuilder(BuilderSettings.DEFAULTS);

    private Module build(String code) throws AstBuildingException {
        return builder.buildFromText(code, "ranges", null);
    }

    private static void assertRange(int first, int last, PyNode node, int line) {
        assertEquals(new BlockRange(first, last), LineRangeResolver.blockRange(node, line), "line " + line);
    }

    @Test
    void testIfStatements() throws AstBuildingException {
        var module = build("""

                if 0:
                    print()

                if True:
                    print()
                else:
                    pass

                if "":
                    print()
                elif []:
                    raise

                if 1:
                    print()
                elif True:
                    print()
                elif func():
                    pass
                else:
                    raise
                """);
        assertEquals(4, module.body().size());
        assertRange(0, 22, module, 1);
        assertRange(0, 22, module, 10);

        var ifElse = (If) module.body().get(1);
        assertRange(5, 6, ifElse, 5);
        assertRange(6, 6, ifElse, 6);
        assertRange(7, 7, ifElse, 7);
        assertRange(8, 8, ifElse, 8);

        var chain = (If) module.body().get(3);
        assertInstanceOf(If.class, chain.orelse().get(0));
        assertInstanceOf(If.class, ((If) chain.orelse().get(0)).orelse().get(0));
    }

    @Test
    void testTryExcept() throws AstBuildingException {
        var module = build("""

                try:
                    print ('pouet')
                except IOError:
                    pass
                except UnicodeError:
                    print()
                else:
                    print()
                """);
        var node = (TryExcept) module.body().get(0);
        assertRange(1, 8, node, 1);
        assertRange(2, 2, node, 2);
        assertRange(3, 8, node, 3);
        for (int line = 4; line <= 8; line++) {
            assertRange(line, line, node, line);
        }
    }

    @Test
    void testTryFinally() throws AstBuildingException {
        var module = build("""

                try:
                    print ('pouet')
                finally:
                    print ('pouet')
                """);
        var node = (TryFinally) module.body().get(0);
        assertRange(1, 4, node, 1);
        assertRange(2, 2, node, 2);
        assertRange(3, 4, node, 3);
        assertRange(4, 4, node, 4);
    }

    @Test
    void testTryExceptFinallyDelegatesToTheInnerTry() throws AstBuildingException {
        var module = build("""

                try:
                    print('pouet')
                except Exception:
                    print ('oops')
                finally:
                    print ('pouet')
                """);
        var node = (TryFinally) module.body().get(0);
        assertRange(1, 6, node, 1);
        assertRange(2, 2, node, 2);
        assertRange(3, 4, node, 3);
        assertRange(4, 4, node, 4);
        assertRange(5, 5, node, 5);
        assertRange(6, 6, node, 6);
    }

    @Test
    void testLoopsAndDefinitions() throws AstBuildingException {
        var module = build("""
                for x in y:
                    a = 1
                    b = 2
                else:
                    c = 3

                @decorator
                def f(p,
                      q):
                    return p
                """);
        var loop = (For) module.body().get(0);
        assertRange(1, 1, loop, 1);
        assertRange(2, 4, loop, 2);
        assertRange(4, 4, loop, 4);
        assertRange(5, 5, loop, 5);

        var function = (FunctionDef) module.body().get(1);
        assertEquals(8, LineRangeResolver.firstLine(function), "decorators are not part of the block");
        assertEquals(9, LineRangeResolver.blockStartLastLine(function));
        assertRange(8, 10, function, 10);
    }
}
