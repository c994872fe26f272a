package ai.canopy.tree.nodes;

import static ai.canopy.tree.testutil.Trees.pos;
import static org.junit.jupiter.api.Assertions.*;

import ai.canopy.exception.NoDefaultException;
import ai.canopy.tree.Empty;
import ai.canopy.tree.NodeSequence;
import java.util.List;
import org.junit.jupiter.api.Test;

class ArgumentsTest {

    private static Parameter parameter(String name) {
        return new Parameter(null, name).postinit(Empty.INSTANCE, Empty.INSTANCE);
    }

    private static Parameter parameter(String name, long defaultValue) {
        return new Parameter(null, name).postinit(new Const(null, defaultValue), Empty.INSTANCE);
    }

    /** {@code p, /, a, b=1, *rest, k, m=2, **kw} */
    private static Arguments full() {
        return new Arguments(pos(1, 6)).postinit(
                NodeSequence.of(parameter("a"), parameter("b", 1)),
                parameter("rest"),
                parameter("kw"),
                NodeSequence.of(parameter("k"), parameter("m", 2)),
                NodeSequence.of(parameter("p")));
    }

    @Test
    void testFormatArgs() {
        assertEquals("p, /, a, b=..., *rest, k, m=..., **kw", full().formatArgs());

        var bareStar = new Arguments(null).postinit(
                NodeSequence.of(parameter("a")), Empty.INSTANCE, Empty.INSTANCE,
                NodeSequence.of(parameter("k")), NodeSequence.empty());
        assertEquals("a, *, k", bareStar.formatArgs());
    }

    @Test
    void testDefaultsAreAlignedWithParameters() {
        var args = full();
        assertEquals(List.of("a", "b", "p"),
                args.positionalAndKeyword().stream().map(Parameter::name).toList());
        assertEquals(List.of(Empty.INSTANCE, new Const(null, 1L), Empty.INSTANCE), args.defaults());
        assertEquals(List.of(Empty.INSTANCE, new Const(null, 2L)), args.keywordOnlyDefaults());
    }

    @Test
    void testDefaultValue() throws NoDefaultException {
        var args = full();
        assertEquals(new Const(null, 1L), args.defaultValue("b"));
        assertEquals(new Const(null, 2L), args.defaultValue("m"));
        var error = assertThrows(NoDefaultException.class, () -> args.defaultValue("a"));
        assertEquals("a", error.name());
        assertEquals("<unattached> has no default for 'a'.", error.getMessage());
        assertThrows(NoDefaultException.class, () -> args.defaultValue("missing"));
    }

    @Test
    void testIsArgument() {
        var args = full();
        assertTrue(args.isArgument("p"));
        assertTrue(args.isArgument("m"));
        assertTrue(args.isArgument("rest"), "the variable-positional name counts");
        assertTrue(args.isArgument("kw"), "the variable-keyword name counts");
        assertFalse(args.isArgument("x"));
    }

    @Test
    void testVariadicAccessors() {
        var args = full();
        assertEquals("rest", args.varargParameter().orElseThrow().name());
        assertEquals("kw", args.kwargParameter().orElseThrow().name());
        var none = new Arguments(null).postinit(
                NodeSequence.empty(), Empty.INSTANCE, Empty.INSTANCE, NodeSequence.empty(), NodeSequence.empty());
        assertTrue(none.varargParameter().isEmpty());
        assertEquals("", none.formatArgs());
    }
}
