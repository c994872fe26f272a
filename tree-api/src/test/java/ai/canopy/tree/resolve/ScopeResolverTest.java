package ai.canopy.tree.resolve;

import static ai.canopy.tree.testutil.Trees.pos;
import static org.junit.jupiter.api.Assertions.*;

import ai.canopy.exception.NotSupportedException;
import ai.canopy.tree.Empty;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.PythonDialect;
import ai.canopy.tree.nodes.Arguments;
import ai.canopy.tree.nodes.Assign;
import ai.canopy.tree.nodes.AssignName;
import ai.canopy.tree.nodes.ClassDef;
import ai.canopy.tree.nodes.Comprehension;
import ai.canopy.tree.nodes.Decorators;
import ai.canopy.tree.nodes.Expr;
import ai.canopy.tree.nodes.FunctionDef;
import ai.canopy.tree.nodes.Lambda;
import ai.canopy.tree.nodes.ListComp;
import ai.canopy.tree.nodes.Module;
import ai.canopy.tree.nodes.Name;
import ai.canopy.tree.nodes.Parameter;
import ai.canopy.tree.nodes.Pass;
import ai.canopy.tree.nodes.Return;
import ai.canopy.tree.testutil.Trees;
import ai.canopy.tree.zipper.Zipper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScopeResolverTest {

    private Module module;
    private FunctionDef function;
    private ListComp listComp;

    @BeforeEach
    void setUp() {
        module = Trees.sample();
        function = (FunctionDef) module.body().get(0);
        listComp = Trees.find(module, ListComp.class, c -> true);
    }

    private static Arguments noArguments() {
        return new Arguments(null).postinit(
                NodeSequence.empty(), Empty.INSTANCE, Empty.INSTANCE, NodeSequence.empty(), NodeSequence.empty());
    }

    @Test
    void testParameterDefaultResolvesOutsideTheFunction() {
        assertSame(module, ScopeResolver.PY3.scope(Trees.name(module, "b")));
        assertSame(module, ScopeResolver.PY2.scope(Trees.name(module, "b")));
    }

    @Test
    void testKeywordOnlyDefaultResolvesOutsideTheMethod() {
        var kwDefault = new Name(pos(2, 20), "v");
        var kwOnly = new Parameter(pos(2, 16), "k").postinit(kwDefault, Empty.INSTANCE);
        var self = new Parameter(pos(2, 10), "self").postinit(Empty.INSTANCE, Empty.INSTANCE);
        var args = new Arguments(pos(2, 10)).postinit(
                NodeSequence.of(self), Empty.INSTANCE, Empty.INSTANCE, NodeSequence.of(kwOnly), NodeSequence.empty());
        var method = new FunctionDef(pos(2, 4), "m", null)
                .postinit(Empty.INSTANCE, args, NodeSequence.of(new Pass(pos(2, 24))), Empty.INSTANCE);
        var classDef = new ClassDef(pos(1, 0), "C", null)
                .postinit(Empty.INSTANCE, NodeSequence.empty(), NodeSequence.of(method), NodeSequence.empty());
        var root = new Module("m", null, "utf-8", false, "class C:\n    def m(self, *, k=v): pass\n", null)
                .postinit(NodeSequence.of(classDef));

        assertSame(classDef, ScopeResolver.PY3.scope(kwDefault), "keyword-only defaults are evaluated in the class body");
        assertSame(method, ScopeResolver.PY3.scope(kwOnly), "the parameter itself belongs to the method");
        assertSame(classDef, ScopeResolver.PY3.scope(new Zipper(root)
                .preorderDescendants().stream()
                .filter(z -> z.focus() == kwDefault)
                .findFirst()
                .orElseThrow()));
    }

    @Test
    void testBodyResolvesToTheFunction() {
        assertSame(function, ScopeResolver.PY3.scope(Trees.name(module, "a")));
        assertSame(function, ScopeResolver.PY3.scope(function), "a scope node is its own scope");
    }

    @Test
    void testDecoratorsResolveOutsideTheFunction() {
        assertSame(module, ScopeResolver.PY3.scope(Trees.name(module, "deco")));
        assertSame(module, ScopeResolver.PY3.scope(function.decorators()));
    }

    @Test
    void testListComprehensionScopeDependsOnDialect() {
        var elt = listComp.elt();
        var target = Trees.find(module, AssignName.class, n -> n.name().equals("i"));
        assertSame(listComp, ScopeResolver.PY3.scope(elt));
        assertSame(listComp, ScopeResolver.PY3.scope(target));
        assertSame(module, ScopeResolver.PY2.scope(elt));
        assertSame(module, ScopeResolver.PY2.scope(target));
        assertTrue(ScopeResolver.PY3.introducesScope(listComp));
        assertFalse(ScopeResolver.PY2.introducesScope(listComp));
    }

    @Test
    void testFirstIterableResolvesOutsideTheComprehension() {
        assertSame(module, ScopeResolver.PY3.scope(Trees.name(module, "y")));
    }

    @Test
    void testReturnAnnotationDependsOnDialect() {
        var returns = new Name(pos(1, 12), "int");
        var annotated = new FunctionDef(pos(1, 0), "g", null)
                .postinit(Empty.INSTANCE, noArguments(), NodeSequence.of(new Pass(pos(1, 17))), returns);
        var owner = new Module("m", null, "utf-8", false, "def g() -> int: pass\n", null)
                .postinit(NodeSequence.of(annotated));
        assertSame(owner, ScopeResolver.PY3.scope(returns));
        assertSame(annotated, ScopeResolver.PY2.scope(returns));
    }

    @Test
    void testParameterAnnotationResolvesOutsideTheFunction() {
        var annotation = new Name(pos(1, 9), "int");
        var parameter = new Parameter(pos(1, 6), "p").postinit(Empty.INSTANCE, annotation);
        var args = new Arguments(pos(1, 6)).postinit(
                NodeSequence.of(parameter), Empty.INSTANCE, Empty.INSTANCE, NodeSequence.empty(), NodeSequence.empty());
        var g = new FunctionDef(pos(1, 0), "g", null)
                .postinit(Empty.INSTANCE, args, NodeSequence.of(new Pass(pos(1, 15))), Empty.INSTANCE);
        var owner = new Module("m", null, "utf-8", false, "def g(p: int): pass\n", null)
                .postinit(NodeSequence.of(g));
        assertSame(owner, ScopeResolver.PY3.scope(annotation));
        assertSame(g, ScopeResolver.PY3.scope(parameter));
    }

    @Test
    void testFrameAndStatement() {
        var resolver = ScopeResolver.PY3;
        assertSame(function, resolver.frame(Trees.name(module, "a")));
        assertSame(module, resolver.frame(Trees.name(module, "y")), "comprehensions are not frames");
        assertSame(module, resolver.frame(module));

        assertTrue(resolver.statement(Trees.name(module, "a")) instanceof Return);
        assertSame(function, resolver.statement(Trees.name(module, "deco")));
        assertSame(function, resolver.statement(Trees.name(module, "b")));
        assertSame(module.body().get(1), resolver.statement(listComp));
        assertSame(module, resolver.statement(module));
    }

    @Test
    void testAssignType() {
        var resolver = ScopeResolver.PY3;
        var x = Trees.find(module, AssignName.class, n -> n.name().equals("x"));
        assertTrue(resolver.assignType(x) instanceof Assign);
        var i = Trees.find(module, AssignName.class, n -> n.name().equals("i"));
        assertTrue(resolver.assignType(i) instanceof Comprehension);
        PyNode parameter = function.args().args().get(0);
        assertSame(function.args(), resolver.assignType(parameter));
    }

    @Test
    void testQualifiedName() throws Exception {
        var resolver = ScopeResolver.PY3;
        assertEquals("pkg.mod", resolver.qualifiedName(module));
        assertEquals("pkg.mod.f", resolver.qualifiedName(function));
        var error = assertThrows(NotSupportedException.class, () -> resolver.qualifiedName(listComp));
        assertTrue(error.getMessage().contains("ListComp"), error.getMessage());

        var lambda = new Lambda(pos(1, 4)).postinit(noArguments(), new Name(pos(1, 12), "z"));
        var owner = new Module("m", null, "utf-8", false, "f = lambda: z\n", null)
                .postinit(NodeSequence.of(new Expr(pos(1, 0)).postinit(lambda)));
        assertEquals("m.<lambda>", resolver.qualifiedName(lambda));
        assertEquals("m", resolver.qualifiedName(owner));
    }

    @Test
    void testDetachedNodeHasNoScope() {
        assertThrows(IllegalStateException.class, () -> ScopeResolver.PY3.scope(new Name(null, "q")));
        assertThrows(IllegalStateException.class,
                () -> ScopeResolver.PY3.scope(new Decorators(null).postinit(NodeSequence.empty())));
    }

    @Test
    void testZipperLocationsResolveLikeNodes() {
        var root = new Zipper(module);
        var functionCursor = root.down().orElseThrow().down().orElseThrow();
        var defaultCursor = functionCursor.down().orElseThrow().right().orElseThrow()
                .down().orElseThrow().down().orElseThrow().down().orElseThrow();
        assertSame(module, ScopeResolver.PY3.scope(defaultCursor).focus());
        assertSame(function, ScopeResolver.PY3.frame(functionCursor).focus());
        assertTrue(ScopeResolver.PY3.assignType(defaultCursor.parent().orElseThrow()).node() instanceof Arguments);
        assertEquals("pkg.mod.f", assertDoesNotThrow(() -> ScopeResolver.PY3.qualifiedName(functionCursor)));
    }

    @Test
    void testForDialect() {
        assertSame(ScopeResolver.PY2, ScopeResolver.forDialect(PythonDialect.PY2));
        assertSame(ScopeResolver.PY3, ScopeResolver.forDialect(PythonDialect.PY3));
    }
}
