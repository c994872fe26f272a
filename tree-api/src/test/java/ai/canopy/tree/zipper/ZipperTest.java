package ai.canopy.tree.zipper;

import static ai.canopy.tree.testutil.Trees.pos;
import static org.junit.jupiter.api.Assertions.*;

import ai.canopy.tree.Empty;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.nodes.Assign;
import ai.canopy.tree.nodes.FunctionDef;
import ai.canopy.tree.nodes.Module;
import ai.canopy.tree.nodes.Name;
import ai.canopy.tree.nodes.Return;
import ai.canopy.tree.resolve.BlockRange;
import ai.canopy.tree.resolve.ScopeResolver;
import ai.canopy.tree.testutil.Trees;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ZipperTest {

    private Module module;
    private Zipper root;
    private Zipper function;

    @BeforeEach
    void setUp() {
        module = Trees.sample();
        root = new Zipper(module);
        function = root.down().orElseThrow().down().orElseThrow();
    }

    /** Cursor at the name read by {@code return a}. */
    private Zipper returnValue() {
        var body = function.down().orElseThrow().right().orElseThrow().right().orElseThrow();
        return body.down().orElseThrow().down().orElseThrow();
    }

    private static List<String> kinds(DescendantTraversal walk) {
        return walk.stream()
                .filter(location -> !location.isSequence() && location.focus().isPresent())
                .map(location -> location.node().kind().displayName())
                .collect(Collectors.toList());
    }

    @Test
    void testMovesWithoutDestinationAreEmpty() {
        assertTrue(root.up().isEmpty());
        assertTrue(root.left().isEmpty());
        assertTrue(root.right().isEmpty());
        assertTrue(function.left().isEmpty());
        assertTrue(function.leftmost().isEmpty());
        assertTrue(returnValue().down().isEmpty());
    }

    @Test
    void testNavigationVisitsTheOriginalObjects() {
        var body = root.down().orElseThrow();
        assertTrue(body.isSequence());
        assertSame(module.body(), body.focus());
        assertEquals(1, body.depth());

        assertSame(module.body().get(0), function.focus());
        assertEquals(2, function.depth());
        var assign = function.right().orElseThrow();
        assertSame(module.body().get(1), assign.focus());
        assertTrue(assign.right().isEmpty());
        assertSame(function.focus(), assign.left().orElseThrow().focus());

        assertSame(module.body(), function.up().orElseThrow().focus());
        assertSame(module, function.up().orElseThrow().up().orElseThrow().focus());
        assertSame(module, returnValue().root().focus());
    }

    @Test
    void testLeftmostAndRightmost() {
        var decorators = function.down().orElseThrow();
        var returns = decorators.rightmost().orElseThrow();
        assertSame(Empty.INSTANCE, returns.focus());
        assertSame(decorators.focus(), returns.leftmost().orElseThrow().focus());
        var body = returns.left().orElseThrow();
        assertSame(((FunctionDef) function.node()).body(), body.focus());
        assertSame(((FunctionDef) function.node()).args(), body.left().orElseThrow().focus());
    }

    @Test
    void testNodeRejectsSequenceFocus() {
        var body = root.down().orElseThrow();
        assertThrows(IllegalStateException.class, body::node);
    }

    @Test
    void testReplaceRebuildsOnlyTheEditedPath() {
        var edited = returnValue().replace(new Name(pos(3, 11), "z"));
        assertTrue(edited.isEdited());
        var newRoot = edited.root();
        assertFalse(newRoot.isEdited());

        var newModule = (Module) newRoot.node();
        assertNotSame(module, newModule);
        var newReturn = Trees.find(newModule, Return.class, r -> true);
        assertEquals("z", ((Name) newReturn.value()).name());
        var oldReturn = Trees.find(module, Return.class, r -> true);
        assertEquals("a", ((Name) oldReturn.value()).name(), "the original tree must stay untouched");

        PyNode untouched = newModule.body().get(1);
        assertSame(module.body().get(1), untouched, "siblings off the edited path are shared");
        assertSame(module, untouched.parent(), "a shared child keeps its first parent");
        assertSame(newModule.body().get(0), newReturn.parent(), "the rebuilt return hangs off the rebuilt function");
        assertSame(newModule, newReturn.parent().parent());
    }

    @Test
    void testUnchangedPathReturnsSameRoot() {
        assertSame(module, returnValue().root().node());
        var rebuilt = returnValue().replace(returnValue().focus()).root().node();
        assertNotSame(module, rebuilt, "a replaced focus always rebuilds its ancestors");
        assertEquals(module, rebuilt);
    }

    @Test
    void testEditReplacesOneField() {
        var annotated = function.edit("returns", new Name(pos(2, 15), "int")).root();
        var newFunction = (FunctionDef) ((Module) annotated.node()).body().get(0);
        assertEquals("int", ((Name) newFunction.returns()).name());
        assertSame(Empty.INSTANCE, ((FunctionDef) module.body().get(0)).returns());
        assertThrows(IllegalArgumentException.class, () -> function.edit("nonsense", Empty.INSTANCE));
    }

    @Test
    void testCommonAncestor() {
        var parameterDefault = function.down().orElseThrow().right().orElseThrow()
                .down().orElseThrow().down().orElseThrow().down().orElseThrow();
        assertEquals("b", ((Name) parameterDefault.node()).name());
        var common = returnValue().commonAncestor(parameterDefault).orElseThrow();
        assertSame(function.focus(), common.focus());

        var assign = function.right().orElseThrow();
        var siblings = function.commonAncestor(assign).orElseThrow();
        assertTrue(siblings.isSequence());
        assertSame(module.body(), siblings.focus());

        var returns = function.down().orElseThrow().rightmost().orElseThrow();
        var absent = returns.commonAncestor(returns).orElseThrow();
        assertSame(function.focus(), absent.focus(), "absent children are never shared");

        assertTrue(new Zipper(new Name(null, "q")).commonAncestor(root).isEmpty());
    }

    @Test
    void testChildrenAndParent() {
        assertEquals(4, function.children().count());
        var nodes = function.nodeChildren().map(child -> child.node().kind().displayName()).collect(Collectors.toList());
        assertEquals(List.of("Decorators", "Arguments", "Return"), nodes);

        var ret = returnValue().parent().orElseThrow();
        assertTrue(ret.node() instanceof Return);
        assertSame(function.focus(), ret.parent().orElseThrow().focus(), "parent skips the body sequence");
        assertTrue(root.parent().isEmpty());
    }

    @Test
    void testPreorderDescendants() {
        assertEquals(
                List.of("FunctionDef", "Decorators", "Name", "Arguments", "Parameter", "Name", "Return", "Name"),
                kinds(function.preorderDescendants()));
    }

    @Test
    void testPostorderDescendants() {
        assertEquals(
                List.of("Name", "Decorators", "Name", "Parameter", "Arguments", "Name", "Return", "FunctionDef"),
                kinds(function.postorderDescendants()));
    }

    @Test
    void testSkippedSubtreesAreNotEntered() {
        var walked = kinds(root.preorderDescendants(location -> location.focus() instanceof Assign));
        assertFalse(walked.contains("Assign"));
        assertFalse(walked.contains("ListComp"));
        assertTrue(walked.contains("FunctionDef"));
    }

    @Test
    void testFindDescendantsOfType() {
        var names = root.findDescendantsOfType(Name.class, Set.of())
                .map(location -> ((Name) location.node()).name())
                .collect(Collectors.toList());
        assertEquals(List.of("deco", "b", "a", "y", "i"), names);

        var outside = root.findDescendantsOfType(Name.class, Set.of(FunctionDef.class))
                .map(location -> ((Name) location.node()).name())
                .collect(Collectors.toList());
        assertEquals(List.of("y", "i"), outside);
    }

    @Test
    void testSubstituteCarriesEditsThroughTheWalk() {
        var walk = root.preorderDescendants();
        while (walk.hasNext()) {
            var location = walk.next();
            if (location.focus() instanceof Name name && name.name().equals("a")) {
                walk.substitute(location.replace(new Name(name.position(), "renamed")));
            }
        }
        var result = (Module) walk.result().node();
        assertEquals("renamed", ((Name) Trees.find(result, Return.class, r -> true).value()).name());
        assertEquals("a", ((Name) Trees.find(module, Return.class, r -> true).value()).name());
        assertThrows(IllegalStateException.class, () -> walk.substitute(root));
    }

    @Test
    void testResultWithoutEditsIsTheStart() {
        var walk = function.preorderDescendants();
        walk.stream().forEach(location -> {});
        assertSame(function.focus(), walk.result().focus());
    }

    @Test
    void testScopeQueriesThroughTheCursor() {
        var resolver = ScopeResolver.PY3;
        assertSame(function.focus(), returnValue().scope(resolver).focus());
        assertSame(function.focus(), returnValue().frame(resolver).focus());
        assertTrue(returnValue().statement(resolver).node() instanceof Return);
        assertSame(module, function.up().orElseThrow().scope(resolver).focus(), "a sequence resolves via its owner");
        assertEquals(new BlockRange(2, 3), function.blockRange(2));
    }

    @Test
    void testSequencesKeepTheirIdentityOnNavigation() {
        var body = root.down().orElseThrow();
        assertTrue(body.focus() instanceof NodeSequence);
        assertSame(body.focus(), body.down().orElseThrow().up().orElseThrow().focus());
    }
}
