package ai.canopy.tree.testutil;

import ai.canopy.tree.Empty;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import ai.canopy.tree.nodes.Arguments;
import ai.canopy.tree.nodes.Assign;
import ai.canopy.tree.nodes.AssignName;
import ai.canopy.tree.nodes.Comprehension;
import ai.canopy.tree.nodes.Decorators;
import ai.canopy.tree.nodes.FunctionDef;
import ai.canopy.tree.nodes.ListComp;
import ai.canopy.tree.nodes.Module;
import ai.canopy.tree.nodes.Name;
import ai.canopy.tree.nodes.Parameter;
import ai.canopy.tree.nodes.Return;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Hand-built trees for tests that should not depend on the parser. {@link #sample()} models
 *
 * <pre>
 * &#64;deco
 * def f(a=b):
 *     return a
 * x = [i for i in y]
 * </pre>
 */
public final class Trees {

    public static final String SAMPLE_SOURCE = "@deco\ndef f(a=b):\n    return a\nx = [i for i in y]\n";

    private Trees() {}

    public static Position pos(int line, int column) {
        return new Position(line, column);
    }

    public static Module sample() {
        var decorators = new Decorators(pos(1, 1)).postinit(NodeSequence.of(new Name(pos(1, 1), "deco")));
        var defaultValue = new Name(pos(2, 8), "b");
        var parameter = new Parameter(pos(2, 6), "a").postinit(defaultValue, Empty.INSTANCE);
        var args = new Arguments(pos(2, 5)).postinit(
                NodeSequence.of(parameter), Empty.INSTANCE, Empty.INSTANCE, NodeSequence.empty(), NodeSequence.empty());
        var ret = new Return(pos(3, 4)).postinit(new Name(pos(3, 11), "a"));
        var function = new FunctionDef(pos(1, 0), "f", null)
                .postinit(decorators, args, NodeSequence.of(ret), Empty.INSTANCE);

        var generator = new Comprehension(pos(4, 7), false)
                .postinit(new AssignName(pos(4, 11), "i"), new Name(pos(4, 16), "y"), NodeSequence.empty());
        var listComp = new ListComp(pos(4, 4)).postinit(NodeSequence.of(generator), new Name(pos(4, 5), "i"));
        var assign = new Assign(pos(4, 0)).postinit(NodeSequence.of(new AssignName(pos(4, 0), "x")), listComp);

        return new Module("pkg.mod", null, "utf-8", false, SAMPLE_SOURCE, null)
                .postinit(NodeSequence.of(function, assign));
    }

    /** The first node in prefix order that is an instance of {@code type} and matches {@code test}. */
    public static <T extends PyNode> T find(PyNode root, Class<T> type, Predicate<T> test) {
        return findOptional(root, type, test)
                .orElseThrow(() -> new AssertionError("No matching " + type.getSimpleName() + " under " + root));
    }

    private static <T extends PyNode> Optional<T> findOptional(PyNode root, Class<T> type, Predicate<T> test) {
        if (type.isInstance(root) && test.test(type.cast(root))) {
            return Optional.of(type.cast(root));
        }
        for (PyNode child : root.children()) {
            var found = findOptional(child, type, test);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /** The first {@link Name} node reading {@code id}. */
    public static Name name(PyNode root, String id) {
        return find(root, Name.class, name -> name.name().equals(id));
    }
}
