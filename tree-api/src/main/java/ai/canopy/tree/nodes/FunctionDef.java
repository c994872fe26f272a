package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A {@code def} statement. {@code decorators} is a {@link Decorators} node or {@link ai.canopy.tree.Empty};
 * {@code returns} is the return annotation or {@code Empty}.
 */
public class FunctionDef extends PyNode implements FunctionLike {

    private final String name;
    private final @Nullable String doc;

    public FunctionDef(@Nullable Position position, String name, @Nullable String doc) {
        super(position);
        this.name = name;
        this.doc = doc;
    }

    public FunctionDef postinit(PyNode decorators, Arguments args, NodeSequence body, PyNode returns) {
        complete(decorators, args, body, returns);
        return this;
    }

    public PyNode decorators() {
        return nodeAt(0);
    }

    @Override
    public Arguments args() {
        return nodeAt(1, Arguments.class);
    }

    public NodeSequence body() {
        return sequenceAt(2);
    }

    public PyNode returns() {
        return nodeAt(3);
    }

    @Override
    public String name() {
        return name;
    }

    public @Nullable String doc() {
        return doc;
    }

    /** True when the body yields, not counting nested functions and lambdas. */
    public boolean isGenerator() {
        var pending = new ArrayDeque<PyNode>(body());
        while (!pending.isEmpty()) {
            PyNode node = pending.pop();
            if (node instanceof Yield) {
                return true;
            }
            if (node instanceof FunctionDef || node instanceof Lambda) {
                continue;
            }
            pending.addAll(node.children());
        }
        return false;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_DEF;
    }

    @Override
    protected PyNode bareCopy() {
        return new FunctionDef(position(), name, doc);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(name, doc);
    }

    @Override
    protected String label() {
        return name;
    }
}
