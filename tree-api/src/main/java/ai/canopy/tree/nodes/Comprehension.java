package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** One {@code for target in iter if ...} clause of a comprehension. */
public final class Comprehension extends PyNode {

    private final boolean isAsync;

    public Comprehension(@Nullable Position position, boolean isAsync) {
        super(position);
        this.isAsync = isAsync;
    }

    public Comprehension postinit(PyNode target, PyNode iter, NodeSequence ifs) {
        complete(target, iter, ifs);
        return this;
    }

    public PyNode target() {
        return nodeAt(0);
    }

    public PyNode iter() {
        return nodeAt(1);
    }

    public NodeSequence ifs() {
        return sequenceAt(2);
    }

    public boolean isAsync() {
        return isAsync;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPREHENSION;
    }

    @Override
    protected PyNode bareCopy() {
        return new Comprehension(position(), isAsync);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(isAsync);
    }
}
