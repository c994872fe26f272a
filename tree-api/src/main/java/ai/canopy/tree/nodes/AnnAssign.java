package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** An annotated assignment. {@code simple} is true when the target is a bare name. */
public final class AnnAssign extends PyNode {

    private final boolean simple;

    public AnnAssign(@Nullable Position position, boolean simple) {
        super(position);
        this.simple = simple;
    }

    public AnnAssign postinit(PyNode target, PyNode annotation, PyNode value) {
        complete(target, annotation, value);
        return this;
    }

    public PyNode target() {
        return nodeAt(0);
    }

    public PyNode annotation() {
        return nodeAt(1);
    }

    public PyNode value() {
        return nodeAt(2);
    }

    public boolean simple() {
        return simple;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ANN_ASSIGN;
    }

    @Override
    protected PyNode bareCopy() {
        return new AnnAssign(position(), simple);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(simple);
    }
}
