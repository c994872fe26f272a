package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** {@code assert test, fail}. */
public final class Assert extends PyNode {

    public Assert(@Nullable Position position) {
        super(position);
    }

    public Assert postinit(PyNode test, PyNode fail) {
        complete(test, fail);
        return this;
    }

    public PyNode test() {
        return nodeAt(0);
    }

    public PyNode fail() {
        return nodeAt(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSERT;
    }

    @Override
    protected PyNode bareCopy() {
        return new Assert(position());
    }
}
