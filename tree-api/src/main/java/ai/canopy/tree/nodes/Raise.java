package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Raise extends PyNode {

    public Raise(@Nullable Position position) {
        super(position);
    }

    public Raise postinit(PyNode exc, PyNode cause, PyNode traceback) {
        complete(exc, cause, traceback);
        return this;
    }

    public PyNode exc() {
        return nodeAt(0);
    }

    public PyNode cause() {
        return nodeAt(1);
    }

    public PyNode traceback() {
        return nodeAt(2);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RAISE;
    }

    @Override
    protected PyNode bareCopy() {
        return new Raise(position());
    }
}
