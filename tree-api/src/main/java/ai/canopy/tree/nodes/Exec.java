package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** Python 2 {@code exec} statement. */
public final class Exec extends PyNode {

    public Exec(@Nullable Position position) {
        super(position);
    }

    public Exec postinit(PyNode expr, PyNode globals, PyNode locals) {
        complete(expr, globals, locals);
        return this;
    }

    public PyNode expr() {
        return nodeAt(0);
    }

    public PyNode globals() {
        return nodeAt(1);
    }

    public PyNode locals() {
        return nodeAt(2);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXEC;
    }

    @Override
    protected PyNode bareCopy() {
        return new Exec(position());
    }
}
