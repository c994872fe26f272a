package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** An expression evaluated for its side effects. */
public final class Expr extends PyNode {

    public Expr(@Nullable Position position) {
        super(position);
    }

    public Expr postinit(PyNode value) {
        complete(value);
        return this;
    }

    public PyNode value() {
        return nodeAt(0);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPR;
    }

    @Override
    protected PyNode bareCopy() {
        return new Expr(position());
    }
}
