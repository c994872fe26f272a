package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** One {@code expr as target} item of a {@code with} statement. */
public final class WithItem extends PyNode {

    public WithItem(@Nullable Position position) {
        super(position);
    }

    public WithItem postinit(PyNode contextExpr, PyNode optionalVars) {
        complete(contextExpr, optionalVars);
        return this;
    }

    public PyNode contextExpr() {
        return nodeAt(0);
    }

    public PyNode optionalVars() {
        return nodeAt(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WITH_ITEM;
    }

    @Override
    protected PyNode bareCopy() {
        return new WithItem(position());
    }
}
