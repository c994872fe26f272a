package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** The {@code ...} literal. */
public final class Ellipsis extends PyNode {

    public Ellipsis(@Nullable Position position) {
        super(position);
        complete();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ELLIPSIS;
    }

    @Override
    protected PyNode bareCopy() {
        return new Ellipsis(position());
    }
}
