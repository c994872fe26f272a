package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Break extends PyNode {

    public Break(@Nullable Position position) {
        super(position);
        complete();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BREAK;
    }

    @Override
    protected PyNode bareCopy() {
        return new Break(position());
    }
}
