package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Continue extends PyNode {

    public Continue(@Nullable Position position) {
        super(position);
        complete();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONTINUE;
    }

    @Override
    protected PyNode bareCopy() {
        return new Continue(position());
    }
}
