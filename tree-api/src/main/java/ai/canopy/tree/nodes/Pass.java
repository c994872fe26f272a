package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Pass extends PyNode {

    public Pass(@Nullable Position position) {
        super(position);
        complete();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PASS;
    }

    @Override
    protected PyNode bareCopy() {
        return new Pass(position());
    }
}
