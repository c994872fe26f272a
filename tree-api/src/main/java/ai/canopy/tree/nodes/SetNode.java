package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** A {@code {a, b}} set display. */
public final class SetNode extends BaseContainer {

    public SetNode(@Nullable Position position) {
        super(position);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SET;
    }

    @Override
    protected PyNode bareCopy() {
        return new SetNode(position());
    }
}
