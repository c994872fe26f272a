package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** {@code yield from value}. */
public final class YieldFrom extends Yield {

    public YieldFrom(@Nullable Position position) {
        super(position);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.YIELD_FROM;
    }

    @Override
    protected PyNode bareCopy() {
        return new YieldFrom(position());
    }
}
