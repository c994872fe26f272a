package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** Placeholder key for a {@code **mapping} entry inside a dict display. */
public final class DictUnpack extends PyNode {

    public DictUnpack(@Nullable Position position) {
        super(position);
        complete();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DICT_UNPACK;
    }

    @Override
    protected PyNode bareCopy() {
        return new DictUnpack(position());
    }
}
