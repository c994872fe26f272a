package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class DictComp extends BaseComprehension {

    public DictComp(@Nullable Position position) {
        super(position);
    }

    public DictComp postinit(NodeSequence generators, PyNode key, PyNode value) {
        complete(generators, key, value);
        return this;
    }

    public PyNode key() {
        return nodeAt(1);
    }

    public PyNode value() {
        return nodeAt(2);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DICT_COMP;
    }

    @Override
    protected PyNode bareCopy() {
        return new DictComp(position());
    }
}
