package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public class With extends PyNode {

    public With(@Nullable Position position) {
        super(position);
    }

    public With postinit(NodeSequence items, NodeSequence body) {
        complete(items, body);
        return this;
    }

    public List<WithItem> items() {
        return elementsAt(0, WithItem.class);
    }

    public NodeSequence body() {
        return sequenceAt(1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WITH;
    }

    @Override
    protected PyNode bareCopy() {
        return new With(position());
    }
}
