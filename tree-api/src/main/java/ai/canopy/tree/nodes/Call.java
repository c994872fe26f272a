package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class Call extends PyNode {

    public Call(@Nullable Position position) {
        super(position);
    }

    public Call postinit(PyNode func, NodeSequence args, NodeSequence keywords) {
        complete(func, args, keywords);
        return this;
    }

    public PyNode func() {
        return nodeAt(0);
    }

    public NodeSequence args() {
        return sequenceAt(1);
    }

    public List<Keyword> keywords() {
        return elementsAt(2, Keyword.class);
    }

    /** The {@code *iterable} positional arguments. */
    public List<Starred> starArgs() {
        return args().stream().filter(Starred.class::isInstance).map(Starred.class::cast).toList();
    }

    /** The {@code **mapping} keyword arguments. */
    public List<Keyword> kwArgs() {
        return keywords().stream().filter(keyword -> keyword.arg() == null).toList();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL;
    }

    @Override
    protected PyNode bareCopy() {
        return new Call(position());
    }
}
