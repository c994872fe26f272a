package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

public final class Lambda extends PyNode implements FunctionLike {

    public static final String NAME = "<lambda>";

    public Lambda(@Nullable Position position) {
        super(position);
    }

    public Lambda postinit(Arguments args, PyNode body) {
        complete(args, body);
        return this;
    }

    @Override
    public Arguments args() {
        return nodeAt(0, Arguments.class);
    }

    public PyNode body() {
        return nodeAt(1);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LAMBDA;
    }

    @Override
    protected PyNode bareCopy() {
        return new Lambda(position());
    }
}
