package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** {@code None}, {@code True}, {@code False} or {@code NotImplemented} written as a name. */
public final class NameConstant extends Const {

    public NameConstant(@Nullable Position position, Object value) {
        super(position, value);
        if (!(value instanceof Singleton || value instanceof Boolean)) {
            throw new IllegalArgumentException("Not a name constant: " + value);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NAME_CONSTANT;
    }

    @Override
    protected PyNode bareCopy() {
        return new NameConstant(position(), value());
    }
}
