package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class BinOp extends PyNode {

    private final String op;

    public BinOp(@Nullable Position position, String op) {
        super(position);
        this.op = op;
    }

    public BinOp postinit(PyNode left, PyNode right) {
        complete(left, right);
        return this;
    }

    public PyNode left() {
        return nodeAt(0);
    }

    public PyNode right() {
        return nodeAt(1);
    }

    public String op() {
        return op;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BIN_OP;
    }

    @Override
    protected PyNode bareCopy() {
        return new BinOp(position(), op);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(op);
    }
}
