package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.NodeSequence;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Python 2 {@code print} statement. */
public final class Print extends PyNode {

    private final boolean nl;

    public Print(@Nullable Position position, boolean nl) {
        super(position);
        this.nl = nl;
    }

    public Print postinit(PyNode dest, NodeSequence values) {
        complete(dest, values);
        return this;
    }

    public PyNode dest() {
        return nodeAt(0);
    }

    public NodeSequence values() {
        return sequenceAt(1);
    }

    public boolean nl() {
        return nl;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PRINT;
    }

    @Override
    protected PyNode bareCopy() {
        return new Print(position(), nl);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(nl);
    }
}
