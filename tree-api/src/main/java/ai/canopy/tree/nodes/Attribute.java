package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class Attribute extends PyNode {

    private final String attrname;

    public Attribute(@Nullable Position position, String attrname) {
        super(position);
        this.attrname = attrname;
    }

    public Attribute postinit(PyNode expr) {
        complete(expr);
        return this;
    }

    public PyNode expr() {
        return nodeAt(0);
    }

    public String attrname() {
        return attrname;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ATTRIBUTE;
    }

    @Override
    protected PyNode bareCopy() {
        return new Attribute(position(), attrname);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(attrname);
    }

    @Override
    protected String label() {
        return attrname;
    }
}
