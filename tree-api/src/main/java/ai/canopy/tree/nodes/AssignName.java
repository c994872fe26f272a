package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** A name being bound. */
public final class AssignName extends PyNode {

    private final String name;

    public AssignName(@Nullable Position position, String name) {
        super(position);
        this.name = name;
        complete();
    }

    public String name() {
        return name;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN_NAME;
    }

    @Override
    protected PyNode bareCopy() {
        return new AssignName(position(), name);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(name);
    }

    @Override
    protected String label() {
        return name;
    }
}
