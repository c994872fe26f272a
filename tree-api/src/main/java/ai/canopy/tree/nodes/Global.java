package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class Global extends PyNode {

    private final List<String> names;

    public Global(@Nullable Position position, List<String> names) {
        super(position);
        this.names = List.copyOf(names);
        complete();
    }

    public List<String> names() {
        return names;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GLOBAL;
    }

    @Override
    protected PyNode bareCopy() {
        return new Global(position(), names);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(names);
    }
}
