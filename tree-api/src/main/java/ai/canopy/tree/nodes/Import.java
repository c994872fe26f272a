package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public final class Import extends PyNode {

    private final List<ImportName> names;

    public Import(@Nullable Position position, List<ImportName> names) {
        super(position);
        this.names = List.copyOf(names);
        complete();
    }

    public List<ImportName> names() {
        return names;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT;
    }

    @Override
    protected PyNode bareCopy() {
        return new Import(position(), names);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(names);
    }
}
