package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * {@code from modname import names}. {@code level} counts the leading dots of a relative import and is null for an
 * absolute one.
 */
public final class ImportFrom extends PyNode {

    private final String modname;
    private final List<ImportName> names;
    private final @Nullable Integer level;

    public ImportFrom(@Nullable Position position, String modname, List<ImportName> names, @Nullable Integer level) {
        super(position);
        this.modname = modname;
        this.names = List.copyOf(names);
        this.level = level;
        complete();
    }

    public String modname() {
        return modname;
    }

    public List<ImportName> names() {
        return names;
    }

    public @Nullable Integer level() {
        return level;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT_FROM;
    }

    @Override
    protected PyNode bareCopy() {
        return new ImportFrom(position(), modname, names, level);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(modname, names, level);
    }

    @Override
    protected String label() {
        return modname;
    }
}
