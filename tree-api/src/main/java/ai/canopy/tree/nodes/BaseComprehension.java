package ai.canopy.tree.nodes;

import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Comprehension expressions. The {@code generators} field always comes first. */
public abstract class BaseComprehension extends PyNode {

    protected BaseComprehension(@Nullable Position position) {
        super(position);
    }

    public List<Comprehension> generators() {
        return elementsAt(0, Comprehension.class);
    }
}
