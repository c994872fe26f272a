package ai.canopy.tree;

import java.util.Optional;

/**
 * A node together with a way to reach its ancestors. Implemented by {@link PyNode} itself, which follows parent
 * links, and by {@link ai.canopy.tree.zipper.Zipper}, which follows its own path and so also sees edits.
 *
 * @param <L> the concrete location type returned when moving to a parent
 */
public interface Located<L extends Located<L>> {

    /** The node at this location. */
    PyNode node();

    /** The nearest enclosing node, skipping over any sequence that holds this node. */
    Optional<L> parentLocation();
}
