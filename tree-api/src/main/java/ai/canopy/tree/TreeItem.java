package ai.canopy.tree;

import java.util.List;

/**
 * Anything a {@link ai.canopy.tree.zipper.Zipper} can focus on: a single {@link PyNode} or a {@link NodeSequence} of
 * siblings held in one child field.
 */
public interface TreeItem {

    /**
     * The children of this item in order. For a node these are its child-field values in declaration order, for a
     * sequence its elements. The returned list is immutable.
     */
    List<? extends TreeItem> items();

    /** Builds a new item of the same shape whose children are {@code items}. The receiver is left untouched. */
    TreeItem withItems(List<? extends TreeItem> items);

    /** False for {@link Empty} and for empty sequences, true for everything else. */
    boolean isPresent();
}
