package ai.canopy.exception;

import ai.canopy.tree.NodeKind;

/** An operation was requested on a node variant that does not provide it. */
public class NotSupportedException extends CanopyException {

    private final NodeKind kind;

    public NotSupportedException(NodeKind kind, String capability) {
        super(kind.displayName() + " does not support " + capability);
        this.kind = kind;
    }

    public NodeKind kind() {
        return kind;
    }
}
