package ai.canopy.exception;

import ai.canopy.tree.PyNode;
import org.jetbrains.annotations.Nullable;

/** A parameter was asked for its default value but was declared without one. */
public class NoDefaultException extends CanopyException {

    private final @Nullable PyNode function;
    private final String name;

    public NoDefaultException(@Nullable PyNode function, String name) {
        super((function == null ? "<unattached>" : function.toString()) + " has no default for '" + name + "'.");
        this.function = function;
        this.name = name;
    }

    public @Nullable PyNode function() {
        return function;
    }

    public String name() {
        return name;
    }
}
