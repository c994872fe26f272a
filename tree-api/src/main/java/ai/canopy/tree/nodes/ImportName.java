package ai.canopy.tree.nodes;

import org.jetbrains.annotations.Nullable;

/** One imported name with its optional alias, as in {@code import a.b as c}. */
public record ImportName(String name, @Nullable String asName) {

    /** The name this import binds in the importing scope. */
    public String boundName() {
        if (asName != null) {
            return asName;
        }
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
