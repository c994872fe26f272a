package ai.canopy.tree;

/** The syntactic context an expression appears in. */
public enum Context {
    LOAD("Load"),
    STORE("Store"),
    DEL("Del");

    private final String displayName;

    Context(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
