package ai.canopy.tree.nodes;

/** Constant values that have no natural Java counterpart. */
public enum Singleton {
    NONE("None"),
    NOT_IMPLEMENTED("NotImplemented");

    private final String pythonName;

    Singleton(String pythonName) {
        this.pythonName = pythonName;
    }

    public String pythonName() {
        return pythonName;
    }

    @Override
    public String toString() {
        return pythonName;
    }
}
