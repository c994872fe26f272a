package ai.canopy.tree;

/**
 * Language dialect the tree was written in. Affects how names are classified while rebuilding and whether list
 * comprehensions open their own scope.
 */
public enum PythonDialect {
    PY2,
    PY3;

    public boolean listComprehensionsHaveScope() {
        return this == PY3;
    }

    public boolean supportsAnnotations() {
        return this == PY3;
    }

    /** Whether {@code True} and {@code False} are ordinary names that can be bound and deleted. */
    public boolean booleansAreNames() {
        return this == PY2;
    }
}
