package ai.canopy.tree;

/**
 * Controls {@link TreeDump} output.
 *
 * @param showIdentity append each node's identity hash to its name
 * @param showPosition include the {@code line} and {@code column} fields
 * @param showDerivedState include the enclosing scope and the line span, which are computed from the whole tree
 * @param indent text added per nesting level
 * @param maxDepth nodes deeper than this are printed as {@code ...}; zero means unlimited
 * @param maxWidth long strings are wrapped to stay within this many columns where possible
 * @param dialect scoping rules used for the derived state
 */
public record DumpOptions(
        boolean showIdentity, boolean showPosition, boolean showDerivedState, String indent, int maxDepth, int maxWidth,
        PythonDialect dialect) {

    public static final DumpOptions DEFAULT = new DumpOptions(false, false, false, "   ", 0, 80, PythonDialect.PY3);

    public DumpOptions {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("maxWidth must be positive: " + maxWidth);
        }
    }

    public DumpOptions withIdentity() {
        return new DumpOptions(true, showPosition, showDerivedState, indent, maxDepth, maxWidth, dialect);
    }

    public DumpOptions withPosition() {
        return new DumpOptions(showIdentity, true, showDerivedState, indent, maxDepth, maxWidth, dialect);
    }

    public DumpOptions withDerivedState() {
        return new DumpOptions(showIdentity, showPosition, true, indent, maxDepth, maxWidth, dialect);
    }

    public DumpOptions withIndent(String newIndent) {
        return new DumpOptions(showIdentity, showPosition, showDerivedState, newIndent, maxDepth, maxWidth, dialect);
    }

    public DumpOptions withMaxDepth(int newMaxDepth) {
        return new DumpOptions(showIdentity, showPosition, showDerivedState, indent, newMaxDepth, maxWidth, dialect);
    }

    public DumpOptions withMaxWidth(int newMaxWidth) {
        return new DumpOptions(showIdentity, showPosition, showDerivedState, indent, maxDepth, newMaxWidth, dialect);
    }

    public DumpOptions withDialect(PythonDialect newDialect) {
        return new DumpOptions(showIdentity, showPosition, showDerivedState, indent, maxDepth, maxWidth, newDialect);
    }
}
