package ai.canopy.builder;

import java.util.Set;

/** Operator spellings accepted from the parser, as they appear in {@code op} fields of the tree. */
final class Operators {

    static final Set<String> BINARY = Set.of("+", "-", "*", "/", "//", "%", "**", "<<", ">>", "&", "|", "^", "@");

    static final Set<String> BOOLEAN = Set.of("and", "or");

    static final Set<String> UNARY = Set.of("+", "-", "~", "not");

    static final Set<String> COMPARISON = Set.of("==", "!=", "<>", "<", "<=", ">", ">=", "is", "is not", "in", "not in");

    static final Set<String> AUGMENTED = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "**=", "<<=", ">>=", "&=", "|=", "^=", "@=");

    private Operators() {}

    static boolean isBinary(String op) {
        return BINARY.contains(op);
    }

    static boolean isComparison(String op) {
        return COMPARISON.contains(op);
    }

    static boolean isAugmented(String op) {
        return AUGMENTED.contains(op);
    }

    /** {@code @} and {@code @=}, which only exist in Python 3. */
    static boolean isMatrixMultiplication(String op) {
        return op.equals("@") || op.equals("@=");
    }
}
