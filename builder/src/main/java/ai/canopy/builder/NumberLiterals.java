package ai.canopy.builder;

import ai.canopy.tree.PythonDialect;
import ai.canopy.tree.nodes.Const;
import java.math.BigInteger;
import java.util.Locale;

/** Parses Python integer, float and imaginary literals. */
final class NumberLiterals {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private NumberLiterals() {}

    /**
     * The constant value of {@code source}: a {@link Long} or {@link BigInteger} for integers, a {@link Double} for
     * floats, a {@link Const.Imaginary} for literals ending in {@code j}.
     *
     * @throws NumberFormatException if the text is not a number literal of the dialect
     */
    static Object parse(String source, PythonDialect dialect) {
        String text = source.replace("_", "").toLowerCase(Locale.ROOT);
        if (text.endsWith("j")) {
            return new Const.Imaginary(Double.parseDouble(text.substring(0, text.length() - 1)));
        }
        if (text.endsWith("l")) {
            text = text.substring(0, text.length() - 1);
        }
        if (text.startsWith("0x")) {
            return integer(new BigInteger(text.substring(2), 16));
        }
        if (text.startsWith("0o")) {
            return integer(new BigInteger(text.substring(2), 8));
        }
        if (text.startsWith("0b")) {
            return integer(new BigInteger(text.substring(2), 2));
        }
        if (text.contains(".") || text.contains("e") || text.equals("inf") || text.equals("nan")) {
            return Double.parseDouble(text);
        }
        if (text.length() > 1 && text.startsWith("0")) {
            if (dialect == PythonDialect.PY2) {
                return integer(new BigInteger(text.substring(1), 8));
            }
            // Python 3 only allows leading zeros on zero itself.
            if (!text.chars().allMatch(c -> c == '0')) {
                throw new NumberFormatException("leading zeros in decimal integer literals are not permitted: " + source);
            }
        }
        return integer(new BigInteger(text));
    }

    private static Object integer(BigInteger value) {
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return value.longValue();
        }
        return value;
    }
}
