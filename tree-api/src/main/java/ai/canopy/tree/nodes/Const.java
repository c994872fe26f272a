package ai.canopy.tree.nodes;

import ai.canopy.tree.NodeKind;
import ai.canopy.tree.Position;
import ai.canopy.tree.PyNode;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A literal constant. The value is one of {@link Singleton}, {@link Boolean}, {@link Long}, {@link BigInteger},
 * {@link Double}, {@link Imaginary}, {@link String} or {@link Bytes}.
 */
public class Const extends PyNode {

    /** An imaginary number literal such as {@code 2j}. */
    public record Imaginary(double imag) {
        @Override
        public String toString() {
            return (imag == Math.rint(imag) && !Double.isInfinite(imag) ? Long.toString((long) imag) : Double.toString(imag))
                    + "j";
        }
    }

    /** A bytes literal; each char of {@code latin1} holds one byte. */
    public record Bytes(String latin1) {
        public static Bytes of(byte[] data) {
            return new Bytes(new String(data, StandardCharsets.ISO_8859_1));
        }

        public byte[] toByteArray() {
            return latin1.getBytes(StandardCharsets.ISO_8859_1);
        }
    }

    private final Object value;

    public Const(@Nullable Position position, Object value) {
        super(position);
        checkValue(value);
        this.value = value;
        complete();
    }

    private static void checkValue(Object value) {
        if (!(value instanceof Singleton
                || value instanceof Boolean
                || value instanceof Long
                || value instanceof BigInteger
                || value instanceof Double
                || value instanceof Imaginary
                || value instanceof String
                || value instanceof Bytes)) {
            throw new IllegalArgumentException("Unsupported constant value " + value);
        }
    }

    public Object value() {
        return value;
    }

    /** The text of a string constant, or null for any other constant. */
    public @Nullable String stringValue() {
        return value instanceof String s ? s : null;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONST;
    }

    @Override
    protected PyNode bareCopy() {
        return new Const(position(), value);
    }

    @Override
    public List<@Nullable Object> otherFieldValues() {
        return Arrays.asList(value);
    }
}
