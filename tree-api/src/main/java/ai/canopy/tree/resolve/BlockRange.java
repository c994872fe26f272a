package ai.canopy.tree.resolve;

/** An inclusive range of source lines. */
public record BlockRange(int firstLine, int lastLine) {

    public static BlockRange line(int line) {
        return new BlockRange(line, line);
    }

    public boolean contains(int line) {
        return firstLine <= line && line <= lastLine;
    }

    @Override
    public String toString() {
        return "(" + firstLine + ", " + lastLine + ")";
    }
}
