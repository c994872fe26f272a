package ai.canopy.tree;

/** A source position: 1-based line, 0-based column counted in UTF-8 bytes. */
public record Position(int line, int column) {

    public Position {
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("Negative position: line=" + line + ", column=" + column);
        }
    }

    @Override
    public String toString() {
        return "l." + line + " c." + column;
    }
}
