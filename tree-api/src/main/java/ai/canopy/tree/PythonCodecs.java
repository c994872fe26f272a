package ai.canopy.tree;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Locale;
import java.util.Optional;

/** Maps Python codec names, as written in {@code coding:} declarations, to Java charsets. */
public final class PythonCodecs {

    private PythonCodecs() {}

    /** The charset for {@code name}, or empty when Java knows no such charset. */
    public static Optional<Charset> charset(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (normalized.equals("utf8") || normalized.startsWith("utf-8-")) {
            normalized = "utf-8";
        } else if (normalized.equals("latin-1") || normalized.equals("latin1") || normalized.equals("l1")) {
            normalized = "iso-8859-1";
        }
        try {
            return Optional.of(Charset.forName(normalized));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return Optional.empty();
        }
    }
}
