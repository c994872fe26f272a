package ai.canopy.builder;

import java.util.Locale;

/** Decodes the source text of a single Python string literal, prefix and quotes included. */
final class StringLiterals {

    /** A decoded literal. For bytes, each char of {@code value} holds one byte. */
    record Literal(String value, boolean bytes, boolean formatted) {}

    private StringLiterals() {}

    static Literal decode(String source) {
        int prefixEnd = 0;
        while (prefixEnd < source.length() && Character.isLetter(source.charAt(prefixEnd))) {
            prefixEnd++;
        }
        String prefix = source.substring(0, prefixEnd).toLowerCase(Locale.ROOT);
        boolean raw = prefix.contains("r");
        boolean bytes = prefix.contains("b");
        boolean formatted = prefix.contains("f");

        String rest = source.substring(prefixEnd);
        int quoteLength = rest.startsWith("\"\"\"") || rest.startsWith("'''") ? 3 : 1;
        if (rest.length() < 2 * quoteLength) {
            throw new IllegalArgumentException("Not a complete string literal: " + source);
        }
        String body = rest.substring(quoteLength, rest.length() - quoteLength);
        String value = raw ? body : unescape(body, bytes);
        return new Literal(value, bytes, formatted);
    }

    private static String unescape(String body, boolean bytes) {
        var sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            i += 2;
            switch (next) {
                case '\n' -> {}
                case '\r' -> {
                    if (i < body.length() && body.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\\' -> sb.append('\\');
                case '\'' -> sb.append('\'');
                case '"' -> sb.append('"');
                case 'a' -> sb.append('\u0007');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'v' -> sb.append('\u000b');
                case 'x' -> i = appendHex(body, i, 2, sb);
                case 'u' -> i = bytes ? appendVerbatim(sb, "\\u", i) : appendHex(body, i, 4, sb);
                case 'U' -> i = bytes ? appendVerbatim(sb, "\\U", i) : appendHex(body, i, 8, sb);
                default -> {
                    if (next >= '0' && next <= '7') {
                        int end = i - 1;
                        while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                            end++;
                        }
                        sb.append((char) Integer.parseInt(body.substring(i - 1, end), 8));
                        i = end;
                    } else {
                        sb.append('\\').append(next);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static int appendVerbatim(StringBuilder sb, String text, int index) {
        sb.append(text);
        return index;
    }

    private static int appendHex(String body, int start, int digits, StringBuilder sb) {
        int end = start + digits;
        if (end > body.length()) {
            throw new IllegalArgumentException("Truncated escape sequence in string literal");
        }
        sb.appendCodePoint(Integer.parseInt(body.substring(start, end), 16));
        return end;
    }
}
