package ai.canopy.builder;

import ai.canopy.exception.AstBuildingException;
import ai.canopy.tree.PythonCodecs;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Works out how a Python source file is encoded: a UTF-8 byte order mark, a {@code coding:} declaration on one of the
 * first two lines, or the configured default.
 */
final class SourceEncoding {

    private static final Pattern CODING_LINE = Pattern.compile("^[ \\t\\f]*#.*?coding[:=][ \\t]*([-\\w.]+)");
    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};

    /** A decoded file: its text, without any byte order mark, and the encoding that was used. */
    record Decoded(String text, Charset charset) {}

    private SourceEncoding() {}

    static Decoded decode(byte[] data, Charset fallback, String moduleName, @Nullable Path path)
            throws AstBuildingException {
        boolean bom = startsWithBom(data);
        int offset = bom ? UTF8_BOM.length : 0;
        String declared = declaredEncoding(data, offset);

        Charset charset;
        if (declared != null) {
            charset = lookup(declared, moduleName, path);
            if (bom && !charset.equals(StandardCharsets.UTF_8)) {
                throw new AstBuildingException(moduleName, path,
                        "Encoding mismatch: file starts with a UTF-8 byte order mark but declares '" + declared + "'");
            }
        } else {
            charset = bom ? StandardCharsets.UTF_8 : fallback;
        }

        var decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(data, offset, data.length - offset)).toString();
            return new Decoded(text, charset);
        } catch (CharacterCodingException e) {
            throw new AstBuildingException(
                    moduleName, path, "Source is not valid '" + charset.name() + "': " + e.getMessage(), e);
        }
    }

    /** The encoding named by a coding declaration on the first or second line, or null if there is none. */
    static @Nullable String declaredEncoding(byte[] data, int offset) {
        int lineStart = offset;
        for (int lineNumber = 0; lineNumber < 2 && lineStart < data.length; lineNumber++) {
            int lineEnd = lineStart;
            while (lineEnd < data.length && data[lineEnd] != '\n' && data[lineEnd] != '\r') {
                lineEnd++;
            }
            // Declarations are plain ASCII, so Latin-1 never fails here.
            String line = new String(data, lineStart, lineEnd - lineStart, StandardCharsets.ISO_8859_1);
            var matcher = CODING_LINE.matcher(line);
            if (matcher.find()) {
                return matcher.group(1);
            }
            if (!line.isBlank() && !line.stripLeading().startsWith("#")) {
                return null;
            }
            lineStart = lineEnd + 1;
            if (lineEnd + 1 < data.length && data[lineEnd] == '\r' && data[lineEnd + 1] == '\n') {
                lineStart++;
            }
        }
        return null;
    }

    private static Charset lookup(String name, String moduleName, @Nullable Path path) throws AstBuildingException {
        return PythonCodecs.charset(name)
                .orElseThrow(() -> new AstBuildingException(moduleName, path, "Unknown encoding '" + name + "'"));
    }

    private static boolean startsWithBom(byte[] data) {
        return data.length >= 3 && data[0] == UTF8_BOM[0] && data[1] == UTF8_BOM[1] && data[2] == UTF8_BOM[2];
    }
}
