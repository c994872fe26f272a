package ai.canopy.builder;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/**
 * Source text together with its UTF-8 encoding. TreeSitter reports byte offsets, so node text is cut from the bytes
 * rather than from the Java string.
 */
final class SourceText {
    private static final Logger logger = LogManager.getLogger(SourceText.class);

    private final String text;
    private final byte[] bytes;

    SourceText(String text) {
        this.text = text;
        this.bytes = text.getBytes(StandardCharsets.UTF_8);
    }

    String text() {
        return text;
    }

    /** The text covered by {@code node}, empty for a null node. */
    String of(@Nullable TSNode node) {
        if (node == null || node.isNull()) {
            return "";
        }
        return slice(node.getStartByte(), node.getEndByte());
    }

    /** Decodes the bytes in {@code [startByte, endByte)}, clamping offsets that run past the source. */
    String slice(int startByte, int endByte) {
        if (startByte < 0 || startByte > endByte) {
            logger.warn("Invalid byte range for source text ({} bytes): startByte={}, endByte={}",
                    bytes.length, startByte, endByte);
            return "";
        }
        if (endByte > bytes.length) {
            logger.warn("End byte offset {} exceeds source byte length {}, truncating", endByte, bytes.length);
            endByte = bytes.length;
        }
        if (startByte >= endByte) {
            return "";
        }
        return new String(bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** The full source line holding the given 0-based row, without its line terminator. */
    String line(int row) {
        List<String> lines = Arrays.asList(text.split("\r\n|\r|\n", -1));
        return row >= 0 && row < lines.size() ? lines.get(row) : "";
    }

    /** Depth-first search for the first node matching the predicate, the root included. */
    static @Nullable TSNode findFirst(@Nullable TSNode root, Predicate<TSNode> predicate) {
        if (root == null || root.isNull()) {
            return null;
        }
        if (predicate.test(root)) {
            return root;
        }
        for (int i = 0; i < root.getChildCount(); i++) {
            var child = root.getChild(i);
            if (child != null && !child.isNull()) {
                var result = findFirst(child, predicate);
                if (result != null) {
                    return result;
                }
            }
        }
        return null;
    }
}
