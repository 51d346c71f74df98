package org.dxworks.jsxforge.analyzer;

import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SourceParser} backed by the tree-sitter JavaScript grammar, which covers JSX.
 * A new native parser is created per call, so one instance can serve concurrent compilations.
 */
public class TreeSitterSourceParser implements SourceParser {

    private static final TSLanguage JAVASCRIPT = new TreeSitterJavascript();

    @Override
    public SyntaxNode parse(String source) {
        TSParser parser = new TSParser();
        parser.setLanguage(JAVASCRIPT);
        TSTree tree = parser.parseString(null, source);
        SourceIndex index = new SourceIndex(source);
        return convert(tree.getRootNode(), null, index, source);
    }

    private static SyntaxNode convert(TSNode node, String field, SourceIndex index, String source) {
        List<SyntaxNode> children = new ArrayList<>();
        int count = node.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = node.getChild(i);
            if (child == null || child.isNull()) continue;
            // Field names are indexed over all children, anonymous tokens included
            children.add(convert(child, node.getFieldNameForChild(i), index, source));
        }
        int start = index.toCharOffset(node.getStartByte());
        int end = index.toCharOffset(node.getEndByte());
        return new SyntaxNode(node.getType(), field, node.isNamed(), node.isMissing(),
                start, end, index.lineOf(start), index.columnOf(start), children, source);
    }

    /**
     * Tree-sitter reports UTF-8 byte offsets; Java strings index UTF-16 code units.
     */
    private static final class SourceIndex {
        private final int[] byteToChar;
        private final int[] lineStarts;

        SourceIndex(String source) {
            byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
            byteToChar = new int[bytes.length + 1];
            int b = 0;
            for (int c = 0; c < source.length(); ) {
                int codePoint = source.codePointAt(c);
                int width = utf8Width(codePoint);
                for (int k = 0; k < width && b < bytes.length; k++) {
                    byteToChar[b++] = c;
                }
                c += Character.charCount(codePoint);
            }
            byteToChar[bytes.length] = source.length();

            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < source.length(); i++) {
                if (source.charAt(i) == '\n') starts.add(i + 1);
            }
            lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        }

        int toCharOffset(int byteOffset) {
            if (byteOffset <= 0) return 0;
            if (byteOffset >= byteToChar.length) return byteToChar[byteToChar.length - 1];
            return byteToChar[byteOffset];
        }

        int lineOf(int charOffset) {
            int lo = 0;
            int hi = lineStarts.length - 1;
            while (lo < hi) {
                int mid = (lo + hi + 1) >>> 1;
                if (lineStarts[mid] <= charOffset) lo = mid;
                else hi = mid - 1;
            }
            return lo + 1;
        }

        int columnOf(int charOffset) {
            return charOffset - lineStarts[lineOf(charOffset) - 1];
        }

        private static int utf8Width(int codePoint) {
            if (codePoint < 0x80) return 1;
            if (codePoint < 0x800) return 2;
            if (codePoint < 0x10000) return 3;
            return 4;
        }
    }
}
