package org.dxworks.jsxforge.backend.dialect;

import org.dxworks.jsxforge.model.annotation.Slot;

/**
 * Spelling shared by the tag-block dialects.
 */
final class DialectSupport {

    static final String CONTENT_SLOT = "content";

    private DialectSupport() {
    }

    static String withExtension(String path, String extension) {
        return path.endsWith(extension) ? path : path + extension;
    }

    /**
     * Layout-style dialects call the unnamed slot {@code content}.
     */
    static String slotName(Slot slot) {
        return slot.isDefault() ? CONTENT_SLOT : slot.name;
    }

    static String singleQuoted(String value) {
        return "'" + value.replace("'", "\\'") + "'";
    }

    static boolean isSpread(String propName) {
        return propName.startsWith("...");
    }

    /**
     * {@code open}, the content on its own line when there is any, then {@code close}.
     */
    static String block(String open, String content, String close) {
        if (content == null || content.isEmpty()) return open + "\n" + close;
        return open + "\n" + content + "\n" + close;
    }
}
