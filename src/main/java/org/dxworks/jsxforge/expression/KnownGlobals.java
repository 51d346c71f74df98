package org.dxworks.jsxforge.expression;

import java.util.Set;

/**
 * Names that never count as free template variables: language literals and keywords, browser
 * and runtime globals, and framework intrinsics.
 */
public final class KnownGlobals {

    private static final Set<String> GLOBALS = Set.of(
            "undefined", "null", "true", "false", "NaN", "Infinity",
            "console", "window", "document", "navigator", "globalThis",
            "Array", "Object", "String", "Number", "Boolean", "Date", "Math", "JSON", "Promise",
            "Map", "Set", "WeakMap", "WeakSet", "Symbol", "RegExp", "Error", "Intl",
            "React", "Fragment", "Component", "PureComponent",
            "useState", "useEffect", "useCallback", "useMemo", "useRef", "useContext", "useReducer",
            "useLayoutEffect", "useImperativeHandle", "useDebugValue",
            "forwardRef", "memo", "lazy", "Suspense",
            "clsx", "cn", "classNames");

    private static final Set<String> KEYWORDS = Set.of(
            "this", "new", "typeof", "instanceof", "in", "of", "void", "delete", "await", "async",
            "function", "return", "if", "else", "let", "const", "var", "class", "super", "yield",
            "and", "or", "not");

    private KnownGlobals() {
    }

    public static boolean isGlobal(String name) {
        return GLOBALS.contains(name);
    }

    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name);
    }

    public static boolean isExcluded(String name) {
        return isGlobal(name) || isKeyword(name);
    }
}
