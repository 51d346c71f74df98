package org.dxworks.jsxforge.analyzer;

import org.dxworks.jsxforge.expression.ExpressionTokenizer;
import org.dxworks.jsxforge.model.PropDefinition;
import org.dxworks.jsxforge.model.SourceImport;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.jsxforge.analyzer.SyntaxHelper.*;

/**
 * Finds the component to compile in a parsed module and reads what surrounds its markup:
 * imports, exports, destructured props and the statements that run before the return.
 */
public class ComponentLocator {

    private static final String NT_IMPORT_CLAUSE = "import_clause";
    private static final String NT_NAMED_IMPORTS = "named_imports";
    private static final String NT_IMPORT_SPECIFIER = "import_specifier";
    private static final String NT_NAMESPACE_IMPORT = "namespace_import";
    private static final String NT_EXPORT_CLAUSE = "export_clause";
    private static final String NT_EXPORT_SPECIFIER = "export_specifier";

    /**
     * One function that may be the component.
     */
    private static final class Candidate {
        final String name;
        final SyntaxNode function;
        final boolean defaultExport;

        Candidate(String name, SyntaxNode function, boolean defaultExport) {
            this.name = name;
            this.function = function;
            this.defaultExport = defaultExport;
        }
    }

    public LocatedComponent locate(SyntaxNode program, String componentName) {
        List<Candidate> candidates = new ArrayList<>();
        List<String> exports = new ArrayList<>();
        List<SourceImport> imports = new ArrayList<>();

        for (SyntaxNode statement : program.namedChildren()) {
            if (statement.is(NT_IMPORT_STATEMENT)) {
                SourceImport sourceImport = readImport(statement);
                if (sourceImport != null) imports.add(sourceImport);
            } else if (statement.is(NT_EXPORT_STATEMENT)) {
                readExport(statement, candidates, exports);
            } else {
                collectCandidates(statement, false, candidates);
            }
        }

        Candidate chosen = choose(candidates, componentName);
        if (chosen == null) {
            return new LocatedComponent(null, null, null, null, List.of(), imports, exports, "", List.of());
        }

        SyntaxNode markup = functionReturnValue(chosen.function);
        if (markup != null && !isJsx(markup) && findFirstDescendant(markup, NT_JSX_ELEMENT, NT_JSX_SELF_CLOSING) == null) {
            markup = null;
        }

        List<SyntaxNode> parameters = functionParameters(chosen.function);
        SyntaxNode propsParameter = parameters.isEmpty() ? null : parameters.get(0);
        List<PropDefinition> props = readProps(propsParameter);
        String propsObject = parameterName(propsParameter);

        List<String> preambleVariables = new ArrayList<>();
        String preamble = readPreamble(chosen.function, preambleVariables);

        return new LocatedComponent(chosen.name, chosen.function, markup, propsObject, props, imports,
                exports, preamble, preambleVariables);
    }

    private static Candidate choose(List<Candidate> candidates, String componentName) {
        if (componentName != null) {
            for (Candidate c : candidates) {
                if (componentName.equals(c.name)) return c;
            }
        }
        for (Candidate c : candidates) {
            if (isPascalCase(c.name) && returnsMarkup(c.function)) return c;
        }
        for (Candidate c : candidates) {
            if (c.defaultExport && returnsMarkup(c.function)) return c;
        }
        for (Candidate c : candidates) {
            if (returnsMarkup(c.function)) return c;
        }
        return null;
    }

    private static boolean returnsMarkup(SyntaxNode function) {
        SyntaxNode value = functionReturnValue(function);
        return value != null && (isJsx(value) || findFirstDescendant(value, NT_JSX_ELEMENT, NT_JSX_SELF_CLOSING) != null);
    }

    private static void collectCandidates(SyntaxNode statement, boolean defaultExport, List<Candidate> out) {
        if (statement.is(NT_FUNCTION_DECLARATION)) {
            SyntaxNode name = statement.childByField("name");
            out.add(new Candidate(name != null ? name.text() : null, statement, defaultExport));
        } else if (statement.is(NT_LEXICAL_DECLARATION, NT_VARIABLE_DECLARATION)) {
            for (SyntaxNode declarator : findAllChildren(statement, NT_VARIABLE_DECLARATOR)) {
                SyntaxNode name = declarator.childByField("name");
                SyntaxNode function = functionOf(declarator.childByField("value"));
                if (name != null && function != null) {
                    out.add(new Candidate(name.text(), function, defaultExport));
                }
            }
        } else {
            SyntaxNode function = functionOf(statement);
            if (function != null) {
                SyntaxNode name = function.childByField("name");
                out.add(new Candidate(name != null ? name.text() : null, function, defaultExport));
            }
        }
    }

    /**
     * The function itself, or the first function argument of a wrapper such as
     * {@code memo(...)} or {@code forwardRef(...)}.
     */
    private static SyntaxNode functionOf(SyntaxNode value) {
        SyntaxNode v = unwrapParentheses(value);
        if (v == null) return null;
        if (isFunction(v) || v.is(NT_FUNCTION_DECLARATION)) return v;
        if (v.is(NT_CALL_EXPRESSION)) {
            SyntaxNode arguments = v.childByField("arguments");
            if (arguments == null) return null;
            for (SyntaxNode argument : arguments.namedChildren()) {
                SyntaxNode function = functionOf(argument);
                if (function != null) return function;
            }
        }
        return null;
    }

    private static void readExport(SyntaxNode export, List<Candidate> candidates, List<String> exports) {
        boolean isDefault = false;
        for (SyntaxNode child : export.children) {
            if (!child.named && "default".equals(child.text())) isDefault = true;
        }

        SyntaxNode declaration = export.childByField("declaration");
        if (declaration != null) {
            int before = candidates.size();
            collectCandidates(declaration, isDefault, candidates);
            for (int i = before; i < candidates.size(); i++) {
                if (candidates.get(i).name != null) exports.add(candidates.get(i).name);
            }
            for (SyntaxNode declarator : findAllChildren(declaration, NT_VARIABLE_DECLARATOR)) {
                SyntaxNode name = declarator.childByField("name");
                if (name != null && !exports.contains(name.text())) exports.add(name.text());
            }
            if (isDefault) exports.add("default");
            return;
        }

        SyntaxNode value = export.childByField("value");
        if (value != null) {
            if (value.is(NT_IDENTIFIER)) {
                exports.add("default");
                for (Candidate c : candidates) {
                    if (value.text().equals(c.name)) {
                        candidates.set(candidates.indexOf(c), new Candidate(c.name, c.function, true));
                        break;
                    }
                }
            } else {
                collectCandidates(value, true, candidates);
                exports.add("default");
            }
            return;
        }

        SyntaxNode clause = findFirstChild(export, NT_EXPORT_CLAUSE);
        if (clause != null) {
            for (SyntaxNode specifier : findAllChildren(clause, NT_EXPORT_SPECIFIER)) {
                SyntaxNode alias = specifier.childByField("alias");
                SyntaxNode name = specifier.childByField("name");
                SyntaxNode exported = alias != null ? alias : name;
                if (exported != null) exports.add(exported.text());
            }
        }
    }

    private static SourceImport readImport(SyntaxNode statement) {
        SyntaxNode source = statement.childByField("source");
        if (source == null) source = findFirstChild(statement, NT_STRING);
        if (source == null) return null;

        String defaultImport = null;
        String namespaceImport = null;
        List<String> named = new ArrayList<>();
        SyntaxNode clause = findFirstChild(statement, NT_IMPORT_CLAUSE);
        if (clause != null) {
            for (SyntaxNode part : clause.namedChildren()) {
                if (part.is(NT_IDENTIFIER)) {
                    defaultImport = part.text();
                } else if (part.is(NT_NAMESPACE_IMPORT)) {
                    SyntaxNode id = findFirstChild(part, NT_IDENTIFIER);
                    if (id != null) namespaceImport = id.text();
                } else if (part.is(NT_NAMED_IMPORTS)) {
                    for (SyntaxNode specifier : findAllChildren(part, NT_IMPORT_SPECIFIER)) {
                        SyntaxNode alias = specifier.childByField("alias");
                        SyntaxNode name = specifier.childByField("name");
                        SyntaxNode local = alias != null ? alias : name;
                        if (local != null) named.add(local.text());
                    }
                }
            }
        }
        return new SourceImport(ExpressionTokenizer.unquote(source.text()), defaultImport, named, namespaceImport);
    }

    private static List<PropDefinition> readProps(SyntaxNode parameter) {
        List<PropDefinition> props = new ArrayList<>();
        SyntaxNode pattern = parameter;
        if (pattern != null && pattern.is(NT_ASSIGNMENT_PATTERN)) pattern = pattern.childByField("left");
        if (pattern == null || !pattern.is(NT_OBJECT_PATTERN)) return props;

        for (SyntaxNode entry : pattern.namedChildren()) {
            if (entry.is(NT_SHORTHAND_PATTERN)) {
                props.add(new PropDefinition(entry.text(), true, null));
            } else if (entry.is(NT_OBJECT_ASSIGNMENT_PATTERN)) {
                SyntaxNode left = entry.childByField("left");
                SyntaxNode right = entry.childByField("right");
                if (left != null) {
                    props.add(new PropDefinition(left.text(), false, right != null ? normalizeInline(right.text()) : null));
                }
            } else if (entry.is(NT_PAIR_PATTERN)) {
                SyntaxNode key = entry.childByField("key");
                SyntaxNode value = entry.childByField("value");
                if (key == null) continue;
                String defaultValue = null;
                if (value != null && value.is(NT_ASSIGNMENT_PATTERN)) {
                    SyntaxNode right = value.childByField("right");
                    defaultValue = right != null ? normalizeInline(right.text()) : null;
                }
                props.add(new PropDefinition(ExpressionTokenizer.unquote(key.text()), defaultValue == null, defaultValue));
            }
        }
        return props;
    }

    private static String readPreamble(SyntaxNode function, List<String> declared) {
        SyntaxNode body = function.childByField("body");
        if (body == null || !body.is(NT_STATEMENT_BLOCK)) return "";
        StringBuilder preamble = new StringBuilder();
        for (SyntaxNode statement : body.namedChildren()) {
            if (statement.is(NT_RETURN_STATEMENT)) break;
            if (preamble.length() > 0) preamble.append('\n');
            preamble.append(statement.text());
            if (statement.is(NT_LEXICAL_DECLARATION, NT_VARIABLE_DECLARATION)) {
                for (SyntaxNode declarator : findAllChildren(statement, NT_VARIABLE_DECLARATOR)) {
                    SyntaxNode name = declarator.childByField("name");
                    if (name == null) continue;
                    if (name.is(NT_IDENTIFIER)) {
                        declared.add(name.text());
                    } else {
                        for (SyntaxNode id : findAllDescendants(name, NT_IDENTIFIER, NT_SHORTHAND_PATTERN)) {
                            declared.add(id.text());
                        }
                    }
                }
            }
        }
        return preamble.toString();
    }
}
