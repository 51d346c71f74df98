package org.dxworks.jsxforge.analyzer;

import org.dxworks.jsxforge.TemplateCompilationException;
import org.dxworks.jsxforge.analyzer.dsl.DslHandlerRegistry;
import org.dxworks.jsxforge.model.AttributeValue;
import org.dxworks.jsxforge.model.Comment;
import org.dxworks.jsxforge.model.ComponentMeta;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.Root;
import org.dxworks.jsxforge.model.Text;
import org.dxworks.jsxforge.model.annotation.Condition;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Slot;
import org.dxworks.jsxforge.model.annotation.Variable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SourceAnalyzerTest {

    private final SourceAnalyzer analyzer = new SourceAnalyzer(new TreeSitterSourceParser(), DslHandlerRegistry.defaults());

    private AnalysisResult analyze(String source) {
        return analyzer.analyze(source, AnalysisOptions.forFile("Sample.jsx"));
    }

    private List<Node> markup(String jsx) {
        return analyze("export function Sample(props) {\n  return (\n" + jsx + "\n  );\n}\n").root.children;
    }

    private static Element element(String tag, Node... children) {
        return new Element(tag, Map.of(), List.of(children));
    }

    private static Element variable(String name) {
        return Element.synthetic("span", new Variable(name), List.of());
    }

    @Test
    void mapCallBecomesLoopWithExplicitKey() {
        AnalysisResult result = analyze("export default function List({ items }) {\n"
                + "  return <ul>{items.map(item => <li key={item.id}>{item.name}</li>)}</ul>;\n"
                + "}\n");

        Element loop = Element.synthetic("template", new Loop("item", "items", "item.id", null),
                List.of(element("li", variable("item.name"))));
        assertEquals(List.of(element("ul", loop)), result.root.children);
        assertTrue(result.warnings.isEmpty());
    }

    @Test
    void componentMetaDescribesTheSource() {
        ComponentMeta meta = analyze("import React, { useState } from 'react';\n"
                + "export default function List({ items, title = 'All' }) {\n"
                + "  const [open, setOpen] = useState(false);\n"
                + "  return <ul />;\n"
                + "}\n").root.meta;

        assertEquals("List", meta.componentName);
        assertEquals("Sample.jsx", meta.sourceFile);
        assertTrue(meta.exports.contains("List"));
        assertTrue(meta.exports.contains("default"));
        assertEquals(2, meta.props.size());
        assertEquals("items", meta.props.get(0).name);
        assertTrue(meta.props.get(0).required);
        assertEquals("'All'", meta.props.get(1).defaultValue);
        assertEquals("react", meta.imports.get(0).source);
        assertEquals("React", meta.imports.get(0).defaultImport);
        assertEquals(List.of("useState"), meta.imports.get(0).namedImports);
        assertEquals("const [open, setOpen] = useState(false);", meta.preamble);
        assertEquals(List.of("open", "setOpen"), meta.preambleVariables);
    }

    @Test
    void destructuredLoopParametersBecomeItemFields() {
        List<Node> children = markup("<ul>{users.map(({ id, name }) => <li key={id}>{name}</li>)}</ul>");

        Element loop = Element.synthetic("template", new Loop("item", "users", "item.id", null),
                List.of(element("li", variable("item.name"))));
        assertEquals(List.of(element("ul", loop)), children);
    }

    @Test
    void nestedTernaryBecomesIfElseIfWithoutNullElse() {
        List<Node> children = markup("<div>{a ? <b>A</b> : c ? <i>C</i> : null}</div>");

        assertEquals(List.of(element("div",
                Element.synthetic("template", Condition.ifTrue("a"), List.of(element("b", new Text("A")))),
                Element.synthetic("template", Condition.elseIf("c"), List.of(element("i", new Text("C")))))), children);
    }

    @Test
    void ternaryWithMarkupAlternativeHasElse() {
        List<Node> children = markup("<div>{ok ? <b>Yes</b> : <i>No</i>}</div>");

        Element div = (Element) children.get(0);
        assertEquals(Condition.otherwise(), ((Element) div.children.get(1)).annotation);
    }

    @Test
    void logicalAndIsAnIf() {
        List<Node> children = markup("<div>{isAdmin && <span>Admin</span>}</div>");

        assertEquals(List.of(element("div",
                Element.synthetic("template", Condition.ifTrue("isAdmin"), List.of(element("span", new Text("Admin")))))),
                children);
    }

    @Test
    void fallbackLiteralBecomesDefault() {
        List<Node> children = markup("<h1>{title || \"Untitled\"}</h1>");

        assertEquals(List.of(element("h1",
                Element.synthetic("span", new Variable("title").withDefault("Untitled"), List.of()))), children);
    }

    @Test
    void propsObjectIsDropped() {
        List<Node> children = markup("<h1 title={props.tooltip}>{props.title}</h1>");

        assertEquals(List.of(new Element("h1", Map.of("title", AttributeValue.expression("tooltip")),
                List.of(variable("title")))), children);
    }

    @Test
    void childrenReferenceIsTheDefaultSlot() {
        List<Node> children = markup("<main>{children}</main>");

        assertEquals(List.of(element("main", Element.synthetic("template", new Slot(Slot.DEFAULT_NAME), List.of()))),
                children);
    }

    @Test
    void componentsBecomeIncludes() {
        List<Node> children = markup("<UserCard user={u} compact label=\"x\" key={u.id} {...rest} />");

        Map<String, String> props = new LinkedHashMap<>();
        props.put("user", "u");
        props.put("compact", "true");
        props.put("label", "\"x\"");
        props.put("...0", "rest");
        assertEquals(List.of(Element.synthetic("template", new Include("partials/user-card", props, "UserCard"), List.of())),
                children);
    }

    @Test
    void passthroughComponentsStayElements() {
        AnalysisOptions options = new AnalysisOptions("Nav.jsx", null, Set.of("Link"), "partials/");

        List<Node> children = analyzer.analyze("const Nav = () => <Link href=\"/\">Home</Link>;", options).root.children;

        assertEquals(List.of(new Element("Link", Map.of("href", AttributeValue.literal("/")), List.of(new Text("Home")))),
                children);
    }

    @Test
    void fragmentsDissolveIntoTheirChildren() {
        List<Node> children = markup("<><h1>A</h1><p>B</p></>");

        assertEquals(List.of(element("h1", new Text("A")), element("p", new Text("B"))), children);
    }

    @Test
    void textFollowsJsxWhitespaceRules() {
        List<Node> children = markup("<p>\n      Hello\n      {name}!\n    </p>");

        assertEquals(List.of(element("p", new Text("Hello"), variable("name"), new Text("!"))), children);
    }

    @Test
    void attributesKeepLiteralsFlagsAndExpressions() {
        List<Node> children = markup("<input type=\"text\" disabled value={form.name} maxLength={20} hidden={false} />");

        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        attributes.put("type", AttributeValue.literal("text"));
        attributes.put("disabled", AttributeValue.flag());
        attributes.put("value", AttributeValue.expression("form.name"));
        attributes.put("maxLength", AttributeValue.literal("20"));
        assertEquals(List.of(new Element("input", attributes, List.of())), children);
    }

    @Test
    void templateLiteralsSplitIntoTextAndVariables() {
        List<Node> children = markup("<p>{`Hi ${name}!`}</p>");

        assertEquals(List.of(element("p", new Text("Hi "), variable("name"), new Text("!"))), children);
    }

    @Test
    void callsAreKeptVerbatimWithWarning() {
        AnalysisResult result = analyze("export function Sample() {\n  return <p>{formatDate(date)}</p>;\n}\n");

        assertEquals(List.of(element("p", variable("formatDate(date)"))), result.root.children);
        assertEquals(1, result.warnings.size());
        assertTrue(result.warnings.get(0).startsWith("Call expression"));
    }

    @Test
    void unknownExpressionsBecomeComments() {
        AnalysisResult result = analyze("export function Sample() {\n  return <p>{a + b}</p>;\n}\n");

        assertEquals(List.of(element("p", new Comment("unsupported expression: a + b"))), result.root.children);
        assertEquals(1, result.warnings.size());
    }

    @Test
    void namedComponentIsChosenOverTheFirst() {
        String source = "export function First() { return <p>1</p>; }\nexport function Second() { return <p>2</p>; }\n";

        AnalysisResult result = analyzer.analyze(source, new AnalysisOptions("Two.jsx", "Second", Set.of(), null));

        assertEquals("Second", result.root.meta.componentName);
        assertEquals(List.of(element("p", new Text("2"))), result.root.children);
    }

    @Test
    void sourceWithoutMarkupGivesEmptyTreeAndWarning() {
        AnalysisResult result = analyze("export const answer = 42;\n");

        assertTrue(result.root.children.isEmpty());
        assertEquals(List.of(SourceAnalyzer.NO_JSX_WARNING), result.warnings);
    }

    @Test
    void unparsableSourceWithoutMarkupFails() {
        TemplateCompilationException e = assertThrows(TemplateCompilationException.class, () -> analyze("const = ;"));

        assertTrue(e.getMessage().contains("syntax error"));
    }

    @Test
    void emptyRootIsStillARoot() {
        Root root = analyze("").root;

        assertNotNull(root.meta);
        assertTrue(root.children.isEmpty());
    }
}
