package org.dxworks.jsxforge.analyzer.dsl;

import org.dxworks.jsxforge.analyzer.AnalysisOptions;
import org.dxworks.jsxforge.analyzer.AnalysisResult;
import org.dxworks.jsxforge.analyzer.SourceAnalyzer;
import org.dxworks.jsxforge.analyzer.TreeSitterSourceParser;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.Text;
import org.dxworks.jsxforge.model.annotation.Block;
import org.dxworks.jsxforge.model.annotation.Condition;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Slot;
import org.dxworks.jsxforge.model.annotation.Variable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DslHandlersTest {

    private final SourceAnalyzer analyzer = new SourceAnalyzer(new TreeSitterSourceParser(), DslHandlerRegistry.defaults());

    private AnalysisResult analyze(String jsx) {
        return analyzer.analyze("export function Page() {\n  return (" + jsx + ");\n}\n", AnalysisOptions.forFile("Page.jsx"));
    }

    private List<Node> markup(String jsx) {
        return analyze(jsx).root.children;
    }

    private static Element element(String tag, Node... children) {
        return new Element(tag, Map.of(), List.of(children));
    }

    @Test
    void loopWithChildren() {
        List<Node> children = markup("<Loop each=\"items\" as=\"item\" keyExpr=\"item.id\"><li><Var name=\"item.name\" /></li></Loop>");

        assertEquals(List.of(Element.synthetic("template", new Loop("item", "items", "item.id", null),
                List.of(element("li", Element.synthetic("span", new Variable("item.name"), List.of()))))), children);
    }

    @Test
    void loopRenderFunctionParameterIsBoundToTheItemName() {
        List<Node> children = markup("<Loop each=\"users\" as=\"u\" index=\"i\">{(user) => <li>{user.name}</li>}</Loop>");

        assertEquals(List.of(Element.synthetic("template", new Loop("u", "users", null, "i"),
                List.of(element("li", Element.synthetic("span", new Variable("u.name"), List.of()))))), children);
    }

    @Test
    void varReadsDefaultFilterArgumentsAndRaw() {
        List<Node> children = markup("<p><Var name=\"price\" filter=\"currency\" args=\"EUR, 2\" /><Var raw name=\"body\" />"
                + "<Var name=\"title\" default=\"Untitled\" /><Var>user.name</Var></p>");

        assertEquals(List.of(element("p",
                Element.synthetic("span", new Variable("price", null, "currency", List.of("EUR", "2"), false), List.of()),
                Element.synthetic("span", new Variable("body").asRaw(), List.of()),
                Element.synthetic("span", new Variable("title").withDefault("Untitled"), List.of()),
                Element.synthetic("span", new Variable("user.name"), List.of()))), children);
    }

    @Test
    void rawOutputsUnescapedValue() {
        assertEquals(List.of(Element.synthetic("span", new Variable("html").asRaw(), List.of())), markup("<Raw>html</Raw>"));
    }

    @Test
    void ifElseIfAndElseTags() {
        List<Node> children = markup("<div><If test=\"user.isAdmin\"><b>A</b></If><ElseIf test=\"user.isEditor\"><b>E</b></ElseIf>"
                + "<Else><i>B</i></Else></div>");

        assertEquals(List.of(element("div",
                Element.synthetic("template", Condition.ifTrue("user.isAdmin"), List.of(element("b", new Text("A")))),
                Element.synthetic("template", Condition.elseIf("user.isEditor"), List.of(element("b", new Text("E")))),
                Element.synthetic("template", Condition.otherwise(), List.of(element("i", new Text("B")))))), children);
    }

    @Test
    void slotsDefaultToContent() {
        List<Node> children = markup("<main><Slot /><Slot name=\"sidebar\">Nothing</Slot></main>");

        assertEquals(List.of(element("main",
                Element.synthetic("template", new Slot("content"), List.of()),
                Element.synthetic("template", new Slot("sidebar"), List.of(new Text("Nothing"))))), children);
    }

    @Test
    void includePropsFromJson() {
        List<Node> children = markup("<Include partial=\"partials/card\" props='{\"title\": \"Hi\", \"count\": 2}' />");

        Map<String, String> props = new LinkedHashMap<>();
        props.put("title", "\"Hi\"");
        props.put("count", "2");
        assertEquals(List.of(Element.synthetic("template", new Include("partials/card", props, null), List.of())), children);
    }

    @Test
    void includePropsFromObjectLiteral() {
        List<Node> children = markup("<Include partial=\"partials/card\" props={{ title: pageTitle, compact }} />");

        Map<String, String> props = new LinkedHashMap<>();
        props.put("title", "pageTitle");
        props.put("compact", "compact");
        assertEquals(List.of(Element.synthetic("template", new Include("partials/card", props, null), List.of())), children);
    }

    @Test
    void invalidJsonPropsWarn() {
        AnalysisResult result = analyze("<Include partial=\"partials/card\" props='{oops' />");

        assertEquals(List.of(Element.synthetic("template", new Include("partials/card"), List.of())), result.root.children);
        assertEquals(1, result.warnings.size());
        assertTrue(result.warnings.get(0).startsWith("Include props are not a valid JSON object"));
    }

    @Test
    void blocksAndExtends() {
        List<Node> children = markup("<><Extends layout=\"layouts/base\" /><DefineBlock name=\"main\"><p>x</p></DefineBlock></>");

        assertEquals(List.of(
                Element.synthetic("template", Block.extending("layouts/base"), List.of()),
                Element.synthetic("template", new Block("main"), List.of(element("p", new Text("x"))))), children);
    }

    @Test
    void missingRequiredAttributeFallsBackToPlainElement() {
        AnalysisResult result = analyze("<If>x</If>");

        assertEquals(List.of(element("div", new Text("x"))), result.root.children);
        assertEquals(List.of("If requires a 'test' attribute (line 2)"), result.warnings);
    }
}
