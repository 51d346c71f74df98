package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.backend.dialect.LiquidBackend;
import org.dxworks.jsxforge.model.ComponentMeta;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Root;
import org.dxworks.jsxforge.model.Text;
import org.dxworks.jsxforge.model.annotation.Condition;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Variable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.dxworks.jsxforge.tree.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class TemplateTransformerTest {

    private final TemplateTransformer transformer = new TemplateTransformer();
    private final LiquidBackend backend = new LiquidBackend();

    private static Element span(String value) {
        return element("span", text(value));
    }

    @Test
    void outputCarriesVariablesDependenciesAndFileName() {
        Root root = root(
                wrap(new Loop("item", "items"), wrap(new Variable("item.name")), wrap(new Variable("currency"))),
                wrap(new Include("partials/footer")),
                wrap(new Include("partials/footer")));

        TemplateOutput output = transformer.transform(root, backend, RenderContext.standalone());

        assertEquals(List.of("items", "currency"), output.variables);
        assertEquals(List.of("partials/footer"), output.dependencies);
        assertEquals("template.liquid", output.filename);
    }

    @Test
    void fileNameFollowsTheComponentName() {
        ComponentMeta meta = new ComponentMeta("src/UserCard.jsx", "UserCard", List.of(), List.of(), List.of(), "", List.of());

        TemplateOutput output = transformer.transform(new Root(List.of(span("x")), meta), backend, new RenderContext(meta, false));

        assertEquals("user-card.liquid", output.filename);
    }

    @Test
    void whitespaceAfterAChainStaysOutsideIt() {
        Root root = root(wrap(Condition.ifTrue("a"), span("A")), text(" "), span("x"));

        assertEquals("{% if a %}\n<span>A</span>\n{% endif %} <span>x</span>",
                transformer.transform(root, backend, RenderContext.standalone()).content);
    }

    @Test
    void separateIfsAreSeparateChains() {
        Root root = root(wrap(Condition.ifTrue("a"), span("A")), wrap(Condition.ifTrue("b"), span("B")));

        assertEquals("{% if a %}\n<span>A</span>\n{% endif %}{% if b %}\n<span>B</span>\n{% endif %}",
                transformer.transform(root, backend, RenderContext.standalone()).content);
    }

    @Test
    void danglingElseIfIsMarkedAndWarned() {
        RenderContext context = RenderContext.standalone();

        TemplateOutput output = transformer.transform(root(wrap(Condition.elseIf("b"), span("B"))), backend, context);

        assertEquals("@@jsxforge:dangling-else-if@@<span>B</span>", output.content);
        assertEquals(List.of("ElseIf without a preceding If"), output.warnings);
    }

    @Test
    void annotatedRealElementKeepsItsTag() {
        Element paragraph = new Element("p", Map.of(), List.of(), new Variable("x"), false);

        assertEquals("<p>{{ x }}</p>", transformer.transformElement(paragraph, backend, RenderContext.standalone()));
    }

    @Test
    void prettyPrintStripsTheBodyAndEndsWithNewline() {
        Root root = root(text("\n  "), span("A"), text("\n"));

        assertEquals("<span>A</span>\n", transformer.transform(root, backend, new RenderContext(null, true)).content);
    }

    @Test
    void plainElementsKeepTheirNesting() {
        Root root = root(element("ul", element("li", text("a")), element("li", text("b"))));

        assertEquals("<ul><li>a</li><li>b</li></ul>", transformer.transform(root, backend, RenderContext.standalone()).content);
    }
}
