package org.dxworks.jsxforge.backend.dialect;

import org.dxworks.jsxforge.backend.RenderContext;
import org.dxworks.jsxforge.backend.TemplateTransformer;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.Root;
import org.dxworks.jsxforge.model.Text;
import org.dxworks.jsxforge.model.ValidationResult;
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

class LiquidBackendTest {

    private final LiquidBackend backend = new LiquidBackend();
    private final TemplateTransformer transformer = new TemplateTransformer();

    private String render(Node... nodes) {
        return transformer.transform(new Root(List.of(nodes)), backend, RenderContext.standalone()).content;
    }

    private static Element variable(String name) {
        return Element.synthetic("span", new Variable(name), List.of());
    }

    private static Element span(String text) {
        return new Element("span", Map.of(), List.of(new Text(text)));
    }

    @Test
    void loopRendersForTag() {
        Element li = new Element("li", Map.of(), List.of(variable("item.name")));
        Element loop = Element.synthetic("template", new Loop("item", "items"), List.of(li));

        assertEquals("{% for item in items %}\n<li>{{ item.name }}</li>\n{% endfor %}", render(loop));
    }

    @Test
    void namedIndexIsAssignedFromForloop() {
        Element loop = Element.synthetic("template", new Loop("user", "users", null, "i"), List.of(variable("user.name")));

        assertEquals("{% for user in users %}\n{% assign i = forloop.index0 %}\n{{ user.name }}\n{% endfor %}",
                render(loop));
    }

    @Test
    void conditionChainUsesElsif() {
        String output = render(
                Element.synthetic("template", Condition.ifTrue("isActive"), List.of(span("A"))),
                new Text("\n"),
                Element.synthetic("template", Condition.elseIf("isPending"), List.of(span("B"))),
                Element.synthetic("template", Condition.otherwise(), List.of(span("C"))));

        assertEquals("{% if isActive %}\n<span>A</span>\n{% elsif isPending %}\n<span>B</span>\n{% else %}\n<span>C</span>\n{% endif %}",
                output);
    }

    @Test
    void expressionsUseWordOperatorsAndLiquidNames() {
        assertEquals("count > 0 and user.isAdmin == blank", backend.formatExpression("count > 0 && !user.isAdmin"));
        assertEquals("items.size > 0 or x == nil", backend.formatExpression("items.length > 0 || x === null"));
        assertEquals("user.name", backend.formatExpression("user?.name"));
    }

    @Test
    void defaultComesBeforeTheFilter() {
        assertEquals("{{ title | default: \"Untitled\" }}",
                backend.renderVariable(new Variable("title").withDefault("Untitled"), RenderContext.standalone()));
        assertEquals("{{ title | default: \"Untitled\" | upcase }}",
                backend.renderVariable(new Variable("title", "Untitled", "uppercase", List.of(), false),
                        RenderContext.standalone()));
    }

    @Test
    void dateFilterGetsItsDefaultFormat() {
        Variable variable = new Variable("createdAt", null, "date", List.of(), false);

        assertEquals("{{ createdAt | date: \"%Y-%m-%d\" }}", backend.renderVariable(variable, RenderContext.standalone()));
    }

    @Test
    void slotsAreVariablesWithFallback() {
        assertEquals("{{ content }}", render(Element.synthetic("template", new Slot(Slot.DEFAULT_NAME), List.of())));
        assertEquals("{% if sidebar %}\n{{ sidebar }}\n{% else %}\nNothing\n{% endif %}",
                render(Element.synthetic("template", new Slot("sidebar"), List.of(new Text("Nothing")))));
    }

    @Test
    void includeChildrenAreCapturedAsContent() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("title", "t");
        Element include = Element.synthetic("template", new Include("partials/card", props, "Card"),
                List.of(span("Body")));

        assertEquals("{% capture include_content %}\n<span>Body</span>\n{% endcapture %}\n"
                        + "{% include 'partials/card.liquid', title: t, content: include_content %}",
                render(include));
    }

    @Test
    void spreadPropsAreDroppedWithWarning() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("...0", "card");
        RenderContext context = RenderContext.standalone();

        assertEquals("{% include 'partials/card.liquid' %}",
                backend.renderInclude(new Include("partials/card", props, "Card"), "", context));
        assertEquals(1, context.getWarnings().size());
    }

    @Test
    void extendsIsLeftAsCommentWithWarning() {
        RenderContext context = RenderContext.standalone();

        assertEquals("{% comment %}extends 'layouts/base.liquid' is not supported in Liquid{% endcomment %}",
                backend.renderExtends("layouts/base", context));
        assertEquals(1, context.getWarnings().size());
    }

    @Test
    void blocksAreCaptures() {
        assertEquals("{% capture main %}\n<span>Hi</span>\n{% endcapture %}",
                render(Element.synthetic("template", new Block("main"), List.of(span("Hi")))));
    }

    @Test
    void validateReportsUnbalancedControlTags() {
        ValidationResult result = backend.validate("{% if a %}x");

        assertEquals(List.of("Unbalanced control tags: 1 opening and 0 closing"), result.errors);
        assertTrue(backend.validate(String.join("\n", result.errors)).valid);
    }

    @Test
    void emptyOutputIsInvalid() {
        assertFalse(backend.validate("  ").valid);
    }

    @Test
    void joinSeparatorKeepsItsSpaces() {
        RenderContext context = RenderContext.standalone();

        assertEquals("{{ tags | join: \", \" }}",
                backend.renderVariable(new Variable("tags", null, "join", List.of(), false), context));
        assertEquals("{{ tags | join: \" / \" }}",
                backend.renderVariable(new Variable("tags", null, "join", List.of(" / "), false), context));
    }
}
