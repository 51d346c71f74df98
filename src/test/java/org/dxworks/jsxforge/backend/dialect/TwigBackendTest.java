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

class TwigBackendTest {

    private final TwigBackend backend = new TwigBackend();
    private final TemplateTransformer transformer = new TemplateTransformer();

    private String render(Node... nodes) {
        return transformer.transform(new Root(List.of(nodes)), backend, RenderContext.standalone()).content;
    }

    private static Element span(String text) {
        return new Element("span", Map.of(), List.of(new Text(text)));
    }

    @Test
    void loopWithIndexUsesKeyValueTarget() {
        Element body = Element.synthetic("span", new Variable("user.name"), List.of());
        Element loop = Element.synthetic("template", new Loop("user", "users", null, "i"), List.of(body));

        assertEquals("{% for i, user in users %}\n{{ user.name }}\n{% endfor %}", render(loop));
    }

    @Test
    void conditionChainUsesElseif() {
        String output = render(
                Element.synthetic("template", Condition.ifTrue("a"), List.of(span("A"))),
                Element.synthetic("template", Condition.elseIf("b"), List.of(span("B"))),
                Element.synthetic("template", Condition.otherwise(), List.of(span("C"))));

        assertEquals("{% if a %}\n<span>A</span>\n{% elseif b %}\n<span>B</span>\n{% else %}\n<span>C</span>\n{% endif %}",
                output);
    }

    @Test
    void expressionsUseTwigOperators() {
        assertEquals("a and not b", backend.formatExpression("a && !b"));
        assertEquals("status == 'active' or x != null", backend.formatExpression("status === 'active' || x !== undefined"));
        assertEquals("items|length > 0", backend.formatExpression("items.length > 0"));
        assertEquals("user.profile|length", backend.formatExpression("user?.profile?.length"));
    }

    @Test
    void defaultIsCoalescedAndParenthesisedBeforeAFilter() {
        RenderContext context = RenderContext.standalone();

        assertEquals("{{ title ?? \"Untitled\" }}", backend.renderVariable(new Variable("title").withDefault("Untitled"), context));
        assertEquals("{{ (title ?? \"Untitled\")|upper }}",
                backend.renderVariable(new Variable("title", "Untitled", "uppercase", List.of(), false), context));
        assertEquals("{{ body|raw }}", backend.renderVariable(new Variable("body").asRaw(), context));
    }

    @Test
    void filtersTakeParenthesisedArguments() {
        RenderContext context = RenderContext.standalone();

        assertEquals("{{ price|format_currency(\"USD\") }}",
                backend.renderVariable(new Variable("price", null, "currency", List.of(), false), context));
        assertEquals("{{ tags|join(\" / \") }}",
                backend.renderVariable(new Variable("tags", null, "join", List.of(" / "), false), context));
        assertTrue(context.getWarnings().isEmpty());
    }

    @Test
    void includePassesPropsWithHash() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("title", "pageTitle");
        props.put("compact", "true");

        assertEquals("{% include 'partials/header.twig' with {title: pageTitle, compact: true} %}",
                render(Element.synthetic("template", new Include("partials/header", props, "Header"), List.of())));
    }

    @Test
    void spreadsAreMergedBeforeExplicitProps() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("...0", "card");
        props.put("...1", "extra");
        props.put("title", "t");

        assertEquals("{% include 'partials/card.twig' with card|merge(extra)|merge({title: t}) %}",
                backend.renderInclude(new Include("partials/card", props, "Card"), "", RenderContext.standalone()));
    }

    @Test
    void includeWithChildrenBecomesEmbed() {
        Element include = Element.synthetic("template", new Include("partials/card"), List.of(span("Body")));

        assertEquals("{% embed 'partials/card.twig' %}\n{% block content %}\n<span>Body</span>\n{% endblock %}\n{% endembed %}",
                render(include));
    }

    @Test
    void slotsBlocksAndExtendsUseInheritance() {
        assertEquals("{% block content %}\n{% endblock %}",
                render(Element.synthetic("template", new Slot(Slot.DEFAULT_NAME), List.of())));
        assertEquals("{% block main %}\n<span>Hi</span>\n{% endblock %}",
                render(Element.synthetic("template", new Block("main"), List.of(span("Hi")))));
        assertEquals("{% extends 'layouts/base.twig' %}",
                render(Element.synthetic("template", Block.extending("layouts/base"), List.of())));
    }

    @Test
    void commentsUseHashDelimiters() {
        assertEquals("{# note #}", backend.renderComment("note"));
    }

    @Test
    void validateReportsUnclosedBlockAndIsIdempotent() {
        ValidationResult result = backend.validate("{% block main %}{{ x }");

        assertFalse(result.valid);
        assertTrue(result.errors.contains("Unbalanced block tags: 1 opening and 0 closing"));
        assertTrue(result.errors.contains("Unbalanced output tags: 1 opening and 0 closing"));
        assertTrue(backend.validate(String.join("\n", result.errors)).valid);
    }

    @Test
    void joinSeparatorKeepsItsSpaces() {
        RenderContext context = RenderContext.standalone();

        assertEquals("{{ tags|join(\", \") }}",
                backend.renderVariable(new Variable("tags", null, "join", List.of(), false), context));
        assertEquals("{{ tags|join(\" / \") }}",
                backend.renderVariable(new Variable("tags", null, "join", List.of(" / "), false), context));
    }

    @Test
    void nestedHashInIncludeValidates() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("title", "title");
        props.put("config", "{ a: 1 }");
        String output = backend.renderInclude(new Include("partials/card", props, null), "", RenderContext.standalone());

        assertEquals("{% include 'partials/card.twig' with {title: title, config: { a: 1 }} %}", output);
        assertTrue(backend.validate("<div>" + output + "{{ title }}</div>").valid);
    }
}
