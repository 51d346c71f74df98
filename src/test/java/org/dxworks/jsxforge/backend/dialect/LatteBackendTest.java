package org.dxworks.jsxforge.backend.dialect;

import org.dxworks.jsxforge.backend.RenderContext;
import org.dxworks.jsxforge.backend.TemplateTransformer;
import org.dxworks.jsxforge.model.AttributeValue;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.Root;
import org.dxworks.jsxforge.model.Text;
import org.dxworks.jsxforge.model.ValidationResult;
import org.dxworks.jsxforge.model.annotation.Block;
import org.dxworks.jsxforge.model.annotation.Condition;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Variable;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LatteBackendTest {

    private final LatteBackend backend = new LatteBackend();
    private final TemplateTransformer transformer = new TemplateTransformer();

    private String render(Node... nodes) {
        return transformer.transform(new Root(List.of(nodes)), backend, RenderContext.standalone()).content;
    }

    private static Element span(String text) {
        return new Element("span", Map.of(), List.of(new Text(text)));
    }

    @Test
    void loopRendersForeachWithSigils() {
        Element li = new Element("li", Map.of(), List.of(Element.synthetic("span", new Variable("item.name"), List.of())));
        Element loop = Element.synthetic("template", new Loop("item", "items"), List.of(li));

        assertEquals("{foreach $items as $item}\n<li>{$item->name}</li>\n{/foreach}", render(loop));
    }

    @Test
    void loopWithIndexUsesKeyArrow() {
        Element loop = Element.synthetic("template", new Loop("row", "data.rows", null, "i"), List.of(span("x")));

        assertEquals("{foreach $data->rows as $i => $row}\n<span>x</span>\n{/foreach}", render(loop));
    }

    @Test
    void conditionChainUsesLatteTags() {
        String output = render(
                Element.synthetic("template", Condition.ifTrue("a"), List.of(span("A"))),
                Element.synthetic("template", Condition.elseIf("b"), List.of(span("B"))),
                Element.synthetic("template", Condition.otherwise(), List.of(span("C"))));

        assertEquals("{if $a}\n<span>A</span>\n{elseif $b}\n<span>B</span>\n{else}\n<span>C</span>\n{/if}", output);
    }

    @Test
    void expressionsBecomePhp() {
        assertEquals("$status === 'active' && !$hidden", backend.formatExpression("status === 'active' && !hidden"));
        assertEquals("$user?->name", backend.formatExpression("user?.name"));
        assertEquals("count($items) > 0", backend.formatExpression("items.length > 0"));
        assertEquals("$x !== null", backend.formatExpression("x !== undefined"));
    }

    @Test
    void variablesWithDefaultsFiltersAndRaw() {
        RenderContext context = RenderContext.standalone();

        assertEquals("{$title ?? \"Untitled\"}", backend.renderVariable(new Variable("title").withDefault("Untitled"), context));
        assertEquals("{($title ?? \"Untitled\")|upper}",
                backend.renderVariable(new Variable("title", "Untitled", "uppercase", List.of(), false), context));
        assertEquals("{$price|number:2, ',', ' '}",
                backend.renderVariable(new Variable("price", null, "currency", List.of(), false), context));
        assertEquals("{$body|noescape}", backend.renderVariable(new Variable("body").asRaw(), context));
    }

    @Test
    void includePassesNamedArgumentsAndExpandsSpreads() {
        Map<String, String> props = new LinkedHashMap<>();
        props.put("title", "t");
        props.put("...0", "card");

        assertEquals("{include 'partials/card.latte', title: $t, (expand) $card}",
                backend.renderInclude(new Include("partials/card", props, "Card"), "", RenderContext.standalone()));
    }

    @Test
    void includeWithChildrenBecomesEmbed() {
        Element include = Element.synthetic("template", new Include("partials/card"), List.of(span("Body")));

        assertEquals("{embed 'partials/card.latte'}\n{block content}\n<span>Body</span>\n{/block}\n{/embed}",
                render(include));
    }

    @Test
    void extendsIsALayoutTag() {
        assertEquals("{layout 'layouts/base.latte'}",
                render(Element.synthetic("template", Block.extending("layouts/base"), List.of())));
        assertEquals("{block main}\n<span>Hi</span>\n{/block}",
                render(Element.synthetic("template", new Block("main"), List.of(span("Hi")))));
    }

    @Test
    void attributeExpressionsAreSingleBraced() {
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        attributes.put("href", AttributeValue.expression("item.url"));

        assertEquals("<a href=\"{$item->url}\">Go</a>", render(new Element("a", attributes, List.of(new Text("Go")))));
    }

    @Test
    void validateReportsUnclosedTagsAndIsIdempotent() {
        ValidationResult result = backend.validate("{if $a}x");

        assertEquals(List.of("Unbalanced block tags: 1 opening and 0 closing"), result.errors);
        assertTrue(backend.validate(String.join("\n", result.errors)).valid);
    }

    @Test
    void commentsUseStarDelimiters() {
        assertEquals("{* note *}", backend.renderComment("note"));
    }

    @Test
    void joinSeparatorKeepsItsSpaces() {
        RenderContext context = RenderContext.standalone();

        assertEquals("{$tags|implode:\", \"}",
                backend.renderVariable(new Variable("tags", null, "join", List.of(), false), context));
        assertEquals("{$tags|implode:\" / \"}",
                backend.renderVariable(new Variable("tags", null, "join", List.of(" / "), false), context));
    }
}
