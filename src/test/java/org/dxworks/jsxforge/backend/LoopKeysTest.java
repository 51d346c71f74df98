package org.dxworks.jsxforge.backend;

import org.dxworks.jsxforge.model.AttributeValue;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Variable;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoopKeysTest {

    private static List<Node> reading(String... expressions) {
        List<Node> body = new ArrayList<>();
        for (String expression : expressions) body.add(Element.synthetic("span", new Variable(expression), List.of()));
        return body;
    }

    @Test
    void explicitIdentifierKeyIsAFieldOfTheItem() {
        assertEquals("item.id", LoopKeys.resolve(new Loop("item", "items", "id", null), List.of()));
    }

    @Test
    void explicitExpressionKeyIsKept() {
        assertEquals("item.slug + i", LoopKeys.resolve(new Loop("item", "items", "item.slug + i", "i"), List.of()));
        assertEquals("i", LoopKeys.resolve(new Loop("item", "items", "i", "i"), List.of()));
    }

    @Test
    void idFieldsFollowPriorityOrder() {
        assertEquals("user.id", LoopKeys.resolve(new Loop("user", "users"), reading("user.uuid", "user.id")));
        assertEquals("user.slug", LoopKeys.resolve(new Loop("user", "users"), reading("user.name", "user.slug")));
    }

    @Test
    void fieldEndingInIdIsTheLastResort() {
        assertEquals("row.orderId", LoopKeys.resolve(new Loop("row", "rows"), reading("row.total", "row.orderId")));
    }

    @Test
    void attributeExpressionsCountAsReferences() {
        Element link = new Element("a", Map.of("href", AttributeValue.expression("post.key")), List.of());

        assertEquals("post.key", LoopKeys.resolve(new Loop("post", "posts"), List.of(link)));
    }

    @Test
    void fieldsOfOtherObjectsAreIgnored() {
        assertEquals("index", LoopKeys.resolve(new Loop("item", "items"), reading("other.id", "item.name")));
    }

    @Test
    void indexIsTheFallback() {
        assertEquals("idx", LoopKeys.resolve(new Loop("item", "items", null, "idx"), reading("item.name")));
        assertEquals(LoopKeys.DEFAULT_INDEX, LoopKeys.resolve(new Loop("item", "items"), List.of()));
    }
}
