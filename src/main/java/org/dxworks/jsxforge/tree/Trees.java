package org.dxworks.jsxforge.tree;

import org.dxworks.jsxforge.expression.ExpressionTokenizer;
import org.dxworks.jsxforge.expression.KnownGlobals;
import org.dxworks.jsxforge.model.Element;
import org.dxworks.jsxforge.model.Node;
import org.dxworks.jsxforge.model.Root;
import org.dxworks.jsxforge.model.Text;
import org.dxworks.jsxforge.model.annotation.Annotation;
import org.dxworks.jsxforge.model.annotation.Condition;
import org.dxworks.jsxforge.model.annotation.Include;
import org.dxworks.jsxforge.model.annotation.Loop;
import org.dxworks.jsxforge.model.annotation.Variable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Traversal, rewriting and query algorithms over the intermediate tree. All rewriting
 * operations return new trees and leave their input untouched.
 */
public final class Trees {

    private Trees() {
    }

    // --- Visiting ---

    /**
     * Walks the tree depth-first.
     *
     * @return false if the visitor aborted the walk
     */
    public static boolean visit(Node tree, TreeVisitor visitor) {
        return walk(tree, null, 0, visitor);
    }

    public static void forEach(Node tree, Consumer<Node> action) {
        visit(tree, (node, parent, depth) -> {
            action.accept(node);
            return VisitAction.CONTINUE;
        });
    }

    public static void visitElements(Node tree, Consumer<Element> action) {
        forEach(tree, node -> {
            if (node instanceof Element element) action.accept(element);
        });
    }

    public static void visitText(Node tree, Consumer<Text> action) {
        forEach(tree, node -> {
            if (node instanceof Text text) action.accept(text);
        });
    }

    private static boolean walk(Node node, Node parent, int depth, TreeVisitor visitor) {
        VisitAction action = visitor.enter(node, parent, depth);
        if (action == VisitAction.ABORT) return false;
        if (action != VisitAction.SKIP_CHILDREN) {
            for (Node child : childrenOf(node)) {
                if (!walk(child, node, depth + 1, visitor)) return false;
            }
        }
        visitor.exit(node, parent, depth);
        return true;
    }

    public static List<Node> childrenOf(Node node) {
        if (node instanceof Element element) return element.children;
        if (node instanceof Root root) return root.children;
        return List.of();
    }

    // --- Rewriting ---

    /**
     * Rebuilds the tree bottom-up: children are mapped before the function sees their parent.
     */
    public static Node map(Node tree, UnaryOperator<Node> fn) {
        Node rebuilt = tree;
        if (tree instanceof Element element) {
            rebuilt = element.withChildren(mapAll(element.children, fn));
        } else if (tree instanceof Root root) {
            rebuilt = root.withChildren(mapAll(root.children, fn));
        }
        return fn.apply(rebuilt);
    }

    public static Root mapRoot(Root root, UnaryOperator<Node> fn) {
        Node mapped = map(root, fn);
        if (!(mapped instanceof Root result)) {
            throw new IllegalStateException("Mapping function must return a Root for the root node");
        }
        return result;
    }

    private static List<Node> mapAll(List<Node> nodes, UnaryOperator<Node> fn) {
        List<Node> result = new ArrayList<>(nodes.size());
        for (Node child : nodes) result.add(map(child, fn));
        return result;
    }

    /**
     * Keeps the nodes accepted by the predicate. A rejected node takes its whole subtree with it;
     * a rejected root gives an empty result.
     */
    public static Optional<Node> filter(Node tree, Predicate<Node> keep) {
        if (!keep.test(tree)) return Optional.empty();
        if (tree instanceof Element element) {
            return Optional.of(element.withChildren(filterAll(element.children, keep)));
        }
        if (tree instanceof Root root) {
            return Optional.of(root.withChildren(filterAll(root.children, keep)));
        }
        return Optional.of(tree);
    }

    public static Optional<Node> remove(Node tree, Predicate<Node> drop) {
        return filter(tree, drop.negate());
    }

    private static List<Node> filterAll(List<Node> nodes, Predicate<Node> keep) {
        List<Node> result = new ArrayList<>();
        for (Node child : nodes) filter(child, keep).ifPresent(result::add);
        return result;
    }

    // --- Queries ---

    public static Optional<Node> find(Node tree, Predicate<Node> predicate) {
        Node[] found = new Node[1];
        visit(tree, (node, parent, depth) -> {
            if (predicate.test(node)) {
                found[0] = node;
                return VisitAction.ABORT;
            }
            return VisitAction.CONTINUE;
        });
        return Optional.ofNullable(found[0]);
    }

    public static List<Node> findAll(Node tree, Predicate<Node> predicate) {
        List<Node> result = new ArrayList<>();
        forEach(tree, node -> {
            if (predicate.test(node)) result.add(node);
        });
        return result;
    }

    public static Optional<Element> findByTag(Node tree, String tag) {
        return find(tree, node -> node instanceof Element e && e.tag.equals(tag)).map(Element.class::cast);
    }

    public static List<Element> findAllByTag(Node tree, String tag) {
        return findElements(tree, e -> e.tag.equals(tag));
    }

    public static Optional<Element> findById(Node tree, String id) {
        return find(tree, node -> node instanceof Element e && id.equals(e.getId())).map(Element.class::cast);
    }

    public static List<Element> findByClass(Node tree, String className) {
        return findElements(tree, e -> e.getClassNames().contains(className));
    }

    public static List<Element> findByAnnotation(Node tree, Class<? extends Annotation> type) {
        return findElements(tree, e -> type.isInstance(e.annotation));
    }

    public static List<Element> findElements(Node tree, Predicate<Element> predicate) {
        List<Element> result = new ArrayList<>();
        visitElements(tree, element -> {
            if (predicate.test(element)) result.add(element);
        });
        return result;
    }

    // --- Diagnostics ---

    public static int countNodes(Node tree) {
        int[] count = new int[1];
        forEach(tree, node -> count[0]++);
        return count[0];
    }

    /**
     * Node counts keyed by element tag, or by lower-case node type for everything else.
     */
    public static Map<String, Integer> countByType(Node tree) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        forEach(tree, node -> {
            String key = node instanceof Element e ? e.tag : node.getType().name().toLowerCase();
            counts.merge(key, 1, Integer::sum);
        });
        return counts;
    }

    public static int getDepth(Node tree) {
        int[] max = new int[1];
        visit(tree, (node, parent, depth) -> {
            max[0] = Math.max(max[0], depth + 1);
            return VisitAction.CONTINUE;
        });
        return max[0];
    }

    // --- Collection ---

    /**
     * Free variables referenced by the tree's annotations, in first-occurrence order. Each
     * reference is reduced to its root identifier; globals, keywords and names bound by an
     * enclosing loop are left out.
     */
    public static List<String> collectVariables(Node tree) {
        Set<String> variables = new LinkedHashSet<>();
        collectVariables(tree, new HashSet<>(), variables);
        return new ArrayList<>(variables);
    }

    private static void collectVariables(Node node, Set<String> bound, Set<String> out) {
        Set<String> scope = bound;
        if (node instanceof Element element && element.annotation != null) {
            Annotation annotation = element.annotation;
            if (annotation instanceof Variable variable) {
                addRoots(variable.name, bound, out);
            } else if (annotation instanceof Loop loop) {
                addRoots(loop.collection, bound, out);
                scope = new HashSet<>(bound);
                scope.add(loop.item);
                if (loop.index != null) scope.add(loop.index);
                if (loop.key != null) addRoots(loop.key, scope, out);
            } else if (annotation instanceof Condition condition && condition.expression != null) {
                addRoots(condition.expression, bound, out);
            } else if (annotation instanceof Include include) {
                for (String value : include.props.values()) addRoots(value, bound, out);
            }
        }
        for (Node child : childrenOf(node)) {
            collectVariables(child, scope, out);
        }
    }

    private static void addRoots(String expression, Set<String> bound, Set<String> out) {
        for (String root : ExpressionTokenizer.rootIdentifiers(expression)) {
            if (!bound.contains(root) && !KnownGlobals.isExcluded(root)) out.add(root);
        }
    }

    /**
     * Included partials in first-occurrence order.
     */
    public static List<String> collectDependencies(Node tree) {
        Set<String> dependencies = new LinkedHashSet<>();
        visitElements(tree, element -> {
            if (element.annotation instanceof Include include) dependencies.add(include.partial);
        });
        return new ArrayList<>(dependencies);
    }
}
