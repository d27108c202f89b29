package rail.cfg;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Collapses indirections: a {@link Node.Continue} whose target is another
 * Continue or an End is replaced by that target. Keys that are no longer
 * reachable from the entry are dropped afterwards.
 */
public final class Simplifier {
    private final RailSystem system;
    // ключ -> то, чем заменяется Continue(ключ)
    private final Map<Key, Node> resolved = new HashMap<>();

    private Simplifier(RailSystem system) {
        this.system = system;
    }

    public static RailSystem simplify(RailSystem system) {
        Simplifier s = new Simplifier(system);

        Map<Key, Node> rewritten = new TreeMap<>();
        for (Map.Entry<Key, Node> e : system.nodes().entrySet()) {
            rewritten.put(e.getKey(), s.rewrite(e.getValue()));
        }
        Node entry = s.rewrite(system.entry());

        return RailSystem.of(entry, reachable(entry, rewritten));
    }

    private Node rewrite(Node node) {
        if (node instanceof Node.Step s) {
            return new Node.Step(s.command(), rewrite(s.next()));
        }
        if (node instanceof Node.Branch b) {
            return new Node.Branch(rewrite(b.left()), rewrite(b.right()));
        }
        if (node instanceof Node.Continue c) {
            return follow(c.target());
        }
        return node;
    }

    // Every key on the walked path shares the result, so each key is walked once.
    private Node follow(Key start) {
        List<Key> path = new ArrayList<>();
        Set<Key> onPath = new HashSet<>();
        Key current = start;
        Node result;

        while (true) {
            Node known = resolved.get(current);
            if (known != null) {
                result = known;
                break;
            }
            if (!onPath.add(current)) {
                // цикл из одних рельсов
                result = new Node.Continue(current);
                break;
            }
            path.add(current);

            Node target = system.node(current);
            if (target instanceof Node.Continue c) {
                current = c.target();
            } else if (target instanceof Node.End) {
                result = target;
                break;
            } else {
                result = new Node.Continue(current);
                break;
            }
        }

        for (Key k : path) resolved.put(k, result);
        return result;
    }

    private static Map<Key, Node> reachable(Node entry, Map<Key, Node> nodes) {
        Map<Key, Node> kept = new TreeMap<>();
        Deque<Key> pending = new ArrayDeque<>(Node.continues(entry));
        while (!pending.isEmpty()) {
            Key key = pending.pop();
            if (kept.containsKey(key)) continue;
            Node node = nodes.get(key);
            if (node == null) throw new IllegalStateException("Dangling continuation: " + key);
            kept.put(key, node);
            pending.addAll(Node.continues(node));
        }
        return kept;
    }
}
