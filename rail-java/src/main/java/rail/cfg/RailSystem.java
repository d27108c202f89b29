package rail.cfg;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Compiled form of one function: an entry node plus every reachable key.
 * Every key referenced from any node is present in {@link #nodes()}.
 */
public record RailSystem(Node entry, NavigableMap<Key, Node> nodes) {

    public RailSystem {
        nodes = Collections.unmodifiableNavigableMap(new TreeMap<>(nodes));
    }

    public static RailSystem of(Node entry, Map<Key, Node> nodes) {
        return new RailSystem(entry, new TreeMap<>(nodes));
    }

    public Node node(Key key) {
        Node n = nodes.get(key);
        if (n == null) throw new IllegalStateException("Dangling continuation: " + key);
        return n;
    }

    public int size() { return nodes.size(); }
}
