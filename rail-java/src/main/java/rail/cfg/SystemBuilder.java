package rail.cfg;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rail.grid.Direction;
import rail.grid.Grid;
import rail.lexer.ActionLexer;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Builds the control-flow graph of one function. Only keys reachable from
 * the entry are lexed, each exactly once; revisiting a key ends that path,
 * which is what keeps cyclic track finite.
 */
public final class SystemBuilder {
    private static final Logger logger = LoggerFactory.getLogger(SystemBuilder.class);

    // поезд стартует с '$' на юго-восток
    public static final Key DEFAULT_ENTRY = Key.of(0, 0, Direction.SE);

    private final Grid grid;
    private final ActionLexer lexer;
    private final Map<Key, Node> nodes = new HashMap<>();
    private int lexed = 0;

    public SystemBuilder(Grid grid) {
        this.grid = grid;
        this.lexer = new ActionLexer(grid);
    }

    public static RailSystem build(Grid grid) {
        return build(grid, DEFAULT_ENTRY, true);
    }

    public static RailSystem build(Grid grid, Key entry, boolean simplify) {
        RailSystem raw = new SystemBuilder(grid).discover(entry);
        return simplify ? Simplifier.simplify(raw) : raw;
    }

    public RailSystem discover(Key entry) {
        if (!nodes.isEmpty()) throw new IllegalStateException("SystemBuilder already used");

        Deque<Key> pending = new ArrayDeque<>();
        pending.push(entry);

        while (!pending.isEmpty()) {
            Key key = pending.pop();
            if (nodes.containsKey(key)) continue;

            // записываем до обхода продолжений: цикл упрётся в уже известный ключ
            Node node = lexer.lex(key);
            lexed++;
            nodes.put(key, node);

            for (Key next : Node.continues(node)) {
                if (!nodes.containsKey(next)) pending.push(next);
            }
        }

        logger.debug("Discovered {} keys on a {}x{} grid", lexed, grid.rows(), grid.cols());
        return RailSystem.of(new Node.Continue(entry), nodes);
    }

    public int lexed() {
        return lexed;
    }
}
