package rail.lexer;

import rail.cfg.Key;
import rail.cfg.Node;
import rail.grid.Direction;
import rail.grid.Grid;
import rail.grid.Position;

/**
 * Decides where a train goes next. A straight connection always wins;
 * otherwise exactly one of the two bends has to accept the train.
 */
public final class MovementResolver {

    private final Grid grid;

    public MovementResolver(Grid grid) {
        this.grid = grid;
    }

    public Move move(Position p, Direction d) {
        Position ahead = d.primary(p);
        Direction straight = Tracks.straight(d, grid.at(ahead));
        if (straight != null) {
            return new Move.To(new Key(ahead, straight));
        }

        Direction.Secondary bends = d.secondary(p);
        Direction left = Tracks.secondary(d, grid.at(bends.left()));
        Direction right = Tracks.secondary(d, grid.at(bends.right()));

        if (left != null && right != null) return stuck(p, "ambiguous movement");
        if (left != null) return new Move.To(new Key(bends.left(), left));
        if (right != null) return new Move.To(new Key(bends.right(), right));
        return stuck(p, "no possible movement");
    }

    // выход из развилки: только прямое соединение
    public Node force(Position p, Direction d) {
        Position ahead = d.primary(p);
        Direction next = Tracks.straight(d, grid.at(ahead));
        if (next == null) {
            return Node.End.internal(at(p) + "invalid movement out of junction");
        }
        return new Node.Continue(new Key(ahead, next));
    }

    private static Move stuck(Position p, String reason) {
        return new Move.Stuck(at(p) + reason);
    }

    static String at(Position p) {
        return "[" + p.row() + ":" + p.col() + "] ";
    }
}
