package rail.lexer;

import rail.grid.Direction;

import static rail.grid.Direction.*;

/**
 * Per-glyph connection tables. Both lookups return the heading a train has
 * after entering the glyph, or {@code null} if it cannot enter.
 */
public final class Tracks {
    private Tracks() {}

    public static Direction straight(Direction d, char c) {
        return switch (c) {
            case ' ' -> null; // единственный символ без прямого входа
            case '-' -> switch (d) {
                case E, NE, SE -> E;
                case W, NW, SW -> W;
                default -> null;
            };
            case '|' -> switch (d) {
                case N, NE, NW -> N;
                case S, SE, SW -> S;
                default -> null;
            };
            case '/' -> switch (d) {
                case N, E, NE -> NE;
                case S, W, SW -> SW;
                default -> null;
            };
            case '\\' -> switch (d) {
                case N, W, NW -> NW;
                case S, E, SE -> SE;
                default -> null;
            };
            case '+' -> accepts(d, N, S, E, W);
            case 'x' -> accepts(d, NW, NE, SW, SE);
            case '@' -> d.reverse();
            case 'v' -> accepts(d, N, SE, SW);
            case '^' -> accepts(d, S, NW, NE);
            case '>' -> accepts(d, W, SE, NE);
            case '<' -> accepts(d, E, NW, SW);
            default -> d; // universal connector
        };
    }

    // через изгиб 45° входят только - | / \
    public static Direction secondary(Direction d, char c) {
        return switch (c) {
            case '-' -> switch (d) {
                case NE, SE -> E;
                case NW, SW -> W;
                default -> null;
            };
            case '|' -> switch (d) {
                case NE, NW -> N;
                case SE, SW -> S;
                default -> null;
            };
            case '/' -> switch (d) {
                case N, E -> NE;
                case S, W -> SW;
                default -> null;
            };
            case '\\' -> switch (d) {
                case N, W -> NW;
                case S, E -> SE;
                default -> null;
            };
            default -> null;
        };
    }

    private static Direction accepts(Direction d, Direction... allowed) {
        for (Direction a : allowed) {
            if (a == d) return d;
        }
        return null;
    }
}
