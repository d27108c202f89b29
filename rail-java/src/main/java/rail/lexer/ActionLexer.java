package rail.lexer;

import rail.cfg.Command;
import rail.cfg.Command.Op;
import rail.cfg.Key;
import rail.cfg.Node;
import rail.grid.Direction;
import rail.grid.Grid;
import rail.grid.Position;
import rail.value.Value;

import java.util.HashMap;
import java.util.Map;

import static rail.grid.Direction.*;

/**
 * Turns the glyph under a train into a graph node. Lexing never throws:
 * malformed literals and bad movement become {@link Node.End#internal}.
 */
public final class ActionLexer {

    private static final Map<Character, Op> BUILTINS = new HashMap<>();

    static {
        for (Op op : Op.values()) BUILTINS.put(op.glyph(), op);
    }

    private final Grid grid;
    private final MovementResolver movement;
    private final LiteralReader literals;

    public ActionLexer(Grid grid) {
        this.grid = grid;
        this.movement = new MovementResolver(grid);
        this.literals = new LiteralReader(grid);
    }

    public Node lex(Key key) {
        Position p = key.position();
        Direction d = key.direction();
        char c = grid.at(p);

        try {
            return switch (c) {
                case '#' -> Node.End.ret();
                case 'b' -> Node.End.boom();

                case 'n' -> step(new Command.Literal(Value.NIL), p, d);
                case 'f' -> step(digit('0'), p, d);
                case 't' -> step(digit('1'), p, d);

                case '[' -> stringLiteral(p, d, ']');
                case ']' -> stringLiteral(p, d, '[');

                case '(' -> variable(p, d, ')');
                case ')' -> variable(p, d, '(');

                case '{' -> call(p, d, '}');
                case '}' -> call(p, d, '{');

                // Y-junctions
                case 'v' -> switch (d) {
                    case N -> junction(p, NW, NE);
                    case SE -> junction(p, NE, S);
                    case SW -> junction(p, S, NW);
                    default -> junctionError(c, p, d);
                };
                case '^' -> switch (d) {
                    case S -> junction(p, SE, SW);
                    case NW -> junction(p, SW, N);
                    case NE -> junction(p, N, SE);
                    default -> junctionError(c, p, d);
                };
                case '>' -> switch (d) {
                    case W -> junction(p, SW, NW);
                    case NE -> junction(p, NW, E);
                    case SE -> junction(p, E, SW);
                    default -> junctionError(c, p, d);
                };
                case '<' -> switch (d) {
                    case E -> junction(p, NE, SE);
                    case SW -> junction(p, SE, W);
                    case NW -> junction(p, W, NE);
                    default -> junctionError(c, p, d);
                };

                default -> {
                    if (c >= '0' && c <= '9') yield step(digit(c), p, d);
                    Op op = BUILTINS.get(c);
                    if (op != null) yield step(new Command.Builtin(op), p, d);
                    yield movement.move(p, d).toNode();
                }
            };
        } catch (LexerException e) {
            return Node.End.internal(e.getMessage());
        }
    }

    // ================= helpers =================

    private Node step(Command command, Position from, Direction d) {
        return new Node.Step(command, movement.move(from, d).toNode());
    }

    private Node stringLiteral(Position p, Direction d, char close) {
        LiteralReader.Text t = literals.readString(p, d, close);
        return step(new Command.Literal(Value.str(t.text())), t.end(), d);
    }

    private Node variable(Position p, Direction d, char close) {
        LiteralReader.Name n = literals.readName(p, d, close, true);
        Command cmd = n.set() ? new Command.SetVar(n.name()) : new Command.GetVar(n.name());
        return step(cmd, n.end(), d);
    }

    private Node call(Position p, Direction d, char close) {
        LiteralReader.Name n = literals.readName(p, d, close, false);
        return step(new Command.Call(n.name()), n.end(), d);
    }

    private Node junction(Position p, Direction left, Direction right) {
        return new Node.Branch(movement.force(p, left), movement.force(p, right));
    }

    private static Node junctionError(char c, Position p, Direction d) {
        return Node.End.internal(MovementResolver.at(p)
                + "internal junction error: '" + c + "' entered heading " + d);
    }

    private static Command digit(char c) {
        return new Command.Literal(Value.str(String.valueOf(c)));
    }
}
