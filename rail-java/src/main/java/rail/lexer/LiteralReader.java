package rail.lexer;

import rail.grid.Direction;
import rail.grid.Grid;
import rail.grid.Position;

import java.util.List;

/**
 * Reads the inline literals a train passes over: string constants between
 * brackets and names between parentheses or braces. Reading always goes in
 * the train's direction, starting just after the opening glyph.
 */
public final class LiteralReader {

    public record Text(String text, Position end) {}

    public record Name(String name, boolean set, Position end) {}

    private static final String NOT_IN_NAMES = "{}!()'";

    private final Grid grid;

    public LiteralReader(Grid grid) {
        this.grid = grid;
    }

    /**
     * Reads a string constant. Escapes: {@code \\}, {@code \n}, {@code \t};
     * a backslash before any other character keeps that character.
     *
     * @param open position of the opening bracket
     * @param close the bracket that ends the constant
     */
    public Text readString(Position open, Direction d, char close) {
        List<Position> cells = grid.ray(open, d);
        StringBuilder sb = new StringBuilder();

        int i = 1;
        while (i < cells.size()) {
            char c = grid.at(cells.get(i));
            if (c == '\\') {
                if (i + 1 >= cells.size()) break;
                char e = grid.at(cells.get(i + 1));
                sb.append(switch (e) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> e;
                });
                i += 2;
            } else if (c == close) {
                return new Text(sb.toString(), cells.get(i));
            } else {
                sb.append(c);
                i++;
            }
        }
        throw new LexerException(open, "lex error: invalid string literal");
    }

    // allowSet == false для вызова функции: {!f!} запрещено
    public Name readName(Position open, Direction d, char close, boolean allowSet) {
        List<Position> cells = grid.ray(open, d);
        String what = allowSet ? "variable get" : "function call";

        if (cells.size() < 2) {
            throw new LexerException(open, "lex error: invalid " + (allowSet ? "variable get/set" : what));
        }

        boolean set = allowSet && grid.at(cells.get(1)) == '!';
        int i = set ? 2 : 1;
        if (set) what = "variable set";

        StringBuilder name = new StringBuilder();
        while (i < cells.size() && isNameChar(grid.at(cells.get(i)))) {
            name.append(grid.at(cells.get(i)));
            i++;
        }

        if (set) {
            if (i >= cells.size() || grid.at(cells.get(i)) != '!') {
                throw new LexerException(open, "lex error: invalid " + what);
            }
            i++;
        }
        if (i >= cells.size() || grid.at(cells.get(i)) != close) {
            throw new LexerException(open, "lex error: invalid " + what);
        }
        return new Name(name.toString(), set, cells.get(i));
    }

    public static boolean isNameChar(char c) {
        return NOT_IN_NAMES.indexOf(c) < 0;
    }
}
