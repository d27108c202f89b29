package rail.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import rail.cfg.Command;
import rail.cfg.Command.Op;
import rail.cfg.Key;
import rail.cfg.Node;
import rail.grid.Direction;
import rail.grid.Grid;
import rail.value.Value;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static rail.grid.Direction.*;

public class ActionLexerTest {

    private static Node lex(String src, int row, int col, Direction d) {
        return new ActionLexer(Grid.of(src)).lex(Key.of(row, col, d));
    }

    private static Node.End assertInternal(Node n, String fragment) {
        var end = assertInstanceOf(Node.End.class, n);
        assertEquals(Node.End.Kind.INTERNAL, end.kind());
        assertTrue(end.message().contains(fragment), end.message());
        return end;
    }

    @Test
    void terminals() {
        assertEquals(Node.End.ret(), lex("#", 0, 0, E));
        assertEquals(Node.End.boom(), lex("b", 0, 0, E));
        assertNull(Node.End.boom().message());
    }

    static Stream<Arguments> builtins() {
        return Stream.of(
                Arguments.of('e', Op.EOF), Arguments.of('i', Op.INPUT),
                Arguments.of('o', Op.OUTPUT), Arguments.of('u', Op.UNDERFLOW),
                Arguments.of('a', Op.ADD), Arguments.of('d', Op.DIV),
                Arguments.of('m', Op.MULT), Arguments.of('r', Op.REM),
                Arguments.of('s', Op.SUB), Arguments.of('c', Op.CUT),
                Arguments.of('p', Op.APPEND), Arguments.of('z', Op.SIZE),
                Arguments.of(':', Op.CONS), Arguments.of('~', Op.UNCONS),
                Arguments.of('?', Op.TYPE), Arguments.of('g', Op.GREATER),
                Arguments.of('q', Op.EQUAL)
        );
    }

    @ParameterizedTest
    @MethodSource("builtins")
    void builtin_glyphs_emit_command_then_move(char glyph, Op op) {
        var n = lex(glyph + "-", 0, 0, E);
        assertEquals(new Node.Step(new Command.Builtin(op), new Node.Continue(Key.of(0, 1, E))), n);
        assertEquals(glyph, op.glyph());
    }

    @Test
    void every_builtin_glyph_is_lexed() {
        for (Op op : Op.values()) {
            var step = assertInstanceOf(Node.Step.class, lex(op.glyph() + "-", 0, 0, E), op.name());
            assertEquals(new Command.Builtin(op), step.command());
        }
    }

    @Test
    void digits_and_boolean_sugar_push_strings() {
        assertEquals(new Node.Step(new Command.Literal(Value.str("7")), new Node.Continue(Key.of(0, 1, E))),
                lex("7-", 0, 0, E));
        assertEquals(new Command.Literal(Value.str("0")), ((Node.Step) lex("f-", 0, 0, E)).command());
        assertEquals(new Command.Literal(Value.str("1")), ((Node.Step) lex("t-", 0, 0, E)).command());
        assertEquals(new Command.Literal(Value.NIL), ((Node.Step) lex("n-", 0, 0, E)).command());
    }

    @Test
    void command_without_exit_keeps_command_and_fails_movement() {
        var step = assertInstanceOf(Node.Step.class, lex("o", 0, 0, E));
        assertEquals(new Command.Builtin(Op.OUTPUT), step.command());
        assertInternal(step.next(), "no possible movement");
    }

    @Test
    void plain_track_advances_without_command() {
        assertEquals(new Node.Continue(Key.of(0, 2, E)), lex("--#", 0, 1, E));
        assertEquals(new Node.Continue(Key.of(1, 1, SE)), lex("$\n \\", 0, 0, SE));
        assertInternal(lex("- -", 0, 0, E), "no possible movement");
    }

    @Test
    void string_literal_continues_after_closing_bracket() {
        var n = lex("[hello\\nworld]-#", 0, 0, E);
        assertEquals(new Node.Step(new Command.Literal(Value.str("hello\nworld")),
                new Node.Continue(Key.of(0, 14, E))), n);
    }

    @Test
    void unterminated_string_is_internal_error() {
        assertInternal(lex("[abc", 0, 0, E), "lex error: invalid string literal");
    }

    @Test
    void variables_and_calls() {
        assertEquals(new Node.Step(new Command.GetVar("x"), new Node.Continue(Key.of(0, 3, E))),
                lex("(x)-", 0, 0, E));
        assertEquals(new Command.SetVar("x"), ((Node.Step) lex("(!x!)-", 0, 0, E)).command());
        assertEquals(new Command.SetVar("x"), ((Node.Step) lex("-(!x!)", 0, 5, W)).command());
        assertEquals(new Command.Call("foo"), ((Node.Step) lex("{foo}-", 0, 0, E)).command());
        assertEquals(new Command.Call("foo"), ((Node.Step) lex("-}oof{", 0, 5, W)).command());
    }

    @Test
    void malformed_names_are_internal_errors() {
        assertInternal(lex("(x", 0, 0, E), "variable get");
        assertInternal(lex("(!x)", 0, 0, E), "variable set");
        assertInternal(lex("{!f!}", 0, 0, E), "function call");
    }

    @Test
    void junction_v_heading_north_forks_left_and_right() {
        var src = """
                \\ /
                 v
                """;
        var n = lex(src, 1, 1, N);
        assertEquals(new Node.Branch(
                new Node.Continue(Key.of(0, 0, NW)),
                new Node.Continue(Key.of(0, 2, NE))), n);
    }

    @Test
    void junction_entered_from_unsupported_side_is_internal_error() {
        var src = """
                \\ /
                 v
                """;
        assertInternal(lex(src, 1, 1, E), "junction");
    }

    @Test
    void junction_arm_without_track_is_internal_error() {
        var b = assertInstanceOf(Node.Branch.class, lex("\\\n v", 1, 1, N));
        assertEquals(new Node.Continue(Key.of(0, 0, NW)), b.left());
        assertInternal(b.right(), "invalid movement out of junction");
    }

    @Test
    void all_junction_shapes() {
        // '<' с востока: вверх-вправо и вниз-вправо
        var lt = assertInstanceOf(Node.Branch.class, lex("  /\n-<\n  \\", 1, 1, E));
        assertEquals(new Node.Continue(Key.of(0, 2, NE)), lt.left());
        assertEquals(new Node.Continue(Key.of(2, 2, SE)), lt.right());

        var gt = assertInstanceOf(Node.Branch.class, lex("\\\n >-\n/", 1, 1, W));
        assertEquals(new Node.Continue(Key.of(2, 0, SW)), gt.left());
        assertEquals(new Node.Continue(Key.of(0, 0, NW)), gt.right());

        var up = assertInstanceOf(Node.Branch.class, lex(" |\n ^\n/ \\", 1, 1, S));
        assertEquals(new Node.Continue(Key.of(2, 2, SE)), up.left());
        assertEquals(new Node.Continue(Key.of(2, 0, SW)), up.right());

        // боковой вход в 'v': наискосок вверх и прямо вниз
        var side = assertInstanceOf(Node.Branch.class, lex("\\ /\n v\n |", 1, 1, SE));
        assertEquals(new Node.Continue(Key.of(0, 2, NE)), side.left());
        assertEquals(new Node.Continue(Key.of(2, 1, S)), side.right());
    }
}
