package rail.cfg;

import rail.value.Value;

public sealed interface Command
        permits Command.Literal, Command.GetVar, Command.SetVar, Command.Call, Command.Builtin {

    record Literal(Value value) implements Command {}

    record GetVar(String name) implements Command {}

    // pop в переменную
    record SetVar(String name) implements Command {}

    record Call(String function) implements Command {}

    record Builtin(Op op) implements Command {}

    enum Op {
        EOF('e'),
        INPUT('i'),
        OUTPUT('o'),
        UNDERFLOW('u'),

        ADD('a'),
        SUB('s'),
        MULT('m'),
        DIV('d'),
        REM('r'),

        CUT('c'),
        APPEND('p'),
        SIZE('z'),

        CONS(':'),
        UNCONS('~'),

        TYPE('?'),
        GREATER('g'),
        EQUAL('q');

        private final char glyph;

        Op(char glyph) {
            this.glyph = glyph;
        }

        public char glyph() { return glyph; }

        // builtin_add и т.п. на стороне бэкенда
        public String mnemonic() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }
}
