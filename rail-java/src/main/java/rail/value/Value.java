package rail.value;

// лексер строит только Str и Nil; Pair появляется во время исполнения
public sealed interface Value permits Value.Str, Value.Nil, Value.Pair {

    record Str(String text) implements Value {}

    record Nil() implements Value {}

    record Pair(Value first, Value second) implements Value {}

    Nil NIL = new Nil();

    static Str str(String text) {
        return new Str(text);
    }

    static String show(Value v) {
        if (v instanceof Str s) return quote(s.text());
        if (v instanceof Pair p) return "(" + show(p.first()) + " : " + show(p.second()) + ")";
        return "nil";
    }

    private static String quote(String s) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
