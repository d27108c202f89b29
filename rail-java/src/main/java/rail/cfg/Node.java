package rail.cfg;

import java.util.ArrayList;
import java.util.List;

/**
 * Control-flow graph node attached to a {@link Key}.
 * The lexer always puts a {@link Continue} or an {@link End} into
 * {@link Step#next()} and into both branch arms.
 */
public sealed interface Node permits Node.Step, Node.Branch, Node.Continue, Node.End {

    record Step(Command command, Node next) implements Node {}

    // true -> right, false -> left
    record Branch(Node left, Node right) implements Node {}

    record Continue(Key target) implements Node {}

    record End(Kind kind, String message) implements Node {
        public enum Kind { RETURN, BOOM, INTERNAL }

        private static final End RETURN = new End(Kind.RETURN, null);
        private static final End BOOM = new End(Kind.BOOM, null);

        public static End ret() { return RETURN; }

        // сообщение берётся со стека во время исполнения
        public static End boom() { return BOOM; }

        public static End internal(String message) {
            return new End(Kind.INTERNAL, message);
        }
    }

    static List<Key> continues(Node node) {
        List<Key> out = new ArrayList<>();
        collect(node, out);
        return out;
    }

    private static void collect(Node node, List<Key> out) {
        if (node instanceof Step s) {
            collect(s.next(), out);
        } else if (node instanceof Branch b) {
            collect(b.left(), out);
            collect(b.right(), out);
        } else if (node instanceof Continue c) {
            out.add(c.target());
        }
    }
}
