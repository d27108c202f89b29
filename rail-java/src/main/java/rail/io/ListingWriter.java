package rail.io;

import rail.cfg.Command;
import rail.cfg.Key;
import rail.cfg.Node;
import rail.cfg.RailSystem;
import rail.program.Program;
import rail.value.Value;

import java.util.Map;

/**
 * Human-readable dump of compiled graphs:
 * <pre>
 * function 'main'
 *   entry:
 *     goto SE_1_1
 *   SE_1_1:
 *     push "1"
 *     goto E_1_2
 * </pre>
 */
public final class ListingWriter {
    private static final String INDENT = "  ";

    private ListingWriter() {}

    public static String render(Program program) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, RailSystem> fn : program.functions().entrySet()) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(render(fn.getKey(), fn.getValue()));
        }
        return sb.toString();
    }

    public static String render(String name, RailSystem system) {
        StringBuilder sb = new StringBuilder();
        sb.append("function '").append(name).append("'\n");
        sb.append(INDENT).append("entry:\n");
        node(sb, system.entry(), 2);
        for (Map.Entry<Key, Node> e : system.nodes().entrySet()) {
            sb.append(INDENT).append(e.getKey().label()).append(":\n");
            node(sb, e.getValue(), 2);
        }
        return sb.toString();
    }

    public static String command(Command c) {
        if (c instanceof Command.Literal l) return "push " + Value.show(l.value());
        if (c instanceof Command.GetVar g) return "get " + g.name();
        if (c instanceof Command.SetVar s) return "set " + s.name();
        if (c instanceof Command.Call call) return "call " + call.function();
        return ((Command.Builtin) c).op().mnemonic();
    }

    private static void node(StringBuilder sb, Node n, int depth) {
        String pad = INDENT.repeat(depth);
        if (n instanceof Node.Step s) {
            sb.append(pad).append(command(s.command())).append('\n');
            node(sb, s.next(), depth);
        } else if (n instanceof Node.Branch b) {
            sb.append(pad).append("if false:\n");
            node(sb, b.left(), depth + 1);
            sb.append(pad).append("if true:\n");
            node(sb, b.right(), depth + 1);
        } else if (n instanceof Node.Continue c) {
            sb.append(pad).append("goto ").append(c.target().label()).append('\n');
        } else {
            Node.End end = (Node.End) n;
            sb.append(pad).append(switch (end.kind()) {
                case RETURN -> "return";
                case BOOM -> "boom";
                case INTERNAL -> "crash " + Value.show(Value.str(end.message()));
            }).append('\n');
        }
    }
}
