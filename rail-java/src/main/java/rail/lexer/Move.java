package rail.lexer;

import rail.cfg.Key;
import rail.cfg.Node;

public sealed interface Move permits Move.To, Move.Stuck {

    record To(Key key) implements Move {}

    record Stuck(String reason) implements Move {}

    default Node toNode() {
        if (this instanceof To to) return new Node.Continue(to.key());
        return Node.End.internal(((Stuck) this).reason());
    }
}
