package rail.lexer;

import rail.grid.Position;

public class LexerException extends RuntimeException {
    private final Position position;

    public LexerException(Position position, String message) {
        super(MovementResolver.at(position) + message);
        this.position = position;
    }

    public Position position() {
        return position;
    }
}
