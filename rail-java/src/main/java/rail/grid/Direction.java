package rail.grid;

// по часовой стрелке от севера; поворот считается по ordinal mod 8
public enum Direction {
    N(-1, 0),
    NE(-1, 1),
    E(0, 1),
    SE(1, 1),
    S(1, 0),
    SW(1, -1),
    W(0, -1),
    NW(-1, -1);

    private static final Direction[] VALUES = values();

    private final int dr;
    private final int dc;

    Direction(int dr, int dc) {
        this.dr = dr;
        this.dc = dc;
    }

    public Direction rotate(int n) {
        return VALUES[Math.floorMod(ordinal() + n, VALUES.length)];
    }

    public Direction reverse() {
        return rotate(4);
    }

    public Position primary(Position p) {
        return p.offset(dr, dc);
    }

    // left = rotate(-1), right = rotate(+1)
    public Secondary secondary(Position p) {
        return new Secondary(rotate(-1).primary(p), rotate(1).primary(p));
    }

    public record Secondary(Position left, Position right) {}
}
