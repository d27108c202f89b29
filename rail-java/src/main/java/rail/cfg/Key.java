package rail.cfg;

import rail.grid.Direction;
import rail.grid.Position;

public record Key(Position position, Direction direction) implements Comparable<Key> {

    public static Key of(int row, int col, Direction direction) {
        return new Key(new Position(row, col), direction);
    }

    // NE_4_7
    public String label() {
        return direction.name() + "_" + position.row() + "_" + position.col();
    }

    @Override
    public int compareTo(Key o) {
        int c = position.compareTo(o.position);
        return c != 0 ? c : direction.compareTo(o.direction);
    }

    @Override
    public String toString() {
        return position + " " + direction;
    }
}
