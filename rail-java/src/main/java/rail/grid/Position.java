package rail.grid;

public record Position(int row, int col) implements Comparable<Position> {

    public Position offset(int dr, int dc) {
        return new Position(row + dr, col + dc);
    }

    @Override
    public int compareTo(Position o) {
        int c = Integer.compare(row, o.row);
        return c != 0 ? c : Integer.compare(col, o.col);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
