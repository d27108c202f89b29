package rail.grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable rectangular character surface of one function body.
 * Reads outside the bounds yield a space.
 */
public final class Grid {
    public static final int TAB_WIDTH = 4;

    private final char[][] cells;
    private final int rows;
    private final int cols;

    private Grid(char[][] cells, int rows, int cols) {
        this.cells = cells;
        this.rows = rows;
        this.cols = cols;
    }

    public static Grid of(String source) {
        String text = source.replace("\r", "").replace("\t", " ".repeat(TAB_WIDTH));

        List<String> lines = new ArrayList<>(List.of(text.split("\n", -1)));
        // "abc\n" -> одна строка, не две
        if (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }

        int width = 1;
        for (String line : lines) width = Math.max(width, line.length());
        int height = Math.max(1, lines.size());

        char[][] cells = new char[height][width];
        for (int r = 0; r < height; r++) {
            String line = r < lines.size() ? lines.get(r) : "";
            for (int c = 0; c < width; c++) {
                cells[r][c] = c < line.length() ? line.charAt(c) : ' ';
            }
        }
        return new Grid(cells, height, width);
    }

    public int rows() { return rows; }

    public int cols() { return cols; }

    public boolean inBounds(Position p) {
        return p.row() >= 0 && p.row() < rows && p.col() >= 0 && p.col() < cols;
    }

    public char at(Position p) {
        return inBounds(p) ? cells[p.row()][p.col()] : ' ';
    }

    public char at(int row, int col) {
        return at(new Position(row, col));
    }

    // start включительно, до края сетки
    public List<Position> ray(Position start, Direction d) {
        List<Position> out = new ArrayList<>();
        for (Position p = start; inBounds(p); p = d.primary(p)) {
            out.add(p);
        }
        return out;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < rows; r++) {
            if (r > 0) sb.append('\n');
            sb.append(cells[r]);
        }
        return sb.toString();
    }
}
