package com.statespace.core.maze;

/**
 * Immutable maze layout shared by every {@link MazeState} of one problem.
 */
public final class MazeGrid {

    private final int width;
    private final int height;
    private final Cell[][] cells;
    private final int startRow;
    private final int startColumn;

    MazeGrid(Cell[][] cells, int startRow, int startColumn) {
        this.height = cells.length;
        this.width = cells[0].length;
        this.cells = new Cell[height][];
        for (int row = 0; row < height; row++) {
            if (cells[row].length != width) {
                throw new IllegalArgumentException("Maze rows must all have the same width");
            }
            this.cells[row] = cells[row].clone();
        }
        this.startRow = startRow;
        this.startColumn = startColumn;
    }

    /**
     * Parses a grid drawn with the symbols of {@link Cell}. Exactly one start cell is required.
     */
    public static MazeGrid parse(String... rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Maze needs at least one row");
        }
        Cell[][] cells = new Cell[rows.length][];
        int startRow = -1;
        int startColumn = -1;
        for (int row = 0; row < rows.length; row++) {
            cells[row] = new Cell[rows[row].length()];
            for (int column = 0; column < rows[row].length(); column++) {
                Cell cell = fromSymbol(rows[row].charAt(column));
                if (cell == Cell.START) {
                    if (startRow >= 0) {
                        throw new IllegalArgumentException("Maze has more than one start cell");
                    }
                    startRow = row;
                    startColumn = column;
                }
                cells[row][column] = cell;
            }
        }
        if (startRow < 0) {
            throw new IllegalArgumentException("Maze has no start cell");
        }
        return new MazeGrid(cells, startRow, startColumn);
    }

    private static Cell fromSymbol(char symbol) {
        for (Cell cell : Cell.values()) {
            if (cell.symbol() == symbol) {
                return cell;
            }
        }
        throw new IllegalArgumentException("Unknown maze symbol '" + symbol + "'");
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int startRow() {
        return startRow;
    }

    public int startColumn() {
        return startColumn;
    }

    public boolean contains(int row, int column) {
        return row >= 0 && row < height && column >= 0 && column < width;
    }

    public Cell cell(int row, int column) {
        if (!contains(row, column)) {
            throw new IllegalArgumentException("Cell (" + row + ", " + column + ") is outside the maze");
        }
        return cells[row][column];
    }

    /**
     * Renders the grid one text line per row using {@link Cell#symbol()}.
     */
    public String render() {
        StringBuilder builder = new StringBuilder((width + 1) * height);
        for (Cell[] row : cells) {
            for (Cell cell : row) {
                builder.append(cell.symbol());
            }
            builder.append(System.lineSeparator());
        }
        return builder.toString();
    }
}
