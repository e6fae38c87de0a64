package com.statespace.core.maze;

import com.statespace.core.State;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Position of the walker inside a maze. The identifier is the row-major cell index.
 */
public final class MazeState implements State {

    private static final int[] ROW_STEPS = {-1, 1, 0, 0};
    private static final int[] COLUMN_STEPS = {0, 0, -1, 1};

    private final MazeGrid grid;
    private final int row;
    private final int column;
    private final MazeState predecessor;

    /**
     * Creates the root state positioned on the start cell of {@code grid}.
     */
    public MazeState(MazeGrid grid) {
        this(grid, grid.startRow(), grid.startColumn(), null);
    }

    private MazeState(MazeGrid grid, int row, int column, MazeState predecessor) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.row = row;
        this.column = column;
        this.predecessor = predecessor;
    }

    /**
     * Returns the neighbouring open cells in the order up, down, left, right.
     */
    @Override
    public List<State> children() {
        List<State> children = new ArrayList<>(ROW_STEPS.length);
        for (int i = 0; i < ROW_STEPS.length; i++) {
            int nextRow = row + ROW_STEPS[i];
            int nextColumn = column + COLUMN_STEPS[i];
            if (grid.contains(nextRow, nextColumn) && grid.cell(nextRow, nextColumn).isPassable()) {
                children.add(new MazeState(grid, nextRow, nextColumn, this));
            }
        }
        return children;
    }

    @Override
    public boolean isGoal() {
        return grid.cell(row, column) == Cell.GOAL;
    }

    @Override
    public long identifier() {
        return (long) row * grid.width() + column;
    }

    @Override
    public Optional<State> predecessor() {
        return Optional.ofNullable(predecessor);
    }

    public MazeGrid grid() {
        return grid;
    }

    public int row() {
        return row;
    }

    public int column() {
        return column;
    }

    @Override
    public String toString() {
        return "MazeState[row=" + row + ", column=" + column + "]";
    }
}
