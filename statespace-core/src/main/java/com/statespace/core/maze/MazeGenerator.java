package com.statespace.core.maze;

import com.statespace.core.InvalidConfigurationException;
import com.statespace.core.ProblemGenerator;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * Builds perfect mazes with a seeded randomized depth-first backtracker.
 *
 * <p>Rooms sit on odd coordinates and walls on even ones, which is why both dimensions must be
 * odd. Start and goal are two distinct rooms chosen at random.
 */
public final class MazeGenerator implements ProblemGenerator {

    private static final int[][] CARVE_STEPS = {{-2, 0}, {2, 0}, {0, -2}, {0, 2}};

    private final int width;
    private final int height;
    private final long seed;

    public MazeGenerator(int width, int height, long seed) {
        if (width % 2 == 0 || height % 2 == 0) {
            throw new InvalidConfigurationException("Width and height must be odd numbers.");
        }
        if (width < 3 || height < 3) {
            throw new InvalidConfigurationException("Width and height must be at least 3.");
        }
        if (((width - 1) / 2) * ((height - 1) / 2) < 2) {
            throw new InvalidConfigurationException("Maze must contain at least two rooms for a start and a goal.");
        }
        this.width = width;
        this.height = height;
        this.seed = seed;
    }

    @Override
    public MazeState generate() {
        return new MazeState(generateGrid());
    }

    /**
     * Generates the grid alone, for callers that only want to display it.
     */
    public MazeGrid generateGrid() {
        Random random = new Random(seed);
        Cell[][] cells = new Cell[height][width];
        for (Cell[] row : cells) {
            Arrays.fill(row, Cell.WALL);
        }

        int startRow = randomRoom(random, height);
        int startColumn = randomRoom(random, width);
        carve(cells, startRow, startColumn, random);
        cells[startRow][startColumn] = Cell.START;

        int goalRow;
        int goalColumn;
        do {
            goalRow = randomRoom(random, height);
            goalColumn = randomRoom(random, width);
        } while (cells[goalRow][goalColumn] != Cell.PATH);
        cells[goalRow][goalColumn] = Cell.GOAL;

        return new MazeGrid(cells, startRow, startColumn);
    }

    private static int randomRoom(Random random, int extent) {
        return random.nextInt((extent - 1) / 2) * 2 + 1;
    }

    private void carve(Cell[][] cells, int startRow, int startColumn, Random random) {
        Deque<Frame> stack = new ArrayDeque<>();
        cells[startRow][startColumn] = Cell.PATH;
        stack.push(new Frame(startRow, startColumn, shuffledSteps(random)));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.next == frame.steps.size()) {
                stack.pop();
                continue;
            }
            int[] step = frame.steps.get(frame.next++);
            int nextRow = frame.row + step[0];
            int nextColumn = frame.column + step[1];
            if (nextRow > 0 && nextRow < height - 1 && nextColumn > 0 && nextColumn < width - 1
                    && cells[nextRow][nextColumn] == Cell.WALL) {
                cells[frame.row + step[0] / 2][frame.column + step[1] / 2] = Cell.PATH;
                cells[nextRow][nextColumn] = Cell.PATH;
                stack.push(new Frame(nextRow, nextColumn, shuffledSteps(random)));
            }
        }
    }

    private static List<int[]> shuffledSteps(Random random) {
        List<int[]> steps = new ArrayList<>(Arrays.asList(CARVE_STEPS));
        Collections.shuffle(steps, random);
        return steps;
    }

    private static final class Frame {

        private final int row;
        private final int column;
        private final List<int[]> steps;
        private int next;

        private Frame(int row, int column, List<int[]> steps) {
            this.row = row;
            this.column = column;
            this.steps = steps;
        }
    }
}
