package com.statespace.core.maze;

/**
 * Content of a single maze grid cell.
 */
public enum Cell {
    WALL('#'),
    PATH(' '),
    START('S'),
    GOAL('G');

    private final char symbol;

    Cell(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    public boolean isPassable() {
        return this != WALL;
    }
}
