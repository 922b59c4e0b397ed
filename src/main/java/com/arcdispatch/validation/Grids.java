package com.arcdispatch.validation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Arrays;

/**
 * Helpers for ARC grids: rectangular integer matrices with cell values 0 to 9.
 */
public final class Grids {

    public static final int MAX_CELL = 9;

    private Grids() {
    }

    /**
     * True for a non-empty array of equally long, non-empty integer rows with cells 0 to 9.
     * Cells outside the int range are rejected before narrowing.
     */
    public static boolean isValidGrid(JsonNode node) {
        if (node == null || !node.isArray() || node.size() == 0) {
            return false;
        }
        int width = -1;
        for (JsonNode row : node) {
            if (!row.isArray() || row.size() == 0) {
                return false;
            }
            if (width < 0) {
                width = row.size();
            } else if (row.size() != width) {
                return false;
            }
            for (JsonNode cell : row) {
                if (!cell.isIntegralNumber() || !cell.canConvertToInt()) {
                    return false;
                }
                int value = cell.asInt();
                if (value < 0 || value > MAX_CELL) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Caller must have checked {@link #isValidGrid}.
     */
    public static int[][] toGrid(JsonNode node) {
        int[][] grid = new int[node.size()][];
        for (int r = 0; r < node.size(); r++) {
            JsonNode row = node.get(r);
            grid[r] = new int[row.size()];
            for (int c = 0; c < row.size(); c++) {
                grid[r][c] = row.get(c).asInt();
            }
        }
        return grid;
    }

    /**
     * Exact cell-by-cell equality. A null on either side never matches.
     */
    public static boolean sameGrid(int[][] a, int[][] b) {
        if (a == null || b == null) {
            return false;
        }
        return Arrays.deepEquals(a, b);
    }

    /**
     * Compact JSON rendering, one row per line.
     */
    public static String format(int[][] grid) {
        if (grid == null) {
            return "[]";
        }
        StringBuilder sb = new StringBuilder("[");
        for (int r = 0; r < grid.length; r++) {
            if (r > 0) {
                sb.append(",\n ");
            }
            sb.append('[');
            for (int c = 0; c < grid[r].length; c++) {
                if (c > 0) {
                    sb.append(',');
                }
                sb.append(grid[r][c]);
            }
            sb.append(']');
        }
        return sb.append(']').toString();
    }
}
