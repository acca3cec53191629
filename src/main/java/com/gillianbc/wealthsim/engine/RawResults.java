package com.gillianbc.wealthsim.engine;

import com.gillianbc.wealthsim.model.YearRecord;
import lombok.Getter;

/**
 * Every path's timeline, indexed {@code [path][yearIndex]}.
 */
public final class RawResults {

    @Getter private final int startYear;
    private final YearRecord[][] rows;

    public RawResults(int startYear, YearRecord[][] rows) {
        this.startYear = startYear;
        this.rows = rows;
    }

    public int pathCount() {
        return rows.length;
    }

    public int yearCount() {
        return rows.length == 0 ? 0 : rows[0].length;
    }

    public YearRecord record(int path, int yearIndex) {
        return rows[path][yearIndex];
    }

    public YearRecord[] timeline(int path) {
        return rows[path].clone();
    }

    public int[] years() {
        int[] years = new int[yearCount()];
        for (int y = 0; y < years.length; y++) {
            years[y] = startYear + y;
        }
        return years;
    }
}
