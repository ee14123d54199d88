package com.spreadsheet.formula.config;

import com.spreadsheet.formula.models.SheetBounds;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for newly created sheets, bound from "spreadsheet.*" properties.
 */
@ConfigurationProperties(prefix = "spreadsheet")
public class SheetProperties {

    // Column count C; A..Z by default
    private int columns = 26;

    // Row count R
    private int rows = 100;

    // Versions kept per sheet; 0 keeps every version
    private int historyLimit = 0;

    public int getColumns() {
        return columns;
    }

    public void setColumns(int columns) {
        this.columns = columns;
    }

    public int getRows() {
        return rows;
    }

    public void setRows(int rows) {
        this.rows = rows;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public SheetBounds toBounds() {
        return new SheetBounds(columns, rows);
    }
}
