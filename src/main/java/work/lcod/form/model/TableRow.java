package work.lcod.form.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One table row: column id to cell, in column order.
 */
public record TableRow(Map<String, TableCell> cells) {
    public TableRow {
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public TableCell cell(String columnId) {
        return cells.getOrDefault(columnId, TableCell.empty());
    }
}
