package com.master.sync.bulk;

import com.master.sync.core.model.Table;
import com.master.sync.reconcile.ReconciliationKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link ReconciliationKeySpec} from a configuration sheet.
 *
 * <p>The sheet lists one column per row under {@code 列名}. A non-empty cell under
 * {@code キー} marks a key column; a non-empty cell under {@code 削除} marks a column dropped
 * before comparison. All other columns are compared.</p>
 */
public class SheetConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(SheetConfigLoader.class);

    public static final String COLUMN_NAME = "列名";
    public static final String KEY_MARKER = "キー";
    public static final String DROP_MARKER = "削除";

    private final XlsxTableReader reader;

    public SheetConfigLoader() {
        this(new XlsxTableReader());
    }

    public SheetConfigLoader(XlsxTableReader reader) {
        this.reader = reader;
    }

    public ReconciliationKeySpec load(Path path, String sheetName) {
        ReconciliationKeySpec spec = fromTable(reader.read(path, sheetName));
        log.info("config.sheet.loaded path={} sheet={} columns={} keys={}",
                path, sheetName, spec.columnNames().size(), spec.keyColumns());
        return spec;
    }

    /**
     * @throws IllegalArgumentException if the table lacks the {@code 列名} column
     */
    public ReconciliationKeySpec fromTable(Table sheet) {
        if (!sheet.hasColumn(COLUMN_NAME)) {
            throw new IllegalArgumentException("Sheet configuration has no '" + COLUMN_NAME + "' column");
        }
        List<String> columns = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        List<String> drops = new ArrayList<>();
        for (Map<String, Object> row : sheet.rows()) {
            Object name = row.get(COLUMN_NAME);
            if (name == null || name.toString().isBlank()) {
                continue;
            }
            String column = name.toString();
            columns.add(column);
            if (marked(row.get(KEY_MARKER))) {
                keys.add(column);
            }
            if (marked(row.get(DROP_MARKER))) {
                drops.add(column);
            }
        }
        return ReconciliationKeySpec.of(columns, keys, drops);
    }

    private static boolean marked(Object cell) {
        return cell != null && !cell.toString().isBlank();
    }
}
