package com.master.sync.bulk;

import com.master.sync.core.model.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvTableReader Tests")
class CsvTableReaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read a tab-separated export with empty cells as missing")
    void readsTabSeparated() throws IOException {
        String text = "org_code\torg_name\tparent_org_code\n"
                + "HQ\t本社\t\n"
                + "TYO\t東京\tHQ\n";

        Table table = CsvTableReader.tabSeparated().read(new StringReader(text));

        assertEquals(List.of("org_code", "org_name", "parent_org_code"), table.columns());
        assertEquals(2, table.size());
        assertEquals("本社", table.get(0, "org_name"));
        assertNull(table.get(0, "parent_org_code"));
        assertEquals("HQ", table.get(1, "parent_org_code"));
    }

    @Test
    @DisplayName("Should decode Windows-31J files by default")
    void readsWindows31j() throws IOException {
        Path file = tempDir.resolve("org.txt");
        Files.writeString(file, "org_code\torg_name\nA\t営業部\n", CsvTableReader.DEFAULT_CHARSET);

        Table table = CsvTableReader.tabSeparated().read(file);

        assertEquals("営業部", table.get(0, "org_name"));
    }

    @Test
    @DisplayName("Should handle quoted commas in comma-separated files")
    void readsQuotedCsv() throws IOException {
        String text = "id,name\n1,\"Acme, Corp\"\n";

        Table table = CsvTableReader.commaSeparated(StandardCharsets.UTF_8).read(new StringReader(text));

        assertEquals("Acme, Corp", table.get(0, "name"));
    }

    @Test
    @DisplayName("A missing file should be reported as TableIoException")
    void missingFile() {
        assertThrows(TableIoException.class,
                () -> CsvTableReader.tabSeparated().read(tempDir.resolve("none.txt")));
    }

    @Test
    @DisplayName("TableReaders should pick the reader from the extension")
    void readersByExtension() {
        assertEquals("xlsx", TableReaders.forPath(Path.of("a.xlsx")).getFormat());
        assertEquals("tsv", TableReaders.forPath(Path.of("a.TXT")).getFormat());
        assertEquals("csv", TableReaders.forPath(Path.of("a.csv")).getFormat());
        assertThrows(IllegalArgumentException.class, () -> TableReaders.forPath(Path.of("a.json")));
    }
}
