package gridcast.marketdata.ingest.service;

import gridcast.marketdata.ingest.table.DataTable;
import gridcast.marketdata.ingest.table.GapFill;
import gridcast.marketdata.ingest.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;

import static gridcast.marketdata.ingest.util.TestDataFactory.cst;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Test class for TimestampAligner
 */
class TimestampAlignerTest {

    private TimestampAligner aligner;
    private Map<String, DataTable> tables;

    @BeforeEach
    void setUp() {
        aligner = new TimestampAligner(TestDataFactory.defaultConfig());

        DataTable load = DataTable.builder("timestamp", "load_mw", "region")
                .addRow(cst(2023, 1, 1, 0), 10.0, "ERCOT")
                .addRow(cst(2023, 1, 1, 2), 30.0, "ERCOT")
                .build();
        DataTable price = DataTable.builder("timestamp", "price")
                .addRow(cst(2023, 1, 1, 1), 40.0)
                .addRow(cst(2023, 1, 1, 3), 42.0)
                .build();

        tables = new LinkedHashMap<>();
        tables.put("load", load);
        tables.put("price", price);
    }

    // ========== Grid Tests ==========

    @Test
    void testAlign_SharedHourlyGrid() {
        Map<String, DataTable> result = aligner.alignTimestamps(tables, "timestamp", "H");

        assertThat(result).containsOnlyKeys("load", "price");
        assertThat(result.get("load").column("timestamp"))
                .containsExactly(cst(2023, 1, 1, 0), cst(2023, 1, 1, 1), cst(2023, 1, 1, 2), cst(2023, 1, 1, 3));
        assertThat(new HashSet<>(result.get("load").column("timestamp")))
                .isEqualTo(new HashSet<>(result.get("price").column("timestamp")));
    }

    @Test
    void testAlign_GapsAreNull() {
        Map<String, DataTable> result = aligner.alignTimestamps(tables, "timestamp", "H");

        assertThat(result.get("load").column("load_mw")).containsExactly(10.0, null, 30.0, null);
        assertThat(result.get("price").column("price")).containsExactly(null, 40.0, null, 42.0);
    }

    @Test
    void testAlign_OffGridRowsDropped() {
        tables.put("price", DataTable.builder("timestamp", "price")
                .addRow(cst(2023, 1, 1, 1, 30), 40.0)
                .build());

        Map<String, DataTable> result = aligner.alignTimestamps(tables, "timestamp", "H");

        assertThat(result.get("price").rowCount()).isEqualTo(3);
        assertThat(result.get("price").column("price")).containsOnlyNulls();
    }

    @Test
    void testAlign_DuplicateTimestampsKept() {
        tables.put("price", DataTable.builder("timestamp", "product", "price")
                .addRow(cst(2023, 1, 1, 0), "DALMP", 40.0)
                .addRow(cst(2023, 1, 1, 0), "RTLMP", 41.0)
                .build());

        Map<String, DataTable> result = aligner.alignTimestamps(tables, "timestamp", "H");

        assertThat(result.get("price").rowCount()).isEqualTo(4);
        assertThat(result.get("price").column("product")).containsExactly("DALMP", "RTLMP", null, null);
    }

    // ========== Pass-through Tests ==========

    @Test
    void testAlign_TableWithoutTimestampPassesThrough() {
        DataTable metadata = DataTable.builder("region", "zone").addRow("ERCOT", "NORTH").build();
        tables.put("metadata", metadata);

        Map<String, DataTable> result = aligner.alignTimestamps(tables, "timestamp", "H");

        assertThat(result.get("metadata")).isSameAs(metadata);
    }

    @Test
    void testAlign_EmptyAndNullTables() {
        tables.put("empty", DataTable.withColumns("timestamp", "price"));
        tables.put("missing", null);

        Map<String, DataTable> result = aligner.alignTimestamps(tables, "timestamp", "H");

        assertThat(result.get("empty").isEmpty()).isTrue();
        assertThat(result.get("missing")).isEqualTo(DataTable.empty());
        assertThat(result.get("load").rowCount()).isEqualTo(4);
    }

    @Test
    void testAlign_NoTimestampsAnywhere() {
        Map<String, DataTable> input = new LinkedHashMap<>();
        input.put("a", DataTable.withColumns("timestamp"));

        Map<String, DataTable> result = aligner.alignTimestamps(input, "timestamp", "H");

        assertThat(result.get("a").isEmpty()).isTrue();
        assertThat(aligner.alignTimestamps(new LinkedHashMap<>(), "timestamp", "H")).isEmpty();
    }

    // ========== Gap Fill Tests ==========

    @Test
    void testAlign_Interpolate() {
        Map<String, DataTable> result = aligner.alignTimestamps(tables, "timestamp", "H", GapFill.INTERPOLATE);

        DataTable load = result.get("load");
        assertThat(load.column("load_mw")).containsExactly(10.0, 20.0, 30.0, 30.0);
        assertThat(load.column("region")).containsExactly("ERCOT", "ERCOT", "ERCOT", "ERCOT");

        // Leading gap has nothing to interpolate from
        assertThat(result.get("price").column("price")).containsExactly(null, 40.0, 41.0, 42.0);
    }
}
