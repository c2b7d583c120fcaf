package ai.tabprof.engine;

import ai.tabprof.config.ProfilerConfig;
import ai.tabprof.config.PropertiesSource;
import ai.tabprof.schema.ColumnSummary;
import ai.tabprof.schema.InferredType;
import ai.tabprof.schema.NumericSummary;
import ai.tabprof.schema.ProfileReport;
import ai.tabprof.schema.ValueCount;
import ai.tabprof.source.Chunk;
import ai.tabprof.source.InMemoryRowSource;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static ai.tabprof.ProfilerPropertyNames.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ProfilingEngineTest {

    private static final String[] PEOPLE = {"name", "age", "city"};

    private static ProfilingEngine engine(String... keyValues) {
        Map<String, String> props = new HashMap<>(1);
        for (int i = 0; i < keyValues.length; i += 2) {
            props.put(keyValues[i], keyValues[i + 1]);
        }
        return new ProfilingEngine(new ProfilerConfig(PropertiesSource.of(props)));
    }

    private static List<String[]> rows(String[]... rows) {
        return Arrays.asList(rows);
    }

    private static List<String[]> numbers(int from, int to) {
        List<String[]> result = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            result.add(new String[]{String.valueOf(i)});
        }
        return result;
    }

    @Test
    public void testEmptySource() {
        ProfileReport report = engine().profile(new InMemoryRowSource(Collections.emptyList()));

        assertThat("Wrong rows", report.getRows(), equalTo(0L));
        assertThat("Wrong duplicates", report.getDuplicateRowCount(), equalTo(0L));
        assertThat("No columns expected", report.getColumns().isEmpty(), equalTo(true));
    }

    @Test
    public void testChunksWithoutRows() {
        InMemoryRowSource source = new InMemoryRowSource(Arrays.asList(
            new Chunk(Arrays.asList(PEOPLE), Collections.emptyList()),
            new Chunk(Arrays.asList("other"), Collections.emptyList())));

        ProfileReport report = engine().profile(source);

        assertThat("Wrong rows", report.getRows(), equalTo(0L));
        assertThat("No columns expected", report.getColumns().isEmpty(), equalTo(true));
    }

    @Test
    public void testSingleDuplicate() {
        InMemoryRowSource source = InMemoryRowSource.of(PEOPLE,
            new String[]{"Alice", "30", "NYC"},
            new String[]{"Bob", "25", "LA"},
            new String[]{"Charlie", null, "SF"},
            new String[]{"Alice", "30", "NYC"},
            new String[]{null, "40", "LA"});

        ProfileReport report = engine().profile(source);

        assertThat("Wrong rows", report.getRows(), equalTo(5L));
        assertThat("Wrong duplicates", report.getDuplicateRowCount(), equalTo(1L));
        assertThat("Wrong column order", new ArrayList<>(report.getColumns().keySet()), contains(PEOPLE));

        ColumnSummary name = report.column("name");
        assertThat("Wrong null count", name.getNullCount(), equalTo(1L));
        assertThat("Wrong null pct", name.getNullPct(), equalTo(0.2));
        assertThat("Wrong distinct", name.getDistinctCount(), equalTo(3L));
        assertThat("Wrong type", name.getType(), equalTo(InferredType.STRING));
        assertThat("Text column has no numeric block", name.getNumeric().isPresent(), equalTo(false));
        assertThat("Wrong top values", name.getTopValues(), contains(
            new ValueCount("Alice", 2), new ValueCount("Bob", 1), new ValueCount("Charlie", 1)));

        ColumnSummary age = report.column("age");
        assertThat("4 of 5 numeric is below the threshold", age.getType(), equalTo(InferredType.STRING));
        assertThat("Wrong numeric count", age.getNumericCount(), equalTo(4L));
        assertThat("Numeric block expected", age.getNumeric().isPresent(), equalTo(true));
        assertThat("Wrong min", age.getNumeric().get().getMin(), equalTo(25.0));
        assertThat("Wrong max", age.getNumeric().get().getMax(), equalTo(40.0));
        assertThat("Wrong mean", age.getNumeric().get().getMean(), closeTo(31.25, 1e-12));
    }

    @Test
    public void testNumericColumn() {
        InMemoryRowSource source = new InMemoryRowSource(Collections.singletonList("value"), numbers(1, 5), 100);

        ColumnSummary value = engine().profile(source).column("value");

        NumericSummary numeric = value.getNumeric().get();
        assertThat("Wrong min", numeric.getMin(), equalTo(1.0));
        assertThat("Wrong max", numeric.getMax(), equalTo(5.0));
        assertThat("Wrong mean", numeric.getMean(), equalTo(3.0));
        assertThat("Wrong std", numeric.getStd(), closeTo(1.5811, 1e-4));
        assertThat("Wrong numeric count", value.getNumericCount(), equalTo(5L));
        assertThat("Wrong type", value.getType(), equalTo(InferredType.FLOAT));
        assertThat("Wrong null pct", value.getNullPct(), equalTo(0.0));
    }

    @Test
    public void testIntegerDetection() {
        InMemoryRowSource source = new InMemoryRowSource(Collections.singletonList("value"), numbers(1, 5), 2);

        ColumnSummary value = engine(TABPROF__PROFILE__DETECT_INTEGER, "true").profile(source).column("value");

        assertThat("Wrong type", value.getType(), equalTo(InferredType.INTEGER));
    }

    @Test
    public void testAllNullColumn() {
        InMemoryRowSource source = InMemoryRowSource.of(new String[]{"id", "empty"},
            new String[]{"1", null},
            new String[]{"2", ""},
            new String[]{"3"});

        ProfileReport report = engine().profile(source);
        ColumnSummary empty = report.column("empty");

        assertThat("All values should be null", empty.getNullCount(), equalTo(report.getRows()));
        assertThat("Wrong null pct", empty.getNullPct(), equalTo(1.0));
        assertThat("No numeric block expected", empty.getNumeric().isPresent(), equalTo(false));
        assertThat("Zero numbers means string", empty.getType(), equalTo(InferredType.STRING));
        assertThat("Wrong distinct", empty.getDistinctCount(), equalTo(0L));
        assertThat("No top values expected", empty.getTopValues().isEmpty(), equalTo(true));
    }

    @Test
    public void testChunkingDoesNotChangeResult() {
        List<String[]> data = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            data.add(new String[]{String.valueOf(i % 7), i % 5 == 0 ? null : "v" + (i % 3), String.valueOf(i * 0.5)});
        }
        List<String> columns = Arrays.asList("mod7", "label", "half");

        ProfileReport whole = engine().profile(new InMemoryRowSource(columns, data, 1000));
        ProfileReport chunked = engine().profile(new InMemoryRowSource(columns, data, 7));

        assertThat("Wrong chunk count", chunked.getChunks(), equalTo(15L));
        assertThat("Rows should match", chunked.getRows(), equalTo(whole.getRows()));
        assertThat("Duplicates should match", chunked.getDuplicateRowCount(), equalTo(whole.getDuplicateRowCount()));
        for (String column : columns) {
            ColumnSummary a = whole.column(column);
            ColumnSummary b = chunked.column(column);
            assertThat("Nulls should match", b.getNullCount(), equalTo(a.getNullCount()));
            assertThat("Distinct should match", b.getDistinctCount(), equalTo(a.getDistinctCount()));
            assertThat("Top values should match", b.getTopValues(), equalTo(a.getTopValues()));
            assertThat("Type should match", b.getType(), equalTo(a.getType()));
        }
        assertThat("Mean should match", chunked.column("half").getNumeric().get().getMean(),
            closeTo(whole.column("half").getNumeric().get().getMean(), 1e-9));
    }

    @Test
    public void testDuplicatesAcrossChunks() {
        List<String[]> data = rows(
            new String[]{"a", "1"},
            new String[]{"b", "2"},
            new String[]{"a", "1"},
            new String[]{"c", "3"},
            new String[]{"b", "2"});

        ProfileReport report = engine().profile(new InMemoryRowSource(Arrays.asList("k", "v"), data, 2));

        assertThat("Wrong duplicates", report.getDuplicateRowCount(), equalTo(2L));
        assertThat("Duplicates never reach row count", report.getDuplicateRowCount(), lessThanOrEqualTo(report.getRows() - 1));
    }

    @Test
    public void testDuplicateCutover() {
        List<String[]> data = rows(
            new String[]{"a"},
            new String[]{"b"},
            new String[]{"a"},
            new String[]{"c"},
            new String[]{"a"});

        ProfileReport report = engine(TABPROF__PROFILE__SEEN_HASHES_LIMIT, "1")
            .profile(new InMemoryRowSource(Collections.singletonList("k"), data, 10));

        // a, b stored; set of 2 is over the limit of 1 from the third row on
        assertThat("Wrong duplicates", report.getDuplicateRowCount(), equalTo(0L));
        assertThat("Count should be flagged approximate", report.isDuplicateCountApprox(), equalTo(true));
    }

    @Test
    public void testDistinctLimit() {
        InMemoryRowSource source = new InMemoryRowSource(Collections.singletonList("value"), numbers(1, 10), 4);

        ColumnSummary value = engine(TABPROF__PROFILE__DISTINCT_LIMIT, "5").profile(source).column("value");

        assertThat("Distinct count should be unknown", value.getDistinctCount(), nullValue());
        assertThat("Distinct count should be approximate", value.isDistinctCountApprox(), equalTo(true));
        assertThat("Numeric stats unaffected", value.getNumeric().get().getMean(), equalTo(5.5));
    }

    @Test
    public void testCustomNullValues() {
        InMemoryRowSource source = InMemoryRowSource.of(new String[]{"score"},
            new String[]{"NA"},
            new String[]{"1"},
            new String[]{"n/a"},
            new String[]{""});

        ColumnSummary score = engine(TABPROF__PROFILE__NULL_VALUES, "NA,n/a").profile(source).column("score");

        assertThat("Wrong null count", score.getNullCount(), equalTo(3L));
        assertThat("Wrong null pct", score.getNullPct(), equalTo(0.75));
        assertThat("Null markers are not values", score.getTopValues(), contains(new ValueCount("1", 1)));
    }

    @Test
    public void testNullPctRounding() {
        InMemoryRowSource source = InMemoryRowSource.of(new String[]{"x"},
            new String[]{null},
            new String[]{"a"},
            new String[]{"b"});

        ColumnSummary x = engine().profile(source).column("x");

        assertThat("Wrong null pct", x.getNullPct(), equalTo(0.333333));
    }

    @Test
    public void testTopTiesFollowFirstOccurrenceAcrossChunks() {
        List<String[]> data = rows(
            new String[]{"pear"},
            new String[]{"apple"},
            new String[]{"fig"},
            new String[]{"apple"},
            new String[]{"fig"},
            new String[]{"pear"});

        ColumnSummary fruit = engine(TABPROF__PROFILE__TOP_N, "2")
            .profile(new InMemoryRowSource(Collections.singletonList("fruit"), data, 4))
            .column("fruit");

        assertThat("Wrong top values", fruit.getTopValues(), contains(
            new ValueCount("pear", 2), new ValueCount("apple", 2)));
    }

    @Test
    public void testCountsAddUpToRows() {
        InMemoryRowSource source = InMemoryRowSource.of(new String[]{"mixed"},
            new String[]{"1"},
            new String[]{"x"},
            new String[]{null},
            new String[]{"2.5"},
            new String[]{"y"});

        ProfileReport report = engine().profile(source);
        ColumnSummary mixed = report.column("mixed");
        long text = mixed.getTopValues().stream().filter(v -> !v.getValue().matches("[0-9.]+")).mapToLong(ValueCount::getCount).sum();

        assertThat("Wrong text count", text, equalTo(2L));
        assertThat("Counts should add up", mixed.getNullCount() + mixed.getNumericCount() + text, equalTo(report.getRows()));
    }

    @Test
    public void testStrictSchemaDrift() {
        InMemoryRowSource source = new InMemoryRowSource(Arrays.asList(
            new Chunk(Arrays.asList("a", "b"), rows(new String[]{"1", "2"})),
            new Chunk(Arrays.asList("a", "c"), rows(new String[]{"3", "4"}))));

        SchemaDriftException e = assertThrows(SchemaDriftException.class, () -> engine().profile(source));

        assertThat("Wrong chunk index", e.getChunkIndex(), equalTo(1L));
        assertThat("Source should be closed on failure", source.isClosed(), equalTo(true));
    }

    @Test
    public void testLenientSchemaDrift() {
        InMemoryRowSource source = new InMemoryRowSource(Arrays.asList(
            new Chunk(Arrays.asList("a", "b"), rows(new String[]{"1", "2"})),
            new Chunk(Arrays.asList("c", "a"), rows(new String[]{"x", "3"}, new String[]{"y", "4"}))));

        ProfileReport report = engine(TABPROF__PROFILE__SCHEMA_DRIFT, "lenient").profile(source);

        assertThat("Wrong rows", report.getRows(), equalTo(3L));
        assertThat("Only first chunk columns are profiled", new ArrayList<>(report.getColumns().keySet()), contains("a", "b"));
        assertThat("Column a matched by name", report.column("a").getNumeric().get().getMax(), equalTo(4.0));
        assertThat("Missing column counted as null", report.column("b").getNullCount(), equalTo(2L));
    }

    @Test
    public void testSourceIsClosed() {
        InMemoryRowSource source = spy(InMemoryRowSource.of(new String[]{"a"}, new String[]{"1"}));

        engine().profile(source);

        verify(source, times(1)).chunks();
        verify(source).close();
    }
}
