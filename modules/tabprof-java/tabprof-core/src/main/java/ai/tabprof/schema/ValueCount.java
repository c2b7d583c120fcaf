package ai.tabprof.schema;

import java.util.Objects;

public class ValueCount {

    private final String value;
    private final long count;

    public ValueCount(String value, long count) {
        this.value = value;
        this.count = count;
    }

    public String getValue() {
        return value;
    }

    public long getCount() {
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ValueCount that = (ValueCount) o;
        return count == that.count && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, count);
    }

    @Override
    public String toString() {
        return String.format("%s (%s)", value, count);
    }
}
