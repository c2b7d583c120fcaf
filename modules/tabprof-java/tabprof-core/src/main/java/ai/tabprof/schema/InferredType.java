package ai.tabprof.schema;

public enum InferredType {

    EMPTY("empty"),
    INTEGER("integer"),
    FLOAT("float"),
    STRING("string");

    private final String value;

    InferredType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
