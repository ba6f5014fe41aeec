package etl.engine.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One row of a {@link Relation}. Values are positional and aligned to the
 * relation's column order; cells may be null.
 */
public final class Record {
    private final List<Object> values;

    public Record(List<Object> values) {
        if (values == null) throw new IllegalArgumentException("values must not be null");
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Record of(Object... values) {
        List<Object> list = new ArrayList<>(values.length);
        for (Object v : values) list.add(Values.normalize(v));
        return new Record(list);
    }

    public List<Object> getValues() {
        return values;
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
