package io.surfworks.graphlower.tensor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node producing several values, e.g. a sort returning values and indices.
 * Elements may be null for outputs that carry no value.
 */
public record TupleValue(List<ExampleValue> elements) implements ExampleValue {

    public TupleValue {
        elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public int size() {
        return elements.size();
    }

    public ExampleValue get(int index) {
        return elements.get(index);
    }
}
