package org.corvo.engine.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, mutable list of values.
 *
 * Storage is 0-based; the 1-based positions used by programs are translated
 * by the evaluator before calling {@link #get(int)}.
 */
public final class ListValue implements Value {

    private final List<Value> elements;

    public ListValue() {
        this.elements = new ArrayList<>();
    }

    public ListValue(List<? extends Value> elements) {
        this.elements = new ArrayList<>(elements);
    }

    public static ListValue of(Value... elements) {
        return new ListValue(List.of(elements));
    }

    public static ListValue ofStrings(List<String> texts) {
        ListValue list = new ListValue();
        for (String text : texts) {
            list.append(StringValue.of(text));
        }
        return list;
    }

    /**
     * @return Read-only view of the current elements
     */
    public List<Value> elements() {
        return Collections.unmodifiableList(elements);
    }

    /**
     * @return Copy of the current elements, unaffected by later mutation
     */
    public List<Value> snapshot() {
        return List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    public Value get(int index) {
        return elements.get(index);
    }

    public void append(Value value) {
        elements.add(value);
    }

    /**
     * Removes the first element equal to the given value.
     *
     * @return true if an element was removed
     */
    public boolean removeFirst(Value value) {
        return elements.remove(value);
    }

    @Override
    public ValueKind kind() {
        return ValueKind.LIST;
    }

    /**
     * Bracketed, comma-joined rendering. Strings inside a list are quoted so
     * that ["1", 1] and [1, 1] render differently. A list that contains
     * itself renders the inner occurrence as [...].
     */
    @Override
    public String displayText() {
        StringBuilder sb = new StringBuilder();
        render(this, sb, Collections.newSetFromMap(new IdentityHashMap<>()));
        return sb.toString();
    }

    private static void render(ListValue list, StringBuilder sb, Set<ListValue> rendering) {
        if (!rendering.add(list)) {
            sb.append("[...]");
            return;
        }
        sb.append('[');
        for (int i = 0; i < list.elements.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Value element = list.elements.get(i);
            if (element instanceof ListValue nested) {
                render(nested, sb, rendering);
            } else if (element instanceof StringValue s) {
                sb.append('"').append(s.value()).append('"');
            } else {
                sb.append(element.displayText());
            }
        }
        sb.append(']');
        rendering.remove(list);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ListValue other && sameElements(this, other, new IdentityHashMap<>());
    }

    /**
     * Element-wise comparison. A pair of lists already being compared further
     * up is taken as equal, so cyclic lists terminate.
     */
    private static boolean sameElements(ListValue left, ListValue right,
            Map<ListValue, Set<ListValue>> comparing) {
        if (left == right) {
            return true;
        }
        if (left.elements.size() != right.elements.size()) {
            return false;
        }
        Set<ListValue> partners = comparing.computeIfAbsent(left,
                key -> Collections.newSetFromMap(new IdentityHashMap<>()));
        if (!partners.add(right)) {
            return true;
        }
        for (int i = 0; i < left.elements.size(); i++) {
            Value a = left.elements.get(i);
            Value b = right.elements.get(i);
            if (a instanceof ListValue nestedA && b instanceof ListValue nestedB) {
                if (!sameElements(nestedA, nestedB, comparing)) {
                    return false;
                }
            } else if (!a.equals(b)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Nested lists contribute only their size, which keeps hashing finite
     * for lists that contain themselves.
     */
    @Override
    public int hashCode() {
        int hash = 1;
        for (Value element : elements) {
            int elementHash = element instanceof ListValue nested ? nested.elements.size() : element.hashCode();
            hash = 31 * hash + elementHash;
        }
        return hash;
    }

    @Override
    public String toString() {
        return displayText();
    }
}
