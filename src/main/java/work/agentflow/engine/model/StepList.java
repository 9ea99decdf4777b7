package work.agentflow.engine.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Ordered step sequence addressed by position. Goto targets are looked up by name within one list;
 * nested loop bodies own their own list.
 */
public final class StepList implements Iterable<Step> {
    private static final StepList EMPTY = new StepList(List.of());

    private final List<Step> steps;
    private final Map<String, Integer> positions;

    public StepList(List<Step> steps) {
        this.steps = List.copyOf(steps);
        var index = new HashMap<String, Integer>();
        for (var i = 0; i < this.steps.size(); i++) {
            index.putIfAbsent(this.steps.get(i).name(), i);
        }
        this.positions = Collections.unmodifiableMap(index);
    }

    public static StepList empty() {
        return EMPTY;
    }

    public Step get(int index) {
        return steps.get(index);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public OptionalInt indexOf(String name) {
        var position = positions.get(name);
        return position == null ? OptionalInt.empty() : OptionalInt.of(position);
    }

    public List<Step> asList() {
        return steps;
    }

    @Override
    public Iterator<Step> iterator() {
        return steps.iterator();
    }
}
