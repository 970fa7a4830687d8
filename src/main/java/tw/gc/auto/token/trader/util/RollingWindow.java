package tw.gc.auto.token.trader.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Fixed-capacity window that evicts its oldest element on overflow.
 * Not thread-safe; callers serialize access per window.
 */
public class RollingWindow<T> {

    private final int capacity;
    private final Deque<T> elements;

    public RollingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(capacity);
    }

    public void add(T element) {
        if (elements.size() == capacity) {
            elements.removeFirst();
        }
        elements.addLast(element);
    }

    /**
     * Drops elements from the oldest end while they match.
     *
     * @return number of evicted elements
     */
    public int evictWhile(Predicate<T> expired) {
        int evicted = 0;
        while (!elements.isEmpty() && expired.test(elements.peekFirst())) {
            elements.removeFirst();
            evicted++;
        }
        return evicted;
    }

    public Optional<T> last() {
        return Optional.ofNullable(elements.peekLast());
    }

    public List<T> toList() {
        return new ArrayList<>(elements);
    }

    public int size() {
        return elements.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }
}
