package dev.zhengxiang.multiplexer;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Fixed-capacity map that evicts the least recently used entry when full.
 * <p>
 * Entries are kept in a hash map and, at the same time, in a doubly-linked list ordered by
 * recency: {@link #set} and {@link #touch} move an entry to the top, eviction takes the bottom.
 * All operations are O(1). There is no time-based expiry.
 * <p>
 * Not thread-safe; owners synchronize access.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class LruCache<K, V> implements Iterable<V> {

    private static final class Node<K, V> {
        final K key;
        V value;
        Node<K, V> up;
        Node<K, V> down;

        Node(K key, V value) {
            this.key = key;
            this.value = value;
        }
    }

    private final int capacity;
    private final Map<K, Node<K, V>> nodes = new HashMap<>();
    private Node<K, V> top;
    private Node<K, V> bottom;

    public LruCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("LRU capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Inserts or updates a value and makes it the most recently used. Evicts the least recently
     * used entry first if the cache is full and the key is new.
     */
    public void set(K key, V value) {
        Node<K, V> node = nodes.get(key);
        if (node != null) {
            node.value = value;
            moveToTop(node);
            return;
        }
        if (nodes.size() == capacity) {
            Node<K, V> evicted = unlink(bottom);
            nodes.remove(evicted.key);
        }
        node = new Node<>(key, value);
        linkTop(node);
        nodes.put(key, node);
    }

    /**
     * Returns the value and marks it most recently used, or {@code null} on a miss.
     */
    public V touch(K key) {
        Node<K, V> node = nodes.get(key);
        if (node == null) {
            return null;
        }
        moveToTop(node);
        return node.value;
    }

    /**
     * Presence check that leaves the recency order untouched.
     */
    public boolean has(K key) {
        return nodes.containsKey(key);
    }

    public void remove(K key) {
        Node<K, V> node = nodes.remove(key);
        if (node != null) {
            unlink(node);
        }
    }

    public void removeAll() {
        nodes.clear();
        top = null;
        bottom = null;
    }

    /**
     * Iterates values from the most to the least recently used.
     */
    @Override
    public Iterator<V> iterator() {
        return new Iterator<>() {
            private Node<K, V> next = top;

            @Override
            public boolean hasNext() {
                return next != null;
            }

            @Override
            public V next() {
                if (next == null) {
                    throw new NoSuchElementException();
                }
                V value = next.value;
                next = next.down;
                return value;
            }
        };
    }

    private void moveToTop(Node<K, V> node) {
        if (top != node) {
            unlink(node);
            linkTop(node);
        }
    }

    private void linkTop(Node<K, V> node) {
        node.up = null;
        node.down = top;
        if (top != null) {
            top.up = node;
        } else {
            bottom = node;
        }
        top = node;
    }

    private Node<K, V> unlink(Node<K, V> node) {
        if (node.up != null) {
            node.up.down = node.down;
        } else {
            top = node.down;
        }
        if (node.down != null) {
            node.down.up = node.up;
        } else {
            bottom = node.up;
        }
        node.up = null;
        node.down = null;
        return node;
    }
}
