package com.farmerworking.skiplist.in.java.data.structure.skiplist;

import com.farmerworking.skiplist.in.java.api.Options;
import com.farmerworking.skiplist.in.java.common.LevelGenerator;
import com.farmerworking.skiplist.in.java.common.RandomLevelGenerator;
import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

// Ordered set of unique keys kept in a skip list.
//
// Every node is linked at levels 0..node.level(). Level 0 links all nodes in
// ascending order; a node linked at level i is linked at every level below i.
// The head node carries no key and has a link for every level up to the cap
// of the level generator.
//
// Thread safety: none. Callers that share a list between threads must
// serialize every access externally.
public class SkipList<T> implements ISkipList<T> {
    private Comparator<? super T> comparator;
    private LevelGenerator levelGenerator;
    private Options options;

    private SkipListNode<T> head;
    // highest level linked by any node, 0 when empty
    private int level;
    private int size;

    public SkipList(Comparator<? super T> comparator) {
        this(comparator, new Options());
    }

    public SkipList(Comparator<? super T> comparator, Options options) {
        this(comparator, new RandomLevelGenerator(options), options);
    }

    public SkipList(Comparator<? super T> comparator, LevelGenerator levelGenerator) {
        this(comparator, levelGenerator, optionsFor(levelGenerator));
    }

    // Copies other's entries in ascending order into a new list using the same
    // ordering and level settings. Levels are drawn again, so the two lists
    // need not share a topology.
    public SkipList(SkipList<T> other) {
        this(other.comparator, new Options(other.options));
        insertAll(other);
    }

    private SkipList(Comparator<? super T> comparator, LevelGenerator levelGenerator, Options options) {
        this.comparator = Preconditions.checkNotNull(comparator, "comparator");
        this.levelGenerator = Preconditions.checkNotNull(levelGenerator, "levelGenerator");
        this.options = options;
        this.head = newHead(levelGenerator);
        this.level = 0;
        this.size = 0;
    }

    @SafeVarargs
    public static <T extends Comparable<? super T>> SkipList<T> of(T... keys) {
        SkipList<T> list = new SkipList<>(Comparator.<T>naturalOrder());
        for (T key : keys) {
            list.insert(key);
        }
        return list;
    }

    public static <T extends Comparable<? super T>> SkipList<T> copyOf(Iterable<? extends T> keys) {
        SkipList<T> list = new SkipList<>(Comparator.<T>naturalOrder());
        list.insertAll(keys);
        return list;
    }

    @Override
    public Pair<ISkipListIterator<T>, Boolean> insert(T key) {
        Preconditions.checkNotNull(key, "key");

        List<SkipListNode<T>> prev = newPredecessorChain();
        SkipListNode<T> x = findGreaterOrEqual(key, prev);
        if (x != null && equal(key, x.getKey())) {
            return Pair.<ISkipListIterator<T>, Boolean>of(new SkipListIterator<>(this, x), false);
        }

        int height = randomLevel();
        // the node is fully built before any link changes
        SkipListNode<T> node = new SkipListNode<>(key, height);
        if (height > level) {
            for (int i = level + 1; i <= height; i++) {
                prev.set(i, head);
            }
            level = height;
        }

        for (int i = 0; i <= height; i++) {
            node.setNext(i, prev.get(i).next(i));
            prev.get(i).setNext(i, node);
        }
        size ++;
        return Pair.<ISkipListIterator<T>, Boolean>of(new SkipListIterator<>(this, node), true);
    }

    // Returns the number of keys that were not already present.
    public int insertAll(Iterable<? extends T> keys) {
        int inserted = 0;
        for (T key : keys) {
            if (insert(key).getRight()) {
                inserted ++;
            }
        }
        return inserted;
    }

    @Override
    public int erase(T key) {
        Preconditions.checkNotNull(key, "key");

        List<SkipListNode<T>> prev = newPredecessorChain();
        SkipListNode<T> x = findGreaterOrEqual(key, prev);
        if (x == null || !equal(key, x.getKey())) {
            return 0;
        }

        // x is linked at a contiguous run of levels starting from 0
        for (int i = 0; i <= level; i++) {
            if (prev.get(i).next(i) != x) {
                break;
            }
            prev.get(i).setNext(i, x.next(i));
        }
        x.unlink();

        while (level > 0 && head.next(level) == null) {
            level --;
        }
        size --;
        return 1;
    }

    @Override
    public ISkipListIterator<T> find(T key) {
        Preconditions.checkNotNull(key, "key");
        SkipListNode<T> x = findGreaterOrEqual(key, null);
        if (x != null && equal(key, x.getKey())) {
            return new SkipListIterator<>(this, x);
        }
        return end();
    }

    @Override
    public ISkipListIterator<T> lowerBound(T key) {
        Preconditions.checkNotNull(key, "key");
        return new SkipListIterator<>(this, findGreaterOrEqual(key, null));
    }

    @Override
    public ISkipListIterator<T> upperBound(T key) {
        Preconditions.checkNotNull(key, "key");
        return new SkipListIterator<>(this, findGreaterThan(key));
    }

    @Override
    public boolean contains(T key) {
        return count(key) != 0;
    }

    @Override
    public int count(T key) {
        return find(key).valid() ? 1 : 0;
    }

    @Override
    public ISkipListIterator<T> begin() {
        return new SkipListIterator<>(this, firstNode());
    }

    @Override
    public ISkipListIterator<T> end() {
        return new SkipListIterator<>(this, null);
    }

    @Override
    public void clear() {
        SkipListNode<T> x = head.next(0);
        while (x != null) {
            SkipListNode<T> next = x.next(0);
            x.unlink();
            x = next;
        }
        head.unlink();
        level = 0;
        size = 0;
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    public Comparator<? super T> comparator() {
        return comparator;
    }

    // Replace the contents of this list with a copy of other's entries. The
    // entries are ordered by this list's comparator.
    public void assign(SkipList<T> other) {
        if (other == this) {
            return;
        }
        clear();
        insertAll(other);
    }

    // Take over source's nodes, ordering and level generator in constant
    // time. source is left empty and usable, with the level generator this
    // list had before.
    public void transferFrom(SkipList<T> source) {
        if (source == this) {
            return;
        }
        clear();

        LevelGenerator previousGenerator = this.levelGenerator;
        Options previousOptions = this.options;

        this.head = source.head;
        this.level = source.level;
        this.size = source.size;
        this.comparator = source.comparator;
        this.levelGenerator = source.levelGenerator;
        this.options = source.options;

        source.levelGenerator = previousGenerator;
        source.options = previousOptions;
        source.head = newHead(previousGenerator);
        source.level = 0;
        source.size = 0;
    }

    @Override
    public Iterator<T> iterator() {
        return new Itr(head.next(0));
    }

    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), size, Spliterator.ORDERED | Spliterator.DISTINCT | Spliterator.NONNULL),
                false);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SkipList)) {
            return false;
        }

        SkipList<?> other = (SkipList<?>) o;
        if (size != other.size) {
            return false;
        }

        Iterator<?> iter = other.iterator();
        for (T key : this) {
            if (!Objects.equals(key, iter.next())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = 1;
        for (T key : this) {
            hash = 31 * hash + key.hashCode();
        }
        return hash;
    }

    @Override
    public String toString() {
        return "[" + StringUtils.join(iterator(), ", ") + "]";
    }

    // Returns the first node whose key is not less than key, or null.
    // If prev is non-null, prev.get(i) is set to the last node at level i whose key
    // is less than key, for every level up to the current one.
    SkipListNode<T> findGreaterOrEqual(T key, List<SkipListNode<T>> prev) {
        SkipListNode<T> x = head;
        for (int i = level; i >= 0; i--) {
            SkipListNode<T> next = x.next(i);
            while (keyIsAfterNode(key, next)) {
                x = next;
                next = x.next(i);
            }
            if (prev != null) {
                prev.set(i, x);
            }
        }
        return x.next(0);
    }

    // Returns the first node whose key is greater than key, or null.
    SkipListNode<T> findGreaterThan(T key) {
        SkipListNode<T> x = head;
        for (int i = level; i >= 0; i--) {
            SkipListNode<T> next = x.next(i);
            while (next != null && comparator.compare(key, next.getKey()) >= 0) {
                x = next;
                next = x.next(i);
            }
        }
        return x.next(0);
    }

    SkipListNode<T> firstNode() {
        return head.next(0);
    }

    SkipListNode<T> getHead() {
        return head;
    }

    int getLevel() {
        return level;
    }

    private boolean keyIsAfterNode(T key, SkipListNode<T> node) {
        return node != null && comparator.compare(node.getKey(), key) < 0;
    }

    private boolean equal(T a, T b) {
        return comparator.compare(a, b) == 0;
    }

    private int randomLevel() {
        int height = levelGenerator.randomLevel();
        Preconditions.checkState(height >= 0 && height <= head.level(),
                "level generator returned %s, expected a level in [0, %s]", height, head.level());
        return height;
    }

    private List<SkipListNode<T>> newPredecessorChain() {
        return new ArrayList<>(Collections.<SkipListNode<T>>nCopies(head.level() + 1, null));
    }

    private static <T> SkipListNode<T> newHead(LevelGenerator levelGenerator) {
        Preconditions.checkArgument(levelGenerator.maxLevel() >= 0 && levelGenerator.maxLevel() <= Options.MAX_LEVEL_LIMIT,
                "max level should be in [0, %s]: %s", Options.MAX_LEVEL_LIMIT, levelGenerator.maxLevel());
        return new SkipListNode<>(null, levelGenerator.maxLevel());
    }

    private static Options optionsFor(LevelGenerator levelGenerator) {
        Options options = new Options();
        options.setMaxLevel(levelGenerator.maxLevel());
        return options;
    }

    private class Itr implements Iterator<T> {
        private SkipListNode<T> next;

        Itr(SkipListNode<T> first) {
            this.next = first;
        }

        @Override
        public boolean hasNext() {
            return next != null;
        }

        @Override
        public T next() {
            if (next == null) {
                throw new NoSuchElementException();
            }
            T key = next.getKey();
            next = next.next(0);
            return key;
        }
    }
}
