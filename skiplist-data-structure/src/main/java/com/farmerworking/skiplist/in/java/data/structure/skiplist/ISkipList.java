package com.farmerworking.skiplist.in.java.data.structure.skiplist;

import org.apache.commons.lang3.tuple.Pair;

public interface ISkipList<T> extends Iterable<T> {
    // Insert key into the list. Returns the position of key and true if it
    // was added, or the position of the entry that compares equal to key and
    // false if such an entry was already present. Nothing is modified in the
    // second case.
    Pair<ISkipListIterator<T>, Boolean> insert(T key);

    // Remove the entry that compares equal to key. Returns the number of
    // entries removed, 0 or 1.
    int erase(T key);

    // Returns the position of the entry that compares equal to key, or end().
    ISkipListIterator<T> find(T key);

    // Returns the position of the first entry that is not less than key, or end().
    ISkipListIterator<T> lowerBound(T key);

    // Returns the position of the first entry that is greater than key, or end().
    ISkipListIterator<T> upperBound(T key);

    // Returns true iff an entry that compares equal to key is in the list.
    boolean contains(T key);

    int count(T key);

    ISkipListIterator<T> begin();

    ISkipListIterator<T> end();

    void clear();

    int size();

    boolean isEmpty();
}
