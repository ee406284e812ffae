package com.farmerworking.skiplist.in.java.data.structure.skiplist;

// A forward-only position inside a skip list. A position stays usable only
// while the entry it refers to is in the list: erasing that entry, clearing
// the list or transferring it away leaves the position undefined.
public interface ISkipListIterator<T> {
    // Returns true iff the iterator is positioned at an entry.
    boolean valid();

    // Returns the entry at the current position.
    // Throws IndexOutOfBoundsException if !valid().
    T key();

    // Advances to the next entry in ascending order. Does nothing if !valid().
    void next();

    // Position at the first entry in the list. The iterator is valid()
    // after this call iff the list is not empty.
    void seekToFirst();

    // Position at the first entry that is not less than target.
    void seek(T target);
}
