package com.farmerworking.skiplist.in.java.data.structure.skiplist;

public class SkipListIterator<T> implements ISkipListIterator<T> {
    private final SkipList<T> skipList;
    private SkipListNode<T> node;

    SkipListIterator(SkipList<T> skipList, SkipListNode<T> node) {
        this.skipList = skipList;
        this.node = node;
    }

    @Override
    public boolean valid() {
        return node != null;
    }

    @Override
    public T key() {
        if (node == null) {
            throw new IndexOutOfBoundsException("skip list iterator out of range");
        }
        return node.getKey();
    }

    @Override
    public void next() {
        if (node != null) {
            node = node.next(0);
        }
    }

    @Override
    public void seekToFirst() {
        node = skipList.firstNode();
    }

    @Override
    public void seek(T target) {
        node = skipList.findGreaterOrEqual(target, null);
    }

    // Two positions are equal iff they refer to the same entry. All end
    // positions are equal.
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SkipListIterator)) {
            return false;
        }
        return node == ((SkipListIterator<?>) o).node;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(node);
    }

    @Override
    public String toString() {
        return node == null ? "SkipListIterator(end)" : "SkipListIterator(" + node.getKey() + ")";
    }
}
