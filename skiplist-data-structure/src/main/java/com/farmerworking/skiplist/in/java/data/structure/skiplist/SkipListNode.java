package com.farmerworking.skiplist.in.java.data.structure.skiplist;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

class SkipListNode<T> {
    @Getter
    private final T key;

    // next.get(i) is the following node linked at level i
    private final List<SkipListNode<T>> next;

    SkipListNode(T key, int level) {
        assert level >= 0;
        this.key = key;
        this.next = new ArrayList<>(Collections.<SkipListNode<T>>nCopies(level + 1, null));
    }

    SkipListNode<T> next(int n) {
        assert n >= 0 && n < next.size();
        return next.get(n);
    }

    void setNext(int n, SkipListNode<T> x) {
        assert n >= 0 && n < next.size();
        next.set(n, x);
    }

    // Highest level this node is linked at.
    int level() {
        return next.size() - 1;
    }

    void unlink() {
        Collections.fill(next, null);
    }
}
