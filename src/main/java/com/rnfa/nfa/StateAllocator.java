package com.rnfa.nfa;

// Not thread-safe: one instance per compilation session
public class StateAllocator {
    private int next;

    public int allocate() {
        return next++;
    }

    public int allocated() {
        return next;
    }

    /** Only call this between compilations, never while one is using the allocator. */
    public void reset() {
        next = 0;
    }
}
