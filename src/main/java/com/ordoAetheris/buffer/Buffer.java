package com.ordoAetheris.buffer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 Double-ended buffer for handing packets / work units between threads.

 Push end and pop end are fixed at construction:
 push REAR, pop FRONT -> FIFO (default)
 push REAR, pop REAR  -> LIFO
 push FRONT, pop REAR -> FIFO from the other side
 push FRONT, pop FRONT -> LIFO from the other side

 One ReentrantLock guards the deque. Every method takes it, including size().
 There are no Conditions: pop() on an empty buffer does not wait, it returns Optional.empty().
 No capacity, no close(), no backpressure.

 Methods
 void push(T item)
   item == null -> IllegalArgumentException
 void push(List<? extends T> items)
   the whole batch goes in under one lock acquisition, in list order, each at the push end
   (push FRONT therefore reverses the batch at the front)
   any null in the batch -> IllegalArgumentException, nothing inserted
 Optional<T> pop()
 List<T> drain()
   same order as repeated pop() until empty, done atomically
 int drainTo(Collection<? super T> sink)
   if the sink throws, whatever it did not accept goes back to the pop end, in pop order
 int size()

 Invariants
 no lost items
 no duplicate items
 a batch push or a drain is never observed half-done
 */
public class Buffer<T> {

    private final PushPopType pushType;
    private final PushPopType popType;

    private final Deque<T> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    public Buffer() {
        this(PushPopType.REAR, PushPopType.FRONT);
    }

    public Buffer(PushPopType pushType, PushPopType popType) {
        if (pushType == null) throw new IllegalArgumentException("pushType must not be null");
        if (popType == null) throw new IllegalArgumentException("popType must not be null");
        this.pushType = pushType;
        this.popType = popType;
    }

    public PushPopType pushType() {
        return pushType;
    }

    public PushPopType popType() {
        return popType;
    }

    public void push(T item) {
        if (item == null) throw new IllegalArgumentException("item must not be null");
        lock.lock();
        try {
            insert(item);
        } finally {
            lock.unlock();
        }
    }

    public void push(List<? extends T> batch) {
        if (batch == null) throw new IllegalArgumentException("batch must not be null");
        // snapshot outside the lock; all-or-nothing on nulls
        List<T> snapshot = new ArrayList<>(batch);
        for (T item : snapshot) {
            if (item == null) throw new IllegalArgumentException("batch must not contain null items");
        }
        lock.lock();
        try {
            for (T item : snapshot) {
                insert(item);
            }
        } finally {
            lock.unlock();
        }
    }

    public Optional<T> pop() {
        lock.lock();
        try {
            if (items.isEmpty()) return Optional.empty();
            return Optional.of(popType == PushPopType.FRONT ? items.pollFirst() : items.pollLast());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every element and returns them in the order successive {@link #pop()} calls would have.
     *
     * @return a new mutable list, empty if the buffer was empty
     */
    public List<T> drain() {
        lock.lock();
        try {
            if (items.isEmpty()) return new ArrayList<>();
            List<T> out = new ArrayList<>(items.size());
            Iterator<T> it = popType == PushPopType.FRONT ? items.iterator() : items.descendingIterator();
            while (it.hasNext()) {
                out.add(it.next());
            }
            items.clear();
            return out;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends every element to {@code sink} in pop order and empties the buffer.
     * The sink is filled after the lock is released. If it throws, the elements it has not
     * accepted are put back at the pop end, so the next pops still return them in order.
     *
     * @return number of elements appended
     */
    public int drainTo(Collection<? super T> sink) {
        if (sink == null) throw new IllegalArgumentException("sink must not be null");
        List<T> drained = drain();
        int accepted = 0;
        try {
            for (T item : drained) {
                sink.add(item);
                accepted++;
            }
        } catch (RuntimeException e) {
            restore(drained.subList(accepted, drained.size()));
            throw e;
        }
        return accepted;
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return items.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Buffer[push=" + pushType + ", pop=" + popType + ", size=" + size() + "]";
    }

    // rest is in pop order; its first element must become the next one popped
    private void restore(List<T> rest) {
        lock.lock();
        try {
            for (int i = rest.size() - 1; i >= 0; i--) {
                if (popType == PushPopType.FRONT) {
                    items.addFirst(rest.get(i));
                } else {
                    items.addLast(rest.get(i));
                }
            }
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private void insert(T item) {
        if (pushType == PushPopType.FRONT) {
            items.addFirst(item);
        } else {
            items.addLast(item);
        }
    }
}
