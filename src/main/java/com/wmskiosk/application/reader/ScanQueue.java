package com.wmskiosk.application.reader;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cola FIFO acotada entre el hilo de lectura y el consumidor.
 *
 * <p>{@link #push} nunca bloquea ni falla: con la cola llena se expulsa el elemento más
 * antiguo, porque en el kiosco importa la lectura más reciente.</p>
 *
 * @param <E> Tipo de elemento
 */
public class ScanQueue<E> {

    public static final int DEFAULT_CAPACITY = 10;

    private final int capacity;
    private final Deque<E> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();

    public ScanQueue() {
        this(DEFAULT_CAPACITY);
    }

    public ScanQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacidad inválida: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Encola un elemento.
     *
     * @return El elemento expulsado si la cola estaba llena
     */
    public Optional<E> push(E item) {
        if (item == null) {
            throw new IllegalArgumentException("No se admiten elementos null");
        }

        lock.lock();
        try {
            E evicted = null;
            if (items.size() >= capacity) {
                evicted = items.pollFirst();
            }
            items.addLast(item);
            notEmpty.signal();
            return Optional.ofNullable(evicted);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Espera como máximo {@code timeout} por un elemento.
     * Si el hilo es interrumpido se restaura el flag y se devuelve vacío.
     */
    public Optional<E> pop(Duration timeout) {
        long remaining = timeout.toNanos();

        lock.lock();
        try {
            while (items.isEmpty()) {
                if (remaining <= 0L) {
                    return Optional.empty();
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return Optional.of(items.pollFirst());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public Optional<E> tryPop() {
        lock.lock();
        try {
            return Optional.ofNullable(items.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        lock.lock();
        try {
            items.clear();
        } finally {
            lock.unlock();
        }
    }
}
