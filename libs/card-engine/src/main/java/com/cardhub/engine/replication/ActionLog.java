package com.cardhub.engine.replication;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 有界动作日志：只保留最近 capacity 条，随快照一起广播。
 */
public class ActionLog {

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<ActionLogEntry> entries = new ArrayDeque<>();

    public ActionLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity 必须为正: " + capacity);
        }
        this.capacity = capacity;
    }

    public ActionLog() {
        this(DEFAULT_CAPACITY);
    }

    public void add(ActionLogEntry entry) {
        entries.addLast(entry);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    /** 从旧到新 */
    public List<ActionLogEntry> entries() {
        return List.copyOf(entries);
    }

    public void replaceWith(List<ActionLogEntry> incoming) {
        entries.clear();
        if (incoming != null) incoming.forEach(this::add);
    }

    public int size() {
        return entries.size();
    }
}
