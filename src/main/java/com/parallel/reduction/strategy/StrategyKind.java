package com.parallel.reduction.strategy;

import com.parallel.reduction.sync.TotalKind;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Closed set of reduction strategies the harness knows how to run, keyed by command-line identifier.
 */
public enum StrategyKind {
    SERIAL("serial", "Serial"),
    SHARED_LOCKED("locked", "SharedLocked"),
    SHARED_ATOMIC_SEQ_CST("atomic-seqcst", "SharedAtomic(SeqCst)"),
    SHARED_ATOMIC_RELAXED("atomic-relaxed", "SharedAtomic(Relaxed)"),
    LOCAL_MERGE_LOCK("local-lock", "LocalThenMerge(Lock)"),
    LOCAL_MERGE_ATOMIC_SEQ_CST("local-atomic-seqcst", "LocalThenMerge(SeqCst)"),
    LOCAL_MERGE_ATOMIC_RELAXED("local-atomic-relaxed", "LocalThenMerge(Relaxed)"),
    THREAD_LOCAL("thread-local", "ThreadLocal"),
    TASK_FUTURES("futures", "TaskFutures");

    public static final String ALL = "all";

    private final String id;
    private final String displayName;

    StrategyKind(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public ReductionStrategy create() {
        return switch (this) {
            case SERIAL -> new SerialStrategy(displayName);
            case SHARED_LOCKED -> new SharedTotalStrategy(displayName, TotalKind.LOCK::newTotal);
            case SHARED_ATOMIC_SEQ_CST -> new SharedTotalStrategy(displayName, TotalKind.ATOMIC_SEQ_CST::newTotal);
            case SHARED_ATOMIC_RELAXED -> new SharedTotalStrategy(displayName, TotalKind.ATOMIC_RELAXED::newTotal);
            case LOCAL_MERGE_LOCK -> new LocalThenMergeStrategy(displayName, TotalKind.LOCK::newTotal);
            case LOCAL_MERGE_ATOMIC_SEQ_CST -> new LocalThenMergeStrategy(displayName, TotalKind.ATOMIC_SEQ_CST::newTotal);
            case LOCAL_MERGE_ATOMIC_RELAXED -> new LocalThenMergeStrategy(displayName, TotalKind.ATOMIC_RELAXED::newTotal);
            case THREAD_LOCAL -> new ThreadLocalStrategy(displayName, TotalKind.ATOMIC_RELAXED::newTotal);
            case TASK_FUTURES -> new TaskFuturesStrategy(displayName);
        };
    }

    public static StrategyKind fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (StrategyKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + id + " (expected one of " + ids() + " or " + ALL + ")");
    }

    /**
     * Parses a comma separated selection; {@code all} expands to every kind in declaration order.
     */
    public static List<StrategyKind> parseSelection(String raw) {
        Set<StrategyKind> selected = new LinkedHashSet<>();
        for (String token : raw.split(",")) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (ALL.equalsIgnoreCase(trimmed)) {
                selected.addAll(Arrays.asList(values()));
            } else {
                selected.add(fromId(trimmed));
            }
        }
        if (selected.isEmpty()) {
            throw new IllegalArgumentException("No strategy selected");
        }
        return List.copyOf(selected);
    }

    public static String ids() {
        return Arrays.stream(values()).map(StrategyKind::id).collect(Collectors.joining(", "));
    }
}
