package org.calista.qualia.diagnostics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Diagnostics — канал предупреждений, который живёт рядом с результатами.
 *
 * <p>Конфигурационные ошибки и недоступные ресурсы (нет паттернов для языка, нет синтаксиса)
 * не прерывают анализ: они записываются сюда и одновременно уходят в лог.</p>
 *
 * Thread-safe: passes may report concurrently.
 */
public final class Diagnostics {
    private static final Logger log = LogManager.getLogger(Diagnostics.class);

    private final Object lock = new Object();
    private final List<Diagnostic> entries = new ArrayList<>();
    private final Set<String> onceKeys = ConcurrentHashMap.newKeySet();

    public void info(String code, String source, String message) {
        record(new Diagnostic(Diagnostic.Severity.INFO, code, source, message));
    }

    public void warn(String code, String source, String message) {
        record(new Diagnostic(Diagnostic.Severity.WARN, code, source, message));
    }

    public void error(String code, String source, String message) {
        record(new Diagnostic(Diagnostic.Severity.ERROR, code, source, message));
    }

    /**
     * Records a warning only the first time {@code key} is seen.
     *
     * @return true if the warning was recorded
     */
    public boolean warnOnce(String key, String code, String source, String message) {
        Objects.requireNonNull(key, "key");
        if (!onceKeys.add(key)) return false;
        warn(code, source, message);
        return true;
    }

    public void record(Diagnostic d) {
        Objects.requireNonNull(d, "d");
        synchronized (lock) {
            entries.add(d);
        }
        switch (d.severity()) {
            case ERROR -> log.error("{}", d);
            case WARN -> log.warn("{}", d);
            default -> log.info("{}", d);
        }
    }

    /** Immutable snapshot of everything recorded so far. */
    public List<Diagnostic> snapshot() {
        synchronized (lock) {
            return List.copyOf(entries);
        }
    }

    public List<Diagnostic> withCode(String code) {
        List<Diagnostic> out = new ArrayList<>();
        for (Diagnostic d : snapshot()) {
            if (d.code().equals(code)) out.add(d);
        }
        return out;
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return entries.isEmpty();
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }
}
