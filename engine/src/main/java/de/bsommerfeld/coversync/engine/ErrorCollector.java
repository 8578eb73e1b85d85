package de.bsommerfeld.coversync.engine;

import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the per-item failures of one engine run. Every entry is also
 * logged at warn level through the owning engine's logger.
 */
public final class ErrorCollector {

    private final Logger log;
    private final List<String> errors = new ArrayList<>();

    public ErrorCollector(Logger log) {
        this.log = log;
    }

    public void add(String message) {
        log.warn("{}", message);
        errors.add(message);
    }

    public int size() {
        return errors.size();
    }

    public List<String> toList() {
        return List.copyOf(errors);
    }
}
