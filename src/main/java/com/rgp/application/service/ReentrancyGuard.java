package com.rgp.application.service;

import com.rgp.domain.exception.StateException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Rejects nested entry into the same component instance while an operation is running.
 * A scope names the instance (the pool, or one venue's engine).
 */
@Slf4j
public class ReentrancyGuard {

    private final String component;
    private final Set<String> entered = new HashSet<>();

    public ReentrancyGuard(String component) {
        this.component = component;
    }

    public <T> T guard(String scope, Supplier<T> work) {
        if (!entered.add(scope)) {
            log.warn("Rejected re-entrant call into {} ({})", component, scope);
            throw new StateException("Re-entrant call into " + component + " " + scope);
        }
        try {
            return work.get();
        } finally {
            entered.remove(scope);
        }
    }

    public boolean isEntered(String scope) {
        return entered.contains(scope);
    }
}
