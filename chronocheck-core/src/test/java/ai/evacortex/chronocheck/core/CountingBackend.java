/*
 * ChronoCheck — Temporal Verification Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chronocheck.core;

import ai.evacortex.chronocheck.core.solver.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scripted {@link SolverBackend} that counts its invocations. An optional gate blocks every
 * call until it is opened.
 */
public final class CountingBackend implements SolverBackend {

    private final Function<SmtScript, SatisfiabilityResult> answer;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<SmtScript> scripts = new CopyOnWriteArrayList<>();
    private final CountDownLatch entered = new CountDownLatch(1);
    private volatile CountDownLatch gate;

    public CountingBackend(Function<SmtScript, SatisfiabilityResult> answer) {
        this.answer = answer;
    }

    public static CountingBackend always(SatisfiabilityResult result) {
        return new CountingBackend(s -> result);
    }

    public static CountingBackend unsat() {
        return new CountingBackend(s -> SatisfiabilityResult.unsatisfiable(
                UnsatisfiabilityProof.fromCore(List.of(), s)));
    }

    /** Blocks every call until {@link #open()} is invoked. */
    public CountingBackend gated() {
        this.gate = new CountDownLatch(1);
        return this;
    }

    public void open() {
        CountDownLatch g = gate;
        if (g != null) g.countDown();
    }

    /** Waits until the first call has entered the backend. */
    public boolean awaitEntered(long timeout, TimeUnit unit) throws InterruptedException {
        return entered.await(timeout, unit);
    }

    @Override
    public SatisfiabilityResult check(SmtScript script, SolverConfig config) {
        calls.incrementAndGet();
        scripts.add(script);
        entered.countDown();
        CountDownLatch g = gate;
        if (g != null) {
            try {
                if (!g.await(10, TimeUnit.SECONDS)) return SatisfiabilityResult.unknown("gate timeout");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return SatisfiabilityResult.unknown("interrupted");
            }
        }
        return answer.apply(script);
    }

    public int calls() {
        return calls.get();
    }

    public List<SmtScript> scripts() {
        return scripts;
    }
}
