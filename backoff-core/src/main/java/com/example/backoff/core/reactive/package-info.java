/**
 * Retry drivers built on Project Reactor.
 *
 * <p>Waiting happens on a {@link reactor.core.scheduler.Scheduler}, and a retry loop may be
 * cancelled between attempts through any {@link org.reactivestreams.Publisher} or {@link
 * java.util.concurrent.CompletionStage}.
 */
package com.example.backoff.core.reactive;
