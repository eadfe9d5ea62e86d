/**
 * Root package for the backoff library.
 *
 * <p>This package holds the small set of types shared by every backoff policy and retry driver:
 *
 * <ul>
 *   <li>{@link com.example.backoff.core.Backoff} – a one-shot sequence of delays; empty means stop.
 *   <li>{@link com.example.backoff.core.BackoffBuilder} – reusable factory for fresh backoffs, one
 *       per retry run.
 *   <li>{@link com.example.backoff.core.RetryListener} – callback fired before each wait.
 *   <li>{@link com.example.backoff.core.DelayAdjuster} – rewrites or vetoes the delay proposed for
 *       a given error.
 *   <li>{@link com.example.backoff.core.JitterSource} – random factors in {@code [0, 1]} used by
 *       jittered policies.
 *   <li>{@link com.example.backoff.core.BackoffDefaults} – builder defaults, overridable through
 *       system properties or environment variables.
 *   <li>{@link com.example.backoff.core.RetryCancelledException} – raised when a reactive retry
 *       is cancelled while waiting.
 * </ul>
 *
 * <p>Policies live in {@code policy}, the thread-blocking driver in {@code blocking} and the
 * Reactor driver in {@code reactive}.
 */
package com.example.backoff.core;
