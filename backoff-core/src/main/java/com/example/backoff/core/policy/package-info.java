/**
 * Backoff policies: {@link com.example.backoff.core.policy.ConstantBuilder constant}, {@link
 * com.example.backoff.core.policy.ExponentialBuilder exponential} and {@link
 * com.example.backoff.core.policy.FibonacciBuilder fibonacci}.
 *
 * <p>Builders are immutable and reusable. Each {@code build()} returns an independent, stateful
 * backoff meant for a single retry run.
 */
package com.example.backoff.core.policy;
