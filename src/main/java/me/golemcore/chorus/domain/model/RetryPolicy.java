package me.golemcore.chorus.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Bounded retry with backoff, resolved per failure. Different error classes of
 * the same task may carry different attempt limits.
 */
public final class RetryPolicy {

    private static final RetryPolicy NONE = new RetryPolicy(error -> Rule.NO_RETRY);

    private final Function<Throwable, Rule> ruleResolver;

    private RetryPolicy(Function<Throwable, Rule> ruleResolver) {
        this.ruleResolver = Objects.requireNonNull(ruleResolver);
    }

    public static RetryPolicy none() {
        return NONE;
    }

    public static RetryPolicy of(Rule rule) {
        return new RetryPolicy(error -> rule);
    }

    public static RetryPolicy perError(Function<Throwable, Rule> ruleResolver) {
        return new RetryPolicy(ruleResolver);
    }

    public Rule ruleFor(Throwable error) {
        Rule rule = ruleResolver.apply(error);
        return rule != null ? rule : Rule.NO_RETRY;
    }

    /**
     * Whether another attempt should follow the given failed attempt (1-based).
     */
    public boolean shouldRetry(Throwable error, int failedAttempt) {
        return failedAttempt < ruleFor(error).maxAttempts();
    }

    public Duration delayAfter(Throwable error, int failedAttempt) {
        return ruleFor(error).delayAfter(failedAttempt);
    }

    /**
     * Attempt limit and backoff for one error class. {@code maxAttempts} counts
     * the first execution.
     */
    public record Rule(int maxAttempts, Duration initialDelay, double multiplier) {

        public static final Rule NO_RETRY = new Rule(1, Duration.ZERO, 1.0);

        public static Rule fixed(int maxAttempts, Duration delay) {
            return new Rule(maxAttempts, delay, 1.0);
        }

        public static Rule exponential(int maxAttempts, Duration initialDelay, double multiplier) {
            return new Rule(maxAttempts, initialDelay, multiplier);
        }

        public Duration delayAfter(int failedAttempt) {
            double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
            return Duration.ofMillis((long) (initialDelay.toMillis() * factor));
        }
    }
}
