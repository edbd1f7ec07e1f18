package com.guno.orderpipeline.util;

import com.guno.orderpipeline.exception.SchemaMismatchException;
import com.guno.orderpipeline.exception.StoreUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class BackoffRetryTest {

    private final BackoffRetry retry = new BackoffRetry(3, 0);

    @Test
    void shouldRetryUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.call("op", () -> {
            if (calls.incrementAndGet() < 3) throw new StoreUnavailableException("down");
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.run("op", () -> {
            calls.incrementAndGet();
            throw new StoreUnavailableException("down");
        })).isInstanceOf(StoreUnavailableException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    void shouldNotRetrySchemaErrors() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.run("op", () -> {
            calls.incrementAndGet();
            throw new SchemaMismatchException("bad column");
        })).isInstanceOf(SchemaMismatchException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldRequireAtLeastOneAttempt() {
        assertThatThrownBy(() -> new BackoffRetry(0, 10)).isInstanceOf(IllegalArgumentException.class);
    }
}
