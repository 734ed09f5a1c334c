package crosspost.adapter.out.storage.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import crosspost.core.model.common.ErrorCode;
import crosspost.core.model.common.StoreUnavailableException;
import crosspost.core.port.out.Metrics;

@DisplayName("RedisTimeoutHelper")
@ExtendWith(MockitoExtension.class)
class RedisTimeoutHelperTest {

    private static final Duration TIMEOUT = Duration.ofMillis(50);
    private static final String STORE_NAME = "test-store";
    private static final String OPERATION_NAME = "testOperation";

    @Mock
    private Metrics metrics;

    private RedisTimeoutHelper helper;

    @BeforeEach
    void setUp() {
        helper = new RedisTimeoutHelper(TIMEOUT, metrics, STORE_NAME);
    }

    @Nested
    @DisplayName("withTimeout()")
    class WithTimeoutTests {

        @Test
        @DisplayName("should return result when operation completes within timeout")
        void shouldReturnResultWithinTimeout() {
            final var result = helper.withTimeout(Uni.createFrom().item("success"), OPERATION_NAME)
                    .await()
                    .indefinitely();

            assertEquals("success", result);
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("should fail with StoreUnavailableException when operation times out")
        void shouldFailOnTimeout() {
            final var operation = Uni.createFrom().<String>nothing();

            final var exception = assertThrows(
                    StoreUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertEquals(ErrorCode.STORE_UNAVAILABLE, exception.code());
            assertTrue(exception.recoverable());
            assertTrue(exception.getMessage().contains(OPERATION_NAME));
            verify(metrics).recordStoreTimeout(eq(STORE_NAME), eq(OPERATION_NAME));
        }

        @Test
        @DisplayName("should wrap Redis failures in StoreUnavailableException")
        void shouldWrapFailures() {
            final var cause = new RuntimeException("connection reset");
            final var operation = Uni.createFrom().<String>failure(cause);

            final var exception = assertThrows(
                    StoreUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertSame(cause, exception.getCause());
            verify(metrics).recordStoreFailure(eq(STORE_NAME), eq(OPERATION_NAME));
        }

        @Test
        @DisplayName("should pass StoreUnavailableException through unchanged")
        void shouldPassStoreUnavailableThrough() {
            final var original = new StoreUnavailableException("already mapped");
            final var operation = Uni.createFrom().<String>failure(original);

            final var exception = assertThrows(
                    StoreUnavailableException.class,
                    () -> helper.withTimeout(operation, OPERATION_NAME).await().indefinitely());

            assertSame(original, exception);
            verifyNoInteractions(metrics);
        }
    }

    @Nested
    @DisplayName("withTimeoutFallback()")
    class WithTimeoutFallbackTests {

        @Test
        @DisplayName("should return fallback on timeout")
        void shouldReturnFallbackOnTimeout() {
            final var result = helper.withTimeoutFallback(Uni.createFrom().<Long>nothing(), OPERATION_NAME, () -> 0L)
                    .await()
                    .indefinitely();

            assertEquals(0L, result);
            verify(metrics).recordStoreTimeout(eq(STORE_NAME), eq(OPERATION_NAME));
        }

        @Test
        @DisplayName("should return fallback on failure")
        void shouldReturnFallbackOnFailure() {
            final var operation = Uni.createFrom().<Long>failure(new IllegalStateException("boom"));

            final var result = helper.withTimeoutFallback(operation, OPERATION_NAME, () -> -1L)
                    .await()
                    .indefinitely();

            assertEquals(-1L, result);
            verify(metrics).recordStoreFailure(eq(STORE_NAME), eq(OPERATION_NAME));
        }

        @Test
        @DisplayName("should tolerate missing metrics")
        void shouldTolerateMissingMetrics() {
            final var withoutMetrics = new RedisTimeoutHelper(TIMEOUT, null, STORE_NAME);

            assertThrows(
                    StoreUnavailableException.class,
                    () -> withoutMetrics
                            .withTimeout(Uni.createFrom().<String>nothing(), OPERATION_NAME)
                            .await()
                            .indefinitely());
        }
    }
}
