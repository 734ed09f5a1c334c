package crosspost.core.service.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.stream.Stream;

import jakarta.enterprise.inject.Instance;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import crosspost.core.config.StorageConfig;
import crosspost.core.port.out.KeyedStore;
import crosspost.spi.KeyedStoreProvider;
import crosspost.spi.StorageProviderException;

@DisplayName("KeyedStoreProviderRegistry")
@ExtendWith(MockitoExtension.class)
class KeyedStoreProviderRegistryTest {

    @Mock
    private Instance<KeyedStoreProvider> providers;

    @Mock
    private StorageConfig config;

    private KeyedStoreProvider redis;
    private KeyedStoreProvider memory;

    @BeforeEach
    void setUp() {
        redis = provider("redis", 100, true);
        memory = provider("memory", 0, true);
    }

    private static KeyedStoreProvider provider(String name, int priority, boolean available) {
        final var provider = mock(KeyedStoreProvider.class);
        lenient().when(provider.name()).thenReturn(name);
        lenient().when(provider.priority()).thenReturn(priority);
        lenient().when(provider.isAvailable()).thenReturn(available);
        return provider;
    }

    private KeyedStoreProviderRegistry registry(String configured, KeyedStoreProvider... discovered) {
        lenient().when(config.provider()).thenReturn(configured);
        lenient().when(providers.stream()).thenAnswer(invocation -> Stream.of(discovered));
        return new KeyedStoreProviderRegistry(providers, config);
    }

    @Nested
    @DisplayName("getSelectedProvider()")
    class SelectionTests {

        @Test
        @DisplayName("should use the configured provider when available")
        void shouldUseConfiguredProvider() {
            assertSame(memory, registry("memory", redis, memory).getSelectedProvider());
        }

        @Test
        @DisplayName("should fall back to the highest priority provider")
        void shouldFallBackToHighestPriority() {
            when(redis.isAvailable()).thenReturn(false);
            final var custom = provider("dynamodb", 50, true);

            assertSame(custom, registry("redis", redis, memory, custom).getSelectedProvider());
        }

        @Test
        @DisplayName("should fail when no provider is available")
        void shouldFailWithoutProviders() {
            when(memory.isAvailable()).thenReturn(false);

            assertThrows(StorageProviderException.class, () -> registry("memory", memory).getSelectedProvider());
        }

        @Test
        @DisplayName("should list only available providers")
        void shouldListAvailableProviders() {
            when(redis.isAvailable()).thenReturn(false);

            assertEquals(List.of(memory), registry("redis", redis, memory).getAvailableProviders());
        }
    }

    @Nested
    @DisplayName("getStore() / close()")
    class StoreTests {

        @Test
        @DisplayName("should create the store once")
        void shouldCreateStoreOnce() {
            final var store = mock(KeyedStore.class);
            when(redis.createStore()).thenReturn(store);
            final var registry = registry("redis", redis, memory);

            assertSame(store, registry.getStore());
            assertSame(store, registry.getStore());
            verify(redis, times(1)).createStore();
        }

        @Test
        @DisplayName("should close the open store")
        void shouldCloseStore() {
            final var store = mock(KeyedStore.class);
            when(redis.createStore()).thenReturn(store);
            final var registry = registry("redis", redis);
            registry.getStore();

            registry.close();

            verify(store).close();
        }
    }
}
