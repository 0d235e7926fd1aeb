package io.eidos.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.eidos.core.spi.BackendAdapter;
import org.junit.jupiter.api.Test;

/** Tests for {@link BackendRegistry}. */
class BackendRegistryTest {

    private static BackendAdapter stubBackend(String id) {
        return new BackendAdapter() {
            @Override
            public String id() {
                return id;
            }

            @Override
            public String displayName() {
                return "Stub " + id;
            }

            @Override
            public String fileExtension() {
                return "out";
            }

            @Override
            public String wrap(String body) {
                return body;
            }
        };
    }

    @Test
    void registerAndRetrieveBackend() {
        var registry = new BackendRegistry();
        var backend = stubBackend("alpha");
        registry.register(backend);

        assertThat(registry.getBackend("alpha")).isPresent().hasValue(backend);
        assertThat(registry.requireBackend("alpha")).isSameAs(backend);
        assertThat(registry.ids()).containsExactly("alpha");
    }

    @Test
    void getBackendReturnsEmptyForUnknownId() {
        var registry = new BackendRegistry();

        assertThat(registry.getBackend("nonexistent")).isEmpty();
    }

    @Test
    void requireBackendNamesAvailableIds() {
        var registry = new BackendRegistry();
        registry.register(stubBackend("beta"));
        registry.register(stubBackend("alpha"));

        assertThatThrownBy(() -> registry.requireBackend("gamma"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown backend 'gamma'")
                .hasMessageContaining("[alpha, beta]");
    }

    @Test
    void registerDuplicateIdReplacesBackend() {
        var registry = new BackendRegistry();
        var first = stubBackend("custom");
        var second = stubBackend("custom");

        registry.register(first);
        registry.register(second);

        assertThat(registry.requireBackend("custom")).isSameAs(second);
        assertThat(registry.ids()).containsExactly("custom");
    }

    @Test
    void registerNullBackendThrowsNpe() {
        var registry = new BackendRegistry();

        assertThatThrownBy(() -> registry.register(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void registerBackendWithEmptyIdThrowsIae() {
        var registry = new BackendRegistry();

        assertThatThrownBy(() -> registry.register(stubBackend(""))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register(stubBackend(null))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void idsAreSortedAndUnmodifiable() {
        var registry = new BackendRegistry();
        registry.register(stubBackend("python"));
        registry.register(stubBackend("c"));

        assertThat(registry.ids()).containsExactly("c", "python");
        assertThatThrownBy(() -> registry.ids().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void installedRegistryHasNoBackendsWithoutBackendModules() {
        assertThat(BackendRegistry.installed().ids()).isEmpty();
    }
}
