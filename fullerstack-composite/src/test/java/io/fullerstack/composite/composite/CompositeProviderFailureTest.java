package io.fullerstack.composite.composite;

import io.fullerstack.composite.error.FailureHandler;
import io.fullerstack.composite.error.ProviderReadException;
import io.fullerstack.composite.provider.MutableProvider;
import io.fullerstack.composite.provider.Provider;
import io.fullerstack.composite.signal.ChangeSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests how {@link CompositeProvider} behaves when a member provider throws.
 */
@ExtendWith(MockitoExtension.class)
class CompositeProviderFailureTest {

    @Mock
    private FailureHandler failureHandler;

    private MutableProvider<String> healthy;
    private FlakyProvider flaky;
    private CompositeProvider<String> composite;

    @BeforeEach
    void setUp() {
        healthy = MutableProvider.of("/healthy");
        flaky = new FlakyProvider("/flaky");
        composite = CompositeProvider.<String>builder()
            .name("failing")
            .provider(healthy)
            .provider(flaky)
            .failureHandler(failureHandler)
            .build();
    }

    @Test
    @DisplayName("a failure during the first read reaches the caller")
    void initialFailurePropagates() {
        flaky.failing = true;

        assertThatThrownBy(() -> composite.endpoints())
            .isInstanceOf(ProviderReadException.class)
            .hasMessageContaining("failing")
            .hasMessageContaining("#1")
            .hasCauseInstanceOf(IllegalStateException.class)
            .satisfies(e -> assertThat(((ProviderReadException) e).getProviderIndex()).isEqualTo(1));

        assertThat(composite.isInitialized()).isFalse();
        verifyNoInteractions(failureHandler);
    }

    @Test
    @DisplayName("the next read retries after a failed first read")
    void initialFailureIsRetried() {
        flaky.failing = true;
        assertThatThrownBy(() -> composite.changeToken()).isInstanceOf(ProviderReadException.class);

        flaky.failing = false;

        assertThat(composite.endpoints()).containsExactly("/healthy", "/flaky");
        assertThat(composite.generation()).isEqualTo(1);
    }

    @Test
    @DisplayName("a background failure keeps the last snapshot and does not fire")
    void backgroundFailureKeepsLastSnapshot() {
        assertThat(composite.endpoints()).containsExactly("/healthy", "/flaky");
        ChangeSignal token = composite.changeToken();

        flaky.failing = true;
        flaky.replace(List.of("/flaky2"));

        ArgumentCaptor<ProviderReadException> captor = ArgumentCaptor.forClass(ProviderReadException.class);
        verify(failureHandler).onFailure(captor.capture());
        assertThat(captor.getValue().getCompositeName()).isEqualTo("failing");
        assertThat(captor.getValue().getProviderIndex()).isEqualTo(1);

        assertThat(token.hasChanged()).isFalse();
        assertThat(composite.endpoints()).containsExactly("/healthy", "/flaky");
        assertThat(composite.generation()).isEqualTo(1);
    }

    @Test
    @DisplayName("the composite recovers on the next change after a background failure")
    void recoversAfterBackgroundFailure() {
        composite.endpoints();
        flaky.failing = true;
        flaky.replace(List.of("/flaky2"));
        flaky.failing = false;

        healthy.replace(List.of("/healthy2"));

        assertThat(composite.endpoints()).containsExactly("/healthy2", "/flaky2");
        verify(failureHandler, times(1)).onFailure(any());
    }

    @Test
    @DisplayName("a failing provider added after initialization is reported to the handler")
    void failingAddedProvider() {
        composite.endpoints();
        ChangeSignal token = composite.changeToken();
        FlakyProvider broken = new FlakyProvider("/broken");
        broken.failing = true;

        composite.addProvider(broken);

        verify(failureHandler).onFailure(any(ProviderReadException.class));
        assertThat(token.hasChanged()).isFalse();
        assertThat(composite.endpoints()).containsExactly("/healthy", "/flaky");

        composite.removeProvider(broken);

        assertThat(token.hasChanged()).isTrue();
        assertThat(composite.endpoints()).containsExactly("/healthy", "/flaky");
        assertThat(composite.generation()).isEqualTo(2);
    }

    private static final class FlakyProvider implements Provider<String> {
        private final MutableProvider<String> delegate;
        private volatile boolean failing = false;

        FlakyProvider(String item) {
            this.delegate = MutableProvider.of(item);
        }

        void replace(List<String> items) {
            delegate.replace(items);
        }

        @Override
        public List<String> items() {
            if (failing) {
                throw new IllegalStateException("provider unavailable");
            }
            return delegate.items();
        }

        @Override
        public ChangeSignal changeSignal() {
            return delegate.changeSignal();
        }
    }
}
