package io.fullerstack.composite.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CompositeConfigTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(CompositeConfig.DIAGNOSTICS_MAX_ITEMS);
    }

    @Test
    void globalDefaults() {
        CompositeConfig config = CompositeConfig.global();

        assertThat(config.maxConsecutiveRefires()).isEqualTo(16);
        assertThat(config.diagnosticsMaxItems()).isEqualTo(100);
        assertThat(config.context()).isEqualTo("global");
    }

    @Test
    void compositeFileOverridesGlobal() {
        CompositeConfig config = CompositeConfig.forComposite("routing");

        assertThat(config.diagnosticsMaxItems()).isEqualTo(2);
        assertThat(config.maxConsecutiveRefires()).isEqualTo(16);
        assertThat(config.context()).isEqualTo("composite:routing");
    }

    @Test
    void compositeWithoutFileUsesGlobal() {
        CompositeConfig config = CompositeConfig.forComposite("health");

        assertThat(config.diagnosticsMaxItems()).isEqualTo(100);
    }

    @Test
    void nameThatIsNotALanguageTagUsesGlobal() {
        CompositeConfig config = CompositeConfig.forComposite("edge_proxy");

        assertThat(config.diagnosticsMaxItems()).isEqualTo(100);
        assertThat(config.context()).isEqualTo("composite:edge_proxy");
    }

    @Test
    void systemPropertyWins() {
        System.setProperty(CompositeConfig.DIAGNOSTICS_MAX_ITEMS, "7");

        assertThat(CompositeConfig.forComposite("routing").diagnosticsMaxItems()).isEqualTo(7);
        assertThat(CompositeConfig.global().contains(CompositeConfig.DIAGNOSTICS_MAX_ITEMS)).isTrue();
    }

    @Test
    void malformedValueFails() {
        CompositeConfig config = CompositeConfig.forComposite("broken");

        assertThatThrownBy(config::maxConsecutiveRefires)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining(CompositeConfig.MAX_CONSECUTIVE_REFIRES);
    }

    @Test
    void missingKeyFails() {
        CompositeConfig config = CompositeConfig.global();

        assertThat(config.getString("no.such.key", "fallback")).isEqualTo("fallback");
        assertThatThrownBy(() -> config.getString("no.such.key"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("no.such.key");
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> CompositeConfig.forComposite(" "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
