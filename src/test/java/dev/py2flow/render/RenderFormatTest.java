package dev.py2flow.render;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderFormatTest {

    @Test
    void parsesNamesAndAliases() {
        assertThat(RenderFormat.fromName("SVG")).isEqualTo(RenderFormat.SVG);
        assertThat(RenderFormat.fromName(" mermaid ")).isEqualTo(RenderFormat.MERMAID);
        assertThat(RenderFormat.fromName("interactive")).isEqualTo(RenderFormat.HTML);
        assertThat(RenderFormat.fromName("text")).isEqualTo(RenderFormat.ASCII);
        assertThat(RenderFormat.PLANTUML.extension()).isEqualTo("puml");
    }

    @Test
    void rejectsUnknownName() {
        assertThatThrownBy(() -> RenderFormat.fromName("graphviz"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("graphviz");
    }

    @Test
    void onlyLayeredFormatsNeedAnAcyclicFlow() {
        assertThat(RenderFormat.ASCII.isLayered()).isTrue();
        assertThat(RenderFormat.HTML.isLayered()).isTrue();
        assertThat(RenderFormat.MERMAID.isLayered()).isFalse();
        assertThat(RenderFormat.PLANTUML.isLayered()).isFalse();
    }

    @Test
    void themeAliases() {
        assertThat(Theme.fromName("dataiku-dark")).isSameAs(Theme.DARK);
        assertThat(Theme.fromName("light")).isSameAs(Theme.LIGHT);
    }
}
