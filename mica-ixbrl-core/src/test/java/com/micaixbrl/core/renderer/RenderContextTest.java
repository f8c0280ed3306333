package com.micaixbrl.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link RenderContext}.
 */
class RenderContextTest {

    @Test
    void constructor_withNullOutputDirectory_throwsException() {
        assertThatThrownBy(() -> new RenderContext(null, Map.of()))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("outputDirectory must not be null");
    }

    @Test
    void getSettingOrDefault_returnsSettingOrFallback() {
        RenderContext context = new RenderContext("./output", Map.of("filesystem.overwrite", "false"));

        assertThat(context.getSettingOrDefault("filesystem.overwrite", "true")).isEqualTo("false");
        assertThat(context.getSettingOrDefault("console.headers", "false")).isEqualTo("false");
    }

    @Test
    void constructor_withNullSettings_usesEmptyMap() {
        assertThat(new RenderContext("./output", null).settings()).isEmpty();
    }
}
