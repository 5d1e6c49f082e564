package io.prospekt.cli.ui;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AnsiStylesTest {

    @Test
    void shouldApplyBoldFormattingWhenColorEnabled() {
        AnsiStyles styles = AnsiStyles.of(true);

        String result = styles.bold("Acme");

        assertThat(result).startsWith("\033[1m").contains("Acme").endsWith("\033[0m");
    }

    @Test
    void shouldReturnPlainTextWhenColorDisabled() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.bold("Acme")).isEqualTo("Acme");
        assertThat(styles.success("OK")).isEqualTo("OK");
        assertThat(styles.checkmark()).isEqualTo("✓");
        assertThat(styles.crossmark()).isEqualTo("✗");
        assertThat(styles.retry()).isEqualTo("↻");
        assertThat(styles.isColorEnabled()).isFalse();
    }

    @Test
    void shouldApplySuccessColor() {
        String result = AnsiStyles.of(true).success("COMPLETED");

        assertThat(result).contains("\033[0;32m").contains("COMPLETED").endsWith("\033[0m");
    }

    @Test
    void shouldStyleStatusColors() {
        AnsiStyles styles = AnsiStyles.of(true);

        assertThat(styles.error("FAILED")).contains("FAILED").endsWith("\033[0m");
        assertThat(styles.warn("PARTIAL_FAILURE")).contains("PARTIAL_FAILURE").endsWith("\033[0m");
        assertThat(styles.accent("from cache")).contains("from cache").endsWith("\033[0m");
    }

    @Test
    void shouldDrawSixtyCharacterRule() {
        assertThat(AnsiStyles.of(false).rule()).hasSize(60).containsOnlyOnce("─".repeat(60));
    }

    @Test
    void shouldAbbreviateLongText() {
        AnsiStyles styles = AnsiStyles.of(false);

        assertThat(styles.abbreviate("short", 10)).isEqualTo("short");
        assertThat(styles.abbreviate("abcdefghijkl", 5)).isEqualTo("abcd…");
        assertThat(styles.abbreviate(null, 5)).isEmpty();
    }
}
