package com.careerbuddy.bot.util;

import com.careerbuddy.bot.constant.BotConstants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageUtilsTest {

    @Test
    @DisplayName("Should keep short messages whole")
    void shouldKeepShortMessage() {
        assertThat(MessageUtils.splitLongMessage("hello")).containsExactly("hello");
    }

    @Test
    @DisplayName("Should split long messages on paragraph boundaries")
    void shouldSplitOnParagraphs() {
        String paragraph = "a".repeat(3000);
        String text = paragraph + "\n\n" + paragraph;

        String[] parts = MessageUtils.splitLongMessage(text);

        assertThat(parts).containsExactly(paragraph + "\n\n", paragraph);
        assertThat(String.join("", parts)).isEqualTo(text);
    }

    @Test
    @DisplayName("Should cut unbroken text at the message limit")
    void shouldHardSplit() {
        String text = "x".repeat(BotConstants.MAX_MESSAGE_LENGTH * 2 + 10);

        String[] parts = MessageUtils.splitLongMessage(text);

        assertThat(parts).hasSize(3);
        assertThat(parts[0]).hasSize(BotConstants.MAX_MESSAGE_LENGTH);
        assertThat(parts[2]).hasSize(10);
    }

    @Test
    @DisplayName("Should escape HTML control characters")
    void shouldEscapeHtml() {
        assertThat(MessageUtils.escapeHtml("R&D <b>lead</b>")).isEqualTo("R&amp;D &lt;b&gt;lead&lt;/b&gt;");
        assertThat(MessageUtils.escapeHtml(null)).isEmpty();
    }

    @Test
    @DisplayName("Should draw the progress bar")
    void shouldDrawProgressBar() {
        assertThat(MessageUtils.progressBar(2, 5)).isEqualTo("●●○○○ 40% (2/5)");
        assertThat(MessageUtils.progressBar(7, 5)).isEqualTo("●●●●● 100% (5/5)");
        assertThat(MessageUtils.progressBar(1, 0)).isEmpty();
    }

    @Test
    @DisplayName("Should truncate with an ellipsis")
    void shouldTruncate() {
        assertThat(MessageUtils.truncate("Senior Data Analyst", 6)).isEqualTo("Senior...");
        assertThat(MessageUtils.truncate("Analyst", 10)).isEqualTo("Analyst");
    }
}
