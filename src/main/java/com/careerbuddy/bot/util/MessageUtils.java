package com.careerbuddy.bot.util;

import com.careerbuddy.bot.constant.BotConstants;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;

public class MessageUtils {

    private MessageUtils() {
    }

    @NotNull
    public static String[] splitLongMessage(@NotNull String text) {
        if (text.length() <= BotConstants.MAX_MESSAGE_LENGTH) {
            return new String[]{text};
        }

        List<String> parts = new ArrayList<>();
        int maxLength = BotConstants.MAX_MESSAGE_LENGTH;

        int start = 0;
        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                parts.add(text.substring(start));
                break;
            }

            int end = findBestSplitPoint(text, start, start + maxLength);
            parts.add(text.substring(start, end));
            start = end;
        }

        return parts.toArray(new String[0]);
    }

    /**
     * Escapes user supplied text for Telegram HTML parse mode.
     */
    @NotNull
    @Contract(pure = true)
    public static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    /** Renders a progress bar such as {@code ●●○○○ 40% (2/5)}. */
    @NotNull
    public static String progressBar(int current, int total) {
        if (total <= 0) {
            return "";
        }
        int bounded = Math.max(0, Math.min(current, total));
        int percentage = bounded * 100 / total;
        return "●".repeat(bounded) + "○".repeat(total - bounded)
                + " " + percentage + "% (" + bounded + "/" + total + ")";
    }

    @NotNull
    public static String truncate(@NotNull String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }

    private static int findBestSplitPoint(String text, int start, int maxEnd) {
        if (maxEnd >= text.length()) {
            return text.length();
        }

        String segment = text.substring(start, maxEnd);

        int paragraphEnd = segment.lastIndexOf("\n\n");
        if (paragraphEnd > segment.length() * 0.6) {
            return start + paragraphEnd + 2;
        }

        int lineEnd = segment.lastIndexOf('\n');
        if (lineEnd > segment.length() * 0.6) {
            return start + lineEnd + 1;
        }

        int sentenceEnd = findLastSentenceEnd(segment);
        if (sentenceEnd > segment.length() * 0.7) {
            return start + sentenceEnd + 1;
        }

        int spaceIndex = segment.lastIndexOf(' ');
        if (spaceIndex > segment.length() * 0.5) {
            return start + spaceIndex + 1;
        }

        return maxEnd;
    }

    private static int findLastSentenceEnd(String text) {
        int lastDot = text.lastIndexOf('.');
        int lastExclamation = text.lastIndexOf('!');
        int lastQuestion = text.lastIndexOf('?');

        return Math.max(lastDot, Math.max(lastExclamation, lastQuestion));
    }
}
