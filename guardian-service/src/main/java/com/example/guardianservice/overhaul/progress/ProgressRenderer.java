package com.example.guardianservice.overhaul.progress;

import java.time.Duration;
import java.util.Locale;

/**
 * Renders a {@link ProgressState} as status message text.
 */
public final class ProgressRenderer {

    static final String TRUNCATION_MARKER = "\n… (truncated)";
    private static final char FILLED = '█';
    private static final char EMPTY = '░';

    private ProgressRenderer() {
    }

    public static String render(ProgressState state, Duration elapsed, int barWidth, int limit, String summary) {
        StringBuilder text = new StringBuilder();
        switch (state.phase()) {
            case RUNNING -> {
                text.append("**🛠️ Server overhaul in progress**\n");
                text.append("Progress: ").append(state.currentStepIndex()).append('/').append(state.totalSteps())
                        .append(" steps\n");
                text.append("Current: ").append(state.stepLabel()).append('\n');
            }
            case FAILED -> {
                text.append("**❌ Overhaul failed at step ").append(state.currentStepIndex())
                        .append(" of ").append(state.totalSteps()).append("**\n");
                text.append("Step: ").append(state.stepLabel()).append('\n');
                text.append("Error: ").append(state.lastError()).append('\n');
            }
            case CANCELLED -> text.append("**⏹️ Overhaul cancelled at step ").append(state.currentStepIndex())
                    .append(" of ").append(state.totalSteps()).append("**\n");
            case COMPLETED -> text.append("**✅ Overhaul completed**\n")
                    .append(state.currentStepIndex()).append('/').append(state.totalSteps())
                    .append(" steps\n");
        }
        text.append('`').append(bar(state.percentage(), barWidth)).append("` ")
                .append(state.percentage()).append("%\n");
        text.append("Elapsed: ").append(formatElapsed(elapsed));
        if (summary != null && !summary.isBlank()) {
            text.append("\n\n").append(summary);
        }
        return truncate(text.toString(), limit);
    }

    static String bar(int percentage, int width) {
        int filled = Math.min(width, percentage * width / 100);
        return String.valueOf(FILLED).repeat(filled) + String.valueOf(EMPTY).repeat(width - filled);
    }

    static String formatElapsed(Duration elapsed) {
        long seconds = elapsed.getSeconds();
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.1fs", elapsed.toMillis() / 1000.0);
        }
        return String.format("%dm %02ds", seconds / 60, seconds % 60);
    }

    public static String truncate(String text, int limit) {
        if (text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
    }
}
