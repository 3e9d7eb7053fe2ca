package com.aqua.stream.core.overlay;

import java.util.List;
import java.util.Objects;

/**
 * 叠加文字标签参数（不可变）
 */
public final class OverlayConfig {
    private static final OverlayConfig DISABLED =
            new OverlayConfig(false, "", 1, 1, 0.7, 2, 0.5, 1.0, new int[]{255, 255, 255});

    private final boolean enabled;
    private final String text;
    private final int cycleMinutes;
    private final int durationSeconds;
    private final double fontScale;
    private final int thickness;
    private final double backgroundOpacity;
    private final double textOpacity;
    private final int[] textColor; // BGR

    public OverlayConfig(boolean enabled, String text, int cycleMinutes, int durationSeconds,
                         double fontScale, int thickness, double backgroundOpacity,
                         double textOpacity, int[] textColor) {
        if (textColor == null || textColor.length != 3) {
            throw new IllegalArgumentException("Overlay text color must be a BGR triple");
        }
        for (int channel : textColor) {
            if (channel < 0 || channel > 255) {
                throw new IllegalArgumentException("Overlay color channel out of range: " + channel);
            }
        }
        if (enabled) {
            if (text == null || text.isBlank()) {
                throw new IllegalArgumentException("Overlay text is required when overlay is enabled");
            }
            if (cycleMinutes <= 0) {
                throw new IllegalArgumentException("Overlay cycle must be positive, got " + cycleMinutes + " minutes");
            }
            if (durationSeconds <= 0 || durationSeconds > cycleMinutes * 60) {
                throw new IllegalArgumentException("Overlay duration " + durationSeconds
                        + "s must be within (0, " + cycleMinutes * 60 + "]s");
            }
            if (fontScale <= 0 || thickness <= 0) {
                throw new IllegalArgumentException("Overlay font scale and thickness must be positive");
            }
            checkOpacity("background", backgroundOpacity);
            checkOpacity("text", textOpacity);
        }
        this.enabled = enabled;
        this.text = text == null ? "" : text;
        this.cycleMinutes = cycleMinutes;
        this.durationSeconds = durationSeconds;
        this.fontScale = fontScale;
        this.thickness = thickness;
        this.backgroundOpacity = backgroundOpacity;
        this.textOpacity = textOpacity;
        this.textColor = textColor.clone();
    }

    public static OverlayConfig disabled() {
        return DISABLED;
    }

    public static OverlayConfig fromColorList(boolean enabled, String text, int cycleMinutes, int durationSeconds,
                                              double fontScale, int thickness, double backgroundOpacity,
                                              double textOpacity, List<Integer> color) {
        if (color == null || color.size() != 3 || color.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Overlay text color must be a BGR triple, got " + color);
        }
        int[] bgr = new int[]{color.get(0), color.get(1), color.get(2)};
        return new OverlayConfig(enabled, text, cycleMinutes, durationSeconds,
                fontScale, thickness, backgroundOpacity, textOpacity, bgr);
    }

    private static void checkOpacity(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Overlay " + name + " opacity must be within [0, 1], got " + value);
        }
    }

    public boolean isEnabled() { return enabled; }
    public String getText() { return text; }
    public int getCycleMinutes() { return cycleMinutes; }
    public int getDurationSeconds() { return durationSeconds; }
    public double getFontScale() { return fontScale; }
    public int getThickness() { return thickness; }
    public double getBackgroundOpacity() { return backgroundOpacity; }
    public double getTextOpacity() { return textOpacity; }
    public int[] getTextColor() { return textColor.clone(); }

    public long getCycleMillis() {
        return cycleMinutes * 60_000L;
    }

    public long getDurationMillis() {
        return durationSeconds * 1000L;
    }
}
