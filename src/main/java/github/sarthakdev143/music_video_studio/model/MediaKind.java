package github.sarthakdev143.music_video_studio.model;

import java.util.Locale;

public enum MediaKind {
    VIDEO,
    IMAGE;

    public static MediaKind fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("mediaKind is required.");
        }

        try {
            return MediaKind.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("mediaKind must be one of VIDEO, IMAGE.");
        }
    }

    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
