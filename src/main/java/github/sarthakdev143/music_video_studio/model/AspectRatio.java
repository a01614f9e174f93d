package github.sarthakdev143.music_video_studio.model;

import java.util.Locale;

public enum AspectRatio {
    LANDSCAPE_16_9("16:9", 1280, 720),
    PORTRAIT_9_16("9:16", 720, 1280),
    SQUARE_1_1("1:1", 1080, 1080);

    private final String apiValue;
    private final int width;
    private final int height;

    AspectRatio(String apiValue, int width, int height) {
        this.apiValue = apiValue;
        this.width = width;
        this.height = height;
    }

    public static AspectRatio fromInput(String input) {
        if (input == null || input.isBlank()) {
            return LANDSCAPE_16_9;
        }

        String normalized = input.trim();
        for (AspectRatio candidate : values()) {
            if (candidate.apiValue.equals(normalized) || candidate.name().equalsIgnoreCase(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException(
                "aspectRatio must be one of 16:9, 9:16, 1:1 (got '" + normalized.toLowerCase(Locale.ROOT) + "').");
    }

    public String apiValue() {
        return apiValue;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }
}
