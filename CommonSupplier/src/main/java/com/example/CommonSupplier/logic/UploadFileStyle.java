package com.example.CommonSupplier.logic;

import java.util.Objects;

/**
 * Colors of the upload file, as hex RGB without the leading '#'.
 */
public final class UploadFileStyle {

    public static final String DEFAULT_HIGHLIGHT_COLOR = "FFFF00";
    public static final String DEFAULT_BANNER_COLOR = "DBD5BF";

    private final String highlightColor;
    private final String bannerColor;

    public UploadFileStyle(String highlightColor, String bannerColor) {
        this.highlightColor = Objects.requireNonNull(highlightColor, "highlightColor");
        this.bannerColor = Objects.requireNonNull(bannerColor, "bannerColor");
    }

    public static UploadFileStyle defaults() {
        return new UploadFileStyle(DEFAULT_HIGHLIGHT_COLOR, DEFAULT_BANNER_COLOR);
    }

    public String getHighlightColor() {
        return highlightColor;
    }

    public String getBannerColor() {
        return bannerColor;
    }
}
