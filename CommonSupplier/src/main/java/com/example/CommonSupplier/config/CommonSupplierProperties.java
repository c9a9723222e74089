package com.example.CommonSupplier.config;

import com.example.CommonSupplier.logic.UploadFileStyle;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "common-supplier")
public class CommonSupplierProperties {

    private String outputFileName = "UploadFile.xlsx";
    private String highlightColor = UploadFileStyle.DEFAULT_HIGHLIGHT_COLOR;
    private String bannerColor = UploadFileStyle.DEFAULT_BANNER_COLOR;

    public String getOutputFileName() {
        return outputFileName;
    }

    public void setOutputFileName(String outputFileName) {
        this.outputFileName = outputFileName;
    }

    public String getHighlightColor() {
        return highlightColor;
    }

    public void setHighlightColor(String highlightColor) {
        this.highlightColor = highlightColor;
    }

    public String getBannerColor() {
        return bannerColor;
    }

    public void setBannerColor(String bannerColor) {
        this.bannerColor = bannerColor;
    }

    public UploadFileStyle toStyle() {
        return new UploadFileStyle(highlightColor, bannerColor);
    }
}
