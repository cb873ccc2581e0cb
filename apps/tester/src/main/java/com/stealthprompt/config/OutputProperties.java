package com.stealthprompt.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "output")
public class OutputProperties {

    public enum Format {
        JSON, TXT, BOTH
    }

    private String resultsDir = "results";

    private Format format = Format.JSON;

    /** Whether agent replies are written into the text report. */
    private boolean saveResponses = true;

    public boolean writesJson() {
        return format == Format.JSON || format == Format.BOTH;
    }

    public boolean writesText() {
        return format == Format.TXT || format == Format.BOTH;
    }
}
