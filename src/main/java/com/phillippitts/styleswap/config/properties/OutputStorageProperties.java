package com.phillippitts.styleswap.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Where transient files (uploaded inputs and rendered results) are written.
 * A blank {@code temp-dir} means the JVM default temporary directory.
 */
@ConfigurationProperties(prefix = "transfer.output")
@Validated
public class OutputStorageProperties {

    private String tempDir = "";

    @NotBlank(message = "File prefix must not be blank")
    private String filePrefix = "styleswap-";

    public String getTempDir() {
        return tempDir;
    }

    public void setTempDir(String tempDir) {
        this.tempDir = tempDir;
    }

    public String getFilePrefix() {
        return filePrefix;
    }

    public void setFilePrefix(String filePrefix) {
        this.filePrefix = filePrefix;
    }
}
