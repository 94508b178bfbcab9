package com.phillippitts.convocapture.exception;

/**
 * Thrown when a session cannot be created because required configuration is missing,
 * such as the transcription service credential. No resources have been acquired when
 * this is thrown.
 */
public class ConfigurationException extends ConvoCaptureException {

    private final String setting;

    public ConfigurationException(String setting) {
        super("Missing required setting: " + setting);
        this.setting = setting;
    }

    public String getSetting() {
        return setting;
    }
}
