package com.phillippitts.convocapture.service.audio.capture;

import com.phillippitts.convocapture.exception.DeviceUnavailableException;

/**
 * Opens microphones for capture sessions. Each session opens its own microphone.
 */
public interface MicrophoneFactory {

    /**
     * Opens the configured (or default) input device in the required format.
     *
     * @return an opened, not yet started microphone
     * @throws DeviceUnavailableException if no usable input device can be opened
     */
    Microphone open();
}
