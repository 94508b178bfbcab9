package com.phillippitts.convocapture.testutil;

import com.phillippitts.convocapture.exception.DeviceUnavailableException;
import com.phillippitts.convocapture.service.audio.capture.Microphone;
import com.phillippitts.convocapture.service.audio.capture.MicrophoneFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hands out {@link FakeMicrophone}s, or fails every open when {@link #unavailable()} is set.
 */
public class FakeMicrophoneFactory implements MicrophoneFactory {

    private final List<FakeMicrophone> opened = new CopyOnWriteArrayList<>();
    private volatile boolean unavailable;

    public FakeMicrophoneFactory unavailable() {
        this.unavailable = true;
        return this;
    }

    @Override
    public Microphone open() {
        if (unavailable) {
            throw new DeviceUnavailableException(DeviceUnavailableException.MIC_UNAVAILABLE,
                    "no input device", null);
        }
        FakeMicrophone mic = new FakeMicrophone();
        opened.add(mic);
        return mic;
    }

    public List<FakeMicrophone> opened() {
        return opened;
    }

    /** The most recently opened microphone. */
    public FakeMicrophone last() {
        return opened.get(opened.size() - 1);
    }
}
