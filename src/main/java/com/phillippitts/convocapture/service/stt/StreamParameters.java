package com.phillippitts.convocapture.service.stt;

import com.phillippitts.convocapture.service.audio.AudioFormat;

/**
 * Protocol parameters announced when opening a transcription stream.
 *
 * @param sampleRate audio sample rate in Hz
 * @param channels   channel count
 * @param encoding   wire encoding name of the raw frames
 * @param punctuate  whether the service should punctuate transcripts
 */
public record StreamParameters(int sampleRate, int channels, String encoding, boolean punctuate) {

    public StreamParameters {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be > 0");
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be > 0");
        }
        if (encoding == null || encoding.isBlank()) {
            throw new IllegalArgumentException("encoding must not be blank");
        }
    }

    /** Parameters matching the microphone capture format. */
    public static StreamParameters forCaptureFormat(boolean punctuate) {
        return new StreamParameters(AudioFormat.REQUIRED_SAMPLE_RATE, AudioFormat.REQUIRED_CHANNELS,
                AudioFormat.STREAM_ENCODING, punctuate);
    }
}
