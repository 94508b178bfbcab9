package com.phillippitts.convocapture.service.stt;

/**
 * Opens streaming connections to a speech-to-text service.
 */
public interface TranscriptionClient {

    /**
     * Opens a bidirectional stream.
     *
     * @param params     stream parameters announced to the service
     * @param credential service credential
     * @return an open connection
     * @throws com.phillippitts.convocapture.exception.TranscriptionStreamException if the
     *         connection cannot be established
     */
    TranscriptionConnection connect(StreamParameters params, String credential);
}
