/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.convocapture.exception.ConvoCaptureException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.convocapture.exception.ConfigurationException} - Missing
 *       transcription credential; fails session creation before anything is acquired</li>
 *   <li>{@link com.phillippitts.convocapture.exception.DeviceUnavailableException} - Microphone
 *       could not be opened; fails session start</li>
 *   <li>{@link com.phillippitts.convocapture.exception.TranscriptionStreamException} - Connect,
 *       send or receive failure on the transcription stream</li>
 *   <li>{@link com.phillippitts.convocapture.exception.ConversationPersistenceException} - Store
 *       read or write failure</li>
 *   <li>{@link com.phillippitts.convocapture.exception.DuplicateSessionException} - Session id
 *       already registered</li>
 * </ul>
 *
 * <p>Only configuration and device errors at start-up surface as creation failures. Errors
 * raised while a session runs are contained by the session and logged.
 *
 * @since 1.0
 */
package com.phillippitts.convocapture.exception;
