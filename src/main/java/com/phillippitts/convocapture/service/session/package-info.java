/**
 * Conversation sessions and their registry.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.convocapture.service.session.SessionManager} - creates, lists and
 *       stops sessions, one daemon thread each</li>
 *   <li>{@link com.phillippitts.convocapture.service.session.ConversationSession} - microphone to
 *       transcription pipelines for one persisted conversation</li>
 *   <li>{@link com.phillippitts.convocapture.service.session.SessionStateMachine} - lifecycle
 *       transitions</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.convocapture.service.session;
