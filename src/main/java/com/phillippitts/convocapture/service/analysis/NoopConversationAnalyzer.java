package com.phillippitts.convocapture.service.analysis;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Used when no analysis service is configured: logs and does nothing.
 */
public final class NoopConversationAnalyzer implements ConversationAnalyzer {

    private static final Logger LOG = LogManager.getLogger(NoopConversationAnalyzer.class);

    public static final NoopConversationAnalyzer INSTANCE = new NoopConversationAnalyzer();

    private NoopConversationAnalyzer() {
    }

    @Override
    public void analyze(long conversationId) {
        LOG.warn("No conversation analyzer configured; skipping analysis of conversation {}", conversationId);
    }
}
