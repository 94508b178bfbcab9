package com.phillippitts.convocapture.service.transcript;

import com.phillippitts.convocapture.domain.TranscriptEntry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * In-memory transcript of one session.
 *
 * <p>Holds two independent views of the same fragments:
 * <ul>
 *   <li>the compiled line list, each line formatted {@code [HH:MM:SS] text}, bounded by a
 *       character budget once more than the minimum number of lines is retained</li>
 *   <li>a fixed-size ring of raw {@link TranscriptEntry} values for recent-fragment lookups</li>
 * </ul>
 *
 * <p>Eviction only ever touches the line list, so recent lookups are unaffected by it.
 * Each line costs its length plus one (the newline it contributes to the compiled text).
 *
 * <p>Thread-safe: the receiver pipeline appends while statistics and recent lookups are
 * served to other threads.
 */
public final class TranscriptBuffer {

    private final int maxChars;
    private final int minLines;
    private final int recentCapacity;

    private final Deque<String> lines = new ArrayDeque<>();
    private final Deque<TranscriptEntry> recent;
    private long charCount;

    public TranscriptBuffer(int maxChars, int minLines, int recentCapacity) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be > 0");
        }
        if (minLines < 0) {
            throw new IllegalArgumentException("minLines must be >= 0");
        }
        if (recentCapacity <= 0) {
            throw new IllegalArgumentException("recentCapacity must be > 0");
        }
        this.maxChars = maxChars;
        this.minLines = minLines;
        this.recentCapacity = recentCapacity;
        this.recent = new ArrayDeque<>(recentCapacity);
    }

    /**
     * Appends a finalized fragment.
     *
     * @param entry fragment with its elapsed timestamp; text is stripped for the line list
     * @return the formatted line that was added
     */
    public synchronized String append(TranscriptEntry entry) {
        String line = "[" + entry.timestamp() + "] " + entry.text().strip();
        lines.addLast(line);
        charCount += line.length() + 1;

        while (charCount > maxChars && lines.size() > minLines) {
            String evicted = lines.removeFirst();
            charCount -= evicted.length() + 1;
        }

        if (recent.size() == recentCapacity) {
            recent.removeFirst();
        }
        recent.addLast(entry);
        return line;
    }

    /**
     * Returns up to {@code n} of the most recent entries, oldest first.
     */
    public synchronized List<TranscriptEntry> recent(int n) {
        if (n <= 0 || recent.isEmpty()) {
            return List.of();
        }
        List<TranscriptEntry> all = new ArrayList<>(recent);
        int from = Math.max(0, all.size() - n);
        return List.copyOf(all.subList(from, all.size()));
    }

    /** Number of entries currently held in the recent ring. */
    public synchronized int recentCount() {
        return recent.size();
    }

    /**
     * Joins all retained lines with newlines, in append order.
     *
     * @return compiled transcript, or an empty string when nothing is retained
     */
    public synchronized String compile() {
        return String.join("\n", lines);
    }

    public synchronized boolean isEmpty() {
        return lines.isEmpty();
    }

    public synchronized int lineCount() {
        return lines.size();
    }

    /** Running character count of the retained lines, newline included per line. */
    public synchronized long charCount() {
        return charCount;
    }
}
