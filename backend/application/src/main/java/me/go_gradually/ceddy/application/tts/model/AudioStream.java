package me.go_gradually.ceddy.application.tts.model;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * Lazy, single-use sequence of audio chunks backed by an in-flight provider response.
 * Closing it releases the underlying exchange. A failure of the source after the first
 * chunk ends the sequence early instead of propagating.
 */
public final class AudioStream implements Iterable<byte[]>, AutoCloseable {
    private static final Logger log = Logger.getLogger(AudioStream.class.getName());

    private final Iterator<byte[]> source;
    private final Runnable onClose;
    private byte[] prefetched;
    private boolean started;
    private boolean finished;
    private boolean closed;

    private AudioStream(Iterator<byte[]> source, Runnable onClose) {
        this.source = source;
        this.onClose = onClose;
    }

    public static AudioStream empty() {
        return new AudioStream(Collections.emptyIterator(), () -> {
        });
    }

    public static AudioStream of(Stream<byte[]> chunks) {
        return new AudioStream(chunks.iterator(), chunks::close);
    }

    public static AudioStream of(List<byte[]> chunks) {
        return new AudioStream(chunks.iterator(), () -> {
        });
    }

    /**
     * Pulls the first non-empty chunk from the source. Source failures propagate from here,
     * which is how a provider error is detected before any byte reaches the client.
     *
     * @return false when the source produced no audio at all
     */
    public boolean prefetch() {
        if (prefetched != null) {
            return true;
        }
        if (started || finished) {
            throw new IllegalStateException("AudioStream already consumed");
        }
        while (source.hasNext()) {
            byte[] chunk = source.next();
            if (chunk != null && chunk.length > 0) {
                prefetched = chunk;
                return true;
            }
        }
        finished = true;
        return false;
    }

    @Override
    public Iterator<byte[]> iterator() {
        if (started) {
            throw new IllegalStateException("AudioStream can only be iterated once");
        }
        started = true;
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                if (prefetched != null) {
                    return true;
                }
                if (finished || closed) {
                    return false;
                }
                try {
                    if (source.hasNext()) {
                        return true;
                    }
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "tts.stream interrupted", e);
                }
                finished = true;
                return false;
            }

            @Override
            public byte[] next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                if (prefetched != null) {
                    byte[] chunk = prefetched;
                    prefetched = null;
                    return chunk;
                }
                byte[] chunk = source.next();
                return chunk == null ? new byte[0] : chunk;
            }
        };
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        prefetched = null;
        onClose.run();
    }
}
