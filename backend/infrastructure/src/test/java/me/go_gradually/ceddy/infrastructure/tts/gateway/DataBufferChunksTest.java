package me.go_gradually.ceddy.infrastructure.tts.gateway;

import me.go_gradually.ceddy.application.tts.model.AudioStream;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import reactor.core.publisher.Flux;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class DataBufferChunksTest {

    @Test
    void close_cancelsUpstream_whenReaderStopsMidStream() {
        AtomicBoolean cancelled = new AtomicBoolean();
        Flux<DataBuffer> endless = Flux.interval(Duration.ofMillis(10))
                .map(tick -> buffer("chunk"))
                .doOnCancel(() -> cancelled.set(true));

        AudioStream audio = DataBufferChunks.toAudioStream(endless);
        assertTrue(audio.prefetch());
        Iterator<byte[]> chunks = audio.iterator();
        assertArrayEquals("chunk".getBytes(StandardCharsets.UTF_8), chunks.next());
        assertArrayEquals("chunk".getBytes(StandardCharsets.UTF_8), chunks.next());

        audio.close();

        assertTrue(cancelled.get());
        assertTrue(audio.isClosed());
        assertFalse(chunks.hasNext());
    }

    @Test
    void close_cancelsUpstream_whenOnlyPrefetched() {
        AtomicBoolean cancelled = new AtomicBoolean();
        Flux<DataBuffer> endless = Flux.interval(Duration.ofMillis(10))
                .map(tick -> buffer("chunk"))
                .doOnCancel(() -> cancelled.set(true));

        AudioStream audio = DataBufferChunks.toAudioStream(endless);
        assertTrue(audio.prefetch());

        audio.close();

        assertTrue(cancelled.get());
    }

    @Test
    void toAudioStream_copiesBufferContentsInOrder() {
        AudioStream audio = DataBufferChunks.toAudioStream(Flux.just(buffer("ab"), buffer("cd")));

        StringBuilder out = new StringBuilder();
        for (byte[] chunk : audio) {
            out.append(new String(chunk, StandardCharsets.UTF_8));
        }

        assertEquals("abcd", out.toString());
        audio.close();
    }

    private static DataBuffer buffer(String text) {
        return DefaultDataBufferFactory.sharedInstance.wrap(text.getBytes(StandardCharsets.UTF_8));
    }
}
