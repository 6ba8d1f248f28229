package me.go_gradually.ceddy.infrastructure.tts.gateway;

import me.go_gradually.ceddy.application.tts.model.AudioStream;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;

final class DataBufferChunks {
    private DataBufferChunks() {
    }

    /**
     * Closing the returned stream cancels the exchange, including one still downloading.
     */
    static AudioStream toAudioStream(Flux<DataBuffer> data) {
        return AudioStream.of(data.toStream().map(DataBufferChunks::drain));
    }

    private static byte[] drain(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
