package se.artisan_be.streaming;

import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import se.artisan_be.dto.response.ProgressFrame;

import java.io.IOException;

/**
 * Writes each frame as one {@code data:<json>} event.
 */
public class SseProgressSink implements ProgressSink {

    private final SseEmitter emitter;

    public SseProgressSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void send(ProgressFrame frame) throws IOException {
        emitter.send(SseEmitter.event().data(frame, MediaType.APPLICATION_JSON));
    }

    @Override
    public void close() {
        emitter.complete();
    }
}
