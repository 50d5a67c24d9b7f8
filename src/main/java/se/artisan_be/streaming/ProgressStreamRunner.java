package se.artisan_be.streaming;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import se.artisan_be.dto.response.ProgressFrame;
import se.artisan_be.exception.BadRequestException;
import se.artisan_be.exception.BusinessLogicException;
import se.artisan_be.exception.ResourceNotFoundException;

import java.io.IOException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Runs a multi-step write off the request thread and reports it as server-sent events.
 * Once the stream is open every failure is reported in the terminal frame, never as an HTTP status.
 */
@Component
@Slf4j
public class ProgressStreamRunner {

    private static final String INTERNAL_ERROR = "Internal server error";

    private final Executor streamExecutor;
    private final boolean exposeDetails;

    @Value("${app.streaming.timeout-ms:300000}")
    private long timeoutMs;

    public ProgressStreamRunner(@Qualifier("streamExecutor") Executor streamExecutor,
                                @Value("${app.errors.expose-details:false}") boolean exposeDetails) {
        this.streamExecutor = streamExecutor;
        this.exposeDetails = exposeDetails;
    }

    public SseEmitter stream(String operation, Function<ProgressListener, ProgressFrame> work) {
        return stream(operation, work, () -> { });
    }

    /**
     * As {@link #stream(String, Function)}; {@code onRejected} runs on the calling thread when the
     * streaming pool refuses the task, so the caller can release what it prepared for the work.
     */
    public SseEmitter stream(String operation, Function<ProgressListener, ProgressFrame> work, Runnable onRejected) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        ProgressSink sink = new SseProgressSink(emitter);
        try {
            streamExecutor.execute(() -> run(operation, sink, work));
        } catch (TaskRejectedException e) {
            log.error("Rejected {}: streaming pool is saturated", operation);
            onRejected.run();
            emitter.completeWithError(e);
        }
        return emitter;
    }

    /**
     * Executes the work on the calling thread, forwarding progress to the sink and finishing with
     * exactly one terminal frame.
     */
    public void run(String operation, ProgressSink sink, Function<ProgressListener, ProgressFrame> work) {
        SafeListener listener = new SafeListener(operation, sink);
        ProgressFrame terminal;
        try {
            terminal = work.apply(listener);
        } catch (ResourceNotFoundException e) {
            log.warn("{} failed: {}", operation, e.getMessage());
            terminal = ProgressFrame.error(404, e.getMessage());
        } catch (BadRequestException | BusinessLogicException e) {
            log.warn("{} rejected: {}", operation, e.getMessage());
            terminal = ProgressFrame.error(400, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed: {}", operation, e.getMessage(), e);
            terminal = ProgressFrame.error(500, INTERNAL_ERROR, exposeDetails ? e.getMessage() : null);
        }
        if (terminal == null || !terminal.isTerminal()) {
            log.error("{} finished without a terminal frame", operation);
            terminal = ProgressFrame.error(500, INTERNAL_ERROR);
        }
        listener.deliver(terminal);
        sink.close();
    }

    private static final class SafeListener implements ProgressListener {
        private final String operation;
        private final ProgressSink sink;
        private boolean connected = true;

        private SafeListener(String operation, ProgressSink sink) {
            this.operation = operation;
            this.sink = sink;
        }

        @Override
        public void progress(String message) {
            log.info("{}: {}", operation, message);
            deliver(ProgressFrame.progress(message));
        }

        private void deliver(ProgressFrame frame) {
            if (!connected) {
                return;
            }
            try {
                sink.send(frame);
            } catch (IOException | IllegalStateException e) {
                // client went away; the write itself carries on
                connected = false;
                log.warn("{}: client disconnected, dropping further frames ({})", operation, e.getMessage());
            }
        }
    }
}
