package se.artisan_be.streaming;

import se.artisan_be.dto.response.ProgressFrame;

import java.io.IOException;

public interface ProgressSink {

    void send(ProgressFrame frame) throws IOException;

    void close();
}
