package com.zzf.simon.stream;

import com.zzf.simon.envelope.Envelope;

import java.io.IOException;

/**
 * Sink for SSE frames on the HTTP response.
 */
public interface FrameWriter {

    void write(Envelope envelope) throws IOException;

    void comment(String text) throws IOException;

    void complete();
}
