package com.equitiesai.providers.stream;

import com.equitiesai.AppLogger;
import com.equitiesai.models.StreamChunk;
import com.equitiesai.providers.NetworkException;
import com.equitiesai.providers.chat.StreamExtractor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pull-based decoder for a server-sent-events body. Each {@code data:} line is one
 * frame; frames may arrive split across any number of reads. The sequence is
 * forward-only and cannot be restarted. Closing it (or the {@link #stream()} view)
 * before the end releases the underlying body.
 */
public class EventStreamDecoder implements Iterator<StreamChunk>, Closeable {

    public enum State {
        READING,
        FRAME_READY,
        DONE,
        ERRORED
    }

    private static final String DATA_PREFIX = "data:";
    private static final int READ_BUFFER_SIZE = 8192;

    private final String providerId;
    private final InputStream body;
    private final StreamExtractor extractor;
    private final ObjectReader frameReader;
    private final AppLogger logger;

    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    private final byte[] readBuffer = new byte[READ_BUFFER_SIZE];
    private ByteBuffer undecoded = ByteBuffer.allocate(0);
    private final StringBuilder pending = new StringBuilder();
    private final Deque<String> lines = new ArrayDeque<>();

    private State state = State.READING;
    private StreamChunk ready;
    private boolean endOfInput;
    private boolean closed;
    private int droppedFrames;

    public EventStreamDecoder(String providerId, InputStream body, StreamExtractor extractor, ObjectMapper mapper) {
        this.providerId = providerId;
        this.body = body;
        this.extractor = extractor;
        this.frameReader = mapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.logger = AppLogger.get();
    }

    @Override
    public boolean hasNext() {
        while (state == State.READING) {
            advance();
        }
        return state == State.FRAME_READY;
    }

    @Override
    public StreamChunk next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Stream from " + providerId + " is finished");
        }
        StreamChunk chunk = ready;
        ready = null;
        state = State.READING;
        return chunk;
    }

    public State getState() {
        return state;
    }

    /** Frames that were not valid JSON and were skipped. */
    public int droppedFrames() {
        return droppedFrames;
    }

    /**
     * Sequential view of the remaining chunks. Closing the stream closes this decoder.
     */
    public Stream<StreamChunk> stream() {
        Spliterator<StreamChunk> spliterator = Spliterators.spliteratorUnknownSize(
            this, Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(this::close);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (state == State.READING || state == State.FRAME_READY) {
            state = State.DONE;
            ready = null;
        }
        try {
            body.close();
        } catch (IOException e) {
            logger.warn("Failed to close stream from " + providerId + ": " + e.getMessage());
        }
    }

    private void advance() {
        String line = lines.poll();
        if (line != null) {
            handleLine(line);
            return;
        }
        if (endOfInput) {
            finish();
            return;
        }
        fill();
    }

    private void fill() {
        int read;
        try {
            read = body.read(readBuffer);
        } catch (IOException e) {
            state = State.ERRORED;
            close();
            throw new NetworkException(providerId, "Stream from " + providerId + " failed: " + e.getMessage(), e);
        }
        if (read < 0) {
            endOfInput = true;
            decode(ByteBuffer.allocate(0), true);
            if (pending.length() > 0) {
                lines.add(stripCarriageReturn(pending.toString()));
                pending.setLength(0);
            }
            return;
        }
        if (read > 0) {
            decode(ByteBuffer.wrap(readBuffer, 0, read), false);
            splitLines();
        }
    }

    private void decode(ByteBuffer input, boolean last) {
        ByteBuffer bytes = input;
        if (undecoded.hasRemaining()) {
            bytes = ByteBuffer.allocate(undecoded.remaining() + input.remaining());
            bytes.put(undecoded).put(input).flip();
        }
        CharBuffer chars = CharBuffer.allocate(bytes.remaining() + 1);
        decoder.decode(bytes, chars, last);
        if (last) {
            decoder.flush(chars);
            decoder.reset();
        }
        chars.flip();
        pending.append(chars);
        // Incomplete multi-byte sequence at the end of the read; keep it for the next one.
        undecoded = bytes.hasRemaining() ? copyRemaining(bytes) : ByteBuffer.allocate(0);
    }

    private void splitLines() {
        int start = 0;
        for (int i = 0; i < pending.length(); i++) {
            if (pending.charAt(i) == '\n') {
                lines.add(stripCarriageReturn(pending.substring(start, i)));
                start = i + 1;
            }
        }
        pending.delete(0, start);
    }

    private void handleLine(String line) {
        if (!line.startsWith(DATA_PREFIX)) {
            return;
        }
        String payload = line.substring(DATA_PREFIX.length()).trim();
        if (payload.isEmpty()) {
            return;
        }
        if (StreamExtractor.DONE_SENTINEL.equals(payload)) {
            finish();
            return;
        }

        JsonNode frame;
        try {
            frame = frameReader.readTree(payload);
        } catch (IOException e) {
            frame = null;
        }
        if (frame == null || !frame.isObject()) {
            droppedFrames++;
            logger.warn("Skipping unparseable stream frame from " + providerId
                + " (" + droppedFrames + " dropped so far)");
            return;
        }

        if (extractor.isEndOfStream(frame)) {
            finish();
            return;
        }
        ready = extractor.extractChunk(frame);
        state = State.FRAME_READY;
    }

    private void finish() {
        state = State.DONE;
        close();
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static ByteBuffer copyRemaining(ByteBuffer source) {
        ByteBuffer copy = ByteBuffer.allocate(source.remaining());
        copy.put(source).flip();
        return copy;
    }
}
