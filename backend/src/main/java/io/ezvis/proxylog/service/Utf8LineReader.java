package io.ezvis.proxylog.service;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Splits a byte stream into lines and decodes each one as strict UTF-8, so an invalid sequence marks only its own
 * line instead of being replaced silently. Terminators are {@code \n}, {@code \r\n} and a lone {@code \r}, as in
 * {@link java.io.BufferedReader#readLine()}.
 */
final class Utf8LineReader implements Closeable {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final InputStream input;
    private final CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
    private final byte[] buffer = new byte[BUFFER_SIZE];
    private final ByteArrayOutputStream current = new ByteArrayOutputStream(512);
    private int position;
    private int limit;
    private boolean skipLineFeed;

    Utf8LineReader(InputStream input) {
        this.input = input;
    }

    /**
     * @return the next line, or {@code null} at end of input
     */
    SourceLine readLine() throws IOException {
        current.reset();
        boolean sawByte = false;
        while (true) {
            if (position == limit) {
                limit = input.read(buffer, 0, buffer.length);
                position = 0;
                if (limit <= 0) {
                    limit = 0;
                    return sawByte ? decode() : null;
                }
            }
            byte b = buffer[position++];
            if (skipLineFeed) {
                skipLineFeed = false;
                if (b == '\n') {
                    continue;
                }
            }
            if (b == '\n') {
                return decode();
            }
            if (b == '\r') {
                skipLineFeed = true;
                return decode();
            }
            current.write(b);
            sawByte = true;
        }
    }

    /** Lazily read lines; I/O errors surface as {@link UncheckedIOException}. The input is not closed. */
    Stream<SourceLine> lines() {
        Iterator<SourceLine> iterator = new Iterator<>() {
            private SourceLine next;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                try {
                    next = readLine();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return next != null;
            }

            @Override
            public SourceLine next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                SourceLine line = next;
                next = null;
                return line;
            }
        };
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public void close() throws IOException {
        input.close();
    }

    private SourceLine decode() {
        byte[] bytes = current.toByteArray();
        try {
            return SourceLine.decoded(decoder.decode(ByteBuffer.wrap(bytes)).toString());
        } catch (CharacterCodingException e) {
            return SourceLine.undecodable(new String(bytes, StandardCharsets.UTF_8));
        }
    }
}
