package com.jobd.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobd.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits a byte stream of concatenated JSON objects into individual messages.
 * <p>
 * A message ends where the brace depth returns to zero outside a string literal.
 * The scan runs over raw UTF-8 bytes: braces, quotes and backslashes are ASCII and
 * never appear inside a multi-byte sequence, so a read that splits a character is
 * harmless. One framer serves one connection and is not thread-safe.
 */
public class MessageFramer {
    private static final Logger log = LoggerFactory.getLogger(MessageFramer.class);

    public static final int DEFAULT_MAX_BUFFER = 1024 * 1024;

    private final ObjectMapper mapper;
    private final int maxBuffer;

    private byte[] buf = new byte[4096];
    private int len;

    public MessageFramer() {
        this(Json.newMapper(), DEFAULT_MAX_BUFFER);
    }

    public MessageFramer(ObjectMapper mapper, int maxBuffer) {
        if (maxBuffer < 2) throw new IllegalArgumentException("maxBuffer too small: " + maxBuffer);
        this.mapper = mapper;
        this.maxBuffer = maxBuffer;
    }

    public List<JsonNode> frameIncoming(byte[] data) {
        return frameIncoming(data, 0, data.length);
    }

    /**
     * Appends {@code data} and returns every message completed by it, in stream order.
     * Incomplete trailing data stays buffered for the next call.
     */
    public List<JsonNode> frameIncoming(byte[] data, int offset, int length) {
        append(data, offset, length);
        List<JsonNode> out = new ArrayList<>();

        int pos = 0;
        while (pos < len) {
            int start = indexOf((byte) '{', pos);
            if (start < 0) {
                pos = len;
                break;
            }
            int end = findObjectEnd(start);
            if (end < 0) {
                pos = start;
                break;
            }
            try {
                out.add(mapper.readTree(buf, start, end - start + 1));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed message: {}", preview(start, end));
            } catch (IOException e) {
                log.warn("Skipping unreadable message: {}", e.getMessage());
            }
            pos = end + 1;
        }
        compact(pos);
        return out;
    }

    public byte[] encode(Object message) {
        try {
            return mapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot encode message: " + e.getOriginalMessage(), e);
        }
    }

    /** Bytes held back waiting for the rest of a message. */
    public int bufferedBytes() {
        return len;
    }

    /** Index of the closing brace of the object starting at {@code start}, or -1 if not yet complete. */
    private int findObjectEnd(int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < len; i++) {
            byte b = buf[i];
            if (escaped) {
                escaped = false;
                continue;
            }
            if (inString) {
                if (b == '\\') escaped = true;
                else if (b == '"') inString = false;
                continue;
            }
            if (b == '"') {
                inString = true;
            } else if (b == '{') {
                depth++;
            } else if (b == '}') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private void append(byte[] data, int offset, int length) {
        if (len + length > buf.length) {
            int capacity = Math.max(buf.length * 2, len + length);
            buf = Arrays.copyOf(buf, Math.min(capacity, Math.max(maxBuffer, len + length)));
        }
        System.arraycopy(data, offset, buf, len, length);
        len += length;

        if (len > maxBuffer) {
            int keep = maxBuffer / 2;
            log.error("Incoming buffer exceeded {} bytes, dropping the oldest {} bytes", maxBuffer, len - keep);
            System.arraycopy(buf, len - keep, buf, 0, keep);
            len = keep;
        }
    }

    private void compact(int consumed) {
        if (consumed <= 0) return;
        System.arraycopy(buf, consumed, buf, 0, len - consumed);
        len -= consumed;
    }

    private int indexOf(byte target, int from) {
        for (int i = from; i < len; i++) {
            if (buf[i] == target) return i;
        }
        return -1;
    }

    private String preview(int start, int end) {
        int n = Math.min(end - start + 1, 200);
        return new String(buf, start, n, StandardCharsets.UTF_8);
    }
}
