////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.analysisls.transport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

import com.tomaszrup.analysisls.protocol.LspProtocolException;

/**
 * LSP base-protocol framing: a header block terminated by an empty line,
 * which must contain {@code Content-Length}, followed by exactly that many
 * bytes of payload.
 *
 * <pre>
 * Content-Length: 52\r\n
 * \r\n
 * {"jsonrpc":"2.0","method":"initialized","params":{}}
 * </pre>
 */
public final class MessageFraming {

    public static final String CONTENT_LENGTH = "Content-Length";

    /** Upper bound for a single header line, to fail fast on garbage input. */
    private static final int MAX_HEADER_LINE = 8192;

    /** Largest payload accepted from a peer. */
    public static final int MAX_CONTENT_LENGTH = 64 * 1024 * 1024;

    private MessageFraming() {
    }

    public static byte[] frame(byte[] payload) {
        byte[] header = (CONTENT_LENGTH + ": " + payload.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        byte[] framed = new byte[header.length + payload.length];
        System.arraycopy(header, 0, framed, 0, header.length);
        System.arraycopy(payload, 0, framed, header.length, payload.length);
        return framed;
    }

    public static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        out.write(frame(payload));
        out.flush();
    }

    /**
     * Reads one framed message. Short reads are retried until the declared
     * length has been consumed.
     *
     * @return the payload, or {@code null} if the stream ended before a new
     *         header started
     * @throws java.io.EOFException  if the stream ends inside a message
     * @throws LspProtocolException  if the header block has no valid
     *                               {@code Content-Length} or it exceeds
     *                               {@link #MAX_CONTENT_LENGTH}
     */
    public static byte[] readFrame(InputStream in) throws IOException {
        int contentLength = -1;
        boolean sawHeader = false;
        while (true) {
            String line = readHeaderLine(in, sawHeader);
            if (line == null) {
                return null;
            }
            if (line.isEmpty()) {
                if (!sawHeader) {
                    // tolerate stray blank lines between messages
                    continue;
                }
                break;
            }
            sawHeader = true;
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new LspProtocolException("Malformed header line: " + line);
            }
            String name = line.substring(0, colon).trim();
            if (CONTENT_LENGTH.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                try {
                    contentLength = Integer.parseInt(line.substring(colon + 1).trim());
                } catch (NumberFormatException e) {
                    throw new LspProtocolException("Invalid Content-Length: " + line, e);
                }
            }
        }
        if (contentLength < 0) {
            throw new LspProtocolException("Header block without Content-Length");
        }
        if (contentLength > MAX_CONTENT_LENGTH) {
            throw new LspProtocolException("Content-Length " + contentLength + " exceeds " + MAX_CONTENT_LENGTH
                    + " bytes");
        }
        return readFully(in, contentLength);
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] payload = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(payload, offset, length - offset);
            if (read < 0) {
                throw new java.io.EOFException("Stream ended after " + offset + " of " + length + " payload bytes");
            }
            offset += read;
        }
        return payload;
    }

    /**
     * Reads one CRLF (or bare LF) terminated header line.
     *
     * @return the line without terminator, or {@code null} at end of stream
     *         before any byte of a new message was read
     */
    private static String readHeaderLine(InputStream in, boolean insideHeader) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        while (true) {
            int c = in.read();
            if (c < 0) {
                if (line.size() == 0 && !insideHeader) {
                    return null;
                }
                throw new java.io.EOFException("Stream ended inside a message header");
            }
            if (c == '\n') {
                break;
            }
            line.write(c);
            if (line.size() > MAX_HEADER_LINE) {
                throw new LspProtocolException("Header line exceeds " + MAX_HEADER_LINE + " bytes");
            }
        }
        String text = line.toString(StandardCharsets.US_ASCII);
        if (text.endsWith("\r")) {
            text = text.substring(0, text.length() - 1);
        }
        return text;
    }
}
