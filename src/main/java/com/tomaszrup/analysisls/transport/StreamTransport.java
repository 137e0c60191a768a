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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.analysisls.protocol.LspConnectionException;

/**
 * Shared logic for the header-framed stream kinds. Subclasses open the
 * underlying channel and hand over its streams through {@link #attach}.
 */
abstract class StreamTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(StreamTransport.class);

    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile InputStream input;
    private volatile OutputStream output;

    protected void attach(InputStream in, OutputStream out) {
        this.input = new BufferedInputStream(in);
        this.output = new BufferedOutputStream(out);
        closed.set(false);
    }

    @Override
    public byte[] send(byte[] payload) throws IOException {
        OutputStream out = output;
        if (out == null || closed.get()) {
            throw new LspConnectionException("No " + getType().id() + " connection");
        }
        synchronized (writeLock) {
            MessageFraming.writeFrame(out, payload);
        }
        return null;
    }

    @Override
    public byte[] receive() throws IOException {
        InputStream in = input;
        if (in == null || closed.get()) {
            return null;
        }
        try {
            return MessageFraming.readFrame(in);
        } catch (IOException e) {
            if (closed.get()) {
                return null;
            }
            throw e;
        }
    }

    @Override
    public boolean isConnected() {
        return input != null && !closed.get();
    }

    @Override
    public void disconnect() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        closeQuietly(output, "output");
        closeQuietly(input, "input");
        output = null;
        input = null;
        releaseChannel();
    }

    protected boolean isClosed() {
        return closed.get();
    }

    /** Releases the channel-specific resources (socket, process). */
    protected abstract void releaseChannel();

    protected static void closeQuietly(AutoCloseable closeable, String what) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            logger.debug("Failed to close {}: {}", what, e.getMessage());
        }
    }
}
