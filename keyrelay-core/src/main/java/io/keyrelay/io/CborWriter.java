/*
 * Copyright 2024 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.keyrelay.io;

import java.io.ByteArrayOutputStream;
import java.util.function.Consumer;

import co.nstant.in.cbor.CborBuilder;
import co.nstant.in.cbor.CborEncoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.builder.ArrayBuilder;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.SimpleValue;
import co.nstant.in.cbor.model.UnicodeString;

/**
 * Builds a single <a href="https://cbor.io">CBOR</a> array. Used wherever a few fields need a canonical byte
 * encoding: the message header that is authenticated as AEAD associated data, and the ratchet key pair before it is
 * sealed at rest.
 */
public final class CborWriter {
    private final ArrayBuilder<CborBuilder> array = new CborBuilder().addArray();

    private CborWriter() {}

    /**
     * Encodes the items written by the callback as one definite-length CBOR array.
     */
    public static byte[] encodeArray(Consumer<CborWriter> contents) {
        var writer = new CborWriter();
        contents.accept(writer);
        var out = new ByteArrayOutputStream();
        try {
            new CborEncoder(out).encode(writer.array.end().build());
        } catch (CborException e) {
            throw new IllegalStateException("CBOR encoding failed", e);
        }
        return out.toByteArray();
    }

    /**
     * Writes a byte string, or CBOR {@code null} for an absent value.
     */
    public CborWriter writeBytes(byte[] bytes) {
        array.add(bytes == null ? SimpleValue.NULL : new ByteString(bytes));
        return this;
    }

    public CborWriter writeString(String string) {
        array.add(string == null ? SimpleValue.NULL : new UnicodeString(string));
        return this;
    }

    public CborWriter writeInt(long value) {
        array.add(value);
        return this;
    }
}
