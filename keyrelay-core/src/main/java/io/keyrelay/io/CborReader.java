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

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.util.Iterator;

import co.nstant.in.cbor.CborDecoder;
import co.nstant.in.cbor.CborException;
import co.nstant.in.cbor.model.Array;
import co.nstant.in.cbor.model.ByteString;
import co.nstant.in.cbor.model.DataItem;
import co.nstant.in.cbor.model.NegativeInteger;
import co.nstant.in.cbor.model.SimpleValue;
import co.nstant.in.cbor.model.UnicodeString;
import co.nstant.in.cbor.model.UnsignedInteger;

/**
 * Reads back an array written by {@link CborWriter}, item by item. Closing the reader checks that every item was
 * consumed, so a decoder that silently ignores trailing fields is caught.
 */
public final class CborReader implements Closeable {
    private final Iterator<DataItem> items;
    private final int size;

    private CborReader(Array array) {
        this.size = array.getDataItems().size();
        this.items = array.getDataItems().iterator();
    }

    /**
     * Decodes input that must consist of exactly one CBOR array.
     *
     * @throws IOException if the input is not well-formed CBOR, is not an array, or has data after the array.
     */
    public static CborReader ofArray(byte[] encoded) throws IOException {
        try {
            var decoded = new CborDecoder(new ByteArrayInputStream(encoded)).decode();
            if (decoded.size() != 1 || !(decoded.get(0) instanceof Array array)) {
                throw new IOException("Expected a single CBOR array");
            }
            return new CborReader(array);
        } catch (CborException e) {
            throw new IOException("Malformed CBOR", e);
        }
    }

    public int size() {
        return size;
    }

    public byte[] readBytes() throws IOException {
        return next(ByteString.class).getBytes();
    }

    /**
     * Reads a byte string that may have been written as CBOR {@code null}.
     */
    public byte[] readOptionalBytes() throws IOException {
        var item = next();
        return SimpleValue.NULL.equals(item) ? null : cast(item, ByteString.class).getBytes();
    }

    public byte[] readFixedLengthBytes(int expectedLength) throws IOException {
        var bytes = readBytes();
        if (bytes.length != expectedLength) {
            throw new IOException("Expected " + expectedLength + " bytes but read " + bytes.length);
        }
        return bytes;
    }

    public String readString() throws IOException {
        return next(UnicodeString.class).getString();
    }

    public long readInt() throws IOException {
        var item = next();
        if (item instanceof UnsignedInteger unsigned) {
            return unsigned.getValue().longValueExact();
        } else if (item instanceof NegativeInteger negative) {
            return negative.getValue().longValueExact();
        }
        throw new IOException("Expected an integer but got " + item.getClass().getSimpleName());
    }

    @Override
    public void close() throws IOException {
        if (items.hasNext()) {
            throw new IOException("Unread items left in CBOR array");
        }
    }

    private DataItem next() throws IOException {
        if (!items.hasNext()) {
            throw new EOFException("CBOR array has no more items");
        }
        return items.next();
    }

    private <T extends DataItem> T next(Class<T> expectedType) throws IOException {
        return cast(next(), expectedType);
    }

    private static <T extends DataItem> T cast(DataItem item, Class<T> expectedType) throws IOException {
        if (!expectedType.isInstance(item)) {
            throw new IOException("Expected " + expectedType.getSimpleName() + " but got "
                    + item.getClass().getSimpleName());
        }
        return expectedType.cast(item);
    }
}
