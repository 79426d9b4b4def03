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

package io.keyrelay.crypto;

import java.util.Arrays;
import java.util.HexFormat;

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.pando.crypto.nacl.Bytes;

public final class CryptoUtils {
    private static final Logger logger = LoggerFactory.getLogger(CryptoUtils.class);

    /**
     * Attempts to destroy the given key material. Any {@link DestroyFailedException}s thrown during the process are
     * logged and otherwise ignored, because most Java built-in keys throw the exception immediately without any
     * attempt to wipe key material from memory.
     *
     * @param toDestroy zero or more keys to destroy. Null entries are skipped.
     */
    public static void destroy(Destroyable... toDestroy) {
        for (var it : toDestroy) {
            if (it == null || it.isDestroyed()) {
                continue;
            }
            try {
                it.destroy();
            } catch (DestroyFailedException e) {
                logger.debug("Failed to destroy key of type {}", it.getClass().getSimpleName());
            }
        }
    }

    public static void wipe(byte[]... data) {
        for (var datum : data) {
            if (datum != null) {
                Arrays.fill(datum, (byte) 0);
            }
        }
    }

    public static byte[] randomBytes(int numBytes) {
        return Bytes.secureRandom(numBytes);
    }

    public static String randomHex(int numBytes) {
        return HexFormat.of().formatHex(randomBytes(numBytes));
    }

    public static boolean constantTimeEquals(byte[] a, byte[] b) {
        return a != null && b != null && Bytes.equal(a, b);
    }

    public static byte[] concat(byte[]... elements) {
        int totalSize = Arrays.stream(elements).mapToInt(b -> b.length).reduce(0, Math::addExact);
        byte[] result = new byte[totalSize];
        int offset = 0;
        for (var element : elements) {
            System.arraycopy(element, 0, result, offset, element.length);
            offset += element.length;
        }
        return result;
    }

    static byte[] reverse(byte[] input) {
        var output = new byte[input.length];
        for (int i = 0; i < input.length; ++i) {
            output[i] = input[input.length - i - 1];
        }
        return output;
    }

    private CryptoUtils() {}
}
