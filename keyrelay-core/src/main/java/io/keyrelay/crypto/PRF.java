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

import java.util.function.BiFunction;

import javax.crypto.SecretKey;

/**
 * A keyed pseudorandom function.
 */
public interface PRF extends BiFunction<SecretKey, byte[], byte[]> {
    int OUTPUT_SIZE_BYTES = 32;

    byte[] apply(SecretKey key, byte[] data);
    String algorithm();
    int outputSizeBytes();
}
