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

import static org.assertj.core.api.Assertions.assertThat;

import org.testng.annotations.Test;

public class HybridKeyAgreementTest {

    @Test
    public void shouldAgreeOnSharedSecret() {
        var alice = HybridKeyAgreement.generateKeyPair();
        var bob = HybridKeyAgreement.generateKeyPair();

        var encapsulation = HybridKeyAgreement.encapsulate(bob, alice.classicalPublicKey(),
                alice.postQuantumPublicKey());
        var aliceSecret = HybridKeyAgreement.decapsulate(alice, bob.classicalPublicKey(),
                encapsulation.postQuantumCiphertext());

        assertThat(encapsulation.sharedSecret()).hasSize(HybridKeyAgreement.SHARED_SECRET_SIZE);
        assertThat(aliceSecret).isEqualTo(encapsulation.sharedSecret());
    }

    @Test
    public void shouldProduceFreshSecretForEachEncapsulation() {
        var alice = HybridKeyAgreement.generateKeyPair();
        var bob = HybridKeyAgreement.generateKeyPair();

        var first = HybridKeyAgreement.encapsulate(bob, alice.classicalPublicKey(), alice.postQuantumPublicKey());
        var second = HybridKeyAgreement.encapsulate(bob, alice.classicalPublicKey(), alice.postQuantumPublicKey());

        assertThat(first.sharedSecret()).isNotEqualTo(second.sharedSecret());
    }

    @Test
    public void shouldNotAgreeWithWrongClassicalKey() {
        var alice = HybridKeyAgreement.generateKeyPair();
        var bob = HybridKeyAgreement.generateKeyPair();
        var mallory = HybridKeyAgreement.generateKeyPair();

        var encapsulation = HybridKeyAgreement.encapsulate(bob, alice.classicalPublicKey(),
                alice.postQuantumPublicKey());
        var aliceSecret = HybridKeyAgreement.decapsulate(alice, mallory.classicalPublicKey(),
                encapsulation.postQuantumCiphertext());

        assertThat(aliceSecret).isNotEqualTo(encapsulation.sharedSecret());
    }
}
