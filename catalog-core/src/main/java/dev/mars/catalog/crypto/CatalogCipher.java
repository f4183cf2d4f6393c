/*
 * Copyright 2026 Mark Andrew Ray-Smith
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
package dev.mars.catalog.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Symmetric codec for catalog documents and image payloads.
 * <p>
 * <b>Document format:</b>
 * <pre>
 * plaintext  = "DATA:" + flag + ":" + document
 * ciphertext = xor(rotate(plaintext, 8, +1), keystream)
 * </pre>
 * Payloads skip the envelope and the rotation and are only XORed with the keystream.
 * <p>
 * <b>Security:</b> this is a legacy obfuscation scheme, kept so existing catalog
 * folders stay readable. It hides content from casual inspection but offers no
 * integrity protection (a flipped ciphertext bit flips the plaintext bit) and the
 * repeating keystream falls to known-plaintext analysis. A wrong passphrase and a
 * corrupted document are indistinguishable on decode.
 * <p>
 * Key material is derived on every call; nothing is cached between calls.
 */
public final class CatalogCipher {

    private static final Logger LOG = LoggerFactory.getLogger(CatalogCipher.class);

    /** Envelope marker preceding the flag. */
    private static final String MARKER = "DATA";

    /** Rotation group size in bytes. */
    static final int GROUP_SIZE = 8;

    private final String passphrase;

    /**
     * Creates a codec bound to one passphrase.
     *
     * @param passphrase the catalog passphrase
     */
    public CatalogCipher(String passphrase) {
        if (passphrase == null) {
            throw new IllegalArgumentException("passphrase must not be null");
        }
        this.passphrase = passphrase;
    }

    // ========================================================================
    // Documents
    // ========================================================================

    /**
     * Wraps a serialized document in the flagged envelope and encrypts it.
     *
     * @param document the serialized document bytes
     * @return ciphertext, same length as the envelope
     */
    public byte[] encodeDocument(byte[] document) {
        KeyMaterial key = KeyMaterial.derive(passphrase);
        byte[] prefix = envelopePrefix(key);
        byte[] envelope = new byte[prefix.length + document.length];
        System.arraycopy(prefix, 0, envelope, 0, prefix.length);
        System.arraycopy(document, 0, envelope, prefix.length, document.length);
        return xor(rotate(envelope, GROUP_SIZE, 1), key.keystream());
    }

    /**
     * Decrypts a document and strips its envelope.
     *
     * @param ciphertext the stored bytes
     * @return the document bytes, or empty if the passphrase is wrong or the data corrupt
     */
    public Optional<byte[]> decodeDocument(byte[] ciphertext) {
        KeyMaterial key = KeyMaterial.derive(passphrase);
        byte[] envelope = rotate(xor(ciphertext, key.keystream()), GROUP_SIZE, -1);
        byte[] prefix = envelopePrefix(key);
        if (envelope.length < prefix.length
                || !Arrays.equals(envelope, 0, prefix.length, prefix, 0, prefix.length)) {
            LOG.debug("Document envelope mismatch ({} bytes)", ciphertext.length);
            return Optional.empty();
        }
        return Optional.of(Arrays.copyOfRange(envelope, prefix.length, envelope.length));
    }

    // ========================================================================
    // Payloads
    // ========================================================================

    /**
     * Encrypts a raw payload. XOR only, no envelope.
     */
    public byte[] encodePayload(byte[] payload) {
        return xor(payload, KeyMaterial.derive(passphrase).keystream());
    }

    /**
     * Decrypts a raw payload. Always succeeds; a wrong key yields garbage.
     */
    public byte[] decodePayload(byte[] payload) {
        return xor(payload, KeyMaterial.derive(passphrase).keystream());
    }

    // ========================================================================
    // Primitives
    // ========================================================================

    private static byte[] envelopePrefix(KeyMaterial key) {
        return (MARKER + ":" + key.flag() + ":").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Rotates bytes within consecutive groups of {@code groupSize}.
     * <p>
     * Output byte {@code i} takes the input byte at {@code i - step}, wrapped inside
     * its group. The final group may be shorter than {@code groupSize}. A negative
     * step undoes a positive one.
     */
    static byte[] rotate(byte[] data, int groupSize, int step) {
        int length = data.length;
        byte[] out = new byte[length];
        for (int head = 0; head < length; head += groupSize) {
            int width = Math.min(groupSize, length - head);
            for (int k = 0; k < width; k++) {
                int source = Math.floorMod(k - step, width);
                out[head + k] = data[head + source];
            }
        }
        return out;
    }

    /**
     * XORs {@code data} against {@code key}, repeating the key as often as needed.
     */
    static byte[] xor(byte[] data, byte[] key) {
        byte[] out = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = (byte) (data[i] ^ key[i % key.length]);
        }
        return out;
    }
}
