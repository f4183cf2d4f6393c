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

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Key material derived from a catalog passphrase.
 * <p>
 * The passphrase is wrapped in a fixed application-domain string and run through
 * two independent digests:
 * <ul>
 *   <li>SHA-224 produces the keystream password, repeated cyclically over the data</li>
 *   <li>SHA-256 produces the flag, embedded in every metadata document so a wrong
 *       passphrase can be detected on decode</li>
 * </ul>
 * Both values are the lowercase hex rendering of the digest, used as ASCII bytes.
 * The domain string is part of the on-disk format and must not change.
 *
 * @param keystream the cyclic XOR key
 * @param flag      the validation flag embedded in document envelopes
 */
public record KeyMaterial(byte[] keystream, String flag) {

    private static final String DOMAIN_PREFIX = "photos.";
    private static final String DOMAIN_SUFFIX = ".heerkirov.com";

    /**
     * Derives fresh key material for the given passphrase.
     *
     * @param passphrase the catalog passphrase (may be empty, never null)
     * @return the derived key material
     */
    public static KeyMaterial derive(String passphrase) {
        if (passphrase == null) {
            throw new IllegalArgumentException("passphrase must not be null");
        }
        byte[] seed = (DOMAIN_PREFIX + passphrase + DOMAIN_SUFFIX).getBytes(StandardCharsets.UTF_8);
        String password = hexDigest("SHA-224", seed);
        String flag = hexDigest("SHA-256", seed);
        return new KeyMaterial(password.getBytes(StandardCharsets.US_ASCII), flag);
    }

    private static String hexDigest(String algorithm, byte[] input) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance(algorithm).digest(input));
        } catch (NoSuchAlgorithmException e) {
            // SHA-224 and SHA-256 are mandatory on every JDK
            throw new IllegalStateException("Digest not available: " + algorithm, e);
        }
    }
}
