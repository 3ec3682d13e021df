/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.names;

import com.icodici.names.crypto.CompositeDigest;

import java.util.Arrays;
import java.util.Base64;

/**
 * Fixed-width identifier of a name: the {@link CompositeDigest} (SHA-512/256, SHA3-256 and Stribog concatenated) of
 * the name's packed form. Instances are immutable and usable as map keys; the natural order compares digests as
 * unsigned bytes.
 * <p>
 * See {@link com.icodici.names.registry.NameHasher} for how names are packed before hashing.
 */
public final class NameHash implements Comparable<NameHash> {

    private final byte[] digest;

    private NameHash(byte[] digest) {
        this.digest = digest;
    }

    /**
     * Return new NameHash calculating composite digest of the data.
     *
     * @param data packed name
     *
     * @return hash of the data
     */
    public static NameHash of(byte[] data) {
        return new NameHash(new CompositeDigest().digest(data));
    }

    /**
     * Create instance from a saved digest (obtained before with {@link #getDigest()}.
     *
     * @param digest to construct with
     *
     * @return instance with a given digest
     */
    public static NameHash withDigest(byte[] digest) {
        if (digest == null || digest.length != CompositeDigest.LENGTH)
            throw new IllegalArgumentException("name hash digest must be " + CompositeDigest.LENGTH + " bytes");
        return new NameHash(digest.clone());
    }

    public static NameHash withDigest(String encodedString) {
        return withDigest(Base64.getUrlDecoder().decode(encodedString));
    }

    public byte[] getDigest() {
        return digest.clone();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof NameHash)
            return Arrays.equals(digest, ((NameHash) obj).digest);
        return false;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digest);
    }

    @Override
    public int compareTo(NameHash other) {
        for (int i = 0; i < digest.length; i++) {
            // unsigned bytes for proper comparing:
            int my = digest[i] & 0xFF;
            int his = other.digest[i] & 0xFF;
            if (my < his) return -1;
            if (my > his) return +1;
        }
        return 0;
    }

    /**
     * @return base64url-encoded digest without trailing padding
     */
    public String toBase64String() {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
    }

    @Override
    public String toString() {
        return toBase64String().substring(0, 8) + "…";
    }
}
