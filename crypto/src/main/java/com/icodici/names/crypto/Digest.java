/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.names.crypto;

import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;

/**
 * Abstract base class for all message digests. Implementation must provide only {@link #getLength()}, {@link
 * #_update(byte[], int, int)} and {@link #_digest()} methods.
 * <p>
 * An instance calculates exactly one digest: once {@link #digest()} is called, further updates are rejected and
 * subsequent {@link #digest()} calls return the same value.
 */
public abstract class Digest {

    /**
     * Override to process sequence of bytes. Is called only until the digest is calculated.
     *
     * @param data   source message
     * @param offset index to start processing from
     * @param size   number of bytes to process
     */
    protected abstract void _update(byte[] data, int offset, int size);

    /**
     * Override it to calculate and return digest of all processed data. It is called only once per instance.
     */
    protected abstract byte[] _digest();

    /**
     * @return digest length in bytes
     */
    public abstract int getLength();

    private byte[] lastDigest = null;

    public void update(byte[] data, int offset, int length) {
        if (lastDigest == null)
            _update(data, offset, length);
        else
            throw new IllegalStateException("digest is already calculated");
    }

    public Digest update(byte[] data) {
        update(data, 0, data.length);
        return this;
    }

    public Digest update(int singleByte) {
        byte[] d = {(byte) (singleByte & 0xFF)};
        update(d, 0, 1);
        return this;
    }

    /**
     * Update digest with the UTF-8 representation of the string.
     */
    public Digest update(String data) {
        return update(data.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Calculate and return message digest or return last calculated digest.
     *
     * @return a copy of the message digest
     */
    public byte[] digest() {
        if (lastDigest == null)
            lastDigest = _digest();
        return lastDigest.clone();
    }

    public byte[] digest(byte[] data) {
        update(data);
        return digest();
    }

    public byte[] digest(String data) {
        update(data);
        return digest();
    }

    public String hexDigest() {
        return Hex.toHexString(digest());
    }

    public String hexDigest(String data) {
        update(data);
        return hexDigest();
    }
}
