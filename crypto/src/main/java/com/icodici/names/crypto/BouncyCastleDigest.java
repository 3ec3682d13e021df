package com.icodici.names.crypto;

import org.bouncycastle.crypto.digests.GOST3411_2012_256Digest;
import org.bouncycastle.crypto.digests.SHA3Digest;
import org.bouncycastle.crypto.digests.SHA512tDigest;

/**
 * Digest implementation over a BouncyCastle digest engine. Use the factory methods to get the algorithms the name
 * hashing relies on.
 */
public final class BouncyCastleDigest extends Digest {

    private final org.bouncycastle.crypto.Digest md;

    private BouncyCastleDigest(org.bouncycastle.crypto.Digest md) {
        this.md = md;
    }

    /**
     * SHA-512/256, the SHA2 family variant resistant to the length extension attack.
     */
    public static BouncyCastleDigest sha512_256() {
        return new BouncyCastleDigest(new SHA512tDigest(256));
    }

    public static BouncyCastleDigest sha3_256() {
        return new BouncyCastleDigest(new SHA3Digest(256));
    }

    /**
     * ГОСТ Р 34.11-2012 "Stribog", 256 bit.
     */
    public static BouncyCastleDigest gost3411_2012_256() {
        return new BouncyCastleDigest(new GOST3411_2012_256Digest());
    }

    public String getAlgorithmName() {
        return md.getAlgorithmName();
    }

    @Override
    protected void _update(byte[] data, int offset, int size) {
        md.update(data, offset, size);
    }

    @Override
    protected byte[] _digest() {
        byte[] result = new byte[md.getDigestSize()];
        md.doFinal(result, 0);
        return result;
    }

    @Override
    public int getLength() {
        return md.getDigestSize();
    }
}
