package com.icodici.names.crypto;

/**
 * Composite digest uses 3 orthogonal algorithms concatenating three different hashes together to get longer but much
 * more strong hash.
 * <p>
 * The algorithms are:
 * <p>
 * 1) SHA-512/256, the strongest to the length extension attack SHA2 family variant
 * <p>
 * 2) SHA3-256, which is a different algorithm from sha2 family
 * <p>
 * 3) ГОСТ Р 34.11-2012 "Stribog"
 * <p>
 * To collide, an attacker has to collide all 3 at the same input at once.
 */
public class CompositeDigest extends Digest {

    public static final int LENGTH = 96;

    private final Digest sha2Digest = BouncyCastleDigest.sha512_256();
    private final Digest sha3Digest = BouncyCastleDigest.sha3_256();
    private final Digest gostDigest = BouncyCastleDigest.gost3411_2012_256();

    @Override
    protected void _update(byte[] data, int offset, int size) {
        sha2Digest.update(data, offset, size);
        sha3Digest.update(data, offset, size);
        gostDigest.update(data, offset, size);
    }

    @Override
    protected byte[] _digest() {
        byte[] data = new byte[getLength()];
        int pos = 0;
        for (Digest d : new Digest[]{sha2Digest, sha3Digest, gostDigest}) {
            byte[] part = d.digest();
            System.arraycopy(part, 0, data, pos, part.length);
            pos += part.length;
        }
        return data;
    }

    @Override
    public int getLength() {
        return sha2Digest.getLength() + sha3Digest.getLength() + gostDigest.getLength();
    }
}
