package com.icodici.names.crypto;

import org.bouncycastle.util.encoders.Hex;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.*;

public class DigestTest {

    @Test
    public void sha512_256() throws Exception {
        assertEquals("53048e2681941ef99b2e29b76b4c7dabe4c2d0c634fc6d46e0e2f13107e7af23",
                     BouncyCastleDigest.sha512_256().hexDigest("abc"));
        assertEquals("c672b8d1ef56ed28ab87c3622c5114069bdd3ad7b8f9737498d0c01ecef0967a",
                     BouncyCastleDigest.sha512_256().hexDigest(""));
        assertEquals(32, BouncyCastleDigest.sha512_256().getLength());
        assertEquals("SHA-512/256", BouncyCastleDigest.sha512_256().getAlgorithmName());
    }

    @Test
    public void sha3_256() throws Exception {
        assertEquals("3a985da74fe225b2045c172d6bd390bd855f086e3e9d525b46bfe24511431532",
                     BouncyCastleDigest.sha3_256().hexDigest("abc"));
        assertEquals("a7ffc6f8bf1ed76651c14756a061d662f580ff4de43b49fa82d80a4b80f8434a",
                     BouncyCastleDigest.sha3_256().hexDigest(""));
    }

    @Test
    public void gost() throws Exception {
        byte[] d1 = BouncyCastleDigest.gost3411_2012_256().digest("abc");
        byte[] d2 = BouncyCastleDigest.gost3411_2012_256().digest("abc");
        byte[] d3 = BouncyCastleDigest.gost3411_2012_256().digest("abd");
        assertEquals(32, d1.length);
        assertArrayEquals(d1, d2);
        assertThat(Hex.toHexString(d1), not(equalTo(Hex.toHexString(d3))));
    }

    @Test
    public void partialUpdates() throws Exception {
        Digest whole = BouncyCastleDigest.sha3_256();
        Digest parts = BouncyCastleDigest.sha3_256();
        parts.update("hello ").update("world");
        parts.update('!');
        assertArrayEquals(whole.digest("hello world!"), parts.digest());
    }

    @Test
    public void digestIsFinal() throws Exception {
        Digest d = BouncyCastleDigest.sha512_256();
        byte[] first = d.digest("abc");
        first[0] ^= 1;
        assertEquals("53048e2681941ef99b2e29b76b4c7dabe4c2d0c634fc6d46e0e2f13107e7af23", d.hexDigest());
        try {
            d.update("more");
            fail("update after digest must fail");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("already"));
        }
    }

    @Test
    public void composite() throws Exception {
        byte[] data = "alice.eth".getBytes();
        byte[] composite = new CompositeDigest().digest(data);
        assertEquals(CompositeDigest.LENGTH, composite.length);
        assertEquals(CompositeDigest.LENGTH, new CompositeDigest().getLength());

        byte[] expected = new byte[96];
        System.arraycopy(BouncyCastleDigest.sha512_256().digest(data), 0, expected, 0, 32);
        System.arraycopy(BouncyCastleDigest.sha3_256().digest(data), 0, expected, 32, 32);
        System.arraycopy(BouncyCastleDigest.gost3411_2012_256().digest(data), 0, expected, 64, 32);
        assertArrayEquals(expected, composite);
    }
}
