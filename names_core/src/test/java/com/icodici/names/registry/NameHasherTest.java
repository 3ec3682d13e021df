package com.icodici.names.registry;

import com.icodici.names.Errors;
import com.icodici.names.NameHash;
import org.junit.Test;

import static com.icodici.names.ErrorAssert.assertError;
import static org.junit.Assert.*;

public class NameHasherTest {

    @Test
    public void caseInsensitive() throws Exception {
        assertEquals(NameHasher.hash("Foo", "eth"), NameHasher.hash("foo", "eth"));
        assertEquals(NameHasher.hash("FOO", "ETH"), NameHasher.hash("foo", "eth"));
    }

    @Test
    public void namespacesDiffer() throws Exception {
        assertNotEquals(NameHasher.hash("foo", "eth"), NameHasher.hash("foo", "xyz"));
    }

    @Test
    public void deterministic() throws Exception {
        NameHash h = NameHasher.hash("alice", "eth");
        assertEquals(h.toBase64String(), NameHasher.hash("alice", "eth").toBase64String());
    }

    @Test
    public void subNamesDoNotCollide() throws Exception {
        NameHash parent = NameHasher.hash("alice", "eth");
        NameHash sub = NameHasher.subHash(parent, "Mail");
        assertEquals(sub, NameHasher.subHash(parent, "mail"));
        assertNotEquals(sub, NameHasher.hash("mail", "eth"));
        assertNotEquals(sub, NameHasher.hash("mail", "alice.eth"));
        assertNotEquals(sub, NameHasher.subHash(NameHasher.hash("bob", "eth"), "mail"));
    }

    @Test
    public void badNames() throws Exception {
        assertError(Errors.BAD_VALUE, () -> NameHasher.hash("", "eth"));
        assertError(Errors.BAD_VALUE, () -> NameHasher.hash(null, "eth"));
        assertError(Errors.BAD_VALUE, () -> NameHasher.hash("a.b", "eth"));
        assertError(Errors.BAD_VALUE, () -> NameHasher.hash("ab", ""));
        assertError(Errors.BAD_VALUE, () -> NameHasher.subHash(null, "mail"));
    }

    @Test
    public void canonicalFoldsOnlyAscii() throws Exception {
        assertEquals("hello-world_9", NameCanonicalizer.canonical("HeLLo-World_9"));
        assertEquals("straße", NameCanonicalizer.canonical("straße"));
        assertEquals("Ä", NameCanonicalizer.canonical("Ä"));
    }

    @Test
    public void lengthInCodePoints() throws Exception {
        assertEquals(4, NameCanonicalizer.length("abcd"));
        assertEquals(3, NameCanonicalizer.length("a😀b"));
    }
}
