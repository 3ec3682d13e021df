package com.icodici.names.registry;

import com.icodici.names.Errors;
import com.icodici.names.NameHash;
import com.icodici.names.exception.NameServiceError;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Derives {@link NameHash} identifiers.
 * <p>
 * A top-level name is packed as {@code name + "." + namespace}, both canonical; names with a dot are rejected so that
 * the packing is unambiguous. A sub-name is packed as the parent digest, a zero byte and the canonical sub-name, so it
 * never collides with any top-level name, whatever its text is.
 */
public final class NameHasher {

    private NameHasher() {
    }

    public static NameHash hash(String name, String namespace) throws NameServiceError {
        String n = NameCanonicalizer.canonical(name);
        String ns = NameCanonicalizer.canonical(namespace);
        if (n.indexOf('.') >= 0)
            throw new NameServiceError(Errors.BAD_VALUE, "name", "name can't contain a dot: " + name);
        return NameHash.of((n + "." + ns).getBytes(StandardCharsets.UTF_8));
    }

    public static NameHash subHash(NameHash parent, String subName) throws NameServiceError {
        if (parent == null)
            throw new NameServiceError(Errors.BAD_VALUE, "parent", "parent hash is required");
        String sub = NameCanonicalizer.canonical(subName);
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        bos.writeBytes(parent.getDigest());
        bos.write(0);
        bos.writeBytes(sub.getBytes(StandardCharsets.UTF_8));
        return NameHash.of(bos.toByteArray());
    }
}
