package com.icodici.names.registry;

import com.icodici.names.Errors;
import com.icodici.names.exception.NameServiceError;

/**
 * Case-insensitive identity of names and namespace labels. Only ASCII capitals are folded, everything else is kept
 * as is, so the result does not depend on the default locale.
 */
public final class NameCanonicalizer {

    private NameCanonicalizer() {
    }

    /**
     * @param name to fold
     *
     * @return lower-cased name
     *
     * @throws NameServiceError with {@link Errors#BAD_VALUE} if the name is null or empty
     */
    public static String canonical(String name) throws NameServiceError {
        if (name == null || name.isEmpty())
            throw new NameServiceError(Errors.BAD_VALUE, "name", "name can't be empty");
        char[] chars = name.toCharArray();
        boolean changed = false;
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (c >= 'A' && c <= 'Z') {
                chars[i] = (char) (c + ('a' - 'A'));
                changed = true;
            }
        }
        return changed ? new String(chars) : name;
    }

    /**
     * Length of the canonical name as the price table sees it, in Unicode code points.
     */
    public static int length(String canonicalName) {
        return canonicalName.codePointCount(0, canonicalName.length());
    }
}
