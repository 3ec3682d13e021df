package com.icodici.names;

import com.icodici.names.exception.NameServiceError;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public final class ErrorAssert {

    public interface Operation {
        void run() throws Exception;
    }

    private ErrorAssert() {
    }

    /**
     * Run the operation and check it fails with the given error code.
     */
    public static NameServiceError assertError(Errors expected, Operation op) throws Exception {
        try {
            op.run();
        } catch (NameServiceError e) {
            assertEquals(e.toString(), expected, e.getError());
            return e;
        }
        fail("expected " + expected);
        return null;
    }
}
