/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.names.exception;

import com.icodici.names.ErrorRecord;
import com.icodici.names.Errors;

/**
 * Rejection of a name service operation. The operation that throws it has no effect at all: no token, no record, no
 * ledger entry and no value moved.
 */
public class NameServiceError extends Exception {

    private final ErrorRecord errorRecord;

    public NameServiceError(ErrorRecord er) {
        super(er.toString());
        this.errorRecord = er;
    }

    public NameServiceError(Errors code, String object, String message) {
        this(new ErrorRecord(code, object, message));
    }

    public ErrorRecord getErrorRecord() {
        return errorRecord;
    }

    public Errors getError() {
        return errorRecord.getError();
    }

    @Override
    public String toString() {
        return "NameServiceError: " + errorRecord;
    }
}
