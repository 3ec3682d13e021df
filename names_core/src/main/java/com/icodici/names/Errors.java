/*
 * Copyright (c) 2017 Sergey Chernov, iCodici S.n.C, All Rights Reserved
 *
 * Written by Sergey Chernov <real.sergeych@gmail.com>, August 2017.
 *
 */

package com.icodici.names;

public enum Errors {
    /**
     * The name (or sub-name) is already bound to an ownership token.
     */
    ALREADY_REGISTERED,
    INSUFFICIENT_PAYMENT,
    /**
     * No price tier is configured for the length of the name.
     */
    INVALID_LENGTH,
    NOT_OWNER,
    /**
     * Name never registered (or burned), or ledger index out of bounds.
     */
    NOT_FOUND,
    /**
     * Fee forward, refund or any other value transfer has failed.
     */
    TRANSFER_FAILED,
    /**
     * State-mutating call made while another one is still in progress on the same call stack.
     */
    REENTRANCY_BLOCKED,
    /**
     * Administrative operation called by someone who is not the administrator.
     */
    UNAUTHORIZED,
    LABEL_TAKEN,
    WRONG_FEE,
    /**
     * Malformed argument: empty name, negative price and like.
     */
    BAD_VALUE
}
