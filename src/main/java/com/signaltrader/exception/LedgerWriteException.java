package com.signaltrader.exception;

/** An append to the trade ledger failed. In-memory state must not move past the ledger when this is thrown. */
public class LedgerWriteException extends BaseException {

    public LedgerWriteException(String message, Throwable cause) {
        super(ErrorCode.LEDGER_WRITE_FAILED, message, cause);
    }
}
