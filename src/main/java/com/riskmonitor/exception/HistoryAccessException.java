package com.riskmonitor.exception;

/**
 * The decision history store could not be read. The monitor skips the current
 * refresh cycle and keeps its previous snapshot.
 */
public class HistoryAccessException extends BaseException {

    public HistoryAccessException(String message) {
        super(ErrorCode.DATA_ACCESS_ERROR, message);
    }

    public HistoryAccessException(String message, Throwable cause) {
        super(ErrorCode.DATA_ACCESS_ERROR, message, cause);
    }
}
