package com.signalrelay.exception;

public class SignatureVerificationException extends BaseException {

    public SignatureVerificationException(String message) {
        super(ErrorCode.SIGNATURE_INVALID, message);
    }
}
