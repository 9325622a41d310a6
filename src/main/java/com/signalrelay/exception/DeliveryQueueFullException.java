package com.signalrelay.exception;

public class DeliveryQueueFullException extends BaseException {

    public DeliveryQueueFullException(String message) {
        super(ErrorCode.QUEUE_FULL, message);
    }
}
