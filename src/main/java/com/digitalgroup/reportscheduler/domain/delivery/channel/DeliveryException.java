package com.digitalgroup.reportscheduler.domain.delivery.channel;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryErrorKind;
import lombok.Getter;

/**
 * Channel failure. PERMANENT errors (bad address, rejected credentials, unknown
 * target) are never retried, whatever the retry policy says.
 */
@Getter
public class DeliveryException extends Exception {

    private final DeliveryErrorKind kind;

    public DeliveryException(DeliveryErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DeliveryException(DeliveryErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static DeliveryException transientError(String message, Throwable cause) {
        return new DeliveryException(DeliveryErrorKind.TRANSIENT, message, cause);
    }

    public static DeliveryException permanentError(String message) {
        return new DeliveryException(DeliveryErrorKind.PERMANENT, message);
    }

    public static DeliveryException permanentError(String message, Throwable cause) {
        return new DeliveryException(DeliveryErrorKind.PERMANENT, message, cause);
    }

    public boolean isPermanent() {
        return kind == DeliveryErrorKind.PERMANENT;
    }
}
