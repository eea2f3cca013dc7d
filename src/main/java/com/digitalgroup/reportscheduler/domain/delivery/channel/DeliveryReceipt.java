package com.digitalgroup.reportscheduler.domain.delivery.channel;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;

/**
 * @param reference provider-side handle: message id, object key, remote path, row id...
 */
public record DeliveryReceipt(DeliveryMethod method, String reference) {
}
