package com.digitalgroup.reportscheduler.domain.delivery.channel;

import com.digitalgroup.reportscheduler.domain.common.enums.DeliveryMethod;

/**
 * One implementation per delivery method; the dispatcher calls them uniformly.
 * <p>
 * Implementations must tolerate being called again for the same run (retries
 * re-deliver to every channel), must bound their blocking I/O by
 * {@link DeliveryContext#remainingTimeout()} and must give up when the calling
 * thread is interrupted, which is how the dispatcher cancels an attempt that
 * ran past its timeout.
 */
public interface ChannelAdapter {

    DeliveryMethod method();

    /**
     * @throws DeliveryException classified as transient (retry allowed) or permanent
     */
    DeliveryReceipt deliver(ReportArtifact artifact, DeliveryContext context) throws DeliveryException;
}
