package com.company.scheduler.client;

public interface DeliveryClient {

    /**
     * @throws com.company.scheduler.exception.DeliveryException when the message was not accepted
     */
    void deliver(OutboundMessage message);
}
