package in.matchbot.application.port.output;

import in.matchbot.domain.conversation.OutboundMessage;

/**
 * Outbound side of the messaging transport.
 */
public interface MessageSender {
    /**
     * Deliver one message.
     *
     * @throws DeliveryException if the transport rejected or failed the delivery
     */
    void send(OutboundMessage message);
}
