package com.intteq.payment.messaging.connection;

import com.rabbitmq.client.Channel;

/**
 * Callback for components that must re-attach to a freshly established channel.
 */
@FunctionalInterface
public interface ConnectionListener {

    /**
     * Called after a connection and channel have been established and the topology applied.
     * The channel replaces any previous one, which must not be used again.
     */
    void onConnected(Channel channel);
}
