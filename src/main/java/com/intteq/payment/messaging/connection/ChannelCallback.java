package com.intteq.payment.messaging.connection;

import com.rabbitmq.client.Channel;

import java.io.IOException;

@FunctionalInterface
public interface ChannelCallback<T> {

    T doInChannel(Channel channel) throws IOException;
}
