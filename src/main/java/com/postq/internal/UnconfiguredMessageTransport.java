package com.postq.internal;

import com.postq.MessageTransport;
import com.postq.RenderedContent;
import com.postq.SendResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Used until the application provides a {@link MessageTransport} bean. Every
 * send fails permanently so no execution looks successful.
 */
public class UnconfiguredMessageTransport implements MessageTransport {

    private static final Logger log = LoggerFactory.getLogger(UnconfiguredMessageTransport.class);

    private final AtomicBoolean warned = new AtomicBoolean(false);

    @Override
    public SendResult send(RenderedContent content, String targetId) {
        if (warned.compareAndSet(false, true)) {
            log.warn("No MessageTransport bean is configured; PostQ deliveries will fail");
        }
        return SendResult.permanentFailure("No MessageTransport configured");
    }
}
