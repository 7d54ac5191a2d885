package com.postq;

/**
 * Pushes rendered content to one target on the messaging platform.
 * Register an implementation as a Spring bean; PostQ calls it from its delivery
 * threads, so implementations must be thread-safe.
 */
public interface MessageTransport {

    /**
     * Sends the content to a single target.
     * <p>
     * Failures may be reported either through the returned {@link SendResult} or
     * by throwing {@link TransientDeliveryException} or
     * {@link PermanentDeliveryException}. Any other exception is treated as
     * transient.
     *
     * @param content  the rendered message
     * @param targetId the destination identifier
     * @return the outcome of the attempt
     * @throws Exception if sending fails
     */
    SendResult send(RenderedContent content, String targetId) throws Exception;
}
