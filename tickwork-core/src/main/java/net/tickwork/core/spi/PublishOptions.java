package net.tickwork.core.spi;

import java.time.Instant;

/**
 * @param mirrorToStream durable stream the message is also appended to, or null for pub/sub only
 * @param deliverAt      earliest time stream consumers may receive it, or null for immediately
 */
public record PublishOptions(String mirrorToStream, Instant deliverAt) {
    private static final PublishOptions NONE = new PublishOptions(null, null);

    public static PublishOptions none() { return NONE; }

    public static PublishOptions mirrorTo(String stream) { return new PublishOptions(stream, null); }

    public PublishOptions deliverAt(Instant at) { return new PublishOptions(mirrorToStream, at); }
}
