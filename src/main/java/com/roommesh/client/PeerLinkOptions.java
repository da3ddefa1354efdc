package com.roommesh.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of {@link PeerLink} negotiation.
 */
public final class PeerLinkOptions {
    public static final Duration DEFAULT_NEGOTIATION_TIMEOUT = Duration.ofSeconds(30);

    private final Duration negotiationTimeout;
    private final boolean strictAnswerState;

    private PeerLinkOptions(Duration negotiationTimeout, boolean strictAnswerState) {
        this.negotiationTimeout = Objects.requireNonNull(negotiationTimeout, "negotiationTimeout");
        this.strictAnswerState = strictAnswerState;
    }

    public static PeerLinkOptions defaults() {
        return new PeerLinkOptions(DEFAULT_NEGOTIATION_TIMEOUT, false);
    }

    /**
     * How long an offer may stay unanswered before the link fails. Zero disables the timeout.
     */
    public PeerLinkOptions withNegotiationTimeout(Duration timeout) {
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Negotiation timeout must not be negative: " + timeout);
        }
        return new PeerLinkOptions(timeout, strictAnswerState);
    }

    /**
     * Drop answers that arrive while no local offer is outstanding instead of applying them.
     */
    public PeerLinkOptions withStrictAnswerState(boolean strict) {
        return new PeerLinkOptions(negotiationTimeout, strict);
    }

    public Duration getNegotiationTimeout() { return negotiationTimeout; }

    public boolean isNegotiationTimeoutEnabled() { return !negotiationTimeout.isZero(); }

    public boolean isStrictAnswerState() { return strictAnswerState; }
}
