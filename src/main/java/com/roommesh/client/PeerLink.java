package com.roommesh.client;

import com.roommesh.client.transport.IceCandidate;
import com.roommesh.client.transport.MediaStream;
import com.roommesh.client.transport.PeerTransport;
import com.roommesh.client.transport.PeerTransportFactory;
import com.roommesh.client.transport.SessionDescription;
import com.roommesh.client.transport.TransportState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Negotiation state machine for the media link between the local participant and one remote
 * participant. Owns exactly one {@link PeerTransport}.
 * <p>
 * Offers, incoming descriptions and incoming candidates are processed one at a time, in arrival
 * order, as a chain of continuations: a step starts only after the previous one has finished.
 * Remote candidates that arrive before a remote description is applied are queued and added in
 * order right after it succeeds.
 * <p>
 * When both sides offer at once, the participant with the lexicographically smaller id is the
 * polite one: it rolls back its own offer and answers. The other side ignores the colliding offer.
 * <p>
 * Listener callbacks are never invoked while the link's monitor is held.
 */
public class PeerLink {
    private static final Logger log = LoggerFactory.getLogger(PeerLink.class);
    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    /**
     * Sends a signal to the remote participant through the relay.
     */
    public interface SignalSender {
        void send(String remoteId, Signal signal);
    }

    public interface Listener {

        void onStateChanged(String remoteId, PeerLinkState state);

        void onRemoteStream(String remoteId, MediaStream stream);

        default void onTransportStateChanged(String remoteId, TransportState state) {
        }
    }

    private final String localId;
    private final String remoteId;
    private final boolean polite;
    private final PeerTransport transport;
    private final SignalSender sender;
    private final Listener listener;
    private final PeerLinkOptions options;
    private final ScheduledExecutorService scheduler;

    private final Object lock = new Object();
    private final Deque<IceCandidate> pendingCandidates = new ArrayDeque<>();
    private CompletableFuture<Void> tail = DONE;
    private PeerLinkState state = PeerLinkState.IDLE;
    private boolean offerSent;
    private boolean localOfferPending;
    private boolean remoteDescriptionApplied;
    private boolean iceRestartAttempted;
    private boolean transportReleased;
    private ScheduledFuture<?> negotiationTimeout;

    public PeerLink(String localId, String remoteId, PeerTransportFactory transportFactory,
                    MediaStream localStream, SignalSender sender, Listener listener,
                    PeerLinkOptions options, ScheduledExecutorService scheduler) {
        this.localId = Objects.requireNonNull(localId, "localId");
        this.remoteId = Objects.requireNonNull(remoteId, "remoteId");
        if (remoteId.equals(localId)) {
            throw new IllegalArgumentException("Refusing to create a peer link from " + localId + " to itself");
        }
        this.polite = localId.compareTo(remoteId) < 0;
        this.sender = Objects.requireNonNull(sender, "sender");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.options = Objects.requireNonNull(options, "options");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.transport = transportFactory.create(remoteId, new TransportObserver());
        if (localStream != null) {
            transport.attachLocalTracks(localStream);
        }
    }

    public String getLocalId() { return localId; }

    public String getRemoteId() { return remoteId; }

    public boolean isPolite() { return polite; }

    public PeerLinkState getState() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean hasSentOffer() {
        synchronized (lock) {
            return offerSent;
        }
    }

    public int getPendingCandidateCount() {
        synchronized (lock) {
            return pendingCandidates.size();
        }
    }

    /**
     * Creates, applies and sends a local offer. Only an {@link PeerLinkState#IDLE} link offers;
     * otherwise this is a no-op. The returned future completes once the step has run.
     */
    public CompletableFuture<Void> offer() {
        return enqueue("offer", () -> {
            synchronized (lock) {
                if (state != PeerLinkState.IDLE) {
                    log.debug("Not offering to {}: link is {}", remoteId, state);
                    return DONE;
                }
                offerSent = true;
            }
            transition(PeerLinkState.OFFERING);
            return invoke(transport::createOffer)
                    .thenCompose(offer -> transport.setLocalDescription(offer).thenApply(v -> offer))
                    .thenAccept(offer -> {
                        synchronized (lock) {
                            if (state.isTerminal()) {
                                return;
                            }
                            localOfferPending = true;
                            scheduleNegotiationTimeout();
                        }
                        transition(PeerLinkState.AWAITING_ANSWER);
                        sender.send(remoteId, Signal.description(offer));
                        log.info("Offer created and sent to {}", remoteId);
                    })
                    .exceptionally(ex -> {
                        fail("could not create offer: " + rootCause(ex).getMessage());
                        return null;
                    });
        });
    }

    /**
     * Processes a signal relayed from the remote participant.
     */
    public CompletableFuture<Void> handleSignal(Signal signal) {
        String type = signal != null ? signal.getType() : null;
        if (type == null) {
            log.warn("Ignoring signal without type from {}", remoteId);
            return DONE;
        }
        switch (type) {
            case Signal.OFFER:
                return enqueue("offer from " + remoteId, () -> acceptOffer(signal.toSessionDescription()));
            case Signal.ANSWER:
                return enqueue("answer from " + remoteId, () -> acceptAnswer(signal.toSessionDescription()));
            case Signal.CANDIDATE:
                return enqueue("candidate from " + remoteId, () -> acceptCandidate(signal.getCandidate()));
            default:
                log.warn("Ignoring signal of unknown type {} from {}", type, remoteId);
                return DONE;
        }
    }

    /**
     * Releases the transport and drops all buffered state. Idempotent.
     */
    public void close() {
        synchronized (lock) {
            if (state == PeerLinkState.CLOSED) {
                return;
            }
            state = PeerLinkState.CLOSED;
            clearNegotiation();
        }
        releaseTransport();
        log.info("Peer link {} -> {} closed", localId, remoteId);
        listener.onStateChanged(remoteId, PeerLinkState.CLOSED);
    }

    private CompletableFuture<Void> acceptOffer(SessionDescription offer) {
        boolean collision;
        synchronized (lock) {
            collision = localOfferPending;
            if (collision && !polite) {
                log.info("Offer collision with {}: keeping own offer, ignoring theirs", remoteId);
                return DONE;
            }
            if (collision) {
                localOfferPending = false;
                cancelNegotiationTimeout();
            }
        }
        CompletableFuture<Void> ready = DONE;
        if (collision) {
            log.info("Offer collision with {}: rolling back own offer", remoteId);
            ready = invoke(() -> transport.setLocalDescription(SessionDescription.rollback()));
        }
        return ready
                .thenCompose(v -> applyRemoteDescription(offer))
                .thenCompose(v -> transport.createAnswer())
                .thenCompose(answer -> {
                    if (getState().isTerminal()) {
                        return CompletableFuture.<SessionDescription>completedFuture(null);
                    }
                    return transport.setLocalDescription(answer).thenApply(v -> answer);
                })
                .thenAccept(answer -> {
                    if (answer == null || getState().isTerminal()) {
                        log.debug("Discarding answer for {}: link is {}", remoteId, getState());
                        return;
                    }
                    transition(PeerLinkState.AWAITING_ANSWER);
                    sender.send(remoteId, Signal.description(answer));
                    log.info("Answer created and sent to {}", remoteId);
                });
    }

    private CompletableFuture<Void> acceptAnswer(SessionDescription answer) {
        synchronized (lock) {
            if (!localOfferPending) {
                if (options.isStrictAnswerState()) {
                    log.warn("Dropping answer from {}: no offer outstanding (link is {})", remoteId, state);
                    return DONE;
                }
                log.warn("Applying answer from {} without an outstanding offer (link is {})", remoteId, state);
            }
        }
        return applyRemoteDescription(answer).thenRun(() -> {
            synchronized (lock) {
                localOfferPending = false;
                cancelNegotiationTimeout();
            }
            log.info("Answer received and set for {}", remoteId);
        });
    }

    private CompletableFuture<Void> acceptCandidate(IceCandidate candidate) {
        if (candidate == null) {
            log.warn("Ignoring empty ICE candidate from {}", remoteId);
            return DONE;
        }
        synchronized (lock) {
            if (!remoteDescriptionApplied) {
                pendingCandidates.addLast(candidate);
                log.debug("Queueing ICE candidate for {} (remote description not ready)", remoteId);
                return DONE;
            }
        }
        return addCandidate(candidate);
    }

    private CompletableFuture<Void> applyRemoteDescription(SessionDescription description) {
        return invoke(() -> transport.setRemoteDescription(description)).thenCompose(v -> {
            List<IceCandidate> queued;
            synchronized (lock) {
                remoteDescriptionApplied = true;
                queued = new ArrayList<>(pendingCandidates);
                pendingCandidates.clear();
            }
            if (!queued.isEmpty()) {
                log.debug("Adding {} queued ICE candidates for {}", queued.size(), remoteId);
            }
            CompletableFuture<Void> flushed = DONE;
            for (IceCandidate candidate : queued) {
                flushed = flushed.thenCompose(ignored -> addCandidate(candidate));
            }
            return flushed;
        });
    }

    // Never fails: a rejected candidate must not stop the link.
    private CompletableFuture<Void> addCandidate(IceCandidate candidate) {
        return invoke(() -> transport.addIceCandidate(candidate)).handle((v, ex) -> {
            if (ex != null) {
                log.warn("Failed to add ICE candidate for {}: {}", remoteId, rootCause(ex).getMessage());
            } else {
                log.debug("ICE candidate added for {}", remoteId);
            }
            return null;
        });
    }

    private CompletableFuture<Void> enqueue(String description, Supplier<CompletableFuture<Void>> step) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous;
        synchronized (lock) {
            if (state.isTerminal()) {
                log.debug("Skipping {}: link to {} is {}", description, remoteId, state);
                return DONE;
            }
            previous = tail;
            tail = done;
        }
        previous.whenComplete((v, ignored) -> runStep(description, step, done));
        return done;
    }

    private void runStep(String description, Supplier<CompletableFuture<Void>> step, CompletableFuture<Void> done) {
        if (getState().isTerminal()) {
            done.complete(null);
            return;
        }
        invoke(step).whenComplete((v, ex) -> {
            if (ex != null) {
                log.error("Error handling {} for link {} -> {}: {}",
                        description, localId, remoteId, rootCause(ex).getMessage());
            }
            done.complete(null);
        });
    }

    private void onTransportStateChange(TransportState transportState) {
        log.debug("Peer connection with {}: {}", remoteId, transportState);
        listener.onTransportStateChanged(remoteId, transportState);
        switch (transportState) {
            case CONNECTED:
                if (transition(PeerLinkState.CONNECTED)) {
                    log.info("Connected to {}", remoteId);
                }
                break;
            case FAILED:
                onIceFailure();
                break;
            default:
                break;
        }
    }

    private void onIceFailure() {
        boolean restart;
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            restart = !iceRestartAttempted;
            iceRestartAttempted = true;
        }
        if (restart) {
            log.warn("ICE connection failed with {}, restarting ICE", remoteId);
            transport.restartIce();
        } else {
            fail("ICE connection failed again after restart");
        }
    }

    private void onNegotiationTimeout() {
        synchronized (lock) {
            if (!localOfferPending || state.isTerminal()) {
                return;
            }
        }
        fail("no answer within " + options.getNegotiationTimeout());
    }

    private void fail(String reason) {
        synchronized (lock) {
            if (state.isTerminal()) {
                return;
            }
            state = PeerLinkState.FAILED;
            clearNegotiation();
        }
        log.error("Connection failed with {}: {}", remoteId, reason);
        releaseTransport();
        listener.onStateChanged(remoteId, PeerLinkState.FAILED);
    }

    private boolean transition(PeerLinkState next) {
        synchronized (lock) {
            if (!canMove(state, next)) {
                return false;
            }
            state = next;
        }
        listener.onStateChanged(remoteId, next);
        return true;
    }

    private static boolean canMove(PeerLinkState from, PeerLinkState to) {
        if (from == to || from.isTerminal() || to == PeerLinkState.IDLE) {
            return false;
        }
        return from != PeerLinkState.CONNECTED || to.isTerminal();
    }

    // Caller holds the lock.
    private void clearNegotiation() {
        cancelNegotiationTimeout();
        pendingCandidates.clear();
        localOfferPending = false;
    }

    // Caller holds the lock.
    private void scheduleNegotiationTimeout() {
        if (!options.isNegotiationTimeoutEnabled()) {
            return;
        }
        cancelNegotiationTimeout();
        negotiationTimeout = scheduler.schedule(this::onNegotiationTimeout,
                options.getNegotiationTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    // Caller holds the lock.
    private void cancelNegotiationTimeout() {
        if (negotiationTimeout != null) {
            negotiationTimeout.cancel(false);
            negotiationTimeout = null;
        }
    }

    private void releaseTransport() {
        synchronized (lock) {
            if (transportReleased) {
                return;
            }
            transportReleased = true;
        }
        try {
            transport.close();
        } catch (RuntimeException e) {
            log.warn("Error closing transport to {}: {}", remoteId, e.getMessage());
        }
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> operation) {
        try {
            return operation.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private final class TransportObserver implements PeerTransport.Observer {

        @Override
        public void onIceCandidate(IceCandidate candidate) {
            if (getState().isTerminal()) {
                return;
            }
            sender.send(remoteId, Signal.candidate(candidate));
        }

        @Override
        public void onTrack(MediaStream stream) {
            if (getState().isTerminal()) {
                return;
            }
            log.info("Received remote stream from {}", remoteId);
            listener.onRemoteStream(remoteId, stream);
        }

        @Override
        public void onConnectionStateChange(TransportState transportState) {
            onTransportStateChange(transportState);
        }
    }
}
