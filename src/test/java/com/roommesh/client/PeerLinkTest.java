package com.roommesh.client;

import com.roommesh.client.transport.IceCandidate;
import com.roommesh.client.transport.MediaStream;
import com.roommesh.client.transport.SessionDescription;
import com.roommesh.client.transport.TransportState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PeerLinkTest {

    private ScheduledExecutorService scheduler;
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final RecordingListener listener = new RecordingListener();

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void refusesLinkToItself() {
        FakeTransportFactory factory = new FakeTransportFactory("a");

        assertThatThrownBy(() -> link("a", "a", factory, PeerLinkOptions.defaults()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(factory.created).isEmpty();
    }

    @Test
    void attachesLocalMediaOnCreation() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        FakeMediaStream camera = new FakeMediaStream("camera");

        new PeerLink("a", "b", factory, camera, this::record, listener, PeerLinkOptions.defaults(), scheduler);

        assertThat(factory.last().attachedStreams).containsExactly(camera);
    }

    @Test
    void offerSendsLocalOfferAndAwaitsAnswer() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = link("a", "b", factory, PeerLinkOptions.defaults());

        link.offer().join();

        assertThat(link.getState()).isEqualTo(PeerLinkState.AWAITING_ANSWER);
        assertThat(link.hasSentOffer()).isTrue();
        assertThat(listener.states).containsExactly(PeerLinkState.OFFERING, PeerLinkState.AWAITING_ANSWER);
        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).to).isEqualTo("b");
        assertThat(sent.get(0).signal.getType()).isEqualTo(Signal.OFFER);
        assertThat(factory.last().hasLocalOffer()).isTrue();
    }

    @Test
    void secondOfferIsIgnored() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = link("a", "b", factory, PeerLinkOptions.defaults());

        link.offer().join();
        link.offer().join();

        assertThat(sent).hasSize(1);
    }

    @Test
    void answerCompletesNegotiation() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = link("a", "b", factory, PeerLinkOptions.defaults());
        link.offer().join();

        link.handleSignal(answer("b")).join();

        assertThat(link.getState()).isEqualTo(PeerLinkState.CONNECTED);
        assertThat(factory.last().currentRemoteDescription().getType()).isEqualTo(SessionDescription.Type.ANSWER);
    }

    @Test
    void incomingOfferIsAnswered() {
        FakeTransportFactory factory = new FakeTransportFactory("b");
        PeerLink link = link("b", "a", factory, PeerLinkOptions.defaults());

        link.handleSignal(offer("a")).join();

        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).signal.getType()).isEqualTo(Signal.ANSWER);
        assertThat(link.getState()).isEqualTo(PeerLinkState.CONNECTED);
        assertThat(link.hasSentOffer()).isFalse();
    }

    @Test
    void answeringSideWaitsForTransportBeforeConnected() {
        FakeTransportFactory factory = new FakeTransportFactory("b");
        PeerLink link = link("b", "a", factory, PeerLinkOptions.defaults());
        factory.last().autoConnect = false;

        link.handleSignal(offer("a")).join();
        assertThat(link.getState()).isEqualTo(PeerLinkState.AWAITING_ANSWER);

        factory.last().emitState(TransportState.CONNECTED);
        assertThat(link.getState()).isEqualTo(PeerLinkState.CONNECTED);
    }

    @Test
    void candidatesBeforeRemoteDescriptionAreQueuedAndFlushedInOrder() {
        FakeTransportFactory factory = new FakeTransportFactory("b");
        PeerLink link = link("b", "a", factory, PeerLinkOptions.defaults());
        IceCandidate first = candidate(1);
        IceCandidate second = candidate(2);
        IceCandidate third = candidate(3);

        link.handleSignal(Signal.candidate(first)).join();
        link.handleSignal(Signal.candidate(second)).join();

        assertThat(link.getPendingCandidateCount()).isEqualTo(2);
        assertThat(factory.last().addedCandidates).isEmpty();

        link.handleSignal(offer("a")).join();
        assertThat(factory.last().addedCandidates).containsExactly(first, second);
        assertThat(link.getPendingCandidateCount()).isZero();

        link.handleSignal(Signal.candidate(third)).join();
        assertThat(factory.last().addedCandidates).containsExactly(first, second, third);
    }

    @Test
    void rejectedCandidateDoesNotStopTheLink() {
        FakeTransportFactory factory = new FakeTransportFactory("b");
        PeerLink link = link("b", "a", factory, PeerLinkOptions.defaults());
        IceCandidate bad = candidate(1);
        IceCandidate good = candidate(2);
        factory.last().rejectedCandidates.add(bad);

        link.handleSignal(Signal.candidate(bad)).join();
        link.handleSignal(Signal.candidate(good)).join();
        link.handleSignal(offer("a")).join();

        assertThat(factory.last().addedCandidates).containsExactly(good);
        assertThat(link.getState()).isEqualTo(PeerLinkState.CONNECTED);
    }

    @Test
    void localCandidatesAreRelayedToRemote() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        link("a", "b", factory, PeerLinkOptions.defaults());

        factory.last().emitLocalCandidate(candidate(7));

        assertThat(sent).hasSize(1);
        assertThat(sent.get(0).to).isEqualTo("b");
        assertThat(sent.get(0).signal.getType()).isEqualTo(Signal.CANDIDATE);
        assertThat(sent.get(0).signal.getCandidate()).isEqualTo(candidate(7));
    }

    @Test
    void remoteTrackIsHandedToListener() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        link("a", "b", factory, PeerLinkOptions.defaults());
        FakeMediaStream remote = new FakeMediaStream("remote-b");

        factory.last().emitTrack(remote);

        assertThat(listener.streams).containsExactly(remote);
    }

    @Test
    void politeSideRollsBackItsOfferOnCollision() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = link("a", "b", factory, PeerLinkOptions.defaults());
        assertThat(link.isPolite()).isTrue();
        link.offer().join();

        link.handleSignal(offer("b")).join();

        FakePeerTransport transport = factory.last();
        assertThat(transport.localDescriptions).extracting(SessionDescription::getType).containsExactly(
                SessionDescription.Type.OFFER, SessionDescription.Type.ROLLBACK, SessionDescription.Type.ANSWER);
        assertThat(sent).extracting(s -> s.signal.getType()).containsExactly(Signal.OFFER, Signal.ANSWER);
        assertThat(link.getState()).isEqualTo(PeerLinkState.CONNECTED);
    }

    @Test
    void impoliteSideIgnoresCollidingOffer() {
        FakeTransportFactory factory = new FakeTransportFactory("b");
        PeerLink link = link("b", "a", factory, PeerLinkOptions.defaults());
        assertThat(link.isPolite()).isFalse();
        link.offer().join();

        link.handleSignal(offer("a")).join();

        assertThat(factory.last().remoteDescriptions).isEmpty();
        assertThat(sent).extracting(s -> s.signal.getType()).containsExactly(Signal.OFFER);
        assertThat(link.getState()).isEqualTo(PeerLinkState.AWAITING_ANSWER);

        link.handleSignal(answer("a")).join();
        assertThat(link.getState()).isEqualTo(PeerLinkState.CONNECTED);
    }

    @Test
    void answerWithoutOfferIsAppliedByDefault() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = link("a", "b", factory, PeerLinkOptions.defaults());

        link.handleSignal(answer("b")).join();

        assertThat(factory.last().remoteDescriptions).hasSize(1);
        assertThat(link.getState()).isEqualTo(PeerLinkState.IDLE);
    }

    @Test
    void strictModeDropsAnswerWithoutOffer() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = link("a", "b", factory, PeerLinkOptions.defaults().withStrictAnswerState(true));

        link.handleSignal(answer("b")).join();

        assertThat(factory.last().remoteDescriptions).isEmpty();
    }

    @Test
    void iceFailureRestartsOnceThenFails() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = link("a", "b", factory, PeerLinkOptions.defaults());
        link.offer().join();
        link.handleSignal(answer("b")).join();
        FakePeerTransport transport = factory.last();

        transport.emitState(TransportState.FAILED);
        assertThat(transport.restartIceCount).isEqualTo(1);
        assertThat(link.getState()).isEqualTo(PeerLinkState.CONNECTED);

        transport.emitState(TransportState.FAILED);
        assertThat(transport.restartIceCount).isEqualTo(1);
        assertThat(link.getState()).isEqualTo(PeerLinkState.FAILED);
        assertThat(transport.closeCount).isEqualTo(1);

        link.close();
        assertThat(link.getState()).isEqualTo(PeerLinkState.CLOSED);
        assertThat(transport.closeCount).isEqualTo(1);
        assertThat(listener.states).endsWith(PeerLinkState.FAILED, PeerLinkState.CLOSED);
    }

    @Test
    void unansweredOfferTimesOut() throws InterruptedException {
        CountDownLatch failed = new CountDownLatch(1);
        PeerLink.Listener timeoutListener = new RecordingListener() {
            @Override
            public void onStateChanged(String remoteId, PeerLinkState state) {
                if (state == PeerLinkState.FAILED) {
                    failed.countDown();
                }
            }
        };
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = new PeerLink("a", "b", factory, null, this::record, timeoutListener,
                PeerLinkOptions.defaults().withNegotiationTimeout(Duration.ofMillis(50)), scheduler);

        link.offer().join();

        assertThat(failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(link.getState()).isEqualTo(PeerLinkState.FAILED);
        assertThat(factory.last().closeCount).isEqualTo(1);
    }

    @Test
    void answeredOfferDoesNotTimeOut() throws InterruptedException {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = link("a", "b", factory,
                PeerLinkOptions.defaults().withNegotiationTimeout(Duration.ofMillis(50)));

        link.offer().join();
        link.handleSignal(answer("b")).join();
        Thread.sleep(200);

        assertThat(link.getState()).isEqualTo(PeerLinkState.CONNECTED);
    }

    @Test
    void closeIsIdempotentAndStopsNegotiation() {
        FakeTransportFactory factory = new FakeTransportFactory("b");
        PeerLink link = link("b", "a", factory, PeerLinkOptions.defaults());
        link.handleSignal(Signal.candidate(candidate(1))).join();

        link.close();
        link.close();
        link.handleSignal(offer("a")).join();

        FakePeerTransport transport = factory.last();
        assertThat(transport.closeCount).isEqualTo(1);
        assertThat(transport.remoteDescriptions).isEmpty();
        assertThat(link.getPendingCandidateCount()).isZero();
        assertThat(listener.states).containsExactly(PeerLinkState.CLOSED);
        assertThat(sent).isEmpty();
    }

    @Test
    void answerFinishingAfterCloseIsDiscarded() {
        FakeTransportFactory factory = new FakeTransportFactory("b");
        PeerLink link = link("b", "a", factory, PeerLinkOptions.defaults());
        FakePeerTransport transport = factory.last();
        transport.deferAnswers = true;

        CompletableFuture<Void> handled = link.handleSignal(offer("a"));
        link.close();
        transport.completeDeferredAnswer();
        handled.join();

        assertThat(link.getState()).isEqualTo(PeerLinkState.CLOSED);
        assertThat(sent).isEmpty();
        assertThat(transport.localDescriptions).isEmpty();
        assertThat(transport.closeCount).isEqualTo(1);
    }

    @Test
    void unknownSignalTypeIsIgnored() {
        FakeTransportFactory factory = new FakeTransportFactory("a");
        PeerLink link = link("a", "b", factory, PeerLinkOptions.defaults());
        Signal bogus = new Signal();
        bogus.setType("pranswer-ish");

        link.handleSignal(bogus).join();

        assertThat(link.getState()).isEqualTo(PeerLinkState.IDLE);
        assertThat(factory.last().remoteDescriptions).isEmpty();
    }

    private PeerLink link(String localId, String remoteId, FakeTransportFactory factory, PeerLinkOptions options) {
        return new PeerLink(localId, remoteId, factory, null, this::record, listener, options, scheduler);
    }

    private void record(String to, Signal signal) {
        sent.add(new Sent(to, signal));
    }

    private static Signal offer(String from) {
        return Signal.description(new SessionDescription(SessionDescription.Type.OFFER, "offer from " + from));
    }

    private static Signal answer(String from) {
        return Signal.description(new SessionDescription(SessionDescription.Type.ANSWER, "answer from " + from));
    }

    private static IceCandidate candidate(int n) {
        return new IceCandidate("candidate:" + n + " 1 udp 2122260223 192.168.1." + n + " 5400" + n + " typ host", "0", 0);
    }

    private static final class Sent {
        final String to;
        final Signal signal;

        Sent(String to, Signal signal) {
            this.to = to;
            this.signal = signal;
        }
    }

    private static class RecordingListener implements PeerLink.Listener {
        final List<PeerLinkState> states = new CopyOnWriteArrayList<>();
        final List<MediaStream> streams = new CopyOnWriteArrayList<>();

        @Override
        public void onStateChanged(String remoteId, PeerLinkState state) {
            states.add(state);
        }

        @Override
        public void onRemoteStream(String remoteId, MediaStream stream) {
            streams.add(stream);
        }
    }
}
