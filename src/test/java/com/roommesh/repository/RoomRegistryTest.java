package com.roommesh.repository;

import com.roommesh.model.LatLng;
import com.roommesh.model.ParticipantLocation;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RoomRegistryTest {

    private final RoomRegistry registry = new RoomRegistry();

    @Test
    void roomIsCreatedOnFirstJoinAndDeletedWithLastLeave() {
        registry.withRoomOrCreate("r1", room -> room.addParticipant("a"));
        registry.withRoomOrCreate("r1", room -> room.addParticipant("b"));

        assertThat(registry.exists("r1")).isTrue();
        assertThat(registry.members("r1")).containsExactly("a", "b");

        registry.withRoom("r1", room -> room.removeParticipant("a"));
        assertThat(registry.participantCount("r1")).isEqualTo(1);

        registry.withRoom("r1", room -> room.removeParticipant("b"));
        assertThat(registry.exists("r1")).isFalse();
        assertThat(registry.roomCount()).isZero();
    }

    @Test
    void emptyRoomIsNeverRegistered() {
        Boolean result = registry.withRoomOrCreate("ghost", room -> room.hasParticipant("a"));

        assertThat(result).isFalse();
        assertThat(registry.exists("ghost")).isFalse();
    }

    @Test
    void actionOnMissingRoomIsEmpty() {
        assertThat(registry.withRoom("missing", room -> room.size())).isEmpty();
        assertThat(registry.members("missing")).isEmpty();
        assertThat(registry.locations("missing")).isEmpty();
        assertThat(registry.participantCount("missing")).isZero();
    }

    @Test
    void locationsAreLatestWinsAndRemovedWithParticipant() {
        registry.withRoomOrCreate("r1", room -> room.addParticipant("a") && room.addParticipant("b"));
        registry.withRoom("r1", room -> room.updateLocation("a", new LatLng(1.0, 2.0)));
        registry.withRoom("r1", room -> room.updateLocation("a", new LatLng(3.0, 4.0)));
        boolean stranger = registry.withRoom("r1", room -> room.updateLocation("x", new LatLng(5.0, 6.0))).orElse(true);

        List<ParticipantLocation> locations = registry.locations("r1");
        assertThat(stranger).isFalse();
        assertThat(locations).hasSize(1);
        assertThat(locations.get(0).getUserId()).isEqualTo("a");
        assertThat(locations.get(0).getLat()).isEqualTo(3.0);

        registry.withRoom("r1", room -> room.removeParticipant("a"));
        assertThat(registry.locations("r1")).isEmpty();
    }

    @Test
    void roomIdsAreSorted() {
        registry.withRoomOrCreate("zeta", room -> room.addParticipant("a"));
        registry.withRoomOrCreate("alpha", room -> room.addParticipant("b"));

        assertThat(registry.roomIds()).containsExactly("alpha", "zeta");
    }

    @Test
    void concurrentJoinsAndLeavesKeepRoomConsistent() throws Exception {
        int threads = 8;
        int rounds = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                String participant = "p" + t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        registry.withRoomOrCreate("shared", room -> room.addParticipant(participant));
                        registry.withRoom("shared", room -> room.removeParticipant(participant));
                    }
                    registry.withRoomOrCreate("shared", room -> room.addParticipant(participant));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.participantCount("shared")).isEqualTo(threads);
        assertThat(registry.roomCount()).isEqualTo(1);
    }
}
