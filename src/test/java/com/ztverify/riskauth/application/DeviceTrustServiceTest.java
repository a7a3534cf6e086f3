package com.ztverify.riskauth.application;

import com.ztverify.riskauth.domain.DeviceRecord;
import com.ztverify.riskauth.support.InMemoryDeviceRecordRepository;
import com.ztverify.riskauth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeviceTrustServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private InMemoryDeviceRecordRepository repository;
    private MutableClock clock;
    private DeviceTrustService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDeviceRecordRepository();
        clock = new MutableClock(T0);
        service = new DeviceTrustService(repository, new UserLockRegistry(), clock);
    }

    @Test
    void shouldRegisterFirstSightingAndTouchLater() {
        DeviceRecord created = service.registerOrTouch("alice", "fp-laptop");
        assertThat(created.getFirstSeen()).isEqualTo(created.getLastSeen());
        assertThat(service.isKnown("alice", "fp-laptop")).isTrue();
        assertThat(service.isKnown("bob", "fp-laptop")).isFalse();

        clock.advance(Duration.ofDays(2));
        DeviceRecord touched = service.registerOrTouch("alice", "fp-laptop");

        assertThat(touched.getFirstSeen()).isEqualTo(OffsetDateTime.ofInstant(T0, ZoneOffset.UTC));
        assertThat(touched.getLastSeen()).isEqualTo(OffsetDateTime.ofInstant(T0.plus(Duration.ofDays(2)), ZoneOffset.UTC));
        assertThat(repository.insertCount()).isEqualTo(1);
    }

    @Test
    void shouldTreatDeviceAsUnknownWhenStoreFails() {
        service.registerOrTouch("alice", "fp");
        repository.failReads(true);

        assertThat(service.isKnown("alice", "fp")).isFalse();
    }

    @Test
    void shouldIgnoreBlankFingerprints() {
        assertThat(service.isKnown("alice", "")).isFalse();
        assertThat(service.isKnown("alice", null)).isFalse();
        assertThatThrownBy(() -> service.registerOrTouch("alice", " "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCreateOneRecordUnderConcurrentRegistration() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 8; i++) {
                pool.submit(() -> {
                    start.await();
                    return service.registerOrTouch("alice", "fp-phone");
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(repository.insertCount()).isEqualTo(1);
        assertThat(repository.size()).isEqualTo(1);
    }

    @Test
    void shouldListMostRecentFirstAndRemove() {
        service.registerOrTouch("alice", "old");
        clock.advance(Duration.ofHours(1));
        service.registerOrTouch("alice", "new");

        assertThat(service.listDevices("alice"))
                .extracting(DeviceRecord::getDeviceFingerprint)
                .containsExactly("new", "old");

        assertThat(service.removeDevice("alice", "old")).isTrue();
        assertThat(service.removeDevice("alice", "old")).isFalse();
        assertThat(service.isKnown("alice", "old")).isFalse();
    }
}
