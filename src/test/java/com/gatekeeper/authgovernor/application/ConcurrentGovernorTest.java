package com.gatekeeper.authgovernor.application;

import com.gatekeeper.authgovernor.domain.AttemptDecision;
import com.gatekeeper.authgovernor.domain.AttemptType;
import com.gatekeeper.authgovernor.domain.UserType;
import com.gatekeeper.authgovernor.infrastructure.jpa.UserEntity;
import com.gatekeeper.authgovernor.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrentGovernorTest extends IntegrationTestSupport {

    private static final int THREADS = 6;
    private static final int ROUNDS = 10;

    @Autowired
    private ProgressiveBlockService blocking;

    @Autowired
    private DeviceSessionService devices;

    @Test
    void simultaneousFailuresOpenExactlyOneBlock() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            String phone = "0105555" + String.format("%04d", round);

            List<AttemptDecision> decisions = runTogether(i ->
                    blocking.recordAttempt(phone, AttemptType.LOGIN, false, "10.0.0." + i, "JUnit", null, "wrong password"));

            assertThat(blockRepository.countByPhoneNumber(phone)).as("blocks for %s", phone).isEqualTo(1);
            assertThat(blockRepository.countByPhoneNumberAndActiveTrue(phone)).isEqualTo(1);
            assertThat(decisions).filteredOn(AttemptDecision::isNewlyBlocked).hasSize(1);
            assertThat(decisions).filteredOn(d -> !d.isBlocked()).hasSize(2);
        }
    }

    @Test
    void everyConcurrentFailureOnAFreshNumberIsRecorded() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            String phone = "0108888" + String.format("%04d", round);

            runTogether(i ->
                    blocking.recordAttempt(phone, AttemptType.LOGIN, false, "10.0.2." + i, "JUnit", null, "wrong password"));

            assertThat(lockRepository.existsById("phone:" + phone)).isTrue();
            assertThat(attemptRepository.countByPhoneNumber(phone)).as("attempts for %s", phone).isEqualTo(THREADS);
        }
    }

    @Test
    void simultaneousLoginsNeverExceedDeviceCap() throws Exception {
        UserEntity student = createUser("01066666666", "secret-pass", UserType.STUDENT);

        runTogether(i -> devices.registerSession(student.getId(), "device-" + i, "Device " + i, "10.0.1." + i, "JUnit"));

        assertThat(sessionRepository.countByUserIdAndActiveTrue(student.getId())).isEqualTo(2);
        assertThat(sessionRepository.findByUserIdOrderByLastUsedAtDesc(student.getId())).hasSize(THREADS);
    }

    private <T> List<T> runTogether(IndexedTask<T> task) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<T>> futures = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                int index = i;
                Callable<T> call = () -> {
                    start.await();
                    return task.run(index);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();

            List<T> results = new ArrayList<>();
            for (Future<T> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    @FunctionalInterface
    private interface IndexedTask<T> {
        T run(int index) throws Exception;
    }
}
