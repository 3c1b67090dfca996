package kr.socialcredit.economy.infrastructure.lock;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("경제 상태 락 테스트")
class EconomyStateLockTest {

    @Test
    @DisplayName("같은 스레드에서 다시 획득할 수 있다")
    void reentrant() {
        EconomyStateLock lock = new EconomyStateLock(Duration.ofMillis(100), 1);

        String result = lock.executeWithLock("outer",
                () -> lock.executeWithLock("inner", () -> "ok"));

        assertThat(result).isEqualTo("ok");
        assertThat(lock.isHeldByCurrentThread()).isFalse();
    }

    @Test
    @DisplayName("작업이 예외를 던져도 락은 해제된다")
    void releasesOnException() {
        EconomyStateLock lock = new EconomyStateLock(Duration.ofMillis(100), 1);

        assertThatThrownBy(() -> lock.runWithLock("boom", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lock.isHeldByCurrentThread()).isFalse();
        assertThat(lock.executeWithLock("after", () -> 1)).isEqualTo(1);
    }

    @Test
    @DisplayName("다른 스레드가 락을 오래 잡고 있으면 재시도 후 실패한다")
    void failsWhenHeldTooLong() throws Exception {
        // given
        EconomyStateLock lock = new EconomyStateLock(Duration.ofMillis(50), 2);
        CountDownLatch acquired = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(() -> lock.runWithLock("holder", () -> {
                acquired.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(acquired.await(5, TimeUnit.SECONDS)).isTrue();

            // when & then
            assertThatThrownBy(() -> lock.executeWithLock("waiter", () -> 1))
                    .isInstanceOf(LockAcquisitionException.class)
                    .hasMessageContaining("waiter");
        } finally {
            release.countDown();
            executor.shutdown();
        }
    }

    @Test
    @DisplayName("동시에 실행해도 작업이 겹치지 않는다")
    void mutualExclusion() throws Exception {
        EconomyStateLock lock = new EconomyStateLock(Duration.ofSeconds(5), 3);
        int[] counter = {0};
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(() -> {
                    for (int j = 0; j < 1_000; j++) {
                        lock.runWithLock("inc", () -> counter[0]++);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdown();
        }

        assertThat(counter[0]).isEqualTo(8_000);
    }
}
