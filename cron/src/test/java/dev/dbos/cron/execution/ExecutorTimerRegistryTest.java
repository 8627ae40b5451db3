package dev.dbos.cron.execution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.dbos.cron.exceptions.NonExistentJobException;
import dev.dbos.cron.job.JobKey;
import dev.dbos.cron.job.TimeSpec;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

@org.junit.jupiter.api.Timeout(value = 1, unit = java.util.concurrent.TimeUnit.MINUTES)
class ExecutorTimerRegistryTest {

  private ExecutorTimerRegistry registry;

  @BeforeEach
  void setup() {
    registry = new ExecutorTimerRegistry(2);
    registry.start();
  }

  @AfterEach
  void cleanup() {
    registry.shutdown();
  }

  @Test
  void oneShotFiresOnceAndLeavesTheRegistry() throws Exception {
    var key = JobKey.persisted(1);
    var latch = new CountDownLatch(1);
    var fireTime = Instant.now().plusMillis(300);

    var handle = registry.register(key, TimeSpec.at(fireTime), latch::countDown);
    assertTrue(registry.isLive(key));
    assertEquals(fireTime, handle.nextFireTime().orElseThrow());

    assertTrue(latch.await(5, TimeUnit.SECONDS));
    Thread.sleep(100);
    assertFalse(registry.isLive(key));
    assertEquals(1, handle.fireCount());
    assertTrue(handle.nextFireTime().isEmpty());
  }

  @Test
  void pastInstantFiresImmediately() throws Exception {
    var latch = new CountDownLatch(1);
    registry.register(
        JobKey.ephemeral(), TimeSpec.at(Instant.now().minusSeconds(60)), latch::countDown);
    assertTrue(latch.await(2, TimeUnit.SECONDS));
  }

  @Test
  void recurringKeepsFiring() throws Exception {
    var key = JobKey.persisted(2);
    var count = new AtomicInteger();

    var handle = registry.register(key, TimeSpec.cron("* * * * * *"), count::incrementAndGet);
    Thread.sleep(3500);

    assertTrue(count.get() >= 2, "fired " + count.get());
    assertTrue(count.get() <= 5, "fired " + count.get());
    assertTrue(registry.isLive(key));
    assertTrue(handle.nextFireTime().isPresent());
  }

  @Test
  void failingCallbackDoesNotStopRecurringTimer() throws Exception {
    var count = new AtomicInteger();
    registry.register(
        JobKey.persisted(3),
        TimeSpec.cron("* * * * * *"),
        () -> {
          count.incrementAndGet();
          throw new IllegalStateException("boom");
        });
    Thread.sleep(3500);
    assertTrue(count.get() >= 2, "fired " + count.get());
  }

  @Test
  void stoppedTimerNeverFires() throws Exception {
    var key = JobKey.persisted(4);
    var count = new AtomicInteger();
    var handle =
        registry.register(key, TimeSpec.at(Instant.now().plusMillis(500)), count::incrementAndGet);

    registry.stop(key);
    assertFalse(registry.isLive(key));
    assertTrue(handle.isStopped());
    assertTrue(handle.nextFireTime().isEmpty());

    Thread.sleep(1000);
    assertEquals(0, count.get());
  }

  @Test
  void stopRecurring() throws Exception {
    var key = JobKey.ephemeral();
    var count = new AtomicInteger();
    registry.register(key, TimeSpec.cron("* * * * * *"), count::incrementAndGet);
    Thread.sleep(1500);

    registry.stop(key);
    int stoppedAt = count.get();
    Thread.sleep(2000);
    assertEquals(stoppedAt, count.get());
  }

  @Test
  void stopUnknownKey() {
    var key = JobKey.persisted(99);
    var e = assertThrows(NonExistentJobException.class, () -> registry.stop(key));
    assertEquals(key, e.jobKey());
  }

  @Test
  void stopTwice() {
    var key = JobKey.ephemeral();
    registry.register(key, TimeSpec.cron("0 0 1 1 *"), () -> {});
    registry.stop(key);
    assertThrows(NonExistentJobException.class, () -> registry.stop(key));
  }

  @Test
  void duplicateKeyIsRejected() {
    var key = JobKey.persisted(5);
    registry.register(key, TimeSpec.cron("0 0 1 1 *"), () -> {});
    assertThrows(
        IllegalStateException.class,
        () -> registry.register(key, TimeSpec.cron("0 0 1 1 *"), () -> {}));
    assertEquals(1, registry.liveKeys().size());
  }

  @Test
  void invalidPatternLeavesNoTimer() {
    var key = JobKey.persisted(6);
    assertThrows(
        IllegalArgumentException.class,
        () -> registry.register(key, TimeSpec.cron("not a pattern"), () -> {}));
    assertFalse(registry.isLive(key));
  }

  @Test
  void patternThatNeverMatchesLeavesNoTimer() {
    var key = JobKey.persisted(9);
    assertThrows(
        IllegalArgumentException.class,
        () -> registry.register(key, TimeSpec.cron("0 0 0 30 2 *"), () -> {}));
    assertFalse(registry.isLive(key));
    assertTrue(registry.liveKeys().isEmpty());
  }

  @Test
  void ephemeralKeysAreDistinct() {
    var first = JobKey.ephemeral();
    var second = JobKey.ephemeral();
    registry.register(first, TimeSpec.cron("0 0 1 1 *"), () -> {});
    registry.register(second, TimeSpec.cron("0 0 1 1 *"), () -> {});
    assertEquals(2, registry.liveKeys().size());
  }

  @Test
  void registerRequiresRunningRegistry() {
    registry.shutdown();
    assertThrows(
        IllegalStateException.class,
        () -> registry.register(JobKey.ephemeral(), TimeSpec.cron("* * * * *"), () -> {}));
  }

  @Test
  void shutdownStopsAllTimers() throws Exception {
    var count = new AtomicInteger();
    var soon = TimeSpec.at(Instant.now().plusMillis(500));
    var handle = registry.register(JobKey.persisted(7), soon, count::incrementAndGet);
    registry.register(JobKey.persisted(8), TimeSpec.cron("* * * * * *"), count::incrementAndGet);

    registry.shutdown();
    assertTrue(registry.liveKeys().isEmpty());
    assertTrue(handle.isStopped());

    Thread.sleep(1500);
    assertEquals(0, count.get());
  }
}
