package com.scholary.consult.scribe.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Name-scoped locks that serialize runs on the same recording.
 *
 * <p>Locks are held weakly: once no run references a recording's lock, it is collected along with
 * its cache entry. Runs on different recordings never contend.
 */
@Component
public class RecordingLocks {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordingLocks.class);

  private final Cache<String, ReentrantLock> locks;
  private final long timeoutSeconds;

  public RecordingLocks(PipelineProperties properties) {
    this.locks = Caffeine.newBuilder().weakValues().build();
    this.timeoutSeconds = properties.lockTimeoutSeconds();
  }

  /**
   * Run an action while holding the lock for a name.
   *
   * @throws RecordingBusyException if the lock is not acquired within the timeout, or the wait is
   *     interrupted
   */
  public <T> T withLock(String name, Supplier<T> action) {
    ReentrantLock lock = lockFor(name);
    try {
      if (!lock.tryLock(timeoutSeconds, TimeUnit.SECONDS)) {
        throw new RecordingBusyException(
            String.format("Recording %s is busy; waited %ds", name, timeoutSeconds));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RecordingBusyException("Interrupted waiting for recording " + name, e);
    }

    try {
      LOGGER.debug("Acquired lock: name={}", name);
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  ReentrantLock lockFor(String name) {
    return locks.get(name, key -> new ReentrantLock());
  }
}
