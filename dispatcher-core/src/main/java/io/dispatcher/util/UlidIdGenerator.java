package io.dispatcher.util;

import com.github.f4b6a3.ulid.UlidCreator;
import io.dispatcher.spi.IdGenerator;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Default {@link IdGenerator}: monotonic ULIDs for string codes and an increasing
 * sequence for numeric ids.
 *
 * <p>Numeric ids start at {@value #FIRST_ID}. Monotonic ULIDs sort in creation order
 * even within the same millisecond.
 */
public final class UlidIdGenerator implements IdGenerator {
  public static final long FIRST_ID = 10_000L;

  private static final UlidIdGenerator DEFAULT = new UlidIdGenerator();

  private final AtomicLong sequence;

  public UlidIdGenerator() {
    this(FIRST_ID);
  }

  public UlidIdGenerator(long firstId) {
    this.sequence = new AtomicLong(firstId);
  }

  /**
   * Returns the shared instance used when no generator is configured explicitly.
   */
  public static UlidIdGenerator getDefault() {
    return DEFAULT;
  }

  @Override
  public long nextId() {
    return sequence.getAndIncrement();
  }

  @Override
  public String nextCode() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
