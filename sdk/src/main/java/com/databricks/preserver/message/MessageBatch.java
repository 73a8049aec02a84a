package com.databricks.preserver.message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * An ordered, non-empty group of {@link Part}s delivered and acknowledged as one unit.
 *
 * <p>Batches are immutable containers. {@link #shallowCopy()} produces a new container holding
 * shallow copies of the parts: payloads are shared, not duplicated.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * MessageBatch batch = MessageBatch.of(Part.of("first"), Part.of("second"));
 * for (Part part : batch) {
 *     System.out.println(part.asString());
 * }
 * }</pre>
 */
public final class MessageBatch implements Iterable<Part> {

  private final List<Part> parts;

  private MessageBatch(List<Part> parts) {
    this.parts = parts;
  }

  /**
   * Creates a batch from a list of parts.
   *
   * @param parts The parts, in order
   * @return A new batch
   * @throws IllegalArgumentException if the list is empty or contains null
   */
  @Nonnull
  public static MessageBatch of(@Nonnull List<Part> parts) {
    Objects.requireNonNull(parts, "parts cannot be null");
    if (parts.isEmpty()) {
      throw new IllegalArgumentException("batch must contain at least one part");
    }
    List<Part> copy = new ArrayList<>(parts.size());
    for (Part part : parts) {
      if (part == null) {
        throw new IllegalArgumentException("batch cannot contain null parts");
      }
      copy.add(part);
    }
    return new MessageBatch(Collections.unmodifiableList(copy));
  }

  /**
   * Creates a batch from varargs parts.
   *
   * @param parts The parts, in order
   * @return A new batch
   */
  @Nonnull
  public static MessageBatch of(@Nonnull Part... parts) {
    return of(Arrays.asList(parts));
  }

  /**
   * Creates a batch with one part per string.
   *
   * @param payloads The UTF-8 payloads, in order
   * @return A new batch
   */
  @Nonnull
  public static MessageBatch ofStrings(@Nonnull String... payloads) {
    List<Part> parts = new ArrayList<>(payloads.length);
    for (String payload : payloads) {
      parts.add(Part.of(payload));
    }
    return of(parts);
  }

  /** Returns the number of parts. */
  public int size() {
    return parts.size();
  }

  /**
   * Returns the part at an index.
   *
   * @param index Zero-based position
   * @return The part
   * @throws IndexOutOfBoundsException if the index is out of range
   */
  @Nonnull
  public Part get(int index) {
    return parts.get(index);
  }

  /** Returns the parts as a read-only list. */
  @Nonnull
  public List<Part> parts() {
    return parts;
  }

  /**
   * Returns a structural copy of this batch whose parts share payloads with this batch.
   *
   * @return A new batch
   */
  @Nonnull
  public MessageBatch shallowCopy() {
    List<Part> copy = new ArrayList<>(parts.size());
    for (Part part : parts) {
      copy.add(part.shallowCopy());
    }
    return new MessageBatch(Collections.unmodifiableList(copy));
  }

  @Override
  public Iterator<Part> iterator() {
    return parts.iterator();
  }
}
