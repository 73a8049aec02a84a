package com.databricks.preserver.message;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A single message within a {@link MessageBatch}.
 *
 * <p>A part carries an opaque payload, a string metadata map, and the tracking tags attached by
 * {@link SortGroup}. Copies made with {@link #shallowCopy()} share the payload array and the tags
 * with the original and get their own metadata map.
 *
 * <p>The payload array is never copied. Code holding a part must not modify the array returned by
 * {@link #asBytes()} in place: a batch that fails is delivered again, and redelivery relies on the
 * payload being exactly what was read from the source. Use {@link #withData(byte[])} to derive a
 * part with a different payload.
 */
public final class Part {

  private final byte[] data;
  private final Map<String, String> metadata;
  @Nullable private final Tag tags;

  private Part(byte[] data, Map<String, String> metadata, @Nullable Tag tags) {
    this.data = data;
    this.metadata = metadata;
    this.tags = tags;
  }

  /**
   * Creates a part with the given payload.
   *
   * @param data The payload, which the part takes ownership of
   * @return A new part without metadata
   */
  @Nonnull
  public static Part of(@Nonnull byte[] data) {
    return new Part(Objects.requireNonNull(data, "data cannot be null"), new HashMap<>(), null);
  }

  /**
   * Creates a part holding the UTF-8 encoding of a string.
   *
   * @param data The payload
   * @return A new part without metadata
   */
  @Nonnull
  public static Part of(@Nonnull String data) {
    return of(Objects.requireNonNull(data, "data cannot be null").getBytes(StandardCharsets.UTF_8));
  }

  /** Returns the payload. The array is shared and must not be modified. */
  @Nonnull
  public byte[] asBytes() {
    return data;
  }

  /** Returns the payload decoded as UTF-8. */
  @Nonnull
  public String asString() {
    return new String(data, StandardCharsets.UTF_8);
  }

  /**
   * Returns a metadata value.
   *
   * @param key The metadata key
   * @return The value, or null if not set
   */
  @Nullable public String getMetadata(@Nonnull String key) {
    return metadata.get(key);
  }

  /**
   * Sets a metadata value on this part only.
   *
   * @param key The metadata key
   * @param value The value
   * @return this part for method chaining
   */
  @Nonnull
  public Part setMetadata(@Nonnull String key, @Nonnull String value) {
    metadata.put(key, value);
    return this;
  }

  /** Returns a read-only view of the metadata. */
  @Nonnull
  public Map<String, String> metadata() {
    return Collections.unmodifiableMap(metadata);
  }

  /**
   * Returns a copy sharing payload and tracking tags with this part.
   *
   * @return A new part
   */
  @Nonnull
  public Part shallowCopy() {
    return new Part(data, new HashMap<>(metadata), tags);
  }

  /**
   * Returns a part with a different payload that keeps this part's metadata and tracking tags.
   *
   * <p>Parts derived this way can still be located by the {@link SortGroup} that tracked this part.
   *
   * @param newData The new payload
   * @return A new part
   */
  @Nonnull
  public Part withData(@Nonnull byte[] newData) {
    return new Part(
        Objects.requireNonNull(newData, "newData cannot be null"), new HashMap<>(metadata), tags);
  }

  Part tagged(Object key, int index) {
    return new Part(data, new HashMap<>(metadata), new Tag(key, index, tags));
  }

  int tagIndex(Object key) {
    for (Tag tag = tags; tag != null; tag = tag.next) {
      if (tag.key == key) {
        return tag.index;
      }
    }
    return -1;
  }

  /** Immutable chain of tracking tags, newest first. */
  private static final class Tag {
    final Object key;
    final int index;
    @Nullable final Tag next;

    Tag(Object key, int index, @Nullable Tag next) {
      this.key = key;
      this.index = index;
      this.next = next;
    }
  }
}
