package com.databricks.preserver.message;

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Correlates parts of a processed batch back to their position in the original batch.
 *
 * <p>{@link #track} returns copies of the batch's parts tagged with their index. The tag survives
 * {@link Part#shallowCopy()} and {@link Part#withData(byte[])}, so even after downstream code has
 * reordered, filtered or copied the parts, {@link #index} still reports where each one came from.
 *
 * <p>Each group uses its own tag, so a part can carry tags from several groups at once.
 */
public final class SortGroup {

  private final Object key = new Object();

  /**
   * Returns tagged copies of every part in the batch.
   *
   * @param batch The original batch
   * @return A batch of tagged copies in the same order
   */
  @Nonnull
  public MessageBatch track(@Nonnull MessageBatch batch) {
    List<Part> tagged = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      tagged.add(batch.get(i).tagged(key, i));
    }
    return MessageBatch.of(tagged);
  }

  /**
   * Returns the original index of a part tracked by this group.
   *
   * @param part A part returned by {@link #track}, or derived from one
   * @return The index in the original batch, or -1 if the part was not tracked by this group
   */
  public int index(@Nonnull Part part) {
    return part.tagIndex(key);
  }
}
