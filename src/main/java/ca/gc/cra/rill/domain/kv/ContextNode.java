package ca.gc.cra.rill.domain.kv;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One link of the persistent context chain shared by a logger hierarchy.
 * <p><strong>Why:</strong> Child loggers must inherit their ancestors' fields without copying them.</p>
 * <p><strong>Role:</strong> Domain structure held by every logger; enumerated by {@link Fields}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own an immutable list of pairs added at this level.</li>
 *   <li>Reference the parent node; never reference children.</li>
 *   <li>Enumerate own pairs first, then the parent's, walking upward on demand.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; freely shared across threads.</p>
 * <p><strong>Performance:</strong> {@link #child(List)} is O(own pairs); depth and pair totals are cached.</p>
 *
 * @since 0.1.0
 */
public final class ContextNode implements Iterable<KeyValue> {
  private static final ContextNode EMPTY = new ContextNode(List.of(), null);

  private final List<KeyValue> own;
  private final ContextNode parent;
  private final int depth;
  private final int totalPairs;

  private ContextNode(List<KeyValue> own, ContextNode parent) {
    this.own = own;
    this.parent = parent;
    this.depth = parent == null ? 0 : parent.depth + 1;
    this.totalPairs = own.size() + (parent == null ? 0 : parent.totalPairs);
  }

  /**
   * Returns the shared node with no pairs and no parent.
   *
   * @return empty root node
   */
  public static ContextNode empty() {
    return EMPTY;
  }

  /**
   * Creates a root node owning {@code pairs}.
   *
   * @param pairs pairs in the order they should be enumerated
   * @return new root node, or the shared empty node when {@code pairs} is empty
   */
  public static ContextNode root(List<KeyValue> pairs) {
    List<KeyValue> copy = List.copyOf(Objects.requireNonNull(pairs, "pairs"));
    return copy.isEmpty() ? EMPTY : new ContextNode(copy, null);
  }

  /**
   * Creates a node owning {@code pairs} whose parent is this node.
   *
   * @param pairs pairs added at the new level
   * @return child node sharing this node as its parent
   */
  public ContextNode child(List<KeyValue> pairs) {
    return new ContextNode(List.copyOf(Objects.requireNonNull(pairs, "pairs")), this);
  }

  /**
   * Returns the pairs added at this level.
   *
   * @return immutable list of own pairs
   */
  public List<KeyValue> own() {
    return own;
  }

  /**
   * Returns the parent node.
   *
   * @return parent, or empty for a root
   */
  public Optional<ContextNode> parent() {
    return Optional.ofNullable(parent);
  }

  /**
   * Returns the number of ancestors above this node.
   *
   * @return zero for a root
   */
  public int depth() {
    return depth;
  }

  /**
   * Returns the number of pairs reachable from this node, own pairs included.
   *
   * @return total pair count along the chain
   */
  public int totalPairs() {
    return totalPairs;
  }

  /**
   * Enumerates own pairs, then each ancestor's own pairs from nearest to furthest.
   *
   * <p>Ancestors are visited only as the iterator advances, so abandoning iteration early never touches
   * the rest of the chain.</p>
   *
   * @return lazy iterator over the chain
   */
  @Override
  public Iterator<KeyValue> iterator() {
    return new ChainIterator(this);
  }

  private static final class ChainIterator implements Iterator<KeyValue> {
    private ContextNode node;
    private int index;

    private ChainIterator(ContextNode start) {
      this.node = start;
    }

    @Override
    public boolean hasNext() {
      while (node != null && index >= node.own.size()) {
        node = node.parent;
        index = 0;
      }
      return node != null;
    }

    @Override
    public KeyValue next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      return node.own.get(index++);
    }
  }
}
