package ca.gc.cra.rill.domain.kv;

import static ca.gc.cra.rill.domain.kv.KeyValue.kv;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class ContextNodeTest {
  @Test
  void rootWithoutPairsIsTheSharedEmptyNode() {
    assertSame(ContextNode.empty(), ContextNode.root(List.of()));
    assertFalse(ContextNode.empty().iterator().hasNext());
    assertEquals(0, ContextNode.empty().totalPairs());
  }

  @Test
  void iteratesOwnPairsThenAncestorsNearestFirst() {
    ContextNode root = ContextNode.root(List.of(kv("svc", "api"), kv("env", "prod")));
    ContextNode request = root.child(List.of(kv("req", 7)));
    ContextNode handler = request.child(List.of(kv("step", "parse"), kv("req", 8)));

    assertEquals(List.of("step", "req", "req", "svc", "env"), keys(handler));
    assertEquals(5, handler.totalPairs());
    assertEquals(2, handler.depth());
    assertSame(request, handler.parent().orElseThrow());
  }

  @Test
  void childrenDoNotAffectParentOrSiblings() {
    ContextNode root = ContextNode.root(List.of(kv("a", 1)));
    ContextNode left = root.child(List.of(kv("left", true)));
    ContextNode right = root.child(List.of(kv("right", true)));

    assertEquals(List.of("a"), keys(root));
    assertEquals(List.of("left", "a"), keys(left));
    assertEquals(List.of("right", "a"), keys(right));
  }

  @Test
  void emptyChildNodesAreSkipped() {
    ContextNode node = ContextNode.root(List.of(kv("a", 1))).child(List.of()).child(List.of(kv("b", 2)));

    assertEquals(List.of("b", "a"), keys(node));
  }

  @Test
  void copiesPairsAtConstruction() {
    List<KeyValue> pairs = new ArrayList<>(List.of(kv("a", 1)));
    ContextNode node = ContextNode.root(pairs);
    pairs.add(kv("b", 2));

    assertEquals(List.of("a"), keys(node));
  }

  @Test
  void exhaustedIteratorThrows() {
    Iterator<KeyValue> iterator = ContextNode.root(List.of(kv("a", 1))).iterator();
    assertTrue(iterator.hasNext());
    iterator.next();
    assertThrows(NoSuchElementException.class, iterator::next);
  }

  private static List<String> keys(ContextNode node) {
    List<String> keys = new ArrayList<>();
    node.forEach(pair -> keys.add(pair.key()));
    return keys;
  }
}
