package dev.dylanburati.chaintable;

/**
 * A singly-linked chain of entries whose keys all landed on the same bucket index.
 *
 * New keys are pushed onto the head, so the chain holds the most recently
 * added key first. Re-inserting an existing key only replaces its value.
 */
/* package-private */ class Bucket<K, V> {
  // INVARIANT 0: keys along the chain are pairwise distinct
  // INVARIANT 1: len == number of nodes reachable from head
  private Node<K, V> head;
  private int len;

  Bucket() {
    // INVARIANT 1 upheld, chain is empty
    this.head = null;
    this.len = 0;
  }

  int len() {
    return this.len;
  }

  void insert(K key, V value) {
    Node<K, V> node = this.find(key);
    if (node != null) {
      // INVARIANT 0 upheld, existing key keeps its position
      node.value = value;
      return;
    }
    this.head = new Node<>(key, value, this.head);
    this.len++;
  }

  void remove(K key) {
    Node<K, V> prev = null;
    for (Node<K, V> curr = this.head; curr != null; prev = curr, curr = curr.next) {
      if (curr.key.equals(key)) {
        if (prev == null) {
          this.head = curr.next;
        } else {
          prev.next = curr.next;
        }
        curr.next = null;
        this.len--;
        return;
      }
    }
  }

  V get(K key) {
    Node<K, V> node = this.find(key);
    return node == null ? null : node.value;
  }

  /**
   * Appends {@code key=value} for each entry, head first, separated by {@code ", "}.
   *
   * @return whether anything was appended
   */
  boolean appendTo(StringBuilder bldr, boolean needsSeparator) {
    for (Node<K, V> curr = this.head; curr != null; curr = curr.next) {
      if (needsSeparator) {
        bldr.append(", ");
      }
      bldr.append(curr.key).append('=').append(curr.value);
      needsSeparator = true;
    }
    return this.head != null;
  }

  private Node<K, V> find(K key) {
    for (Node<K, V> curr = this.head; curr != null; curr = curr.next) {
      if (curr.key.equals(key)) {
        return curr;
      }
    }
    return null;
  }

  /* package-private */ static class Node<K, V> {
    final K key;
    V value;
    Node<K, V> next;

    Node(K key, V value, Node<K, V> next) {
      this.key = key;
      this.value = value;
      this.next = next;
    }
  }
}
