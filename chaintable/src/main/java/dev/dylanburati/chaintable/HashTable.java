package dev.dylanburati.chaintable;

import java.util.Objects;

/**
 * Hash table with a fixed number of buckets, resolving collisions by chaining.
 *
 * Each key is routed to one of {@value #BUCKET_SIZE} buckets by its hash, and
 * each bucket is a singly-linked list scanned linearly. The bucket count never
 * changes, so lookups degrade towards O(n) as the table fills up. This is a
 * known limitation: the table never rehashes.
 *
 * Null keys and null values are not permitted; {@link #get} returns
 * {@code null} to signal an absent key. This class is not thread-safe.
 */
public class HashTable<K, V> {
  static final int BUCKET_SIZE = 8;
  private final Hasher hasher;
  // INVARIANT 0: buckets.length == BUCKET_SIZE, for the lifetime of the table
  // INVARIANT 1: a key can only be present in buckets[index(key)]
  private final Bucket<K, V>[] buckets;

  public HashTable() {
    this(DefaultHasher.instance());
  }

  @SuppressWarnings("unchecked")
  /* package-private */ HashTable(final Hasher hasher) {
    this.hasher = Objects.requireNonNull(hasher);
    // INVARIANT 0 upheld
    this.buckets = (Bucket<K, V>[]) new Bucket<?, ?>[BUCKET_SIZE];
    for (int i = 0; i < BUCKET_SIZE; i++) {
      this.buckets[i] = new Bucket<>();
    }
  }

  /**
   * Returns the number of entries across all buckets.
   */
  public int size() {
    int total = 0;
    for (Bucket<K, V> bucket : this.buckets) {
      total += bucket.len();
    }
    return total;
  }

  public boolean isEmpty() {
    return this.size() == 0;
  }

  /**
   * Associates {@code value} with {@code key}. If the key is already present,
   * its value is replaced and the size is unchanged.
   *
   * @throws NullPointerException if the key or value is null
   */
  public void insert(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    this.buckets[this.index(key)].insert(key, value);
  }

  /**
   * Removes the entry for {@code key}. Does nothing if the key is absent.
   *
   * @throws NullPointerException if the key is null
   */
  public void remove(K key) {
    Objects.requireNonNull(key, "key");
    this.buckets[this.index(key)].remove(key);
  }

  /**
   * Returns the value associated with {@code key}, or {@code null} if the key is absent.
   *
   * @throws NullPointerException if the key is null
   */
  public V get(K key) {
    return this.getOrDefault(key, null);
  }

  public V getOrDefault(K key, V defaultValue) {
    Objects.requireNonNull(key, "key");
    V value = this.buckets[this.index(key)].get(key);
    return value == null ? defaultValue : value;
  }

  public boolean containsKey(K key) {
    return this.get(key) != null;
  }

  private int index(K key) {
    // INVARIANT 1 upheld: equal keys have equal hashes
    return Integer.remainderUnsigned(this.hasher.hash(key), BUCKET_SIZE);
  }

  @Override
  public String toString() {
    StringBuilder bldr = new StringBuilder("{");
    boolean needsSeparator = false;
    for (Bucket<K, V> bucket : this.buckets) {
      needsSeparator |= bucket.appendTo(bldr, needsSeparator);
    }
    return bldr.append('}').toString();
  }
}
