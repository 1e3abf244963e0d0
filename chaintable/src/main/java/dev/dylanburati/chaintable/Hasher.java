package dev.dylanburati.chaintable;

/**
 * Computes hashes for bucket selection. The rules of {@link Object#hashCode}
 * also apply here.
 */
/* package-private */ interface Hasher {
  int hash(Object key);
}
