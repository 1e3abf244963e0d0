package dev.dylanburati.chaintable;

/* package-private */ class DefaultHasher implements Hasher {
  private static final int GOLDEN_RATIO = 0x9e3779b9;
  private static DefaultHasher instance = null;

  private DefaultHasher() {}

  static DefaultHasher instance() {
    if (instance == null) {
      instance = new DefaultHasher();
    }
    return instance;
  }

  @Override
  public int hash(Object key) {
    // multiply then fold the high half down, the table only looks at the low bits
    int h = key.hashCode() * GOLDEN_RATIO;
    return h ^ (h >>> 16);
  }
}
