package dev.dylanburati.chaintable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class Helpers {
  // routes every key to the same bucket
  static final Hasher COLLIDING = key -> 0;

  public static <T> List<T> reversed(List<T> original) {
    List<T> result = new ArrayList<>(original);
    Collections.reverse(result);
    return result;
  }

  public static List<String> numberedKeys(int count) {
    List<String> result = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      result.add(Integer.toString(i));
    }
    return result;
  }
}
