package dev.dylanburati.chaintable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Counts simulated words with a capped vocabulary. HashTable never grows past
 * its fixed bucket count, so its cost per word rises with the vocabulary while
 * the resizing maps stay flat.
 */
@State(Scope.Benchmark)
public class WordcountBenchmark {
  private static final int WORDS = 1_000_000;

  @Param({"8", "64", "512", "4096"})
  public int vocabulary;

  private String[] words;

  @Setup
  public void generateWords() {
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[32];
    Random r = new Random(0L);
    this.words = new String[WORDS];
    for (int i = 0; i < WORDS; i++) {
      double uniform = r.nextDouble();
      int wlen = Math.max(1, genWordLen(uniform));
      for (int wid = genWordId(uniform) % this.vocabulary, j = 0; j < wlen; j++) {
        wbuf[j] = alph[(wid >> (3 * (j%9))) & 7];
      }
      this.words[i] = new String(wbuf, 0, wlen, StandardCharsets.US_ASCII);
    }
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountHashTable(Blackhole bh) {
    HashTable<String, Integer> m = new HashTable<>();
    for (String word : this.words) {
      m.insert(word, m.getOrDefault(word, 0) + 1);
    }
    System.out.println("Size: " + m.size());
    bh.consume(m.size());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountHashMap(Blackhole bh) {
    bh.consume(wordcount(new HashMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountObject2IntMap(Blackhole bh) {
    bh.consume(wordcount(new Object2IntOpenHashMap<>()));
  }

  private int wordcount(Map<String, Integer> m) {
    for (String word : this.words) {
      m.merge(word, 1, (v1, v2) -> v1 + v2);
    }
    System.out.println("Size: " + m.size());
    return m.size();
  }

  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01
    // Similar distribution to English, maximum of x is 2**27
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static final double[] LENGTH_CDF = new double[]{
    2.55402880e-15, 3.73483535e-07, 2.06251620e-04, 4.60037401e-03,
    2.77018313e-02, 8.59221455e-02, 1.82026193e-01, 3.04121079e-01,
    4.34720260e-01, 5.58784740e-01, 6.67021855e-01, 7.55676596e-01,
    8.24886736e-01, 8.76934270e-01, 9.14931000e-01, 9.42014131e-01,
    9.60943967e-01, 9.73962076e-01, 9.82793792e-01, 9.88716864e-01,
    9.92650419e-01, 9.95240748e-01, 9.96934095e-01, 9.98034022e-01,
    9.98744497e-01, 9.99201152e-01, 9.99493382e-01, 9.99679661e-01,
    9.99797989e-01, 9.99872918e-01, 9.99920231e-01, 9.99950030e-01
  };

  private static int genWordLen(double uniform) {
    // pdf = const * exp(-(x - 8.5)**2 / 2x)
    int i = Arrays.binarySearch(LENGTH_CDF, uniform);
    return Math.min(32, i >= 0 ? i : -i - 1);
  }
}
