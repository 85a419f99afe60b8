package ca.gc.cra.testreport.domain.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.testreport.domain.report.Benchmark;
import ca.gc.cra.testreport.domain.report.TestCase;
import ca.gc.cra.testreport.domain.report.TestPackage;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class SuiteBufferTest {

  @Test
  void appendReusesExistingTest() {
    SuiteBuffer buffer = new SuiteBuffer();
    TestCase first = buffer.append(new OutputRecord("pkgA", "TestA", "one"));
    TestCase second = buffer.append(new OutputRecord("pkgA", "TestA", "two"));

    assertSame(first, second);
    assertEquals(List.of("one", "two"), first.output());
    assertEquals(1, buffer.testCount());
  }

  @Test
  void findScansSuitesInInsertionOrder() {
    SuiteBuffer buffer = new SuiteBuffer();
    TestCase inA = buffer.append(new OutputRecord("pkgA", "TestShared", ""));
    buffer.append(new OutputRecord("pkgB", "TestShared", ""));

    assertSame(inA, buffer.find("TestShared").orElseThrow());
    assertTrue(buffer.find("TestMissing").isEmpty());
  }

  @Test
  void benchmarkNeedsASuite() {
    SuiteBuffer buffer = new SuiteBuffer();
    Benchmark benchmark = new Benchmark("BenchmarkA", Duration.ofNanos(5), 0, 0);

    assertFalse(buffer.addBenchmark(benchmark));
    buffer.append(new OutputRecord("pkgA", "TestA", ""));
    assertTrue(buffer.addBenchmark(benchmark));
  }

  @Test
  void drainBuildsPackagesAndClears() {
    SuiteBuffer buffer = new SuiteBuffer();
    buffer.append(new OutputRecord("pkgA", "TestA", "")).duration(Duration.ofMillis(5));
    buffer.append(new OutputRecord("pkgA", "TestB", "")).duration(Duration.ofMillis(7));
    buffer.addBenchmark(new Benchmark("BenchmarkA", Duration.ofNanos(5), 1, 1));

    List<TestPackage> packages = buffer.drain();

    assertEquals(1, packages.size());
    assertEquals(Duration.ofMillis(12), packages.get(0).duration());
    assertEquals(1, packages.get(0).benchmarks().size());
    assertTrue(buffer.isEmpty());
    assertFalse(buffer.addBenchmark(new Benchmark("BenchmarkB", Duration.ZERO, 0, 0)));
    assertTrue(buffer.drain().isEmpty());
  }
}
