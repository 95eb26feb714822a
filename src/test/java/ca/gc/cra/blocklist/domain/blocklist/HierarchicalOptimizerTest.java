package ca.gc.cra.blocklist.domain.blocklist;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class HierarchicalOptimizerTest {

  @Test
  void dropsDomainsCoveredByAnAncestor() {
    Set<String> result = HierarchicalOptimizer.optimize(
        List.of("ads.example.com", "example.com", "x.y.tracker.net", "tracker.net", "other.org"));

    assertEquals(Set.of("example.com", "tracker.net", "other.org"), result);
  }

  @Test
  void keepsSiblingsWithoutCommonAncestorInSet() {
    Set<String> result = HierarchicalOptimizer.optimize(List.of("a.example.com", "b.example.com"));

    assertEquals(Set.of("a.example.com", "b.example.com"), result);
  }

  @Test
  void ancestorMustSitAtLabelBoundary() {
    Set<String> result = HierarchicalOptimizer.optimize(List.of("badexample.com", "example.com"));

    assertEquals(Set.of("badexample.com", "example.com"), result);
  }

  @Test
  void coverageSkipsIntermediateLevels() {
    Set<String> result = HierarchicalOptimizer.optimize(List.of("deep.a.b.c.example.com", "example.com"));

    assertEquals(Set.of("example.com"), result);
  }

  @Test
  void isIdempotent() {
    Set<String> once = HierarchicalOptimizer.optimize(
        List.of("a.b.example.com", "b.example.com", "c.example.com", "tracker.io"));
    Set<String> twice = HierarchicalOptimizer.optimize(once);

    assertEquals(once, twice);
  }

  @Test
  void emptyInputYieldsEmptyOutput() {
    assertTrue(HierarchicalOptimizer.optimize(List.of()).isEmpty());
  }
}
