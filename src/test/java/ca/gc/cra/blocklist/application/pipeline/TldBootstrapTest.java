package ca.gc.cra.blocklist.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.blocklist.domain.tld.TldSnapshot;
import java.net.URI;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TldBootstrapTest {
  private static final String TLD_LIST = "https://data.example.org/tlds-alpha-by-domain.txt";
  private static final String EFFECTIVE = "https://data.example.org/effective_tld_names.dat";

  @Test
  void combinesBothReferenceLists() throws Exception {
    StubSourceFetcher fetcher = new StubSourceFetcher()
        .serve(TLD_LIST, "# Version 2024\nCOM\nNET\n")
        .serve(EFFECTIVE, "// ICANN\nuk\nco.uk\n*.ck\n!www.ck\n");

    TldSnapshot snapshot = new TldBootstrap(fetcher).load(URI.create(TLD_LIST), URI.create(EFFECTIVE));

    assertEquals(Set.of("com", "net", "uk"), snapshot.exactLabels());
    assertEquals(List.of(".co.uk"), snapshot.suffixes());
    assertTrue(snapshot.matches("ads.example.co.uk"));
  }

  @Test
  void missingListContributesNothing() throws Exception {
    StubSourceFetcher fetcher = new StubSourceFetcher().serve(TLD_LIST, "COM\n");

    TldSnapshot snapshot = new TldBootstrap(fetcher).load(URI.create(TLD_LIST), URI.create(EFFECTIVE));

    assertEquals(Set.of("com"), snapshot.exactLabels());
    assertTrue(snapshot.suffixes().isEmpty());
  }

  @Test
  void bothListsMissingYieldsEmptySnapshot() throws Exception {
    TldSnapshot snapshot =
        new TldBootstrap(new StubSourceFetcher()).load(URI.create(TLD_LIST), URI.create(EFFECTIVE));

    assertTrue(snapshot.isEmpty());
    assertFalse(snapshot.matches("ads.example.com"));
  }
}
