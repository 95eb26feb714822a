package ca.gc.cra.blocklist.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.blocklist.domain.catalog.SourceDescriptor;
import ca.gc.cra.blocklist.domain.rules.LineRule;
import ca.gc.cra.blocklist.domain.rules.Whitelist;
import ca.gc.cra.blocklist.domain.tld.TldSnapshot;
import java.net.URI;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CandidateStageTest {
  private static final SourceProcessor PROCESSOR =
      new SourceProcessor(TldSnapshot.of(Set.of("com", "net"), List.of()), Whitelist.empty(), null);

  @Test
  void mergesDomainsFromAllSources() throws Exception {
    StubSourceFetcher fetcher = new StubSourceFetcher()
        .serve("https://a.example.org/hosts", "0.0.0.0 ads.example.com\n0.0.0.0 shared.tracker.net")
        .serve("https://b.example.org/hosts", "127.0.0.1 shared.tracker.net\n127.0.0.1 pixel.example.com")
        .serve("https://c.example.org/list", "only.tracker.net");
    List<SourceDescriptor> sources = List.of(
        new SourceDescriptor(URI.create("https://a.example.org/hosts"), LineRule.hostLine("0.0.0.0")),
        new SourceDescriptor(URI.create("https://b.example.org/hosts"), LineRule.hostLine("127.0.0.1")),
        new SourceDescriptor(URI.create("https://c.example.org/list"), LineRule.domainList()));

    CandidateStage.Result result = new CandidateStage(fetcher).collect(sources, PROCESSOR);

    assertEquals(
        Set.of("ads.example.com", "shared.tracker.net", "pixel.example.com", "only.tracker.net"),
        result.candidates());
    assertEquals(3, result.sourcesSucceeded());
    assertEquals(0, result.sourcesFailed());
  }

  @Test
  void failedSourceIsSkippedWithoutAbortingRun() throws Exception {
    StubSourceFetcher fetcher = new StubSourceFetcher()
        .serve("https://a.example.org/hosts", "0.0.0.0 ads.example.com");
    List<SourceDescriptor> sources = List.of(
        new SourceDescriptor(URI.create("https://a.example.org/hosts"), LineRule.hostLine("0.0.0.0")),
        new SourceDescriptor(URI.create("https://missing.example.org/hosts"), LineRule.hostLine("0.0.0.0")));

    CandidateStage.Result result = new CandidateStage(fetcher).collect(sources, PROCESSOR);

    assertEquals(Set.of("ads.example.com"), result.candidates());
    assertEquals(1, result.sourcesSucceeded());
    assertEquals(1, result.sourcesFailed());
  }

  @Test
  void noSourcesYieldsEmptyResult() throws Exception {
    CandidateStage.Result result = new CandidateStage(new StubSourceFetcher()).collect(List.of(), PROCESSOR);

    assertTrue(result.candidates().isEmpty());
    assertEquals(0, result.sourcesFailed());
  }
}
