package ca.gc.cra.blocklist.application.pipeline;

import ca.gc.cra.blocklist.domain.blocklist.BlocklistVariant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-stage tallies of one run.
 *
 * @param sourcesTotal sources in the catalog
 * @param sourcesFailed sources that contributed nothing because every fetch failed
 * @param candidates domains entering verification
 * @param nxdomain candidates dropped as NXDOMAIN
 * @param unverified candidates kept after every lookup failed
 * @param finalDomains domains surviving verification
 * @param peakInFlight highest number of concurrent lookups
 * @param linesWritten line count of each variant written successfully
 * @param failedWrites variants whose write failed
 * @since 0.1.0
 */
public record RunReport(
    int sourcesTotal,
    int sourcesFailed,
    int candidates,
    int nxdomain,
    int unverified,
    int finalDomains,
    int peakInFlight,
    Map<BlocklistVariant, Integer> linesWritten,
    List<BlocklistVariant> failedWrites) {

  public RunReport {
    Objects.requireNonNull(linesWritten, "linesWritten");
    linesWritten = linesWritten.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new EnumMap<>(linesWritten));
    failedWrites = List.copyOf(Objects.requireNonNull(failedWrites, "failedWrites"));
  }

  /**
   * Returns whether any variant could not be written.
   *
   * @return {@code true} when at least one write failed
   */
  public boolean hasWriteFailures() {
    return !failedWrites.isEmpty();
  }
}
