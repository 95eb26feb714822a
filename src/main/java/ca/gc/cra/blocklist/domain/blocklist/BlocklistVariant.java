package ca.gc.cra.blocklist.domain.blocklist;

/**
 * The four published block list files.
 *
 * @since 0.1.0
 */
public enum BlocklistVariant {
  PLAIN("toblock.lst", false, true),
  PLAIN_WITHOUT_SHORTLINKS("toblock-without-shorturl.lst", false, false),
  OPTIMIZED("toblock-optimized.lst", true, true),
  OPTIMIZED_WITHOUT_SHORTLINKS("toblock-without-shorturl-optimized.lst", true, false);

  private final String fileName;
  private final boolean optimized;
  private final boolean withShortlinks;

  BlocklistVariant(String fileName, boolean optimized, boolean withShortlinks) {
    this.fileName = fileName;
    this.optimized = optimized;
    this.withShortlinks = withShortlinks;
  }

  /**
   * Returns the file name written inside the output directory.
   *
   * @return file name
   */
  public String fileName() {
    return fileName;
  }

  /**
   * Returns whether the variant is hierarchically reduced.
   *
   * @return {@code true} for the optimized files
   */
  public boolean optimized() {
    return optimized;
  }

  /**
   * Returns whether configured shortlink domains are appended.
   *
   * @return {@code true} when shortlinks are included
   */
  public boolean withShortlinks() {
    return withShortlinks;
  }
}
