/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

/** How spans and service metadata are partitioned into indices. Fixed for a writer's lifetime. */
public enum IndexingMode {
  /** Daily (or per date layout) indices named by the span's start time. */
  DATED(false, false),
  /** Fixed write aliases, repointed externally when the underlying index rolls over. */
  ROLLOVER_ALIAS(false, true),
  /**
   * The archive counterpart of {@link #DATED}: one archive index with a fixed suffix, as archived
   * spans live outside date-based retention. Service metadata is not written.
   */
  ARCHIVE_DATED(true, false),
  /** A write alias for the archive. Service metadata is not written. */
  ARCHIVE_ALIAS(true, true);

  final boolean archive, useReadWriteAliases;

  IndexingMode(boolean archive, boolean useReadWriteAliases) {
    this.archive = archive;
    this.useReadWriteAliases = useReadWriteAliases;
  }

  public static IndexingMode of(boolean archive, boolean useReadWriteAliases) {
    if (archive) return useReadWriteAliases ? ARCHIVE_ALIAS : ARCHIVE_DATED;
    return useReadWriteAliases ? ROLLOVER_ALIAS : DATED;
  }

  public boolean isArchive() {
    return archive;
  }

  public boolean usesReadWriteAliases() {
    return useReadWriteAliases;
  }
}
