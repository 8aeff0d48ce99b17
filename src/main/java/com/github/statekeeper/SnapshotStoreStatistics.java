package com.github.statekeeper;

/**
 * Point-in-time statistics of a {@link SnapshotStore}. Obtaining one has no side effects on the
 * store.
 */
public final class SnapshotStoreStatistics {
  private final String storeId;
  private final int undoDepth;
  private final int redoDepth;
  private final long totalSaves;
  private final long totalUndos;
  private final long totalRedos;
  private final long totalEvictions;

  SnapshotStoreStatistics(final String storeId, final int undoDepth, final int redoDepth,
      final long totalSaves, final long totalUndos, final long totalRedos,
      final long totalEvictions) {
    this.storeId = storeId;
    this.undoDepth = undoDepth;
    this.redoDepth = redoDepth;
    this.totalSaves = totalSaves;
    this.totalUndos = totalUndos;
    this.totalRedos = totalRedos;
    this.totalEvictions = totalEvictions;
  }

  public String getStoreId() {
    return storeId;
  }

  public int getUndoDepth() {
    return undoDepth;
  }

  public int getRedoDepth() {
    return redoDepth;
  }

  public long getTotalSaves() {
    return totalSaves;
  }

  public long getTotalUndos() {
    return totalUndos;
  }

  public long getTotalRedos() {
    return totalRedos;
  }

  /**
   * Snapshots dropped off the bottom of either stack because it was full.
   */
  public long getTotalEvictions() {
    return totalEvictions;
  }

  @Override
  public String toString() {
    return "SnapshotStoreStatistics [storeId=" + storeId + ", undoDepth=" + undoDepth
        + ", redoDepth=" + redoDepth + ", totalSaves=" + totalSaves + ", totalUndos=" + totalUndos
        + ", totalRedos=" + totalRedos + ", totalEvictions=" + totalEvictions + "]";
  }
}
