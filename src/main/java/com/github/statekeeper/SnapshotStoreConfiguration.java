package com.github.statekeeper;

/**
 * Configuration parameters for a {@link SnapshotStore}. Use the
 * {@code SnapshotStoreConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. maxDepth bounds the undo and the redo stack independently. Once a stack is full, the oldest
 * snapshot is evicted to make room for the newest one.<br>
 * 2. If maxDepth is not set, a default of 100 snapshots per stack applies.<br>
 */
public final class SnapshotStoreConfiguration {
  static final int defaultMaxDepth = 100;
  static final int maxDepthCeiling = 100_000;

  private final int maxDepth;

  public int getMaxDepth() {
    return maxDepth;
  }

  public final static class SnapshotStoreConfigurationBuilder {
    private int maxDepth;

    public static SnapshotStoreConfigurationBuilder newBuilder() {
      return new SnapshotStoreConfigurationBuilder();
    }

    public SnapshotStoreConfigurationBuilder maxDepth(final int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    public SnapshotStoreConfiguration build() throws StateKeeperException {
      final SnapshotStoreConfiguration config = new SnapshotStoreConfiguration(maxDepth);
      config.validate();
      return config;
    }

    private SnapshotStoreConfigurationBuilder() {}
  }

  private void validate() throws StateKeeperException {
    if (maxDepth > maxDepthCeiling) {
      throw new StateKeeperException(StateKeeperException.Code.INVALID_CONFIG,
          "maxDepth cannot exceed " + maxDepthCeiling + ", found " + maxDepth);
    }
  }

  @Override
  public String toString() {
    return "SnapshotStoreConfiguration [maxDepth=" + maxDepth + "]";
  }

  private SnapshotStoreConfiguration(final int maxDepth) {
    if (maxDepth <= 0) {
      this.maxDepth = defaultMaxDepth;
    } else {
      this.maxDepth = maxDepth;
    }
  }

}
