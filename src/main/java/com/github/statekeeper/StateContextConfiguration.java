package com.github.statekeeper;

/**
 * This class encapsulates all the configuration parameters for a {@link StateContext}. Use the
 * {@code StateContextConfigurationBuilder} to build it.
 *
 * Bound the transition history of every context. Long-lived owners that flip between variants
 * forever would otherwise grow their history without limit.
 *
 * Notes:<br>
 * 1. If this is not set, a default of 1000 retained transition records applies.<br>
 * 2. Once full, the oldest record is evicted. The context still counts every accepted transition
 * in {@link StateContext#getTransitionCount()}.<br>
 */
public final class StateContextConfiguration {
  static final int defaultMaxHistoryDepth = 1000;
  static final int maxHistoryDepthCeiling = 1_000_000;

  private final int maxHistoryDepth;

  public int getMaxHistoryDepth() {
    return maxHistoryDepth;
  }

  public final static class StateContextConfigurationBuilder {
    private int maxHistoryDepth;

    public static StateContextConfigurationBuilder newBuilder() {
      return new StateContextConfigurationBuilder();
    }

    public StateContextConfigurationBuilder maxHistoryDepth(final int maxHistoryDepth) {
      this.maxHistoryDepth = maxHistoryDepth;
      return this;
    }

    public StateContextConfiguration build() throws StateKeeperException {
      final StateContextConfiguration config = new StateContextConfiguration(maxHistoryDepth);
      config.validate();
      return config;
    }

    private StateContextConfigurationBuilder() {}
  }

  private void validate() throws StateKeeperException {
    StringBuilder messages = new StringBuilder();
    if (maxHistoryDepth > maxHistoryDepthCeiling) {
      messages.append("maxHistoryDepth cannot exceed ").append(maxHistoryDepthCeiling)
          .append(". ");
    }
    if (messages.length() > 0) {
      throw new StateKeeperException(StateKeeperException.Code.INVALID_CONFIG,
          messages.toString());
    }
  }

  @Override
  public String toString() {
    return "StateContextConfiguration [maxHistoryDepth=" + maxHistoryDepth + "]";
  }

  private StateContextConfiguration(final int maxHistoryDepth) {
    if (maxHistoryDepth <= 0) {
      this.maxHistoryDepth = defaultMaxHistoryDepth;
    } else {
      this.maxHistoryDepth = maxHistoryDepth;
    }
  }

}
