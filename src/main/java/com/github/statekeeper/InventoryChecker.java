package com.github.statekeeper;

/**
 * Answers whether every item of an order can be fulfilled.
 */
public interface InventoryChecker {

  boolean isAvailable(final Order order);

}
