package com.github.statekeeper;

public interface ShippingService {

  /**
   * Pack the order and hand it to a carrier. Returns false if that could not be done right now.
   */
  boolean prepareForShipping(final Order order);

  boolean isDelivered(final Order order);

}
