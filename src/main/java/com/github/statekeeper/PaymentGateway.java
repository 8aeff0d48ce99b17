package com.github.statekeeper;

/**
 * Payment side of order processing.
 */
public interface PaymentGateway {

  /**
   * Check whether payment for the order has been received.
   */
  boolean isPaid(final Order order);

  /**
   * Give the customer their money back. {@link Order} guarantees this is called at most once per
   * order.
   */
  void refund(final Order order);

}
