package com.github.statekeeper;

/**
 * Lifecycle of an {@link Order}.
 *
 * <pre>
 * CREATED --process--> CONFIRMED --process--> PAID --process--> SHIPPED --process--> DELIVERED
 *    |                     |                    |                                       |
 *    +---cancel/process----+-------cancel-------+--cancel (refund)                   return
 *                    v                                                                  v
 *                CANCELLED                                                   RETURNED (refund)
 * </pre>
 *
 * Every event that does not apply in a state is rejected, never thrown.
 */
public enum OrderState implements Variant {
  CREATED("Created", "Order created, awaiting confirmation", false) {
    @Override
    TransitionResult process(final Order order) throws StateKeeperException {
      if (order.checkAvailability()) {
        return order.accept(CONFIRMED, "Items available, confirming order");
      }
      return order.accept(CANCELLED, "Items unavailable, cancelling order");
    }

    @Override
    TransitionResult cancel(final Order order) throws StateKeeperException {
      return order.accept(CANCELLED, "Cancelling order");
    }
  },

  CONFIRMED("Confirmed", "Order confirmed, awaiting payment", false) {
    @Override
    TransitionResult process(final Order order) throws StateKeeperException {
      if (order.checkPayment()) {
        return order.accept(PAID, "Payment received");
      }
      return order.reject("Payment not received yet");
    }

    @Override
    TransitionResult cancel(final Order order) throws StateKeeperException {
      return order.accept(CANCELLED, "Cancelling order");
    }
  },

  PAID("Paid", "Order paid, being prepared for shipping", false) {
    @Override
    TransitionResult process(final Order order) throws StateKeeperException {
      if (order.prepareForShipping()) {
        return order.accept(SHIPPED, "Order handed to carrier");
      }
      return order.reject("Order could not be prepared for shipping");
    }

    @Override
    TransitionResult cancel(final Order order) throws StateKeeperException {
      order.refundPayment();
      return order.accept(CANCELLED, "Cancelling paid order with refund");
    }
  },

  SHIPPED("Shipped", "Order shipped, in transit", false) {
    @Override
    TransitionResult process(final Order order) throws StateKeeperException {
      if (order.checkDelivery()) {
        return order.accept(DELIVERED, "Order delivered");
      }
      return order.reject("Order still in transit");
    }
  },

  DELIVERED("Delivered", "Order delivered", true) {
    @Override
    TransitionResult process(final Order order) {
      return order.reject("Order already delivered");
    }

    @Override
    TransitionResult returnOrder(final Order order) throws StateKeeperException {
      order.refundPayment();
      return order.accept(RETURNED, "Returning order with refund");
    }
  },

  RETURNED("Returned", "Order returned", true) {
    @Override
    TransitionResult process(final Order order) {
      // refunds are idempotent, so re-processing a returned order is safe
      if (order.refundPayment()) {
        return order.reject("Refund issued for returned order");
      }
      return order.reject("Returned order already refunded");
    }
  },

  CANCELLED("Cancelled", "Order cancelled", true) {
    @Override
    TransitionResult process(final Order order) {
      return order.reject("Cancelled order cannot be processed");
    }
  };

  private final String name;
  private final String description;
  private final boolean terminal;

  private OrderState(final String name, final String description, final boolean terminal) {
    this.name = name;
    this.description = description;
    this.terminal = terminal;
  }

  abstract TransitionResult process(final Order order) throws StateKeeperException;

  TransitionResult cancel(final Order order) throws StateKeeperException {
    return order.reject("Cannot cancel an order in state " + name);
  }

  TransitionResult returnOrder(final Order order) throws StateKeeperException {
    return order.reject("Cannot return an order in state " + name);
  }

  @Override
  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  @Override
  public boolean isTerminal() {
    return terminal;
  }
}
