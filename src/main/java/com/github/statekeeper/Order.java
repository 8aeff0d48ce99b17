package com.github.statekeeper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.github.statekeeper.StateContextConfiguration.StateContextConfigurationBuilder;
import com.github.statekeeper.StateKeeperException.Code;

/**
 * An order moving through its {@link OrderState} lifecycle. Availability, payment and shipping
 * decisions are delegated to the injected collaborators.
 *
 * Refunds are guarded: whichever path triggers one (cancelling a paid order, returning a delivered
 * one, re-processing a returned one), {@link PaymentGateway#refund(Order)} runs at most once.
 */
public final class Order extends StateContext<OrderState> {

  public static enum PaymentStatus {
    PENDING, PAID, REFUNDED;
  }

  public static enum ShippingStatus {
    NOT_SHIPPED, READY;
  }

  public static enum DeliveryStatus {
    NOT_DELIVERED, DELIVERED;
  }

  private final List<String> items;
  private final long createdMillis = System.currentTimeMillis();

  private final InventoryChecker inventoryChecker;
  private final PaymentGateway paymentGateway;
  private final ShippingService shippingService;

  private PaymentStatus paymentStatus = PaymentStatus.PENDING;
  private ShippingStatus shippingStatus = ShippingStatus.NOT_SHIPPED;
  private DeliveryStatus deliveryStatus = DeliveryStatus.NOT_DELIVERED;
  private boolean refunded;

  public Order(final String orderId, final List<String> items,
      final InventoryChecker inventoryChecker, final PaymentGateway paymentGateway,
      final ShippingService shippingService) throws StateKeeperException {
    this(orderId, items, inventoryChecker, paymentGateway, shippingService,
        StateContextConfigurationBuilder.newBuilder().build());
  }

  public Order(final String orderId, final List<String> items,
      final InventoryChecker inventoryChecker, final PaymentGateway paymentGateway,
      final ShippingService shippingService, final StateContextConfiguration config)
      throws StateKeeperException {
    super(checkArguments(orderId, inventoryChecker, paymentGateway, shippingService),
        OrderState.CREATED, config);
    this.items = items == null ? Collections.<String>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(items));
    this.inventoryChecker = inventoryChecker;
    this.paymentGateway = paymentGateway;
    this.shippingService = shippingService;
  }

  // must run before the super constructor, which already logs the new context
  private static String checkArguments(final String orderId,
      final InventoryChecker inventoryChecker, final PaymentGateway paymentGateway,
      final ShippingService shippingService) throws StateKeeperException {
    if (orderId == null || orderId.trim().isEmpty()) {
      throw new StateKeeperException(Code.INVALID_STATE, "Order id cannot be blank");
    }
    if (inventoryChecker == null || paymentGateway == null || shippingService == null) {
      throw new StateKeeperException(Code.INVALID_COLLABORATOR);
    }
    return orderId;
  }

  public TransitionResult process() throws StateKeeperException {
    return getCurrentState().process(this);
  }

  public TransitionResult cancel() throws StateKeeperException {
    return getCurrentState().cancel(this);
  }

  public TransitionResult returnOrder() throws StateKeeperException {
    return getCurrentState().returnOrder(this);
  }

  boolean checkAvailability() {
    final boolean available = inventoryChecker.isAvailable(this);
    logInfo("Inventory check: " + (available ? "available" : "unavailable"));
    return available;
  }

  boolean checkPayment() {
    final boolean paid = paymentGateway.isPaid(this);
    if (paid) {
      paymentStatus = PaymentStatus.PAID;
    }
    logInfo("Payment check: " + (paid ? "paid" : "not paid"));
    return paid;
  }

  boolean prepareForShipping() {
    final boolean prepared = shippingService.prepareForShipping(this);
    if (prepared) {
      shippingStatus = ShippingStatus.READY;
    }
    logInfo("Shipping preparation: " + (prepared ? "ready" : "failed"));
    return prepared;
  }

  boolean checkDelivery() {
    final boolean delivered = shippingService.isDelivered(this);
    if (delivered) {
      deliveryStatus = DeliveryStatus.DELIVERED;
    }
    logInfo("Delivery check: " + (delivered ? "delivered" : "in transit"));
    return delivered;
  }

  /**
   * Returns true iff this call issued the refund.
   */
  boolean refundPayment() {
    if (refunded) {
      logInfo("Refund already issued, skipping");
      return false;
    }
    paymentGateway.refund(this);
    refunded = true;
    paymentStatus = PaymentStatus.REFUNDED;
    logInfo("Refund issued");
    return true;
  }

  public String getId() {
    return getContextId();
  }

  public List<String> getItems() {
    return items;
  }

  public long getCreatedMillis() {
    return createdMillis;
  }

  public PaymentStatus getPaymentStatus() {
    return paymentStatus;
  }

  public ShippingStatus getShippingStatus() {
    return shippingStatus;
  }

  public DeliveryStatus getDeliveryStatus() {
    return deliveryStatus;
  }

  public boolean isRefunded() {
    return refunded;
  }

  public String getStateDescription() {
    return getCurrentState().getDescription();
  }

  @Override
  public String toString() {
    return "Order [id=" + getId() + ", state=" + getCurrentState().getName() + ", items=" + items
        + ", paymentStatus=" + paymentStatus + ", shippingStatus=" + shippingStatus
        + ", deliveryStatus=" + deliveryStatus + ", createdMillis=" + createdMillis
        + ", transitions=" + getTransitionCount() + "]";
  }
}
