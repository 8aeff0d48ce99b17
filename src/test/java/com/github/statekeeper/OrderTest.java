package com.github.statekeeper;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.statekeeper.Order.DeliveryStatus;
import com.github.statekeeper.Order.PaymentStatus;
import com.github.statekeeper.Order.ShippingStatus;
import com.github.statekeeper.StateKeeperException.Code;

/**
 * Tests for the order processing state machine.
 */
public final class OrderTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(OrderTest.class.getSimpleName());

  @Test
  public void testProcessThenCancelPaidOrder() throws StateKeeperException {
    final StubCollaborators stubs = new StubCollaborators(true, true, true, true);
    final Order order = stubs.newOrder("ORD-001");
    assertEquals(OrderState.CREATED, order.getCurrentState());

    // 1. created->confirmed
    TransitionResult result = order.process();
    assertTrue(result.isAccepted());
    assertEquals("Created", result.getFrom());
    assertEquals("Confirmed", result.getTo().get());
    assertEquals(OrderState.CONFIRMED, order.getCurrentState());
    assertEquals(1, order.getHistory().size());
    assertEquals("Created", order.getHistory().get(0).getFrom());
    assertEquals("Confirmed", order.getHistory().get(0).getTo());

    // 2. confirmed->paid
    assertTrue(order.process().isAccepted());
    assertEquals(OrderState.PAID, order.getCurrentState());
    assertEquals(PaymentStatus.PAID, order.getPaymentStatus());
    assertEquals(2, order.getHistory().size());

    // 3. paid->cancelled with a single refund
    result = order.cancel();
    assertTrue(result.isAccepted());
    assertEquals(OrderState.CANCELLED, order.getCurrentState());
    assertEquals(1, stubs.refunds.get());
    assertEquals(PaymentStatus.REFUNDED, order.getPaymentStatus());
    assertEquals(3, order.getHistory().size());

    // 4. cancelling again is a rejected no-op
    result = order.cancel();
    assertFalse(result.isAccepted());
    assertEquals("Cancelled", result.getFrom());
    assertFalse(result.getTo().isPresent());
    assertEquals(3, order.getHistory().size());
    assertEquals(1, stubs.refunds.get());
  }

  @Test
  public void testHappyPathAndReturn() throws StateKeeperException {
    final StubCollaborators stubs = new StubCollaborators(true, true, true, true);
    final Order order = stubs.newOrder("ORD-002");

    assertTrue(order.process().isAccepted());
    assertTrue(order.process().isAccepted());
    assertTrue(order.process().isAccepted());
    assertEquals(ShippingStatus.READY, order.getShippingStatus());
    assertTrue(order.process().isAccepted());
    assertEquals(OrderState.DELIVERED, order.getCurrentState());
    assertEquals(DeliveryStatus.DELIVERED, order.getDeliveryStatus());
    assertEquals(4, order.getHistory().size());

    // delivered absorbs cancel and process
    assertFalse(order.cancel().isAccepted());
    assertFalse(order.process().isAccepted());
    assertEquals(OrderState.DELIVERED, order.getCurrentState());
    assertEquals(4, order.getHistory().size());

    // delivered->returned refunds once
    assertTrue(order.returnOrder().isAccepted());
    assertEquals(OrderState.RETURNED, order.getCurrentState());
    assertEquals(1, stubs.refunds.get());
    assertTrue(order.isRefunded());

    // processing a returned order never refunds twice
    assertFalse(order.process().isAccepted());
    assertFalse(order.process().isAccepted());
    assertEquals(1, stubs.refunds.get());
    assertFalse(order.returnOrder().isAccepted());
    assertFalse(order.cancel().isAccepted());
    assertEquals(5, order.getHistory().size());
    assertEquals("Order returned", order.getStateDescription());
  }

  @Test
  public void testUnavailableInventoryCancels() throws StateKeeperException {
    final StubCollaborators stubs = new StubCollaborators(false, true, true, true);
    final Order order = stubs.newOrder("ORD-003");

    final TransitionResult result = order.process();
    assertTrue(result.isAccepted());
    assertEquals(OrderState.CANCELLED, order.getCurrentState());
    assertEquals(0, stubs.refunds.get());
    assertFalse(order.process().isAccepted());
    assertEquals(1, order.getHistory().size());
  }

  @Test
  public void testPendingChecksAreRejectedUntilCollaboratorsAgree() throws StateKeeperException {
    final StubCollaborators stubs = new StubCollaborators(true, false, false, false);
    final Order order = stubs.newOrder("ORD-004");
    assertTrue(order.process().isAccepted());

    // awaiting payment
    assertFalse(order.process().isAccepted());
    assertEquals(OrderState.CONFIRMED, order.getCurrentState());
    assertEquals(PaymentStatus.PENDING, order.getPaymentStatus());
    stubs.paid = true;
    assertTrue(order.process().isAccepted());

    // shipping preparation fails
    assertFalse(order.process().isAccepted());
    assertEquals(OrderState.PAID, order.getCurrentState());
    stubs.prepared = true;
    assertTrue(order.process().isAccepted());

    // in transit, cannot be cancelled any longer
    assertFalse(order.process().isAccepted());
    assertFalse(order.cancel().isAccepted());
    assertEquals(OrderState.SHIPPED, order.getCurrentState());
    stubs.delivered = true;
    assertTrue(order.process().isAccepted());

    assertEquals(4, order.getHistory().size());
    assertEquals(4, order.getStatistics().getAcceptedTransitions());
    assertEquals(4, order.getStatistics().getRejectedRequests());
  }

  @Test
  public void testReturnOnlyFromDelivered() throws StateKeeperException {
    final StubCollaborators stubs = new StubCollaborators(true, true, true, true);
    final Order order = stubs.newOrder("ORD-005");
    for (int iter = 0; iter < 3; iter++) {
      assertFalse(order.returnOrder().isAccepted());
      assertTrue(order.process().isAccepted());
    }
    assertEquals(OrderState.SHIPPED, order.getCurrentState());
    assertFalse(order.returnOrder().isAccepted());
    assertEquals(3, order.getHistory().size());
    assertEquals(0, stubs.refunds.get());
  }

  @Test
  public void testCancelFromCreatedAndConfirmed() throws StateKeeperException {
    final StubCollaborators stubs = new StubCollaborators(true, true, true, true);
    final Order created = stubs.newOrder("ORD-006");
    assertTrue(created.cancel().isAccepted());
    assertEquals(OrderState.CANCELLED, created.getCurrentState());

    final Order confirmed = stubs.newOrder("ORD-007");
    assertTrue(confirmed.process().isAccepted());
    assertTrue(confirmed.cancel().isAccepted());
    assertEquals(OrderState.CANCELLED, confirmed.getCurrentState());
    assertEquals(0, stubs.refunds.get());
  }

  @Test
  public void testOrderContract() throws StateKeeperException {
    final StubCollaborators stubs = new StubCollaborators(true, true, true, true);
    final Order order = stubs.newOrder("ORD-008");
    assertEquals("ORD-008", order.getId());
    assertEquals(Arrays.asList("Laptop", "Mouse"), order.getItems());
    try {
      order.getItems().add("Keyboard");
      fail("items should be read-only");
    } catch (UnsupportedOperationException expected) {
    }
    try {
      new Order("ORD-009", null, null, stubs, stubs);
      fail("collaborators are mandatory");
    } catch (StateKeeperException expected) {
      assertEquals(Code.INVALID_COLLABORATOR, expected.getCode());
    }
    for (final String badId : new String[] {null, "", "   "}) {
      try {
        new Order(badId, null, stubs, stubs, stubs);
        fail("order id cannot be blank");
      } catch (StateKeeperException expected) {
        assertEquals(Code.INVALID_STATE, expected.getCode());
      }
    }
    // a bad id is reported ahead of missing collaborators
    try {
      new Order(null, null, null, null, null);
      fail("order id cannot be blank");
    } catch (StateKeeperException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
  }

  @Test
  public void testIndependentOrdersOnManyThreads() throws Exception {
    final AtomicInteger delivered = new AtomicInteger();
    final AtomicInteger failures = new AtomicInteger();
    final Runnable orderWorker = new Runnable() {
      @Override
      public void run() {
        try {
          final StubCollaborators stubs = new StubCollaborators(true, true, true, true);
          final Order order = stubs.newOrder(Thread.currentThread().getName());
          for (int iter = 0; iter < 4; iter++) {
            if (!order.process().isAccepted()) {
              failures.incrementAndGet();
            }
          }
          if (order.getCurrentState() == OrderState.DELIVERED
              && order.getHistory().size() == 4) {
            delivered.incrementAndGet();
          }
          logger.info(order.getStatistics().toString());
        } catch (StateKeeperException problem) {
          logger.error("order worker encountered an issue", problem);
          failures.incrementAndGet();
        }
      }
    };

    int workerCount = 5;
    final List<Thread> workers = new ArrayList<>(workerCount);
    for (int iter = 0; iter < workerCount; iter++) {
      final Thread worker = new Thread(orderWorker, "test-order-worker-" + iter);
      workers.add(worker);
    }
    for (final Thread worker : workers) {
      worker.start();
    }
    for (final Thread worker : workers) {
      worker.join();
    }

    assertEquals(workerCount, delivered.get());
    assertEquals(0, failures.get());
  }

  /**
   * Deterministic stand-ins for inventory, payment and shipping.
   */
  static final class StubCollaborators
      implements InventoryChecker, PaymentGateway, ShippingService {
    volatile boolean available;
    volatile boolean paid;
    volatile boolean prepared;
    volatile boolean delivered;
    final AtomicInteger refunds = new AtomicInteger();

    StubCollaborators(final boolean available, final boolean paid, final boolean prepared,
        final boolean delivered) {
      this.available = available;
      this.paid = paid;
      this.prepared = prepared;
      this.delivered = delivered;
    }

    Order newOrder(final String orderId) throws StateKeeperException {
      return new Order(orderId, Arrays.asList("Laptop", "Mouse"), this, this, this);
    }

    @Override
    public boolean isAvailable(final Order order) {
      return available;
    }

    @Override
    public boolean isPaid(final Order order) {
      return paid;
    }

    @Override
    public void refund(final Order order) {
      refunds.incrementAndGet();
    }

    @Override
    public boolean prepareForShipping(final Order order) {
      return prepared;
    }

    @Override
    public boolean isDelivered(final Order order) {
      return delivered;
    }
  }

}
