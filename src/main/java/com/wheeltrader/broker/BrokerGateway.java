package com.wheeltrader.broker;

import com.wheeltrader.domain.model.AccountBalances;
import com.wheeltrader.domain.model.BrokerOrder;
import com.wheeltrader.domain.model.BrokerPosition;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.UnderlyingQuote;
import java.util.List;

/**
 * Every broker interaction of the wheel goes through this interface: market data, account
 * state and order routing.
 *
 * <p>Order status changes are not returned from these calls. Implementations report them as
 * {@link com.wheeltrader.event.OrderEvent}s, from whatever thread the broker uses; the order
 * lifecycle manager queues them for the evaluation loop.
 *
 * <p>Any call may throw {@link com.wheeltrader.exception.BrokerDisconnectedException} when the
 * connection is down, or {@link com.wheeltrader.exception.BrokerException} for other failures.
 */
public interface BrokerGateway {

    // ---- Market data ----

    /**
     * Full chain snapshot for the underlying, every listed expiration and strike, with the
     * latest quote and, where the data source has it, delta.
     */
    List<OptionContract> getOptionChain(String underlying);

    UnderlyingQuote getUnderlyingQuote(String underlying);

    // ---- Account ----

    /** All open option positions in the account, on any underlying. Short legs have negative quantity. */
    List<BrokerPosition> getPositions();

    /** Cash balance and shares of the underlying held. */
    AccountBalances getAccountBalances(String underlying);

    // ---- Orders ----

    /**
     * Routes a new order.
     *
     * @param order contract, side, type, quantity, limit price and the client correlation id
     * @return the broker-assigned order id
     */
    String placeOrder(BrokerOrder order);

    /** Changes the limit price of a working order. */
    void modifyOrder(String brokerOrderId, BrokerOrder order);

    void cancelOrder(String brokerOrderId);

    /** All orders of the current session, working and terminal. */
    List<BrokerOrder> getOrders();

    // ---- Connectivity ----

    boolean isConnected();
}
