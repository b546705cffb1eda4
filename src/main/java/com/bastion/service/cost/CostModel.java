package com.bastion.service.cost;

import java.math.BigDecimal;

/**
 * Prices requests and measures responses of one provider category.
 *
 * @param <Q> request type
 * @param <N> normalized response type
 */
public interface CostModel<Q, N> {

    /**
     * Cost of serving {@code request} upstream, estimated before any call is made.
     */
    BigDecimal estimate(Q request);

    /**
     * Cost of a completed call, using what the response reports about itself.
     */
    default BigDecimal actual(Q request, N response) {
        return estimate(request);
    }

    /**
     * Units the response delivers: tokens, results or bytes.
     */
    long unitsServed(N response);

    /**
     * Size of the response in the unit of the operation's output cap.
     */
    default long responseSize(N response) {
        return unitsServed(response);
    }

    Class<N> responseType();
}
