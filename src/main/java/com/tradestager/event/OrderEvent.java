package com.tradestager.event;

import com.tradestager.domain.enums.OrderStatus;
import com.tradestager.domain.model.OrderRecord;
import org.springframework.context.ApplicationEvent;

/** Published after an order's submission or fill has been recorded in the staging ledger. */
public class OrderEvent extends ApplicationEvent {

    private final OrderRecord order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    public OrderEvent(Object source, OrderRecord order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderRecord getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }

    @Override
    public String toString() {
        return "OrderEvent{" + eventType + ", order=" + order.getId() + ", " + previousStatus + " -> "
                + order.getStatus() + "}";
    }
}
