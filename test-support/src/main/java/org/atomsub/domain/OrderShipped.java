/*
 * Copyright 2024 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.atomsub.domain;

import java.util.Objects;
import java.util.UUID;

public class OrderShipped extends OrderEvent implements Auditable {

    private String carrier;

    @SuppressWarnings("unused")
    OrderShipped() {
    }

    public OrderShipped(String orderId, String carrier) {
        this(UUID.randomUUID().toString(), orderId, carrier);
    }

    public OrderShipped(String eventId, String orderId, String carrier) {
        super(eventId, orderId);
        this.carrier = carrier;
    }

    public String getCarrier() {
        return carrier;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        OrderShipped that = (OrderShipped) o;
        return Objects.equals(carrier, that.carrier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), carrier);
    }

    @Override
    public String toString() {
        return "OrderShipped{" +
                "eventId='" + getEventId() + '\'' +
                ", orderId='" + getOrderId() + '\'' +
                ", carrier=" + carrier +
                '}';
    }
}
