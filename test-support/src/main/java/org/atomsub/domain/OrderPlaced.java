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

public class OrderPlaced extends OrderEvent {

    private int amount;

    @SuppressWarnings("unused")
    OrderPlaced() {
    }

    public OrderPlaced(String orderId, int amount) {
        this(UUID.randomUUID().toString(), orderId, amount);
    }

    public OrderPlaced(String eventId, String orderId, int amount) {
        super(eventId, orderId);
        this.amount = amount;
    }

    public int getAmount() {
        return amount;
    }

    @Override
    public boolean equals(Object o) {
        if (!super.equals(o)) return false;
        OrderPlaced that = (OrderPlaced) o;
        return Objects.equals(amount, that.amount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(super.hashCode(), amount);
    }

    @Override
    public String toString() {
        return "OrderPlaced{" +
                "eventId='" + getEventId() + '\'' +
                ", orderId='" + getOrderId() + '\'' +
                ", amount=" + amount +
                '}';
    }
}
