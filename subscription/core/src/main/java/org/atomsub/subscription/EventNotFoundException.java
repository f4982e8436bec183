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

package org.atomsub.subscription;

import java.net.URI;

/**
 * Thrown when the body of an event cannot be found. This may be transient if the store is eventually
 * consistent across replicas.
 */
public class EventNotFoundException extends RuntimeException {

    private final URI link;

    public EventNotFoundException(URI link) {
        super("Event could not be found at " + link);
        this.link = link;
    }

    public URI getLink() {
        return link;
    }
}
