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

package org.atomsub.subscription.internal;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

public class ExecutorShutdown {

    /**
     * Shutdown the executor service and wait for the running tasks to complete. If they don't
     * complete within the timeout the executor is shutdown forcefully.
     */
    public static void shutdownSafely(ExecutorService executorService, long timeout, TimeUnit unit) {
        if (!executorService.isShutdown() && !executorService.isTerminated()) {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(timeout, unit)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                if (!executorService.isTerminated()) {
                    executorService.shutdownNow();
                }
                Thread.currentThread().interrupt();
            }
        }
    }
}
