/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.framekit.operator.window;

import io.framekit.spi.window.WindowPartition;
import io.prestosql.spi.Page;

import java.util.OptionalLong;

/**
 * Source of the partitions the window operator evaluates. Input pages are accumulated until
 * {@link #noMoreInput()}; partitions are then handed out one at a time, in order.
 */
public interface WindowBuild
{
    /**
     * Accumulate the rows of {@code page}. Empty pages are ignored.
     */
    void addInput(Page page);

    void noMoreInput();

    boolean hasNextPartition();

    /**
     * Must only be called after {@link #hasNextPartition()} returned true. The previous
     * partition must not be used anymore once this method is called.
     */
    WindowPartition nextPartition();

    /**
     * Estimated size of one row in bytes, if it can be estimated.
     * <p>
     * The window operator calls this once when it is created, before any input has been
     * added, so builds over variable-width columns usually return empty there and the
     * operator uses the preferred batch row count.
     */
    OptionalLong estimateRowSize();

    long getRetainedSizeInBytes();
}
