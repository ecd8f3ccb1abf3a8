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
package io.framekit.spi.window;

import io.prestosql.memory.context.AggregatedMemoryContext;
import io.prestosql.spi.type.Type;

import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface WindowFunctionFactory
{
    /**
     * @param memoryContext memory context the function reports its own allocations to
     * @param sessionProperties session properties of the query the function runs in
     */
    WindowFunction createWindowFunction(
            List<WindowFunctionArgument> arguments,
            Type returnType,
            boolean ignoreNulls,
            AggregatedMemoryContext memoryContext,
            Map<String, String> sessionProperties);
}
