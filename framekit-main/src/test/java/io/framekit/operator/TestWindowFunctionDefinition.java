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
package io.framekit.operator;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.framekit.operator.window.TestingWindowFunctions.RankFunction;
import io.framekit.operator.window.WindowFunctionRegistry;
import io.framekit.spi.window.WindowFunction;
import org.testng.annotations.Test;

import java.util.concurrent.atomic.AtomicReference;

import static io.framekit.operator.WindowFunctionDefinition.window;
import static io.framekit.operator.window.FrameInfo.defaultFrame;
import static io.framekit.operator.window.WindowFunctionSignature.signature;
import static io.framekit.spi.window.WindowFunctionArgument.channelArgument;
import static io.prestosql.memory.context.AggregatedMemoryContext.newSimpleAggregatedMemoryContext;
import static io.prestosql.spi.type.BigintType.BIGINT;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertSame;
import static org.testng.Assert.assertTrue;

public class TestWindowFunctionDefinition
{
    @Test
    public void testIgnoreNullsDefaultsToFalse()
    {
        WindowFunctionDefinition definition = window("first_value", BIGINT, defaultFrame(), channelArgument(BIGINT, 1));
        assertFalse(definition.isIgnoreNulls());
        assertEquals(definition.getArguments(), ImmutableList.of(channelArgument(BIGINT, 1)));
    }

    @Test
    public void testCreateWindowFunctionPassesIgnoreNulls()
    {
        AtomicReference<Boolean> ignoreNulls = new AtomicReference<>();
        WindowFunction function = new RankFunction();
        WindowFunctionRegistry registry = new WindowFunctionRegistry();
        registry.register("first_value", ImmutableList.of(signature(BIGINT, BIGINT)), (arguments, returnType, ignore, memoryContext, sessionProperties) -> {
            ignoreNulls.set(ignore);
            return function;
        });

        WindowFunctionDefinition definition = window("first_value", BIGINT, defaultFrame(), true, ImmutableList.of(channelArgument(BIGINT, 1)));
        assertTrue(definition.isIgnoreNulls());
        assertSame(definition.createWindowFunction(registry, newSimpleAggregatedMemoryContext(), ImmutableMap.of()), function);
        assertEquals(ignoreNulls.get(), Boolean.valueOf(definition.isIgnoreNulls()));
    }
}
