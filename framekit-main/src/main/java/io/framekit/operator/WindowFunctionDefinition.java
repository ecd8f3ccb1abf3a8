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
import io.framekit.operator.window.FrameInfo;
import io.framekit.operator.window.WindowFunctionRegistry;
import io.framekit.spi.window.WindowFunction;
import io.framekit.spi.window.WindowFunctionArgument;
import io.prestosql.memory.context.AggregatedMemoryContext;
import io.prestosql.spi.type.Type;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * One window function of an OVER clause: the function call and the frame it is evaluated over.
 */
public class WindowFunctionDefinition
{
    private final String name;
    private final Type type;
    private final FrameInfo frameInfo;
    private final List<WindowFunctionArgument> arguments;
    private final boolean ignoreNulls;

    public static WindowFunctionDefinition window(String name, Type type, FrameInfo frameInfo, boolean ignoreNulls, List<WindowFunctionArgument> arguments)
    {
        return new WindowFunctionDefinition(name, type, frameInfo, ignoreNulls, arguments);
    }

    public static WindowFunctionDefinition window(String name, Type type, FrameInfo frameInfo, WindowFunctionArgument... arguments)
    {
        return window(name, type, frameInfo, false, Arrays.asList(arguments));
    }

    WindowFunctionDefinition(String name, Type type, FrameInfo frameInfo, boolean ignoreNulls, List<WindowFunctionArgument> arguments)
    {
        requireNonNull(name, "name is null");
        requireNonNull(type, "type is null");
        requireNonNull(frameInfo, "frameInfo is null");
        requireNonNull(arguments, "arguments is null");

        this.name = name;
        this.type = type;
        this.frameInfo = frameInfo;
        this.ignoreNulls = ignoreNulls;
        this.arguments = ImmutableList.copyOf(arguments);
    }

    public String getName()
    {
        return name;
    }

    public FrameInfo getFrameInfo()
    {
        return frameInfo;
    }

    public Type getType()
    {
        return type;
    }

    public List<WindowFunctionArgument> getArguments()
    {
        return arguments;
    }

    public boolean isIgnoreNulls()
    {
        return ignoreNulls;
    }

    public WindowFunction createWindowFunction(WindowFunctionRegistry registry, AggregatedMemoryContext memoryContext, Map<String, String> sessionProperties)
    {
        return registry.createWindowFunction(name, arguments, type, ignoreNulls, memoryContext, sessionProperties);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("name", name)
                .add("type", type)
                .add("frameInfo", frameInfo)
                .add("arguments", arguments)
                .add("ignoreNulls", ignoreNulls)
                .toString();
    }
}
