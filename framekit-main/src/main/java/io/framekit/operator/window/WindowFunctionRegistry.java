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

import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.framekit.spi.window.WindowFunction;
import io.framekit.spi.window.WindowFunctionArgument;
import io.framekit.spi.window.WindowFunctionFactory;
import io.prestosql.memory.context.AggregatedMemoryContext;
import io.prestosql.spi.type.Type;

import javax.annotation.concurrent.ThreadSafe;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.framekit.operator.window.WindowFunctionSignature.formatArgumentTypes;
import static io.framekit.util.Failures.checkCondition;
import static io.prestosql.spi.StandardErrorCode.FUNCTION_NOT_FOUND;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * Window functions by name. Names are case insensitive.
 */
@ThreadSafe
public class WindowFunctionRegistry
{
    private static final Logger log = Logger.get(WindowFunctionRegistry.class);

    private final Map<String, RegisteredFunction> functions = new ConcurrentHashMap<>();

    public void register(String name, List<WindowFunctionSignature> signatures, WindowFunctionFactory factory)
    {
        requireNonNull(name, "name is null");
        requireNonNull(signatures, "signatures is null");
        requireNonNull(factory, "factory is null");
        checkArgument(!signatures.isEmpty(), "window function %s has no signatures", name);

        String key = name.toLowerCase(ENGLISH);
        RegisteredFunction previous = functions.putIfAbsent(key, new RegisteredFunction(signatures, factory));
        checkArgument(previous == null, "Window function already registered: %s", name);
        log.debug("Registered window function %s with signatures %s", key, signatures);
    }

    public Optional<List<WindowFunctionSignature>> getSignatures(String name)
    {
        return Optional.ofNullable(functions.get(name.toLowerCase(ENGLISH)))
                .map(RegisteredFunction::getSignatures);
    }

    public WindowFunction createWindowFunction(
            String name,
            List<WindowFunctionArgument> arguments,
            Type returnType,
            boolean ignoreNulls,
            AggregatedMemoryContext memoryContext,
            Map<String, String> sessionProperties)
    {
        requireNonNull(name, "name is null");
        requireNonNull(arguments, "arguments is null");
        requireNonNull(returnType, "returnType is null");

        RegisteredFunction function = functions.get(name.toLowerCase(ENGLISH));
        checkCondition(function != null, FUNCTION_NOT_FOUND, "Window function not registered: %s", name);

        List<Type> argumentTypes = arguments.stream()
                .map(WindowFunctionArgument::getType)
                .collect(toImmutableList());
        Optional<WindowFunctionSignature> signature = function.getSignatures().stream()
                .filter(candidate -> candidate.matchesArguments(argumentTypes))
                .findFirst();
        checkCondition(
                signature.isPresent(),
                FUNCTION_NOT_FOUND,
                "Window function signature is not supported: %s. Supported signatures: %s.",
                name + formatArgumentTypes(argumentTypes),
                function.getSignatures());
        checkCondition(
                signature.get().getReturnType().equals(returnType),
                FUNCTION_NOT_FOUND,
                "Unexpected return type for window function %s. Expected %s. Got %s.",
                name + formatArgumentTypes(argumentTypes),
                signature.get().getReturnType().getDisplayName(),
                returnType.getDisplayName());

        return function.getFactory().createWindowFunction(arguments, returnType, ignoreNulls, memoryContext, sessionProperties);
    }

    private static class RegisteredFunction
    {
        private final List<WindowFunctionSignature> signatures;
        private final WindowFunctionFactory factory;

        public RegisteredFunction(List<WindowFunctionSignature> signatures, WindowFunctionFactory factory)
        {
            this.signatures = ImmutableList.copyOf(signatures);
            this.factory = factory;
        }

        public List<WindowFunctionSignature> getSignatures()
        {
            return signatures;
        }

        public WindowFunctionFactory getFactory()
        {
            return factory;
        }
    }
}
