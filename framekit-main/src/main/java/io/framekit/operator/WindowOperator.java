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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import io.airlift.log.Logger;
import io.framekit.operator.WindowInfo.DriverWindowInfoBuilder;
import io.framekit.operator.window.ChannelFrameOffset;
import io.framekit.operator.window.FrameInfo;
import io.framekit.operator.window.FrameOffset;
import io.framekit.operator.window.FrameOffsetColumns;
import io.framekit.operator.window.PresortedWindowBuild;
import io.framekit.operator.window.WindowBuild;
import io.framekit.operator.window.WindowFunctionRegistry;
import io.framekit.spi.window.PeerGroup;
import io.framekit.spi.window.RowIndexBuffer;
import io.framekit.spi.window.ValiditySelector;
import io.framekit.spi.window.WindowFunction;
import io.framekit.spi.window.WindowFunctionArgument;
import io.framekit.spi.window.WindowPartition;
import io.prestosql.memory.context.LocalMemoryContext;
import io.prestosql.spi.Page;
import io.prestosql.spi.PageBuilder;
import io.prestosql.spi.block.BlockBuilder;
import io.prestosql.spi.type.Type;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.math.LongMath.saturatedMultiply;
import static com.google.common.primitives.Ints.saturatedCast;
import static io.framekit.operator.window.FrameBoundsComputer.computeFrameBounds;
import static io.framekit.operator.window.FrameBoundsRepairer.repairFrameBounds;
import static java.util.Objects.requireNonNull;

/**
 * Evaluates window functions over partitions of its input. All input is buffered; output
 * starts after {@link #finish()}. Output pages hold every input channel followed by one
 * channel per window function, and at most {@link #getRowsPerOutput()} rows.
 */
@NotThreadSafe
public class WindowOperator
        implements Operator
{
    private static final Logger log = Logger.get(WindowOperator.class);

    public static class WindowOperatorFactory
            implements OperatorFactory
    {
        private final int operatorId;
        private final List<Type> sourceTypes;
        private final List<Integer> partitionChannels;
        private final List<Integer> sortChannels;
        private final List<WindowFunctionDefinition> windowFunctionDefinitions;
        private final WindowFunctionRegistry functionRegistry;
        private final WindowOperatorConfig config;
        private final int expectedPositions;
        private boolean closed;

        public WindowOperatorFactory(
                int operatorId,
                List<? extends Type> sourceTypes,
                List<Integer> partitionChannels,
                List<Integer> sortChannels,
                List<WindowFunctionDefinition> windowFunctionDefinitions,
                WindowFunctionRegistry functionRegistry,
                WindowOperatorConfig config,
                int expectedPositions)
        {
            this.operatorId = operatorId;
            this.sourceTypes = ImmutableList.copyOf(requireNonNull(sourceTypes, "sourceTypes is null"));
            this.partitionChannels = ImmutableList.copyOf(requireNonNull(partitionChannels, "partitionChannels is null"));
            this.sortChannels = ImmutableList.copyOf(requireNonNull(sortChannels, "sortChannels is null"));
            this.windowFunctionDefinitions = ImmutableList.copyOf(requireNonNull(windowFunctionDefinitions, "windowFunctionDefinitions is null"));
            this.functionRegistry = requireNonNull(functionRegistry, "functionRegistry is null");
            this.config = requireNonNull(config, "config is null");
            checkArgument(expectedPositions > 0, "expectedPositions must be positive");
            this.expectedPositions = expectedPositions;
        }

        @Override
        public Operator createOperator(OperatorContext operatorContext)
        {
            checkState(!closed, "Factory is already closed");
            return new WindowOperator(
                    operatorContext,
                    sourceTypes,
                    partitionChannels,
                    sortChannels,
                    windowFunctionDefinitions,
                    functionRegistry,
                    config,
                    expectedPositions);
        }

        @Override
        public void noMoreOperators()
        {
            closed = true;
        }

        @Override
        public OperatorFactory duplicate()
        {
            return new WindowOperatorFactory(operatorId, sourceTypes, partitionChannels, sortChannels, windowFunctionDefinitions, functionRegistry, config, expectedPositions);
        }
    }

    private final OperatorContext operatorContext;
    private final LocalMemoryContext localUserMemoryContext;
    private final int inputChannelCount;
    private final List<WindowFunctionDefinition> windowFunctionDefinitions;
    private final List<WindowFunction> windowFunctions;
    private final List<FrameInfo> frames;
    private final WindowBuild windowBuild;
    private final int rowsPerOutput;
    private final PageBuilder pageBuilder;

    // scratch buffers, overwritten by every slice
    private final RowIndexBuffer peerStarts;
    private final RowIndexBuffer peerEnds;
    private final RowIndexBuffer[] frameStarts;
    private final RowIndexBuffer[] frameEnds;
    private final ValiditySelector[] validFrames;
    private final FrameOffsetColumns offsetColumns;

    private final DriverWindowInfoBuilder windowInfo = new DriverWindowInfoBuilder();

    private WindowPartition currentPartition;
    // next row of the current partition to produce output for
    private int partitionOffset;
    // peer group left by the previous slice of the current partition, end is exclusive
    private int peerStartRow;
    private int peerEndRow;

    private long numRows;
    private long numProcessedRows;
    private boolean finishing;

    public WindowOperator(
            OperatorContext operatorContext,
            List<Type> sourceTypes,
            List<Integer> partitionChannels,
            List<Integer> sortChannels,
            List<WindowFunctionDefinition> windowFunctionDefinitions,
            WindowFunctionRegistry functionRegistry,
            WindowOperatorConfig config,
            int expectedPositions)
    {
        this.operatorContext = requireNonNull(operatorContext, "operatorContext is null");
        requireNonNull(sourceTypes, "sourceTypes is null");
        requireNonNull(windowFunctionDefinitions, "windowFunctionDefinitions is null");
        requireNonNull(functionRegistry, "functionRegistry is null");
        requireNonNull(config, "config is null");
        checkArgument(!windowFunctionDefinitions.isEmpty(), "no window functions");
        for (WindowFunctionDefinition definition : windowFunctionDefinitions) {
            checkInputChannels(definition, sourceTypes);
        }

        this.localUserMemoryContext = operatorContext.localUserMemoryContext();
        this.inputChannelCount = sourceTypes.size();
        this.windowFunctionDefinitions = ImmutableList.copyOf(windowFunctionDefinitions);
        this.frames = windowFunctionDefinitions.stream()
                .map(WindowFunctionDefinition::getFrameInfo)
                .collect(toImmutableList());
        this.windowFunctions = windowFunctionDefinitions.stream()
                .map(definition -> definition.createWindowFunction(functionRegistry, operatorContext.aggregateUserMemoryContext(), operatorContext.getSessionProperties()))
                .collect(toImmutableList());

        this.windowBuild = new PresortedWindowBuild(sourceTypes, partitionChannels, sortChannels, expectedPositions);
        this.rowsPerOutput = outputBatchRows(windowBuild.estimateRowSize(), config);

        List<Type> outputTypes = ImmutableList.<Type>builder()
                .addAll(sourceTypes)
                .addAll(windowFunctionDefinitions.stream()
                        .map(WindowFunctionDefinition::getType)
                        .collect(toImmutableList()))
                .build();
        this.pageBuilder = new PageBuilder(rowsPerOutput, outputTypes);

        this.peerStarts = new RowIndexBuffer(rowsPerOutput);
        this.peerEnds = new RowIndexBuffer(rowsPerOutput);
        this.frameStarts = new RowIndexBuffer[windowFunctions.size()];
        this.frameEnds = new RowIndexBuffer[windowFunctions.size()];
        this.validFrames = new ValiditySelector[windowFunctions.size()];
        for (int i = 0; i < windowFunctions.size(); i++) {
            frameStarts[i] = new RowIndexBuffer(rowsPerOutput);
            frameEnds[i] = new RowIndexBuffer(rowsPerOutput);
            validFrames[i] = new ValiditySelector(rowsPerOutput);
        }
        this.offsetColumns = new FrameOffsetColumns(frames);

        log.debug("Created window operator %s with %s functions and %s rows per output page", operatorContext.getOperatorId(), windowFunctions.size(), rowsPerOutput);
        updateMemoryReservation();
    }

    private static void checkInputChannels(WindowFunctionDefinition definition, List<Type> sourceTypes)
    {
        for (WindowFunctionArgument argument : definition.getArguments()) {
            if (argument.getChannel().isPresent()) {
                int channel = argument.getChannel().get();
                checkArgument(channel < sourceTypes.size(), "argument channel %s of %s is out of range", channel, definition.getName());
                checkArgument(sourceTypes.get(channel).equals(argument.getType()), "argument channel %s of %s is %s, not %s", channel, definition.getName(), sourceTypes.get(channel), argument.getType());
            }
        }
        checkOffsetChannel(definition.getFrameInfo().getStartOffset(), sourceTypes);
        checkOffsetChannel(definition.getFrameInfo().getEndOffset(), sourceTypes);
    }

    private static void checkOffsetChannel(Optional<FrameOffset> offset, List<Type> sourceTypes)
    {
        if (offset.isPresent() && offset.get() instanceof ChannelFrameOffset) {
            ChannelFrameOffset channelOffset = (ChannelFrameOffset) offset.get();
            checkArgument(channelOffset.getChannel() < sourceTypes.size(), "frame offset channel %s is out of range", channelOffset.getChannel());
            checkArgument(sourceTypes.get(channelOffset.getChannel()).equals(channelOffset.getType()), "frame offset channel %s is %s, not %s",
                    channelOffset.getChannel(), sourceTypes.get(channelOffset.getChannel()), channelOffset.getType());
        }
    }

    /**
     * Number of rows of an output page: as many rows of {@code rowSize} bytes as fit in the preferred
     * output size, but no more than the maximum row count and at least one row.
     */
    @VisibleForTesting
    static int outputBatchRows(OptionalLong rowSize, WindowOperatorConfig config)
    {
        if (!rowSize.isPresent()) {
            return config.getPreferredOutputBatchRows();
        }
        long bytesPerRow = Math.max(rowSize.getAsLong(), 1);
        long preferredBytes = config.getPreferredOutputBatchSize().toBytes();
        if (saturatedMultiply(bytesPerRow, config.getMaxOutputBatchRows()) < preferredBytes) {
            return config.getMaxOutputBatchRows();
        }
        return saturatedCast(Math.max(preferredBytes / bytesPerRow, 1));
    }

    @Override
    public OperatorContext getOperatorContext()
    {
        return operatorContext;
    }

    public int getRowsPerOutput()
    {
        return rowsPerOutput;
    }

    @Override
    public boolean needsInput()
    {
        return !finishing;
    }

    @Override
    public void addInput(Page page)
    {
        checkState(!finishing, "Operator is already finishing");
        requireNonNull(page, "page is null");

        windowBuild.addInput(page);
        numRows += page.getPositionCount();
        updateMemoryReservation();
    }

    @Override
    public void finish()
    {
        if (finishing) {
            return;
        }
        finishing = true;
        windowBuild.noMoreInput();
        log.debug("Window operator %s received %s rows", operatorContext.getOperatorId(), numRows);
    }

    @Override
    public boolean isFinished()
    {
        return finishing && numProcessedRows == numRows;
    }

    @Override
    public Page getOutput()
    {
        if (!finishing || numRows == 0 || numProcessedRows == numRows) {
            return null;
        }

        int numOutputRows = (int) Math.min(rowsPerOutput, numRows - numProcessedRows);
        pageBuilder.reset();
        applyLoop(numOutputRows);
        pageBuilder.declarePositions(numOutputRows);
        Page page = pageBuilder.build();

        numProcessedRows += numOutputRows;
        windowInfo.addOutputPage();
        updateMemoryReservation();
        return page;
    }

    private void applyLoop(int numOutputRows)
    {
        int resultOffset = 0;
        while (resultOffset < numOutputRows) {
            while (currentPartition == null || partitionOffset == currentPartition.getPositionCount()) {
                advancePartition();
            }
            int numSliceRows = Math.min(numOutputRows - resultOffset, currentPartition.getPositionCount() - partitionOffset);
            processSlice(resultOffset, numSliceRows);
            resultOffset += numSliceRows;
        }
    }

    private void advancePartition()
    {
        checkState(windowBuild.hasNextPartition(), "Window build has fewer rows than the operator received");
        currentPartition = windowBuild.nextPartition();
        partitionOffset = 0;
        peerStartRow = 0;
        peerEndRow = 0;
        for (WindowFunction windowFunction : windowFunctions) {
            windowFunction.resetPartition(currentPartition);
        }
        windowInfo.addPartition(currentPartition.getPositionCount());
    }

    private void processSlice(int resultOffset, int numSliceRows)
    {
        for (int channel = 0; channel < inputChannelCount; channel++) {
            currentPartition.extractColumn(channel, partitionOffset, numSliceRows, resultOffset, pageBuilder.getBlockBuilder(channel));
        }

        computePeerAndFrameBuffers(partitionOffset, partitionOffset + numSliceRows);

        for (int i = 0; i < windowFunctions.size(); i++) {
            BlockBuilder result = pageBuilder.getBlockBuilder(inputChannelCount + i);
            windowFunctions.get(i).apply(peerStarts, peerEnds, frameStarts[i], frameEnds[i], validFrames[i], resultOffset, result);
            checkState(result.getPositionCount() == resultOffset + numSliceRows,
                    "Window function %s produced %s values for %s rows",
                    windowFunctionDefinitions.get(i).getName(),
                    result.getPositionCount() - resultOffset,
                    numSliceRows);
        }
        partitionOffset += numSliceRows;
    }

    private void computePeerAndFrameBuffers(int startRow, int endRow)
    {
        int numSliceRows = endRow - startRow;
        int lastRow = currentPartition.getPositionCount() - 1;

        PeerGroup peerGroup = currentPartition.computePeerBuffers(startRow, endRow, peerStartRow, peerEndRow, peerStarts, peerEnds);
        peerStartRow = peerGroup.getStart();
        peerEndRow = peerGroup.getEnd();

        offsetColumns.reset(currentPartition, startRow, numSliceRows);
        for (int i = 0; i < frames.size(); i++) {
            FrameInfo frame = frames.get(i);
            validFrames[i].resizeFill(numSliceRows, true);
            computeFrameBounds(frame, true, lastRow, startRow, numSliceRows, peerStarts, peerEnds, offsetColumns, frameStarts[i]);
            computeFrameBounds(frame, false, lastRow, startRow, numSliceRows, peerStarts, peerEnds, offsetColumns, frameEnds[i]);
            if (frame.hasOffset()) {
                repairFrameBounds(lastRow, frameStarts[i], frameEnds[i], validFrames[i]);
            }
        }
    }

    private void updateMemoryReservation()
    {
        long bytes = windowBuild.getRetainedSizeInBytes() +
                pageBuilder.getRetainedSizeInBytes() +
                peerStarts.getRetainedSizeInBytes() +
                peerEnds.getRetainedSizeInBytes() +
                offsetColumns.getRetainedSizeInBytes();
        for (int i = 0; i < windowFunctions.size(); i++) {
            bytes += frameStarts[i].getRetainedSizeInBytes() +
                    frameEnds[i].getRetainedSizeInBytes() +
                    validFrames[i].getRetainedSizeInBytes();
        }
        localUserMemoryContext.setBytes(bytes);
    }

    public WindowInfo getInfo()
    {
        return new WindowInfo(ImmutableList.of(windowInfo.build()));
    }

    @Override
    public void close()
    {
        currentPartition = null;
        localUserMemoryContext.setBytes(0);
    }
}
