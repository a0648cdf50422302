package com.archlens.core.flow;

import com.archlens.core.model.FlowStep;
import com.archlens.core.model.FlowStepKind;
import com.archlens.core.model.Language;
import com.archlens.core.model.SourceFile;
import com.archlens.core.model.StepGraph;
import com.archlens.core.model.StepTag;
import com.archlens.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives a start/process/decision/end step graph from one source file.
 *
 * <p>Reconstruction is lexical: a single state machine walks the file's logical lines,
 * keeping a stack of open blocks whose boundaries are defined by the language's
 * {@link BlockDelimiter}. Per line, in order:
 * <ol>
 *   <li>Block close: the delimiter's close predicate pops blocks. A loop wires its
 *       last step back to the header, and the code after the loop follows the loop's
 *       exit: the {@code while} decision itself, or the hidden exit decision of a
 *       {@code for/loop} block. Any other block wires its last step to the chain's join
 *       point; the join point becomes current once the whole if/elif/else chain is
 *       closed.</li>
 *   <li>Block header: {@code if/elif/while/match} create a decision step,
 *       {@code for/loop/try/catch} a process step. A {@code for/loop} header that opens
 *       a block is followed by a hidden exit decision whose {@code next} enters the
 *       body. {@code elif} hangs off the previous decision's {@code alternateNext};
 *       {@code else} routes its first step there. {@code catch/except} continues from
 *       the last step of the try body, so the handler lies on the main path. If and
 *       match headers that open a block allocate a hidden join step.</li>
 *   <li>Call or assignment: a process step tagged by {@link CallTagger}.</li>
 * </ol>
 *
 * <p>At end of input open blocks are closed, an end step is appended, and any
 * {@code next}/{@code alternateNext} pointing at a missing id is nulled. The number of
 * lines examined is capped, so reconstruction always terminates.
 */
public class FlowReconstructor {

    private static final Logger log = LoggerFactory.getLogger(FlowReconstructor.class);

    public static final int DEFAULT_MAX_LINES = 500;

    static final String ENTRY_ID = "entry";
    static final String STEP_PREFIX = "step_";

    private final int maxLines;

    public FlowReconstructor() {
        this(DEFAULT_MAX_LINES);
    }

    /**
     * Creates a reconstructor reading at most {@code maxLines} physical lines per file.
     *
     * @param maxLines line cap, must be positive
     */
    public FlowReconstructor(int maxLines) {
        if (maxLines <= 0) {
            throw new IllegalArgumentException("maxLines must be positive: " + maxLines);
        }
        this.maxLines = maxLines;
    }

    /**
     * Reads a file and reconstructs its flow.
     *
     * <p>A missing or unreadable file yields a graph holding only the start and end steps.
     *
     * @param path file to read
     * @return step graph, never null
     */
    public StepGraph scanForFlow(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String fileName = path.getFileName() == null ? path.toString() : path.getFileName().toString();

        if (!Files.isRegularFile(path)) {
            log.warn("Cannot reconstruct flow, file not found: {}", path);
            return reconstructFlow(new SourceFile(fileName, null, ""));
        }
        try {
            return reconstructFlow(SourceFile.of(FileUtils.normalize(path.toString()), FileUtils.readString(path)));
        } catch (IOException e) {
            log.warn("Failed to read {} for flow reconstruction: {}", path, e.getMessage());
            return reconstructFlow(new SourceFile(fileName, null, ""));
        }
    }

    /**
     * Reconstructs the flow of an in-memory file.
     *
     * @param file source file
     * @return step graph with id {@code flow_<file name>}
     */
    public StepGraph reconstructFlow(SourceFile file) {
        Objects.requireNonNull(file, "file must not be null");
        FlowStateMachine machine = new FlowStateMachine(file.fileName());

        Optional<BlockDelimiter> delimiter = delimiterFor(file.language());
        if (delimiter.isPresent()) {
            List<String> physicalLines = file.content().lines().limit(maxLines).toList();
            List<String> logicalLines = delimiter.get().logicalLines(physicalLines);
            machine.run(delimiter.get(), logicalLines);
        }

        StepGraph graph = new StepGraph("flow_" + file.fileName(), file.fileName() + " Execution Flow", machine.finish());
        log.debug("Reconstructed {} steps for {}", graph.steps().size(), file.path());
        return graph;
    }

    /**
     * Selects the block delimiter for a language.
     *
     * @param language source language
     * @return delimiter, empty for languages without control blocks
     */
    static Optional<BlockDelimiter> delimiterFor(Language language) {
        return switch (language.blockStyle()) {
            case BRACE -> Optional.of(new BraceBlockDelimiter(language != Language.RUST));
            case INDENT -> Optional.of(new IndentBlockDelimiter());
            default -> Optional.empty();
        };
    }

    /**
     * Position the next step is wired from: a step's {@code next}, or a decision's
     * {@code alternateNext} at the start of an else branch.
     */
    private record Cursor(String stepId, boolean alternate) {

        static Cursor at(String stepId) {
            return new Cursor(stepId, false);
        }

        static Cursor alternateOf(String decisionId) {
            return new Cursor(decisionId, true);
        }
    }

    /**
     * Mutable state of one reconstruction.
     */
    private static final class FlowStateMachine {

        private final Map<String, StepDraft> steps = new LinkedHashMap<>();
        private final Deque<BlockFrame> stack = new ArrayDeque<>();
        private BlockDelimiter delimiter;
        private BlockFrame pendingChain;
        private Cursor cursor;
        private int counter;
        private int trackedDepth;

        FlowStateMachine(String fileName) {
            StepDraft entry = new StepDraft(ENTRY_ID, FlowStepKind.START, "Start: " + fileName, StepTag.NONE, false);
            steps.put(entry.id(), entry);
            cursor = Cursor.at(entry.id());
        }

        void run(BlockDelimiter blockDelimiter, List<String> lines) {
            this.delimiter = blockDelimiter;
            for (String line : lines) {
                process(line);
            }
            while (!stack.isEmpty()) {
                pop(stack.pop());
            }
        }

        List<FlowStep> finish() {
            closeChain();
            StepDraft end = newStep(FlowStepKind.END, "End", StepTag.NONE, false);
            link(end.id());

            for (StepDraft step : steps.values()) {
                if (step.next() != null && !steps.containsKey(step.next())) {
                    step.next(null);
                }
                if (step.alternateNext() != null && !steps.containsKey(step.alternateNext())) {
                    step.alternateNext(null);
                }
            }
            return steps.values().stream().map(StepDraft::toStep).toList();
        }

        private void process(String line) {
            String statement = line.strip();
            if (statement.isEmpty()) {
                return;
            }
            int depth = delimiter.depthOf(line, trackedDepth);
            trackedDepth = delimiter.trackedDepthAfter(statement, trackedDepth);

            boolean closed = false;
            while (!stack.isEmpty() && delimiter.closes(statement, depth, stack.peek())) {
                pop(stack.pop());
                statement = delimiter.afterClose(statement);
                closed = true;
            }
            statement = delimiter.afterClose(statement);
            int headerDepth = closed ? delimiter.depthAfterClose(depth) : depth;

            if (statement.isEmpty()) {
                return;
            }

            Optional<ControlKeyword.Header> header = ControlKeyword.parse(statement);
            if (header.isEmpty() || !header.get().keyword().isContinuation()) {
                closeChain();
            }

            if (header.isPresent()) {
                handleHeader(header.get(), statement, headerDepth);
            } else if (!delimiter.opensBlock(statement)) {
                CallTagger.classify(statement).ifPresent(tagged -> {
                    StepDraft step = newStep(FlowStepKind.PROCESS, tagged.label(), tagged.tag(), false);
                    link(step.id());
                    cursor = Cursor.at(step.id());
                });
            }
        }

        private void handleHeader(ControlKeyword.Header header, String statement, int depth) {
            ControlKeyword keyword = header.keyword();
            boolean opens = delimiter.opensBlock(statement);
            BlockFrame chain = keyword.isContinuation() ? pendingChain : null;
            pendingChain = null;

            if (keyword == ControlKeyword.ELSE) {
                if (chain == null || chain.lastDecisionId() == null) {
                    return;
                }
                cursor = Cursor.alternateOf(chain.lastDecisionId());
                BlockFrame elseFrame = new BlockFrame(depth, chain.lastDecisionId(), keyword,
                    chain.joinId(), chain.lastDecisionId(), true, null);
                if (opens) {
                    stack.push(elseFrame);
                } else {
                    pendingChain = elseFrame;
                }
                return;
            }

            StepDraft step = newStep(
                keyword.isDecision() ? FlowStepKind.DECISION : FlowStepKind.PROCESS,
                header.label(), StepTag.NONE, false);

            if (keyword == ControlKeyword.ELIF && chain != null && chain.lastDecisionId() != null) {
                StepDraft previous = steps.get(chain.lastDecisionId());
                if (previous.alternateNext() == null) {
                    previous.alternateNext(step.id());
                }
            } else {
                link(step.id());
            }
            cursor = Cursor.at(step.id());

            String exitId = null;
            if (keyword.isLoop() && !keyword.isDecision() && opens) {
                StepDraft exit = newStep(FlowStepKind.DECISION, "repeat", StepTag.NONE, true);
                step.next(exit.id());
                cursor = Cursor.at(exit.id());
                exitId = exit.id();
            }

            String joinId = null;
            String lastDecisionId = null;
            if (chain != null && keyword == ControlKeyword.ELIF) {
                joinId = chain.joinId();
                lastDecisionId = step.id();
            } else if (keyword.allocatesJoin() || keyword == ControlKeyword.ELIF) {
                joinId = opens ? newStep(FlowStepKind.PROCESS, "merge", StepTag.NONE, true).id() : null;
                lastDecisionId = step.id();
            }

            BlockFrame frame = new BlockFrame(depth, step.id(), keyword, joinId, lastDecisionId, false, exitId);
            if (opens) {
                stack.push(frame);
            } else if (joinId != null) {
                pendingChain = frame;
            }
        }

        private void pop(BlockFrame frame) {
            closeChain();
            if (frame.keyword().isLoop()) {
                String exitId = frame.exitId() != null ? frame.exitId() : frame.headerId();
                if (cursor != null && !cursor.alternate()
                    && !frame.headerId().equals(cursor.stepId()) && !exitId.equals(cursor.stepId())) {
                    link(frame.headerId());
                }
                cursor = Cursor.at(exitId);
                return;
            }
            if (frame.joinId() != null) {
                link(frame.joinId());
                cursor = Cursor.at(frame.joinId());
            }
            if (frame.continuesChain()) {
                pendingChain = frame;
            }
        }

        private void closeChain() {
            if (pendingChain == null) {
                return;
            }
            BlockFrame chain = pendingChain;
            pendingChain = null;
            if (chain.joinId() == null) {
                return;
            }
            if (cursor != null && !cursor.stepId().equals(chain.joinId())) {
                link(chain.joinId());
            }
            if (!chain.hasElse() && chain.lastDecisionId() != null) {
                StepDraft decision = steps.get(chain.lastDecisionId());
                if (decision.alternateNext() == null) {
                    decision.alternateNext(chain.joinId());
                }
            }
            cursor = Cursor.at(chain.joinId());
        }

        /**
         * Wires the cursor to a step. A decision whose {@code next} is taken continues
         * through its {@code alternateNext}, which is how a loop exit reaches the code
         * after the loop.
         */
        private void link(String targetId) {
            if (cursor == null) {
                return;
            }
            StepDraft from = steps.get(cursor.stepId());
            if (from == null || from.id().equals(targetId)) {
                return;
            }
            if (cursor.alternate()) {
                if (from.alternateNext() == null) {
                    from.alternateNext(targetId);
                }
            } else if (from.next() == null) {
                from.next(targetId);
            } else if (from.kind() == FlowStepKind.DECISION && from.alternateNext() == null) {
                from.alternateNext(targetId);
            }
        }

        private StepDraft newStep(FlowStepKind kind, String label, StepTag tag, boolean hidden) {
            StepDraft step = new StepDraft(STEP_PREFIX + (++counter), kind, label, tag, hidden);
            steps.put(step.id(), step);
            return step;
        }
    }
}
