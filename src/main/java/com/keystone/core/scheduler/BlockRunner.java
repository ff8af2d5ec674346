package com.keystone.core.scheduler;

import com.keystone.core.chunking.AdaptiveChunker;
import com.keystone.core.chunking.Chunk;
import com.keystone.core.collaborator.CollaboratorCalls;
import com.keystone.core.collaborator.Collaborators;
import com.keystone.core.error.ErrorCategory;
import com.keystone.core.error.ExecutionFailureException;
import com.keystone.core.error.OrchestrationException;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.ExecutionStep;
import com.keystone.core.model.ImplementationBlock;
import com.keystone.core.model.ValidationResult;
import com.keystone.core.recovery.RecoverableOperation;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a block's steps through the generation collaborator and judges the result with the
 * validation collaborator. Each invocation of {@link #execute()} is one attempt, run on the attempt
 * executor and bounded by the attempt timeout.
 * <p>
 * Variants for the recovery fallbacks: simplified (every step reduced in scope), alternate (the
 * steps of another block, validated as this block) and subdivided (one unvalidated part per step).
 * Security-critical blocks are never subdivided, since the parts would skip validation.
 */
final class BlockRunner implements RecoverableOperation<BlockExecution> {

    /**
     * @param graph source of alternate blocks; only their steps are read
     */
    record Context(
        Collaborators collaborators,
        AdaptiveChunker chunker,
        CancellationToken token,
        ExecutorService attemptExecutor,
        Duration timeout,
        DependencyGraph graph
    ) {}

    private final ImplementationBlock block;
    private final List<ExecutionStep> steps;
    private final boolean validate;
    private final String name;
    private final Context context;

    BlockRunner(ImplementationBlock block, Context context) {
        this(block, block.steps(), true, block.id(), context);
    }

    private BlockRunner(ImplementationBlock block, List<ExecutionStep> steps, boolean validate, String name,
                        Context context) {
        this.block = block;
        this.steps = steps;
        this.validate = validate;
        this.name = name;
        this.context = context;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public BlockExecution execute() {
        long timeoutMs = context.timeout().toMillis();
        if (timeoutMs <= 0) {
            return runAttempt();
        }
        Future<BlockExecution> attempt = context.attemptExecutor().submit(this::runAttempt);
        try {
            return attempt.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            throw new ExecutionFailureException(ErrorCategory.TIMEOUT,
                    name + " exceeded its attempt timeout of " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutionFailureException(ErrorCategory.TIMEOUT, "Interrupted while running " + name, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new ExecutionFailureException(ErrorCategory.GENERATION_FAILURE,
                    name + " failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public Optional<RecoverableOperation<BlockExecution>> simplified() {
        var reduced = steps.stream().map(ExecutionStep::asSimplified).toList();
        return Optional.of(new BlockRunner(block, reduced, validate, name + " (simplified)", context));
    }

    /**
     * Runs the steps of block {@code alternateId}; when no such block exists, the first block
     * declared ALTERNATIVE to this one is used instead.
     */
    @Override
    public Optional<RecoverableOperation<BlockExecution>> alternate(String alternateId) {
        var graph = context.graph();
        Optional<String> target = graph.contains(alternateId)
                ? Optional.of(alternateId)
                : graph.alternativesFor(block.id()).stream().findFirst();
        return target.map(graph::block).map(alternate -> new BlockRunner(block, alternate.steps(), validate,
                        name + " (alternate " + alternate.id() + ")", context));
    }

    @Override
    public List<RecoverableOperation<BlockExecution>> subdivide() {
        if (!validate || steps.isEmpty() || block.securityCritical()) {
            return List.of();
        }
        var parts = new ArrayList<RecoverableOperation<BlockExecution>>();
        for (var step : steps) {
            parts.add(new BlockRunner(block, List.of(step), false, name + " [" + step.id() + "]", context));
        }
        return parts;
    }

    @Override
    public BlockExecution combine(List<BlockExecution> results, List<OrchestrationException> failures) {
        var artifacts = new ArrayList<Artifact>();
        results.forEach(r -> artifacts.addAll(r.artifacts()));
        var notes = failures.stream()
                .map(f -> "Part failed (" + f.category() + "): " + f.getMessage())
                .toList();
        return new BlockExecution(artifacts, null, notes);
    }

    private BlockExecution runAttempt() {
        var token = context.token();
        var artifacts = new ArrayList<Artifact>();
        for (var step : steps) {
            token.throwIfCancelled();
            artifacts.add(new Artifact(step.targetPath(), block.id(), step.id(), generate(step)));
        }
        token.throwIfCancelled();
        if (!validate) {
            return new BlockExecution(artifacts, null, List.of());
        }

        ValidationResult verdict = CollaboratorCalls.validate(context.collaborators().validator(), block, artifacts);
        if (!verdict.passed()) {
            var category = verdict.buildSucceeded() ? ErrorCategory.VALIDATION_FAILURE : ErrorCategory.BUILD_ERROR;
            throw new ExecutionFailureException(category,
                    "Block " + block.id() + " failed validation: " + String.join("; ", verdict.issues()));
        }
        if (block.securityCritical() && !verdict.issues().isEmpty()) {
            throw new ExecutionFailureException(ErrorCategory.VALIDATION_FAILURE,
                    "Security-critical block " + block.id() + " has validation issues: "
                            + String.join("; ", verdict.issues()));
        }
        return new BlockExecution(artifacts, verdict, List.of());
    }

    /**
     * Large contexts are split by the chunker and generated chunk by chunk; outputs are concatenated.
     */
    private String generate(ExecutionStep step) {
        var generator = context.collaborators().generator();
        var chunker = context.chunker();

        if (step.contextFile() != null) {
            var output = new StringBuilder();
            try (Reader reader = Files.newBufferedReader(step.contextFile())) {
                chunker.stream(reader, chunk -> output.append(generateChunk(step, chunk)));
            } catch (IOException | UncheckedIOException e) {
                throw new ExecutionFailureException(ErrorCategory.GENERATION_FAILURE,
                        "Unable to read context file " + step.contextFile() + " for step " + step.id(), e);
            }
            return output.toString();
        }

        if (step.context() != null && step.context().length() > chunker.currentChunkSize()) {
            var output = new StringBuilder();
            for (Chunk chunk : chunker.chunk(step.context())) {
                output.append(generateChunk(step, chunk));
            }
            return output.toString();
        }

        return CollaboratorCalls.generate(generator, step).content();
    }

    private String generateChunk(ExecutionStep step, Chunk chunk) {
        return CollaboratorCalls.generate(context.collaborators().generator(), step.withContext(chunk.content()))
                .content();
    }
}
