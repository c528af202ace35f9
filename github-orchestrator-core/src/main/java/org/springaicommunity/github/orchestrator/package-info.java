/**
 * GitHub Orchestrator core package.
 *
 * <p>
 * Holds the stage-derivation and guarded-action engine: the {@link StageClassifier}, the
 * single-step actions ({@link QueuePromoter}, {@link GapAnalysisEnsurer},
 * {@link MergeGate}, {@link CapabilityUpdateTrigger}) and the {@link LoopController} that
 * composes them.
 *
 * <p>
 * This package is null-marked, meaning all reference types are non-null by default unless
 * explicitly annotated with @Nullable.
 */
@NullMarked
package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.NullMarked;
