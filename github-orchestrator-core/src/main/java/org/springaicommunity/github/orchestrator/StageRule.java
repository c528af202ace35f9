package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.util.Optional;
import java.util.function.Function;

/**
 * One entry of the classifier's priority list: a stage and a matcher that, when the rule
 * applies, yields the match with its focus.
 *
 * @param stage stage reported when the rule matches
 * @param matcher returns a match, or empty when the rule does not apply
 */
public record StageRule(Stage stage, Function<PipelineState, Optional<Match>> matcher) {

	/**
	 * A successful match.
	 *
	 * @param focus the focused work, or {@code null} when there is none
	 */
	public record Match(@Nullable Focus focus) {

		static Optional<Match> of(Focus focus) {
			return Optional.of(new Match(focus));
		}

		static Optional<Match> idle() {
			return Optional.of(new Match(null));
		}

	}

	public Optional<Match> apply(PipelineState state) {
		return matcher.apply(state);
	}

}
