package org.springaicommunity.github.orchestrator;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Structured outcome of one loop action.
 *
 * @param status how the action ended
 * @param value the action's result when completed
 * @param reasons machine-readable reasons for anything other than completion, e.g.
 * {@code EMPTY_QUEUE} or {@code #12: REVIEW_NOT_REQUESTED}
 * @param warnings degraded best-effort steps
 * @param <T> result type
 */
public record ActionResult<T>(ActionStatus status, @Nullable T value, List<String> reasons, List<Warning> warnings) {

	public ActionResult {
		reasons = List.copyOf(reasons);
		warnings = List.copyOf(warnings);
	}

	public static <T> ActionResult<T> completed(T value, List<Warning> warnings) {
		return new ActionResult<>(ActionStatus.COMPLETED, value, List.of(), warnings);
	}

	public static <T> ActionResult<T> nothingToDo(List<String> reasons) {
		return new ActionResult<>(ActionStatus.NOTHING_TO_DO, null, reasons, List.of());
	}

	public static <T> ActionResult<T> refused(List<String> reasons, List<Warning> warnings) {
		return new ActionResult<>(ActionStatus.REFUSED, null, reasons, warnings);
	}

	public static <T> ActionResult<T> failed(List<String> reasons) {
		return new ActionResult<>(ActionStatus.FAILED, null, reasons, List.of());
	}

}
