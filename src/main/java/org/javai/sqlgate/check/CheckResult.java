package org.javai.sqlgate.check;

import java.util.Objects;

/**
 * Outcome of a single validation stage.
 *
 * @param passed whether the stage accepted the query
 * @param reason human-readable explanation, never null
 */
public record CheckResult(boolean passed, String reason) {

	public CheckResult {
		Objects.requireNonNull(reason, "reason must not be null");
	}

	public static CheckResult pass(String reason) {
		return new CheckResult(true, reason);
	}

	public static CheckResult fail(String reason) {
		return new CheckResult(false, reason);
	}
}
