package org.javai.sqlgate;

import java.util.Objects;

/**
 * Result of one full validation run.
 *
 * <p>A failing verdict names the first stage that rejected the query and its message
 * reads {@code "<Stage> failed: <detail>"}. A passing verdict reports the last stage,
 * {@link Stage#EXECUTION}.</p>
 *
 * @param passed whether every stage accepted the query
 * @param stage the failing stage, or {@link Stage#EXECUTION} when all passed
 * @param message human-readable outcome
 */
public record Verdict(boolean passed, Stage stage, String message) {

	public static final String PASSED_MESSAGE = "All validations passed";

	public Verdict {
		Objects.requireNonNull(stage, "stage must not be null");
		Objects.requireNonNull(message, "message must not be null");
	}

	public static Verdict passedAll() {
		return new Verdict(true, Stage.EXECUTION, PASSED_MESSAGE);
	}

	public static Verdict failed(Stage stage, String detail) {
		return new Verdict(false, stage, stage.displayName() + " failed: " + detail);
	}
}
