package org.javai.sqlgate;

/**
 * Validation stages, in the order they run.
 */
public enum Stage {
	SAFETY("Safety"),
	SEMANTIC("Semantic"),
	EXECUTION("Execution");

	private final String displayName;

	Stage(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}
}
