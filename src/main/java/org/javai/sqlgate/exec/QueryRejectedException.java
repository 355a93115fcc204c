package org.javai.sqlgate.exec;

import java.util.Objects;
import org.javai.sqlgate.Verdict;
import org.javai.sqlgate.sql.QueryValidationException;

/**
 * Thrown instead of executing SQL the validator did not pass.
 */
public class QueryRejectedException extends QueryValidationException {

	private final transient Verdict verdict;

	public QueryRejectedException(Verdict verdict) {
		super(Objects.requireNonNull(verdict, "verdict must not be null").message());
		this.verdict = verdict;
	}

	public Verdict verdict() {
		return verdict;
	}
}
