package org.javai.sqlassist.generate;

import java.util.Optional;

/**
 * Result of a remote generation attempt. Failures are values, not exceptions, so the fallback
 * combinator can decide what to do without unwinding the stack.
 *
 * @param outcome classification of the attempt
 * @param sql the cleaned SQL on success, null otherwise
 * @param modelId identifier of the model asked (may be null)
 * @param durationMillis time taken by the attempt
 * @param errorDetails reason for failure, null on success
 */
public record GenerationAttempt(
		AttemptOutcome outcome,
		String sql,
		String modelId,
		long durationMillis,
		String errorDetails
) {
	public GenerationAttempt {
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (outcome == AttemptOutcome.SUCCESS && (sql == null || sql.isBlank())) {
			throw new IllegalArgumentException("a successful attempt must carry SQL");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public static GenerationAttempt success(String sql, String modelId, long durationMillis) {
		return new GenerationAttempt(AttemptOutcome.SUCCESS, sql, modelId, durationMillis, null);
	}

	public static GenerationAttempt failure(AttemptOutcome outcome, String modelId, long durationMillis,
			String errorDetails) {
		return new GenerationAttempt(outcome, null, modelId, durationMillis, errorDetails);
	}

	public boolean isSuccess() {
		return outcome == AttemptOutcome.SUCCESS;
	}

	public Optional<String> query() {
		return Optional.ofNullable(sql);
	}
}
