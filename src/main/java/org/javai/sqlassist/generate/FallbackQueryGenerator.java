package org.javai.sqlassist.generate;

import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.SchemaCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries the remote generator first and degrades to the pattern generator on any unsuccessful
 * attempt. Callers never see a remote failure; only {@link GeneratedQuery#method()} differs.
 */
public final class FallbackQueryGenerator implements QueryGenerator {

	private static final Logger logger = LoggerFactory.getLogger(FallbackQueryGenerator.class);

	private final RemoteQueryGenerator remote;
	private final QueryGenerator fallback;

	/**
	 * @param remote the preferred generator, or null to always use the fallback
	 * @param fallback the always-available generator
	 */
	public FallbackQueryGenerator(RemoteQueryGenerator remote, QueryGenerator fallback) {
		if (fallback == null) {
			throw new IllegalArgumentException("fallback must not be null");
		}
		this.remote = remote;
		this.fallback = fallback;
	}

	public boolean hasRemote() {
		return remote != null;
	}

	@Override
	public GeneratedQuery generate(String question, SchemaCatalog schema, Documentation documentation) {
		if (remote == null) {
			return fallback.generate(question, schema, documentation);
		}
		GenerationAttempt attempt = attemptRemote(question, schema, documentation);
		if (attempt.isSuccess()) {
			return GeneratedQuery.ai(attempt.sql());
		}
		logger.warn("Remote generation by {} failed ({}: {}); falling back to pattern generator",
				attempt.modelId(), attempt.outcome(), attempt.errorDetails());
		return fallback.generate(question, schema, documentation);
	}

	// A thrown exception or a null attempt counts as a failed attempt.
	private GenerationAttempt attemptRemote(String question, SchemaCatalog schema, Documentation documentation) {
		try {
			GenerationAttempt attempt = remote.attempt(question, schema, documentation);
			if (attempt != null) {
				return attempt;
			}
			return GenerationAttempt.failure(AttemptOutcome.EMPTY_RESPONSE, null, 0, "remote generator returned no attempt");
		}
		catch (RuntimeException e) {
			return GenerationAttempt.failure(AttemptOutcome.REMOTE_ERROR, null, 0, e.toString());
		}
	}
}
