package org.javai.sqlassist.generate;

/**
 * Outcome of a single remote generation attempt.
 */
public enum AttemptOutcome {
	/**
	 * The model returned a usable SELECT statement.
	 */
	SUCCESS,

	/**
	 * The model answered with nothing once code fences were removed.
	 */
	EMPTY_RESPONSE,

	/**
	 * The response does not start with SELECT and would be refused by the executor.
	 */
	NOT_A_SELECT,

	/**
	 * The call itself failed: network, authentication, malformed payload or any other error.
	 */
	REMOTE_ERROR
}
