package org.javai.sqlassist.exec;

/**
 * Thrown when a statement is refused at the executor boundary.
 */
public class QueryRejectedException extends RuntimeException {

	public QueryRejectedException(String message) {
		super(message);
	}
}
