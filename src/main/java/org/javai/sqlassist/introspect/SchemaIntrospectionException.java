package org.javai.sqlassist.introspect;

public class SchemaIntrospectionException extends RuntimeException {

	public SchemaIntrospectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
