package org.javai.sqlassist.generate;

import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.SchemaCatalog;

/**
 * A best-effort generator backed by an external service. Implementations must not throw:
 * every failure is reported through {@link GenerationAttempt#outcome()}.
 */
public interface RemoteQueryGenerator {

	GenerationAttempt attempt(String question, SchemaCatalog schema, Documentation documentation);
}
