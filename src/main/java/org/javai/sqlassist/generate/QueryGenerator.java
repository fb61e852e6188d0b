package org.javai.sqlassist.generate;

import org.javai.sqlassist.schema.Documentation;
import org.javai.sqlassist.schema.SchemaCatalog;

/**
 * Translates a plain-language question into one SQL statement.
 */
public interface QueryGenerator {

	/**
	 * @param question the user's question
	 * @param schema the current schema (may be empty)
	 * @param documentation the documentation overlay (may be empty)
	 * @return the generated query; never null
	 */
	GeneratedQuery generate(String question, SchemaCatalog schema, Documentation documentation);
}
