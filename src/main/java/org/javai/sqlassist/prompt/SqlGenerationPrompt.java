package org.javai.sqlassist.prompt;

import java.util.Objects;

/**
 * The instructional prompt sent to the remote generator.
 *
 * @param schemaContext rendered schema context, see {@link SchemaContextRenderer}
 * @param question the user's plain-language question
 */
public record SqlGenerationPrompt(String schemaContext, String question) {

	private static final String TEMPLATE = """
			You translate questions about a relational database into SQL.
			Using the database schema below, write one SQL SELECT query that answers the question.

			DATABASE SCHEMA:
			%s

			QUESTION: %s

			RULES:
			1. Generate a SELECT query only. Never modify data or structure.
			2. The query must be syntactically valid SQL.
			3. Return ONLY the SQL query. No explanations, no prose.
			4. If the schema cannot answer the question exactly, return the query that retrieves the closest relevant data.

			SQL QUERY:""";

	public SqlGenerationPrompt {
		schemaContext = schemaContext != null ? schemaContext : "";
		question = Objects.requireNonNullElse(question, "");
	}

	public String render() {
		return TEMPLATE.formatted(schemaContext, question);
	}
}
